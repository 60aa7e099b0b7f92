package com.farmerworking.filters.in.java.common;

import org.apache.commons.lang3.StringUtils;

import java.util.HashMap;
import java.util.Map;

public class Status {
    private Integer code;
    private String message;

    public Status() {
        this.code = Code.kOk.value;
    }

    private Status(Code code, String msg1, String msg2) {
        this.code = code.value;
        this.message = msg1 + ": " + msg2;
    }

    private Status(Code code, String msg) {
        this.code = code.value;
        this.message = msg;
    }

    // Returns true iff the status indicates success.
    public boolean isOk() { return code.equals(Code.kOk.value); }

    public boolean isNotOk() { return !code.equals(Code.kOk.value); }

    // Returns true iff the status indicates a Corruption error, i.e. a snapshot
    // that does not describe the structure it is imported into.
    public boolean isCorruption() { return code.equals(Code.kCorruption.value); }

    public String getMessage() {
        return message;
    }

    // Returns the string "OK" for success.
    @Override
    public String toString() {
        Code valueOf = Code.valueOf(code);
        String result = valueOf == null ? String.format("Unknown code(%d)", code) : valueOf.display;
        return result + (StringUtils.isEmpty(message) ? "" : ": " + message);
    }

    public static Status OK() {
        return new Status();
    }

    public static Status Corruption(String msg) {
        return new Status(Code.kCorruption, msg);
    }

    public static Status Corruption(String msg1, String msg2) {
        return new Status(Code.kCorruption, msg1, msg2);
    }

    enum Code {
        kOk(0, "OK"),
        kCorruption(2, "Corruption");

        private static Map<Integer, Code> map = new HashMap<>();

        static {
            map.put(kOk.value, kOk);
            map.put(kCorruption.value, kCorruption);
        }

        private Integer value;
        private String display;

        Code(Integer i, String display) {
            this.value = i;
            this.display = display;
        }

        public static Code valueOf(Integer code) {
            return map.getOrDefault(code, null);
        }
    }
}
