package com.farmerworking.filters.in.java.common;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

// Byte buffers are compared right aligned: the last byte of each operand is
// its least significant one, the way an unsigned big-endian number would be.
public class ByteUtils {
    public static final byte[] EMPTY = new byte[0];

    public static byte[] toBytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    public static String toString(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * Non-destructive XOR of two buffers. The shorter operand is zero padded on
     * the left, and leading zero bytes of the result are dropped, so XOR-ing a
     * buffer with itself gives a zero-length buffer.
     */
    public static byte[] xor(byte[] a, byte[] b) {
        int length = Math.max(a.length, b.length);
        byte[] buffer = new byte[length];
        for (int i = 0; i < length; i++) {
            int left = i < a.length ? a[a.length - i - 1] : 0;
            int right = i < b.length ? b[b.length - i - 1] : 0;
            buffer[length - i - 1] = (byte) (left ^ right);
        }
        return trimLeadingZeros(buffer);
    }

    public static byte[] trimLeadingZeros(byte[] bytes) {
        int start = 0;
        while (start < bytes.length && bytes[start] == 0) {
            start++;
        }
        return start == 0 ? bytes : Arrays.copyOfRange(bytes, start, bytes.length);
    }

    public static boolean isEmpty(byte[] bytes) {
        return bytes == null || bytes.length == 0;
    }
}
