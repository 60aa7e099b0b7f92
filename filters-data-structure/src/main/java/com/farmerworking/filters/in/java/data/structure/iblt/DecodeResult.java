package com.farmerworking.filters.in.java.data.structure.iblt;

import lombok.Data;

import java.util.List;

@Data
public class DecodeResult {
    // true iff every cell was emptied by the decoding
    private final boolean success;
    // elements with a positive count: present in the minuend only
    private final List<String> additional;
    // elements with a negative count: present in the subtrahend only
    private final List<String> missing;
    // copies of the cells left non empty, empty on success
    private final List<Cell> reason;
    // number of elements peeled off the table
    private final int decoded;

    public DecodeResult(boolean success, List<String> additional, List<String> missing, List<Cell> reason, int decoded) {
        this.success = success;
        this.additional = additional;
        this.missing = missing;
        this.reason = reason;
        this.decoded = decoded;
    }
}
