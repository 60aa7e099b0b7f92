package com.farmerworking.filters.in.java.common;

import lombok.Data;

// Two independent hashes of one element, recomputed on every operation
@Data
public class TwoHashes {
    private final long first;
    private final long second;

    public TwoHashes(long first, long second) {
        this.first = first;
        this.second = second;
    }
}
