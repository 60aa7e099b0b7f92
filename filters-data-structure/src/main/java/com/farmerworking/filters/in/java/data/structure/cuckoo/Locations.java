package com.farmerworking.filters.in.java.data.structure.cuckoo;

import lombok.Data;

// Where an element lives in a cuckoo filter: its fingerprint and its two
// candidate buckets. Either index can be recomputed from the other one and
// the fingerprint alone.
@Data
public class Locations {
    private final long fingerprint;
    private final int firstIndex;
    private final int secondIndex;

    public Locations(long fingerprint, int firstIndex, int secondIndex) {
        this.fingerprint = fingerprint;
        this.firstIndex = firstIndex;
        this.secondIndex = secondIndex;
    }
}
