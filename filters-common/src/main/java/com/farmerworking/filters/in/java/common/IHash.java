package com.farmerworking.filters.in.java.common;

/**
 * Fast, non cryptographic hash library used by every structure. Implementations
 * must be pure functions of (data, seed): two structures can only be compared,
 * merged or subtracted when they hash with the same library and seed.
 */
public interface IHash {
    int hash32(byte[] data, long seed);

    long hash64(byte[] data, long seed);

    // 16 bytes
    byte[] hash128(byte[] data, long seed);

    static IHash getDefaultImpl() {
        return new Hash();
    }
}
