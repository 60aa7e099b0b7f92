package com.farmerworking.filters.in.java.common;

// Turns an element into array positions. Every method is a pure function of
// its arguments and of the underlying hash library.
public interface IDoubleHashing {
    // Two independent hashes of element, taken under seed + 1 and seed + 2.
    TwoHashes hashTwice(byte[] element, long seed);

    // Enhanced double hashing: (hashA + n * hashB + (n^3 - n) / 6) mod size,
    // reduced as an unsigned value so the result is always in [0, size).
    int doubleHashing(int n, long hashA, long hashB, int size);

    // hashCount indexes on [0, size). Indexes may repeat.
    int[] getIndexes(byte[] element, int size, int hashCount, long seed);

    // hashCount pairwise distinct indexes on [0, size).
    // REQUIRES: hashCount <= size
    // Throws IllegalStateException when the reseed budget runs out.
    int[] getDistinctIndexes(byte[] element, int size, int hashCount, long seed);

    IHash getHash();

    static IDoubleHashing getDefaultImpl() {
        return new DoubleHashing(IHash.getDefaultImpl(), 0, DoubleHashing.DEFAULT_MAX_RESEEDS);
    }
}
