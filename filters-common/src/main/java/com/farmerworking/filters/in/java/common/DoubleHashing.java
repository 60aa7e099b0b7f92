package com.farmerworking.filters.in.java.common;

import java.util.LinkedHashSet;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

public class DoubleHashing implements IDoubleHashing {
    public static final int DEFAULT_MAX_RESEEDS = 100;

    private final IHash hash;
    // Recurrence steps allowed per seed in getDistinctIndexes before reseeding.
    // Non positive means "the size of the range".
    private final int distinctIndexAttempts;
    // Fresh seeds getDistinctIndexes may try before giving up. A hash library
    // that ignores the seed keeps cycling through the same indexes.
    private final int maxReseeds;

    public DoubleHashing(IHash hash, int distinctIndexAttempts) {
        this(hash, distinctIndexAttempts, DEFAULT_MAX_RESEEDS);
    }

    public DoubleHashing(IHash hash, int distinctIndexAttempts, int maxReseeds) {
        checkArgument(maxReseeds >= 0, "max reseeds should not be negative: %s", maxReseeds);
        this.hash = hash;
        this.distinctIndexAttempts = distinctIndexAttempts;
        this.maxReseeds = maxReseeds;
    }

    @Override
    public TwoHashes hashTwice(byte[] element, long seed) {
        return new TwoHashes(hash.hash64(element, seed + 1), hash.hash64(element, seed + 2));
    }

    @Override
    public int doubleHashing(int n, long hashA, long hashB, int size) {
        long i = n;
        long value = hashA + i * hashB + (i * i * i - i) / 6;
        return (int) Long.remainderUnsigned(value, size);
    }

    @Override
    public int[] getIndexes(byte[] element, int size, int hashCount, long seed) {
        checkArgument(size > 0, "size must be positive, got %s", size);
        checkArgument(hashCount > 0, "hashCount must be positive, got %s", hashCount);

        TwoHashes hashes = hashTwice(element, seed);
        int[] indexes = new int[hashCount];
        for (int i = 0; i < hashCount; i++) {
            indexes[i] = doubleHashing(i, hashes.getFirst(), hashes.getSecond(), size);
        }
        return indexes;
    }

    @Override
    public int[] getDistinctIndexes(byte[] element, int size, int hashCount, long seed) {
        checkArgument(size > 0, "size must be positive, got %s", size);
        checkArgument(hashCount > 0 && hashCount <= size,
                "cannot pick %s distinct indexes on [0, %s)", hashCount, size);

        int attemptsPerSeed = distinctIndexAttempts > 0 ? distinctIndexAttempts : size;
        Set<Integer> indexes = new LinkedHashSet<>();
        long currentSeed = seed;

        while (indexes.size() < hashCount) {
            if (currentSeed - seed > maxReseeds) {
                throw new IllegalStateException(String.format(
                        "found %d of %d distinct indexes on [0, %d) after %d reseeds",
                        indexes.size(), hashCount, size, maxReseeds));
            }

            TwoHashes hashes = hashTwice(element, currentSeed);
            long a = Long.remainderUnsigned(hashes.getFirst(), size);
            long b = Long.remainderUnsigned(hashes.getSecond(), size);

            for (int i = 0; i < attemptsPerSeed && indexes.size() < hashCount; i++) {
                indexes.add((int) a);
                a = (a + b) % size;
                b = (b + i) % size;
            }
            // the recurrence went around a short cycle, start again from fresh hashes
            currentSeed++;
        }

        int[] result = new int[hashCount];
        int i = 0;
        for (Integer index : indexes) {
            result[i++] = index;
        }
        return result;
    }

    @Override
    public IHash getHash() {
        return hash;
    }
}
