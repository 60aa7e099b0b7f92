package com.farmerworking.filters.in.java.common;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

// murmur3 from guava. The full 64 bit seed is fed into the hasher ahead of the
// data because guava only accepts 32 bit seeds.
public class Hash implements IHash {
    private static final HashFunction murmur3_32 = Hashing.murmur3_32_fixed();
    private static final HashFunction murmur3_128 = Hashing.murmur3_128();

    @Override
    public int hash32(byte[] data, long seed) {
        return murmur3_32.newHasher(data.length + 8).putLong(seed).putBytes(data).hash().asInt();
    }

    @Override
    public long hash64(byte[] data, long seed) {
        return murmur3_128.newHasher(data.length + 8).putLong(seed).putBytes(data).hash().asLong();
    }

    // hash64 is the first 8 bytes of hash128, read little endian
    @Override
    public byte[] hash128(byte[] data, long seed) {
        return murmur3_128.newHasher(data.length + 8).putLong(seed).putBytes(data).hash().asBytes();
    }
}
