package com.farmerworking.filters.in.java.common;

import com.google.common.primitives.Longs;
import org.junit.Test;

import static org.junit.Assert.*;

public class HashTest {
    private final IHash hash = IHash.getDefaultImpl();

    @Test
    public void testDeterministic() {
        byte[] data = ByteUtils.toBytes("alice");
        assertEquals(hash.hash64(data, 42L), hash.hash64(data, 42L));
        assertEquals(hash.hash32(data, 42L), hash.hash32(data, 42L));
        assertEquals(new Hash().hash64(data, 42L), hash.hash64(data, 42L));
    }

    @Test
    public void testKnownValues() {
        byte[] data = ByteUtils.toBytes("alice");
        assertEquals(1557849021011485338L, hash.hash64(data, 0L));
        assertEquals(1710596706, hash.hash32(data, 0L));
        assertArrayEquals(new byte[]{-102, 98, 20, 71, 110, -105, -98, 21, -17, -60, 39, 23, -123, -97, -15, 26},
                hash.hash128(data, 0L));
    }

    @Test
    public void testHash128ExtendsHash64() {
        byte[] data = ByteUtils.toBytes("bob");
        byte[] wide = hash.hash128(data, 99L);
        assertEquals(16, wide.length);
        assertEquals(hash.hash64(data, 99L), Longs.fromBytes(wide[7], wide[6], wide[5], wide[4], wide[3], wide[2], wide[1], wide[0]));
    }

    @Test
    public void testSeedMatters() {
        byte[] data = ByteUtils.toBytes("alice");
        assertNotEquals(hash.hash64(data, 1L), hash.hash64(data, 2L));
        assertNotEquals(hash.hash32(data, 1L), hash.hash32(data, 2L));
        // the high half of the seed takes part too
        assertNotEquals(hash.hash64(data, 1L), hash.hash64(data, 1L | (1L << 40)));
    }

    @Test
    public void testDataMatters() {
        assertNotEquals(hash.hash64(ByteUtils.toBytes("alice"), 7L), hash.hash64(ByteUtils.toBytes("bob"), 7L));
        assertNotEquals(hash.hash64(ByteUtils.EMPTY, 7L), hash.hash64(new byte[]{0}, 7L));
    }
}
