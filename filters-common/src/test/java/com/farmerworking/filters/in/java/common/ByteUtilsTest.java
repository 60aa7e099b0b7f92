package com.farmerworking.filters.in.java.common;

import org.junit.Test;

import static org.junit.Assert.*;

public class ByteUtilsTest {
    @Test
    public void testXorWithItselfIsEmpty() {
        byte[] bytes = ByteUtils.toBytes("meow");
        byte[] result = ByteUtils.xor(bytes, bytes);
        assertEquals(0, result.length);
        assertTrue(ByteUtils.isEmpty(result));
    }

    @Test
    public void testXorWithEmpty() {
        byte[] bytes = ByteUtils.toBytes("help");
        assertArrayEquals(bytes, ByteUtils.xor(bytes, ByteUtils.EMPTY));
        assertArrayEquals(bytes, ByteUtils.xor(ByteUtils.EMPTY, bytes));
    }

    @Test
    public void testXorRightAligned() {
        byte[] result = ByteUtils.xor(new byte[]{1, 2, 3}, new byte[]{3});
        assertArrayEquals(new byte[]{1, 2, 0}, result);

        result = ByteUtils.xor(new byte[]{4}, new byte[]{1, 2, 3});
        assertArrayEquals(new byte[]{1, 2, 7}, result);
    }

    @Test
    public void testXorTrimsLeadingZeros() {
        byte[] result = ByteUtils.xor(new byte[]{1, 2}, new byte[]{1, 3});
        assertArrayEquals(new byte[]{1}, result);

        result = ByteUtils.xor(new byte[]{7, 7, 9}, new byte[]{7, 7, 1});
        assertArrayEquals(new byte[]{8}, result);
    }

    @Test
    public void testXorIsSelfInverse() {
        byte[] a = ByteUtils.toBytes("alice");
        byte[] b = ByteUtils.toBytes("json");
        assertArrayEquals(a, ByteUtils.xor(ByteUtils.xor(a, b), b));
        assertArrayEquals(b, ByteUtils.xor(ByteUtils.xor(a, b), a));
    }

    @Test
    public void testXorDoesNotTouchOperands() {
        byte[] a = {1, 2, 3};
        byte[] b = {1, 2, 3};
        ByteUtils.xor(a, b);
        assertArrayEquals(new byte[]{1, 2, 3}, a);
        assertArrayEquals(new byte[]{1, 2, 3}, b);
    }

    @Test
    public void testStringConvert() {
        assertEquals("42", ByteUtils.toString(ByteUtils.toBytes("42")));
        assertEquals("héllo", ByteUtils.toString(ByteUtils.toBytes("héllo")));
    }
}
