package com.farmerworking.filters.in.java.data.structure.iblt;

import com.farmerworking.filters.in.java.common.ByteUtils;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.junit.Test;

import static org.junit.Assert.*;

public class CellTest {
    @Test
    public void testEmpty() {
        Cell cell = Cell.empty();
        assertTrue(cell.isEmpty());
        assertEquals(0, cell.getIdSum().length);
        assertEquals(0, cell.getHashSum());
        assertEquals(0, cell.getCount());
    }

    @Test
    public void testAdd() {
        Cell cell = Cell.empty();
        cell.add(ByteUtils.toBytes("ab"), 5);
        assertArrayEquals(ByteUtils.toBytes("ab"), cell.getIdSum());
        assertEquals(5, cell.getHashSum());
        assertEquals(1, cell.getCount());

        cell.add(ByteUtils.toBytes("b"), 3);
        // right aligned: "ab" ^ "\0b"
        assertArrayEquals(new byte[]{'a', 0}, cell.getIdSum());
        assertEquals(6, cell.getHashSum());
        assertEquals(2, cell.getCount());
        assertFalse(cell.isEmpty());
    }

    @Test
    public void testXorm() {
        Cell cell = Cell.empty();
        cell.add(ByteUtils.toBytes("alice"), 17);
        Cell other = new Cell(ByteUtils.toBytes("alice"), 17, 1);

        Cell diff = cell.xorm(other);
        assertTrue(diff.isEmpty());
        // operands are untouched
        assertEquals(1, cell.getCount());
        assertArrayEquals(ByteUtils.toBytes("alice"), cell.getIdSum());

        Cell negative = Cell.empty().xorm(other);
        assertEquals(-1, negative.getCount());
        assertArrayEquals(ByteUtils.toBytes("alice"), negative.getIdSum());
        assertEquals(17, negative.getHashSum());
    }

    @Test
    public void testZeroCountIsNotEnoughToBeEmpty() {
        Cell cell = new Cell(ByteUtils.toBytes("a"), 0, 0);
        assertFalse(cell.isEmpty());
        assertFalse(new Cell(ByteUtils.EMPTY, 1, 0).isEmpty());
    }

    @Test
    public void testLeadingZerosTrimmed() {
        Cell cell = new Cell(new byte[]{0, 0, 7}, 1, 1);
        assertArrayEquals(new byte[]{7}, cell.getIdSum());
        assertEquals(new Cell(new byte[]{7}, 1, 1), cell);
    }

    @Test
    public void testCopy() {
        Cell cell = new Cell(ByteUtils.toBytes("x"), 9, 2);
        Cell copy = cell.copy();
        assertEquals(cell, copy);
        assertEquals(cell.hashCode(), copy.hashCode());

        copy.add(ByteUtils.toBytes("y"), 1);
        assertNotEquals(cell, copy);
    }

    @Test
    public void testJson() {
        Cell cell = new Cell(new byte[]{1, (byte) 0xFF}, -4, -1);
        JsonObject json = cell.saveAsJSON();
        JsonArray idSum = json.getAsJsonArray("idSum");
        assertEquals(2, idSum.size());
        assertEquals(255, idSum.get(1).getAsInt());
        assertEquals(-4, json.get("hashSum").getAsLong());
        assertEquals(-1, json.get("count").getAsInt());

        assertEquals(cell, Cell.fromJSON(json));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testJsonByteOutOfRange() {
        JsonObject json = Cell.empty().saveAsJSON();
        json.getAsJsonArray("idSum").add(256);
        Cell.fromJSON(json);
    }
}
