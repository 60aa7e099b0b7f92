package com.farmerworking.filters.in.java.data.structure.iblt;

import com.farmerworking.filters.in.java.common.ByteUtils;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.Arrays;

// One cell of an invertible bloom filter: the xor of the ids and of the id
// hashes of every element mapped to it, and how many elements were mapped.
public class Cell {
    private byte[] idSum;
    private long hashSum;
    private int count;

    public Cell(byte[] idSum, long hashSum, int count) {
        this.idSum = ByteUtils.trimLeadingZeros(idSum);
        this.hashSum = hashSum;
        this.count = count;
    }

    public static Cell empty() {
        return new Cell(ByteUtils.EMPTY, 0, 0);
    }

    // Folds one element into this cell.
    public void add(byte[] id, long hash) {
        idSum = ByteUtils.xor(idSum, id);
        hashSum ^= hash;
        count++;
    }

    // New cell holding the symmetric difference of this cell and other:
    // sums are xor-ed, counts are subtracted.
    public Cell xorm(Cell other) {
        return new Cell(ByteUtils.xor(idSum, other.idSum), hashSum ^ other.hashSum, count - other.count);
    }

    public boolean isEmpty() {
        return count == 0 && hashSum == 0 && ByteUtils.isEmpty(idSum);
    }

    public byte[] getIdSum() {
        return idSum;
    }

    public long getHashSum() {
        return hashSum;
    }

    public int getCount() {
        return count;
    }

    public Cell copy() {
        return new Cell(idSum.clone(), hashSum, count);
    }

    public JsonObject saveAsJSON() {
        JsonObject json = new JsonObject();
        JsonArray id = new JsonArray();
        for (byte b : idSum) {
            id.add(b & 0xFF);
        }
        json.add("idSum", id);
        json.addProperty("hashSum", hashSum);
        json.addProperty("count", count);
        return json;
    }

    // REQUIRES: json holds the fields written by saveAsJSON
    public static Cell fromJSON(JsonObject json) {
        JsonArray id = json.getAsJsonArray("idSum");
        byte[] idSum = new byte[id.size()];
        for (int i = 0; i < idSum.length; i++) {
            int value = id.get(i).getAsInt();
            if (value < 0 || value > 0xFF) {
                throw new IllegalArgumentException("idSum byte out of range: " + value);
            }
            idSum[i] = (byte) value;
        }
        return new Cell(idSum, json.get("hashSum").getAsLong(), json.get("count").getAsInt());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Cell cell = (Cell) o;
        return hashSum == cell.hashSum && count == cell.count && Arrays.equals(idSum, cell.idSum);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(idSum);
        result = 31 * result + Long.hashCode(hashSum);
        result = 31 * result + count;
        return result;
    }

    @Override
    public String toString() {
        return String.format("Cell{idSum=%s, hashSum=%d, count=%d}", Arrays.toString(idSum), hashSum, count);
    }
}
