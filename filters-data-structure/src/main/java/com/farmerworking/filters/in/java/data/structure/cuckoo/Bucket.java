package com.farmerworking.filters.in.java.data.structure.cuckoo;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkElementIndex;

// A fixed number of fingerprint slots. A null slot is empty.
public class Bucket {
    private final Long[] elements;
    private int length;

    public Bucket(int size) {
        this.elements = new Long[size];
        this.length = 0;
    }

    // maximum number of fingerprints
    public int size() {
        return elements.length;
    }

    // number of fingerprints currently stored
    public int length() {
        return length;
    }

    public boolean isFree() {
        return length < elements.length;
    }

    // Returns -1 if the bucket is full
    public int nextEmptySlot() {
        for (int i = 0; i < elements.length; i++) {
            if (elements[i] == null) {
                return i;
            }
        }
        return -1;
    }

    public Long at(int index) {
        return elements[index];
    }

    public boolean add(long fingerprint) {
        if (!isFree()) {
            return false;
        }
        elements[nextEmptySlot()] = fingerprint;
        length++;
        return true;
    }

    public boolean remove(long fingerprint) {
        int index = indexOf(fingerprint);
        if (index < 0) {
            return false;
        }
        elements[index] = null;
        length--;
        return true;
    }

    public boolean has(long fingerprint) {
        return indexOf(fingerprint) >= 0;
    }

    // Overwrites a slot without touching the length: only used to swap
    // fingerprints of an occupied slot and to undo such swaps.
    public Long swap(int index, Long fingerprint) {
        checkElementIndex(index, elements.length);
        Long previous = elements[index];
        elements[index] = fingerprint;
        return previous;
    }

    // Used when rebuilding a bucket from a snapshot.
    void load(int index, Long fingerprint) {
        if (elements[index] == null && fingerprint != null) {
            length++;
        } else if (elements[index] != null && fingerprint == null) {
            length--;
        }
        elements[index] = fingerprint;
    }

    private int indexOf(long fingerprint) {
        for (int i = 0; i < elements.length; i++) {
            if (elements[i] != null && elements[i] == fingerprint) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Bucket bucket = (Bucket) o;
        return length == bucket.length && Arrays.equals(elements, bucket.elements);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(elements) + length;
    }

    @Override
    public String toString() {
        return Arrays.toString(elements);
    }
}
