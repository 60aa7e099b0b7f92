package com.farmerworking.filters.in.java.api;

// An approximate membership structure that supports insertion and deletion.
// None of the implementations are thread safe: callers must serialize
// mutations of one instance themselves.
public interface WritableFilter<T> {
    // Returns false when the element could not be stored.
    boolean add(T element);

    // Returns false when the element was not found.
    boolean remove(T element);

    // false means "definitely absent", true means "probably present".
    boolean has(T element);
}
