package com.farmerworking.filters.in.java.api;

import com.google.gson.JsonObject;

// A structure that can be written to a flat, versionless json snapshot.
// Every implementation pairs this with a static fromJSON that rebuilds an
// identical instance from the snapshot.
public interface Exportable {
    JsonObject saveAsJSON();

    default String toJson() {
        return saveAsJSON().toString();
    }
}
