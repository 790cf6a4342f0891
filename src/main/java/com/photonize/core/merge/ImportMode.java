package com.photonize.core.merge;

/**
 * Where incoming files go relative to the existing batch.
 */
public enum ImportMode {
    /** After every existing entry, in the order given. */
    APPEND,
    /** Spread evenly between existing entries. */
    DISTRIBUTE;

    public static ImportMode parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("import mode is required");
        }
        return ImportMode.valueOf(value.trim().toUpperCase(java.util.Locale.ROOT));
    }
}
