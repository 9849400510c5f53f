package com.yoursp.faceapproval.service.storage;

/**
 * Which backend the process selected at start-up.
 */
public enum StorageMode {
    DATABASE("database"),
    IN_MEMORY("in-memory");

    private final String label;

    StorageMode(String label) {
        this.label = label;
    }

    /** Value reported by the health endpoint. */
    public String label() {
        return label;
    }
}
