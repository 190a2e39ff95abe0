package com.shannon.core.model;

/**
 * Opaque handle to a workspace snapshot. Only equality is meaningful.
 */
public record CommitRef(String value) {

    public CommitRef {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CommitRef value must not be blank");
        }
    }

    public String shortValue() {
        return value.length() > 8 ? value.substring(0, 8) : value;
    }

    @Override
    public String toString() {
        return value;
    }
}
