package com.hrx.core.model;

/**
 * Number of {@code =} characters in an archive's boundary marker.
 *
 * <p>Always at least one; an instance with a smaller value cannot be created.
 *
 * @param value count of {@code =} characters between {@code <} and {@code >}
 */
public record BoundaryLength(int value) {

    /**
     * Compact constructor with validation.
     */
    public BoundaryLength {
        if (value < 1) {
            throw new IllegalArgumentException("boundary length must be at least 1, was " + value);
        }
    }

    public static BoundaryLength of(int value) {
        return new BoundaryLength(value);
    }

    /**
     * Builds the marker for this length, e.g. {@code <===>} for 3.
     *
     * @return the boundary marker
     */
    public String marker() {
        return "<" + "=".repeat(value) + ">";
    }
}
