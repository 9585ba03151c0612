package com.hrx.core.error;

/**
 * Reasons a raw string is not a legal archive path.
 */
public enum PathError {
    EMPTY_COMPONENT("empty path component"),
    FORBIDDEN_CHARACTER("path component contains a forbidden character"),
    RESERVED_COMPONENT("path component is \".\" or \"..\"");

    private final String description;

    PathError(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
