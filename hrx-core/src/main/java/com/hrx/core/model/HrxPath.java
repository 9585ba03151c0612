package com.hrx.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Verified-valid path of an archive entry.
 *
 * <p>Construction always runs {@link PathValidator}, so holding an instance proves the path
 * is legal. Directory entries are keyed without their trailing {@code /}.
 *
 * @param value the raw path, e.g. {@code "dir/file.txt"}
 */
public record HrxPath(String value) {

    /**
     * Compact constructor with validation.
     *
     * @throws com.hrx.core.error.HrxPathException if {@code value} is not a legal path
     */
    public HrxPath {
        Objects.requireNonNull(value, "value must not be null");
        PathValidator.check(value);
    }

    /**
     * Parses a path.
     *
     * @param raw raw path string
     * @return validated path
     * @throws com.hrx.core.error.HrxPathException if {@code raw} is not a legal path
     */
    public static HrxPath parse(String raw) {
        return PathValidator.validate(raw);
    }

    public List<String> components() {
        return List.of(value.split("/"));
    }

    /**
     * Returns the enclosing path, or empty for single-component paths.
     *
     * @return parent path
     */
    public Optional<HrxPath> parent() {
        int slash = value.lastIndexOf('/');
        return slash < 0 ? Optional.empty() : Optional.of(new HrxPath(value.substring(0, slash)));
    }

    /**
     * Lists every strict ancestor, outermost first ({@code a}, {@code a/b} for {@code a/b/c}).
     *
     * @return strict ancestors of this path
     */
    public List<HrxPath> ancestors() {
        List<HrxPath> ancestors = new ArrayList<>();
        int slash = value.indexOf('/');
        while (slash >= 0) {
            ancestors.add(new HrxPath(value.substring(0, slash)));
            slash = value.indexOf('/', slash + 1);
        }
        return ancestors;
    }

    /**
     * Checks whether {@code other} lies strictly below this path.
     *
     * @param other candidate descendant
     * @return true if {@code other} starts with this path followed by {@code /}
     */
    public boolean isAncestorOf(HrxPath other) {
        return other.value.length() > value.length()
            && other.value.startsWith(value)
            && other.value.charAt(value.length()) == '/';
    }

    @Override
    public String toString() {
        return value;
    }
}
