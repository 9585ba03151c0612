package com.hrx.core.parser;

import com.hrx.core.error.NoBoundaryException;
import com.hrx.core.model.BoundaryLength;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Determines an archive's boundary length from its first marker.
 *
 * <p>A marker is {@code <}, one or more {@code =}, then {@code >}, located at the start of the
 * text or immediately after a {@code \n}. The number of {@code =} in the first such marker
 * fixes the boundary for the whole document.
 */
public final class BoundaryDiscovery {

    private BoundaryDiscovery() {
        // Utility class - no instantiation
    }

    // Only \n starts a line; MULTILINE ^ would also match after \r and U+2028
    private static final Pattern BOUNDARY_PATTERN = Pattern.compile("(?:\\A|(?<=\\n))<(=+)>");

    /**
     * Finds the width of the first boundary marker.
     *
     * @param text archive text
     * @return number of {@code =} in the first marker
     * @throws NoBoundaryException if no line starts with a marker
     */
    public static int discover(String text) {
        Objects.requireNonNull(text, "text must not be null");
        Matcher matcher = BOUNDARY_PATTERN.matcher(text);
        if (!matcher.find()) {
            throw new NoBoundaryException();
        }
        return matcher.group(1).length();
    }

    /** Same as {@link #discover(String)}, returned as a {@link BoundaryLength}. */
    public static BoundaryLength discoverLength(String text) {
        return BoundaryLength.of(discover(text));
    }
}
