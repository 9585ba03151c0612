package com.hrx.core.validation;

import com.hrx.core.error.HrxContentException;
import com.hrx.core.model.BoundaryLength;
import com.hrx.core.model.HrxArchive;
import com.hrx.core.model.HrxEntry;
import com.hrx.core.model.HrxEntryData;
import com.hrx.core.model.HrxPath;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks that an archive's text can be delimited by a boundary of a given length.
 *
 * <p>A comment or body is unsafe for width {@code n} when it contains a newline followed by
 * the marker of width {@code n}, or when it starts with that marker; either would be read
 * back as a boundary header. Texts are checked in a fixed order, stopping at the first hit:
 * <ol>
 *   <li>the root comment</li>
 *   <li>for each entry in map order, its comment and then (for files) its body</li>
 * </ol>
 *
 * <p>This is the only content check in the engine; boundary length changes and
 * serialization both go through it.
 */
public final class ContentValidator {

    private ContentValidator() {
        // Utility class - no instantiation
    }

    /**
     * Looks for the first text that contains the boundary of the given width.
     *
     * @param archive archive to inspect; not modified
     * @param width boundary length to check against
     * @return the offending location, or empty if the archive is safe for {@code width}
     */
    public static Optional<ContentViolation> check(HrxArchive archive, BoundaryLength width) {
        Objects.requireNonNull(archive, "archive must not be null");
        Objects.requireNonNull(width, "width must not be null");

        String marker = width.marker();
        String delimiter = "\n" + marker;

        if (containsBoundary(archive.getComment(), marker, delimiter)) {
            return Optional.of(new ContentViolation.RootComment());
        }
        for (Map.Entry<HrxPath, HrxEntry> e : archive.entries().entrySet()) {
            HrxEntry entry = e.getValue();
            if (containsBoundary(entry.comment(), marker, delimiter)) {
                return Optional.of(new ContentViolation.EntryComment(e.getKey()));
            }
            if (entry.data() instanceof HrxEntryData.File file
                && containsBoundary(file.body(), marker, delimiter)) {
                return Optional.of(new ContentViolation.EntryData(e.getKey()));
            }
        }
        return Optional.empty();
    }

    /** Same as {@link #check(HrxArchive, BoundaryLength)} for a plain boundary length. */
    public static Optional<ContentViolation> check(HrxArchive archive, int width) {
        return check(archive, BoundaryLength.of(width));
    }

    /**
     * Same as {@link #check(HrxArchive, BoundaryLength)}, but throws on the first violation.
     *
     * @param archive archive to inspect
     * @param width boundary length to check against
     * @throws HrxContentException if any text contains the boundary
     */
    public static void validate(HrxArchive archive, BoundaryLength width) {
        Optional<ContentViolation> violation = check(archive, width);
        if (violation.isPresent()) {
            throw new HrxContentException(violation.get());
        }
    }

    /**
     * Finds the smallest boundary length, starting at {@code from}, that all texts are safe for.
     *
     * @param archive archive to inspect
     * @param from first length to try
     * @return smallest safe length that is at least {@code from}
     */
    public static BoundaryLength smallestSafeBoundaryLength(HrxArchive archive, BoundaryLength from) {
        BoundaryLength candidate = from;
        while (check(archive, candidate).isPresent()) {
            candidate = BoundaryLength.of(candidate.value() + 1);
        }
        return candidate;
    }

    private static boolean containsBoundary(String text, String marker, String delimiter) {
        return text != null && (text.startsWith(marker) || text.contains(delimiter));
    }
}
