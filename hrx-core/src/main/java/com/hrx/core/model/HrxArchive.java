package com.hrx.core.model;

import com.hrx.core.error.HrxContentException;
import com.hrx.core.parser.HrxParser;
import com.hrx.core.serializer.HrxSerializer;
import com.hrx.core.validation.ContentValidator;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A Human-Readable Archive: an optional root comment and an ordered set of entries, all
 * separated by a boundary of fixed length.
 *
 * <p>No comment or file body may contain a newline followed by the boundary. Since comments
 * and entries are freely mutable, this is not enforced continuously; it is checked when
 * the archive is parsed, when {@link #setBoundaryLength(int)} is called, on
 * {@link #validateContent()} and before serialization.
 *
 * <p>Entry keys are unique and files never contain other entries when the archive comes
 * from {@link #parse(String)}. Callers mutating {@link #entries()} directly are responsible
 * for keeping it that way.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * HrxArchive archive = HrxArchive.parse("<===> input.scss\nul { margin: 0 }\n");
 * archive.entries().put(HrxPath.parse("output.css"), HrxEntry.file("ul {\n  margin: 0;\n}"));
 * archive.setBoundaryLength(5);
 * String text = archive.serializeToString();
 * }</pre>
 *
 * <p>Instances are not thread-safe.
 */
public final class HrxArchive {

    private String comment;
    private final Map<HrxPath, HrxEntry> entries = new LinkedHashMap<>();
    private BoundaryLength boundaryLength;
    private boolean trailingNewline = true;

    public HrxArchive(BoundaryLength boundaryLength) {
        this.boundaryLength = Objects.requireNonNull(boundaryLength, "boundaryLength must not be null");
    }

    /**
     * Creates an archive with no comment and no entries.
     *
     * @param boundaryLength number of {@code =} in the boundary
     * @return empty archive
     * @throws IllegalArgumentException if {@code boundaryLength} is less than 1
     */
    public static HrxArchive empty(int boundaryLength) {
        return new HrxArchive(BoundaryLength.of(boundaryLength));
    }

    /**
     * Parses archive text, discovering the boundary length from its first marker.
     *
     * @param text full archive text
     * @return parsed archive
     * @throws com.hrx.core.error.NoBoundaryException if the text contains no boundary
     * @throws com.hrx.core.error.HrxParseException if the text is not a valid archive
     * @throws com.hrx.core.error.HrxPathException if an entry path is invalid
     */
    public static HrxArchive parse(String text) {
        return HrxParser.parse(text);
    }

    public String getComment() {
        return comment;
    }

    public void setComment(String comment) {
        this.comment = comment;
    }

    /**
     * Returns the live, insertion-ordered entry map.
     *
     * @return mutable entries keyed by path
     */
    public Map<HrxPath, HrxEntry> entries() {
        return entries;
    }

    /**
     * Looks up an entry by its raw path.
     *
     * @param path raw path, validated before lookup
     * @return the entry, or empty if there is none
     * @throws com.hrx.core.error.HrxPathException if {@code path} is not a valid path
     */
    public Optional<HrxEntry> entry(String path) {
        return Optional.ofNullable(entries.get(HrxPath.parse(path)));
    }

    /**
     * Returns the number of {@code =} characters in the boundary.
     *
     * @return current boundary length, always at least 1
     */
    public int boundaryLength() {
        return boundaryLength.value();
    }

    /** Returns the boundary as a value that can build the marker. */
    public BoundaryLength getBoundary() {
        return boundaryLength;
    }

    /**
     * Whether the serialized text ends with {@code \n}.
     *
     * <p>Archives parsed from text whose last body runs to the end of input report
     * {@code false}; all others report {@code true}.
     *
     * @return true if the last block is written with its terminating newline
     */
    public boolean hasTrailingNewline() {
        return trailingNewline;
    }

    /**
     * Chooses whether the last block is written with its terminating newline.
     *
     * <p>The newline is only left out when the text of the last block is non-empty and does
     * not itself end with {@code \n}; otherwise the output would read back differently and
     * the newline is written regardless.
     *
     * @param trailingNewline false to leave out the final {@code \n}
     */
    public void setTrailingNewline(boolean trailingNewline) {
        this.trailingNewline = trailingNewline;
    }

    /**
     * Changes the boundary length if no comment or body contains the new boundary.
     *
     * <p>On failure the archive is left unchanged.
     *
     * @param newLength new number of {@code =} characters
     * @throws IllegalArgumentException if {@code newLength} is less than 1
     * @throws HrxContentException naming the first text that contains the new boundary
     */
    public void setBoundaryLength(int newLength) {
        BoundaryLength candidate = BoundaryLength.of(newLength);
        ContentValidator.validate(this, candidate);
        this.boundaryLength = candidate;
    }

    /**
     * Checks that no comment or body contains the current boundary.
     *
     * @throws HrxContentException naming the first offending text
     */
    public void validateContent() {
        ContentValidator.validate(this, boundaryLength);
    }

    /**
     * Writes this archive to {@code sink}.
     *
     * @param sink destination
     * @throws HrxContentException if content validation fails; nothing is written
     * @throws IOException if the sink fails; it may then hold a partial archive
     */
    public void serialize(Appendable sink) throws IOException {
        HrxSerializer.serialize(this, sink);
    }

    /**
     * Serializes this archive to a string.
     *
     * @return archive text
     * @throws HrxContentException if content validation fails
     */
    public String serializeToString() {
        return HrxSerializer.serializeToString(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HrxArchive other)) {
            return false;
        }
        // entry order is part of the archive
        return boundaryLength.equals(other.boundaryLength)
            && Objects.equals(comment, other.comment)
            && new ArrayList<>(entries.entrySet()).equals(new ArrayList<>(other.entries.entrySet()));
    }

    @Override
    public int hashCode() {
        return Objects.hash(comment, entries, boundaryLength);
    }

    @Override
    public String toString() {
        return "HrxArchive[boundaryLength=" + boundaryLength.value()
            + ", entries=" + entries.keySet()
            + ", comment=" + (comment != null) + "]";
    }
}
