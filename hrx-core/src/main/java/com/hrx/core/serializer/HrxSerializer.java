package com.hrx.core.serializer;

import com.hrx.core.error.HrxContentException;
import com.hrx.core.model.HrxArchive;
import com.hrx.core.model.HrxEntry;
import com.hrx.core.model.HrxEntryData;
import com.hrx.core.model.HrxPath;
import com.hrx.core.validation.ContentValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Writes an {@link HrxArchive} back to text.
 *
 * <p>Content is validated against the archive's current boundary length before anything is
 * written, so a content failure never leaves partial output. Every block is newline
 * terminated:
 * <ul>
 *   <li>comment: {@code <===>\n} + comment + {@code \n}</li>
 *   <li>file: {@code <===> path\n}, then body + {@code \n} if the file has a body</li>
 *   <li>directory: {@code <===> path/\n}</li>
 * </ul>
 * The newline after the last block is left out when the archive
 * {@linkplain HrxArchive#hasTrailingNewline() has no trailing newline} and the last block
 * ends with non-empty text that does not already end with {@code \n}.
 * An entry's comment block directly precedes its header. The root comment opens the
 * archive when there are no entries or the first entry has a comment, and closes it
 * otherwise; those are the placements {@link com.hrx.core.parser.HrxParser} reads back as
 * the root comment.
 *
 * <p>For any text {@code T} accepted by the parser, serializing the parsed archive yields
 * {@code T} unchanged as long as the boundary length is not changed in between.
 */
public final class HrxSerializer {

    private static final Logger log = LoggerFactory.getLogger(HrxSerializer.class);

    private HrxSerializer() {
        // Utility class - no instantiation
    }

    /**
     * Validates and writes an archive.
     *
     * @param archive archive to write
     * @param sink destination
     * @throws HrxContentException if a comment or body contains the boundary; nothing is written
     * @throws IOException if the sink fails; it may then hold a partial, unusable prefix
     */
    public static void serialize(HrxArchive archive, Appendable sink) throws IOException {
        Objects.requireNonNull(archive, "archive must not be null");
        Objects.requireNonNull(sink, "sink must not be null");

        archive.validateContent();

        String marker = archive.getBoundary().marker();
        Map<HrxPath, HrxEntry> entries = archive.entries();
        String rootComment = archive.getComment();
        boolean rootFirst = rootCommentFirst(entries);
        boolean rootLast = !rootFirst && rootComment != null;
        boolean terminateLast = archive.hasTrailingNewline()
            || !canOmitFinalNewline(lastText(entries, rootComment, rootLast));

        if (rootFirst) {
            writeComment(sink, marker, rootComment, terminateLast || !entries.isEmpty());
        }
        int remaining = entries.size();
        for (Map.Entry<HrxPath, HrxEntry> e : entries.entrySet()) {
            remaining--;
            writeEntry(sink, marker, e.getKey(), e.getValue(), terminateLast || rootLast || remaining > 0);
        }
        if (rootLast) {
            writeComment(sink, marker, rootComment, terminateLast);
        }

        log.debug("Serialized archive: {} entries, boundary length {}", entries.size(), archive.boundaryLength());
    }

    /**
     * Validates and serializes an archive to a string.
     *
     * @param archive archive to write
     * @return archive text
     * @throws HrxContentException if a comment or body contains the boundary
     */
    public static String serializeToString(HrxArchive archive) {
        StringBuilder out = new StringBuilder();
        try {
            serialize(archive, out);
        } catch (IOException e) {
            // StringBuilder.append never throws
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    private static boolean rootCommentFirst(Map<HrxPath, HrxEntry> entries) {
        Iterator<HrxEntry> it = entries.values().iterator();
        return !it.hasNext() || it.next().comment() != null;
    }

    /**
     * Returns the text of the block written last, or null if that block ends with its header.
     */
    private static String lastText(Map<HrxPath, HrxEntry> entries, String rootComment, boolean rootLast) {
        if (rootLast || entries.isEmpty()) {
            return rootComment;
        }
        HrxEntry last = null;
        for (HrxEntry entry : entries.values()) {
            last = entry;
        }
        return last.body();
    }

    // otherwise the text would read back with a different final block
    private static boolean canOmitFinalNewline(String text) {
        return text != null && !text.isEmpty() && !text.endsWith("\n");
    }

    private static void writeEntry(Appendable sink, String marker, HrxPath path, HrxEntry entry,
                                   boolean terminate) throws IOException {
        writeComment(sink, marker, entry.comment(), true);

        sink.append(marker).append(' ').append(path.value());
        if (entry.data() instanceof HrxEntryData.File file) {
            sink.append('\n');
            if (file.body() != null) {
                writeText(sink, file.body(), terminate);
            }
        } else {
            sink.append("/\n");
        }
    }

    private static void writeComment(Appendable sink, String marker, String comment, boolean terminate)
            throws IOException {
        if (comment != null) {
            sink.append(marker).append('\n');
            writeText(sink, comment, terminate);
        }
    }

    private static void writeText(Appendable sink, String text, boolean terminate) throws IOException {
        sink.append(text);
        if (terminate) {
            sink.append('\n');
        }
    }
}
