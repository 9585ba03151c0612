package com.hrx.core.parser;

import com.hrx.core.error.DuplicateEntryException;
import com.hrx.core.error.FileAsDirectoryException;
import com.hrx.core.error.HrxSyntaxException;
import com.hrx.core.error.SyntaxError;
import com.hrx.core.model.BoundaryLength;
import com.hrx.core.model.HrxArchive;
import com.hrx.core.model.HrxEntry;
import com.hrx.core.model.HrxEntryData;
import com.hrx.core.model.HrxPath;
import com.hrx.core.model.PathValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Turns archive text into an {@link HrxArchive}.
 *
 * <p>The document is a sequence of blocks, each opened by a boundary header line:
 * <pre>
 * block       ::= marker header-tail "\n" body?
 * header-tail ::= ""  |  " " path  |  " " path "/"
 * body        ::= contents "\n"
 * </pre>
 * where {@code contents} neither starts with the marker nor contains {@code "\n" + marker}.
 * The final body of the document may also run to the end of input without its {@code \n};
 * the archive then records that it has no trailing newline. Header lines are always
 * newline terminated.
 * A bare header opens a comment, a header with a path opens a file, and a trailing {@code /}
 * opens a directory, which cannot have a body. A file with no body section and a file with
 * an empty body are different: {@code "<===> a\n"} versus {@code "<===> a\n\n"}.
 *
 * <p><b>Comments:</b> a comment directly before a path header belongs to that entry. The
 * archive's root comment is either the first of two comments opening the document, or the
 * comment that closes it. The closing position is only accepted when the first entry has no
 * comment of its own, which keeps every archive's text unique.
 *
 * <p><b>Structure:</b> each path is validated, then checked against the entries seen so far.
 * A repeated path fails with {@link DuplicateEntryException}; a path below a file, or a
 * file above an existing path, fails with {@link FileAsDirectoryException}.
 *
 * <p>Parsing is all-or-nothing: no partially built archive escapes a failure. Instances are
 * single-use and private to one call, so the static entry points are safe to call from any
 * thread.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * HrxArchive archive = HrxParser.parse("<===> dir/\n<===> dir/file.txt\ncontents\n");
 * }</pre>
 */
public final class HrxParser {

    private static final Logger log = LoggerFactory.getLogger(HrxParser.class);

    private final String text;
    private final String marker;
    private final String delimiter;
    private final HrxArchive archive;

    // strict ancestor -> first entry inserted below it
    private final Map<HrxPath, HrxPath> descendants = new HashMap<>();

    private int pos;
    private int line = 1;
    private String pendingComment;
    private int pendingCommentLine;
    private String rootComment;
    private HrxEntry firstEntry;

    private HrxParser(String text, BoundaryLength boundary) {
        this.text = text;
        this.marker = boundary.marker();
        this.delimiter = "\n" + marker;
        this.archive = new HrxArchive(boundary);
    }

    /**
     * Parses archive text, discovering the boundary length from the first marker.
     *
     * @param text complete archive text
     * @return parsed archive
     * @throws com.hrx.core.error.NoBoundaryException if the text contains no marker
     * @throws com.hrx.core.error.HrxParseException if the text is not a valid archive
     * @throws com.hrx.core.error.HrxPathException if an entry path is invalid
     */
    public static HrxArchive parse(String text) {
        return parse(text, BoundaryDiscovery.discoverLength(text));
    }

    /**
     * Parses archive text using a known boundary length.
     *
     * @param text complete archive text
     * @param width number of {@code =} in the boundary
     * @return parsed archive
     * @throws com.hrx.core.error.HrxParseException if the text is not a valid archive
     * @throws com.hrx.core.error.HrxPathException if an entry path is invalid
     */
    public static HrxArchive parse(String text, int width) {
        return parse(text, BoundaryLength.of(width));
    }

    /**
     * Parses archive text using a known boundary.
     *
     * @param text complete archive text
     * @param width boundary to split blocks on
     * @return parsed archive
     */
    public static HrxArchive parse(String text, BoundaryLength width) {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(width, "width must not be null");
        HrxArchive archive = new HrxParser(text, width).parseArchive();
        log.debug("Parsed archive: {} entries, boundary length {}", archive.entries().size(), width.value());
        return archive;
    }

    private HrxArchive parseArchive() {
        if (!text.startsWith(marker)) {
            throw new HrxSyntaxException(SyntaxError.MISSING_LEADING_BOUNDARY, 1);
        }
        while (pos < text.length()) {
            parseBlock();
        }
        finishRootComment();
        return archive;
    }

    private void parseBlock() {
        int headerLine = line;
        int lineEnd = text.indexOf('\n', pos);
        if (lineEnd < 0) {
            throw new HrxSyntaxException(SyntaxError.UNEXPECTED_END_OF_INPUT, headerLine);
        }
        String tail = text.substring(pos + marker.length(), lineEnd);
        advanceTo(lineEnd + 1);
        String body = readBody();

        if (tail.isEmpty()) {
            onComment(body, headerLine);
        } else if (tail.charAt(0) == ' ') {
            onEntry(tail.substring(1), body, headerLine);
        } else {
            throw new HrxSyntaxException(SyntaxError.MALFORMED_HEADER, headerLine);
        }
    }

    /**
     * Reads the body section following a header line, or returns null if there is none.
     */
    private String readBody() {
        if (pos == text.length() || text.startsWith(marker, pos)) {
            return null;
        }
        int end = text.indexOf(delimiter, pos);
        int next;
        if (end >= 0) {
            next = end + 1;
        } else if (text.charAt(text.length() - 1) == '\n') {
            end = text.length() - 1;
            next = text.length();
        } else {
            // last body runs to end of input
            end = text.length();
            next = end;
            archive.setTrailingNewline(false);
        }
        String body = text.substring(pos, end);
        advanceTo(next);
        return body;
    }

    private void onComment(String body, int headerLine) {
        if (body == null) {
            throw new HrxSyntaxException(SyntaxError.EMPTY_COMMENT_BLOCK, headerLine);
        }
        if (pendingComment != null) {
            if (rootComment != null || firstEntry != null) {
                throw new HrxSyntaxException(SyntaxError.CONSECUTIVE_COMMENTS, headerLine);
            }
            // two comments open the document: the first one is the root comment
            rootComment = pendingComment;
        }
        pendingComment = body;
        pendingCommentLine = headerLine;
    }

    private void onEntry(String rawPath, String body, int headerLine) {
        boolean directory = rawPath.endsWith("/");
        if (directory) {
            if (body != null) {
                throw new HrxSyntaxException(SyntaxError.DIRECTORY_WITH_BODY, headerLine);
            }
            rawPath = rawPath.substring(0, rawPath.length() - 1);
        }
        HrxPath path = PathValidator.validate(rawPath);
        HrxEntryData data = directory ? HrxEntryData.directory() : HrxEntryData.file(body);
        HrxEntry entry = new HrxEntry(pendingComment, data);
        pendingComment = null;

        insert(path, entry);
        if (firstEntry == null) {
            firstEntry = entry;
        }
    }

    private void insert(HrxPath path, HrxEntry entry) {
        Map<HrxPath, HrxEntry> entries = archive.entries();

        HrxEntry existing = entries.get(path);
        if (existing != null) {
            throw new DuplicateEntryException(path, existing, entry);
        }
        for (HrxPath ancestor : path.ancestors()) {
            HrxEntry parent = entries.get(ancestor);
            if (parent != null && !parent.isDirectory()) {
                throw new FileAsDirectoryException(ancestor, path);
            }
        }
        HrxPath descendant = descendants.get(path);
        if (descendant != null && !entry.isDirectory()) {
            throw new FileAsDirectoryException(path, descendant);
        }

        entries.put(path, entry);
        for (HrxPath ancestor : path.ancestors()) {
            descendants.putIfAbsent(ancestor, path);
        }
    }

    private void finishRootComment() {
        if (pendingComment != null) {
            if (rootComment != null) {
                throw new HrxSyntaxException(SyntaxError.CONFLICTING_ROOT_COMMENT, pendingCommentLine);
            }
            if (firstEntry != null && firstEntry.comment() != null) {
                // this archive's root comment is written before the first entry's comment
                throw new HrxSyntaxException(SyntaxError.CONFLICTING_ROOT_COMMENT, pendingCommentLine);
            }
            rootComment = pendingComment;
        }
        archive.setComment(rootComment);
    }

    private void advanceTo(int next) {
        for (int i = pos; i < next; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        pos = next;
    }
}
