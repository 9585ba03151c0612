package com.hrx.core.validation;

import com.hrx.core.model.HrxPath;

import java.util.Objects;

/**
 * Location of the first comment or body found to contain a boundary.
 */
public interface ContentViolation {

    /**
     * Human-readable location, e.g. {@code "comment of entry dir/file.txt"}.
     *
     * @return description of the location
     */
    String describe();

    /**
     * The archive's root comment.
     */
    record RootComment() implements ContentViolation {
        @Override
        public String describe() {
            return "root comment";
        }
    }

    /**
     * The comment attached to an entry.
     *
     * @param path entry path
     */
    record EntryComment(HrxPath path) implements ContentViolation {
        public EntryComment {
            Objects.requireNonNull(path, "path must not be null");
        }

        @Override
        public String describe() {
            return "comment of entry " + path;
        }
    }

    /**
     * The body of a file entry.
     *
     * @param path entry path
     */
    record EntryData(HrxPath path) implements ContentViolation {
        public EntryData {
            Objects.requireNonNull(path, "path must not be null");
        }

        @Override
        public String describe() {
            return "body of entry " + path;
        }
    }
}
