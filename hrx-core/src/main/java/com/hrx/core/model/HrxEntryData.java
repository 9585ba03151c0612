package com.hrx.core.model;

/**
 * What an archive entry holds: a {@link File} or a {@link Directory}.
 */
public interface HrxEntryData {

    /**
     * File with optional contents.
     *
     * <p>A {@code null} body means the file has no body section at all, which is distinct
     * from an empty body {@code ""}.
     *
     * @param body file contents, or {@code null} when absent
     */
    record File(String body) implements HrxEntryData {

        public boolean hasBody() {
            return body != null;
        }
    }

    /**
     * Bodyless directory.
     */
    record Directory() implements HrxEntryData {
    }

    static File file(String body) {
        return new File(body);
    }

    static Directory directory() {
        return new Directory();
    }

    default boolean isDirectory() {
        return this instanceof Directory;
    }
}
