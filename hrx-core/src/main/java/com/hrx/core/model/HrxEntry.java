package com.hrx.core.model;

import java.util.Objects;

/**
 * A single archive entry: optional comment plus its data.
 *
 * <p>The comment is metadata only and never affects how the entry is interpreted.
 *
 * @param comment optional comment, {@code null} when absent
 * @param data file or directory data
 */
public record HrxEntry(
    String comment,
    HrxEntryData data
) {
    /**
     * Compact constructor with validation.
     */
    public HrxEntry {
        Objects.requireNonNull(data, "data must not be null");
    }

    /**
     * Creates an uncommented file entry.
     *
     * @param body file contents, or {@code null} for no body section
     * @return file entry
     */
    public static HrxEntry file(String body) {
        return new HrxEntry(null, HrxEntryData.file(body));
    }

    /**
     * Creates an uncommented directory entry.
     *
     * @return directory entry
     */
    public static HrxEntry directory() {
        return new HrxEntry(null, HrxEntryData.directory());
    }

    public HrxEntry withComment(String newComment) {
        return new HrxEntry(newComment, data);
    }

    public boolean isDirectory() {
        return data.isDirectory();
    }

    /**
     * Returns the file body, or {@code null} for directories and bodiless files.
     *
     * @return body text or null
     */
    public String body() {
        return data instanceof HrxEntryData.File file ? file.body() : null;
    }
}
