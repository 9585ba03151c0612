package com.hrx.core.error;

import com.hrx.core.model.HrxPath;

/**
 * Thrown when a file entry would have to act as the parent directory of another entry.
 */
public class FileAsDirectoryException extends HrxParseException {

    private final HrxPath file;
    private final HrxPath child;

    /**
     * @param file the file entry used as a directory
     * @param child the entry located below it
     */
    public FileAsDirectoryException(HrxPath file, HrxPath child) {
        super("File \"" + file + "\" cannot contain \"" + child + "\"");
        this.file = file;
        this.child = child;
    }

    public HrxPath getFile() {
        return file;
    }

    public HrxPath getChild() {
        return child;
    }
}
