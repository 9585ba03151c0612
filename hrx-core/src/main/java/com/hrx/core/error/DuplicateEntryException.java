package com.hrx.core.error;

import com.hrx.core.model.HrxEntry;
import com.hrx.core.model.HrxPath;

/**
 * Thrown when a path occurs more than once in an archive.
 *
 * <p>Both conflicting entries are retained for diagnostics.
 */
public class DuplicateEntryException extends HrxParseException {

    private final HrxPath path;
    private final HrxEntry existing;
    private final HrxEntry duplicate;

    /**
     * @param path the repeated path
     * @param existing the entry seen first
     * @param duplicate the entry that repeats the path
     */
    public DuplicateEntryException(HrxPath path, HrxEntry existing, HrxEntry duplicate) {
        super("Duplicate entry: " + path);
        this.path = path;
        this.existing = existing;
        this.duplicate = duplicate;
    }

    public HrxPath getPath() {
        return path;
    }

    public HrxEntry getExisting() {
        return existing;
    }

    public HrxEntry getDuplicate() {
        return duplicate;
    }
}
