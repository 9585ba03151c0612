package com.hrx.core.error;

/**
 * Parent of the grammar and structural failures raised while turning text into an archive.
 *
 * @see HrxSyntaxException
 * @see DuplicateEntryException
 * @see FileAsDirectoryException
 */
public abstract class HrxParseException extends HrxException {

    protected HrxParseException(String message) {
        super(message);
    }
}
