package com.hrx.core.error;

import com.hrx.core.validation.ContentViolation;

/**
 * Thrown when a comment or file body contains the boundary of the width being validated.
 *
 * <p>Raised only by content validation; the archive is left untouched.
 */
public class HrxContentException extends HrxException {

    private final ContentViolation violation;

    public HrxContentException(ContentViolation violation) {
        super("Text contains the boundary: " + violation.describe());
        this.violation = violation;
    }

    /**
     * Returns where the boundary was found.
     *
     * @return the tagged location
     */
    public ContentViolation getViolation() {
        return violation;
    }
}
