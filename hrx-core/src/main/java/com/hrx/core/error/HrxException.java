package com.hrx.core.error;

/**
 * Base class for every failure raised by the HRX engine.
 *
 * <p>All engine failures are unchecked and carry enough context to locate the offending
 * input (a path, a pair of conflicting entries, a line number or a tagged content location).
 * Failures of the sink an archive is written to are not part of this hierarchy; those
 * surface as {@link java.io.IOException}.
 */
public abstract class HrxException extends RuntimeException {

    protected HrxException(String message) {
        super(message);
    }

    protected HrxException(String message, Throwable cause) {
        super(message, cause);
    }
}
