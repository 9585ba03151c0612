package com.hrx.core.error;

/**
 * Thrown when the input contains no boundary marker at the start of any line.
 */
public class NoBoundaryException extends HrxException {

    public NoBoundaryException() {
        super("No boundary marker found in input");
    }
}
