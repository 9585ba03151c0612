package com.hrx.core.error;

/**
 * Thrown by {@link com.hrx.core.HrxCodec} when input exceeds the configured size limit.
 */
public class HrxInputTooLargeException extends HrxException {

    private final int length;
    private final int limit;

    public HrxInputTooLargeException(int length, int limit) {
        super("Input of " + length + " characters exceeds the limit of " + limit);
        this.length = length;
        this.limit = limit;
    }

    public int getLength() {
        return length;
    }

    public int getLimit() {
        return limit;
    }
}
