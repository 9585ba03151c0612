package com.hrx.core.error;

/**
 * Thrown when a raw string fails path validation.
 */
public class HrxPathException extends HrxException {

    private final String rawPath;
    private final PathError reason;
    private final String component;

    /**
     * @param rawPath the string that failed validation, as given
     * @param reason why it failed
     * @param component the offending component ({@code ""} for empty components)
     */
    public HrxPathException(String rawPath, PathError reason, String component) {
        super("Invalid path \"" + rawPath + "\": " + reason.description()
            + (component.isEmpty() ? "" : " (\"" + component + "\")"));
        this.rawPath = rawPath;
        this.reason = reason;
        this.component = component;
    }

    public String getRawPath() {
        return rawPath;
    }

    public PathError getReason() {
        return reason;
    }

    public String getComponent() {
        return component;
    }
}
