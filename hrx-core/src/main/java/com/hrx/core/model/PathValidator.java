package com.hrx.core.model;

import com.hrx.core.error.HrxPathException;
import com.hrx.core.error.PathError;

/**
 * Sole gate for archive path legality.
 *
 * <p>A path is a {@code /}-separated list of components. Each component must be non-empty,
 * contain only characters above U+001F other than {@code /}, {@code \} and {@code :}, and
 * must not be {@code .} or {@code ..}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * HrxPath path = PathValidator.validate("src/main.scss");
 * PathValidator.validate("a//b");   // throws HrxPathException (EMPTY_COMPONENT)
 * }</pre>
 */
public final class PathValidator {

    private PathValidator() {
        // Utility class - no instantiation
    }

    /**
     * Validates a raw string and wraps it as a path.
     *
     * @param raw raw path string
     * @return validated path wrapping {@code raw} unchanged
     * @throws HrxPathException if {@code raw} is not a legal path
     */
    public static HrxPath validate(String raw) {
        return new HrxPath(raw);
    }

    /**
     * Checks a raw string without constructing a path.
     *
     * @param raw raw path string
     * @throws HrxPathException if {@code raw} is not a legal path
     */
    static void check(String raw) {
        // split(-1) keeps leading and trailing empty components
        for (String component : raw.split("/", -1)) {
            if (component.isEmpty()) {
                throw new HrxPathException(raw, PathError.EMPTY_COMPONENT, component);
            }
            for (int i = 0; i < component.length(); i++) {
                if (isForbidden(component.charAt(i))) {
                    throw new HrxPathException(raw, PathError.FORBIDDEN_CHARACTER, component);
                }
            }
            if (component.equals(".") || component.equals("..")) {
                throw new HrxPathException(raw, PathError.RESERVED_COMPONENT, component);
            }
        }
    }

    private static boolean isForbidden(char c) {
        return c <= '\u001F' || c == '\\' || c == ':';
    }
}
