package com.hrx.core.error;

/**
 * Kinds of grammar violations reported by {@link HrxSyntaxException}.
 */
public enum SyntaxError {
    /** The document does not open with a boundary marker. */
    MISSING_LEADING_BOUNDARY("archive must start with a boundary"),
    /** Something other than nothing or {@code " " path} follows a marker. */
    MALFORMED_HEADER("malformed boundary header"),
    /** A header line or a trailing body is not terminated by a newline. */
    UNEXPECTED_END_OF_INPUT("unexpected end of input"),
    /** A directory header is followed by a body section. */
    DIRECTORY_WITH_BODY("directory entries cannot have a body"),
    /** A bare marker line is not followed by any comment text. */
    EMPTY_COMMENT_BLOCK("comment block has no body"),
    /** Two comment blocks follow each other outside the leading root position. */
    CONSECUTIVE_COMMENTS("comment block is not followed by an entry"),
    /** The archive supplies the root comment in a second, conflicting place. */
    CONFLICTING_ROOT_COMMENT("conflicting root comment placement");

    private final String description;

    SyntaxError(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
