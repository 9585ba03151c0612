package com.hrx.core.error;

import java.util.Objects;

/**
 * Thrown when the text does not follow the HRX grammar.
 */
public class HrxSyntaxException extends HrxParseException {

    private final SyntaxError kind;
    private final int line;

    /**
     * @param kind the grammar rule that was violated
     * @param line 1-based line of the offending boundary header
     */
    public HrxSyntaxException(SyntaxError kind, int line) {
        super(Objects.requireNonNull(kind, "kind must not be null").description() + " (line " + line + ")");
        this.kind = kind;
        this.line = line;
    }

    public SyntaxError getKind() {
        return kind;
    }

    public int getLine() {
        return line;
    }
}
