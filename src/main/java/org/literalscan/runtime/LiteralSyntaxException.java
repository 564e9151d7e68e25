package org.literalscan.runtime;

import org.literalscan.lexer.ScanError;

import java.io.Serial;

/**
 * Thrown by the run-to-completion driver when the input does not hold a single
 * well formed literal. The literal parsers themselves never throw; they record into
 * {@link ScanError}.
 */
public class LiteralSyntaxException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final String expected;
    private final int pos;
    // Detailed error message that includes line, column and a source snippet
    private final String errorMessage;

    public LiteralSyntaxException(ScanError error, ErrorMessageUtil errorMessageUtil) {
        super(error.toString());
        this.expected = error.getExpected();
        this.pos = error.getPos();
        this.errorMessage = errorMessageUtil.errorMessage(error);
    }

    public String getExpected() {
        return expected;
    }

    public int getPos() {
        return pos;
    }

    @Override
    public String getMessage() {
        return errorMessage;
    }
}
