package com.pipeduck.parser;

/**
 * Raised when PPL text is not syntactically valid.
 *
 * <p>Carries the 1-based line, 0-based column and the text of the offending token so
 * callers can point at the error in the original query.
 */
public class PPLParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;
    private final String offendingToken;

    public PPLParseException(int line, int column, String offendingToken, String message) {
        super(formatMessage(line, column, offendingToken, message));
        this.line = line;
        this.column = column;
        this.offendingToken = offendingToken;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    /**
     * Returns the offending token text, or an empty string when there is none
     * (empty input, end of input).
     */
    public String offendingToken() {
        return offendingToken;
    }

    private static String formatMessage(int line, int column, String token, String message) {
        if (line <= 0) {
            return "Syntax error: " + message;
        }
        if (token == null || token.isEmpty()) {
            return String.format("Syntax error at line %d:%d: %s", line, column, message);
        }
        return String.format("Syntax error at line %d:%d near '%s': %s", line, column, token, message);
    }
}
