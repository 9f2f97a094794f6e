package com.pipeduck.exception;

/**
 * Exception thrown when a parsed PPL query cannot be turned into a logical plan.
 *
 * <p>Common causes:
 * <ul>
 *   <li>Unknown table or column</li>
 *   <li>Ambiguous unqualified column after a join</li>
 *   <li>Unknown function or wrong argument count</li>
 *   <li>Type mismatch (e.g. a non-boolean {@code where} predicate)</li>
 *   <li>Failure reported by the catalog</li>
 * </ul>
 *
 * <p>The offending identifier, when there is one, is available through {@link #reference()}.
 */
public class AnalysisException extends RuntimeException {

    private final String reference;

    public AnalysisException(String message) {
        this(message, (String) null);
    }

    /**
     * Creates an analysis exception naming the identifier that failed.
     *
     * @param message the error message
     * @param reference the column, table or function name involved (may be null)
     */
    public AnalysisException(String message, String reference) {
        super(message);
        this.reference = reference;
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
        this.reference = null;
    }

    /**
     * Returns the column, table or function name that caused the failure.
     *
     * @return the reference, or null if the failure is not tied to one name
     */
    public String reference() {
        return reference;
    }
}
