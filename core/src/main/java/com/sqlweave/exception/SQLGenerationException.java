package com.sqlweave.exception;

/**
 * Exception thrown when an expression cannot be rendered to SQL.
 *
 * <p>Rendering is a pure in-memory operation, so this exception never signals
 * an I/O or transient condition. It always means the expression tree, or a
 * host value embedded in it, cannot be expressed as SQL text.
 *
 * <p>Nodes never catch this exception: it propagates unchanged from the
 * innermost failing render call to the statement builder that asked for the
 * SQL, and no partial SQL text is produced.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       String sql = condition.toSQL(scope);
 *   } catch (SQLGenerationException e) {
 *       log.warn("cannot build this query: {}", e.getMessage());
 *   }
 * </pre>
 *
 * @see UnsupportedValueException
 */
public class SQLGenerationException extends RuntimeException {

    private final Class<?> failedType;

    /**
     * Creates a SQL generation exception.
     *
     * @param message the error message
     */
    public SQLGenerationException(String message) {
        this(message, null, null);
    }

    /**
     * Creates a SQL generation exception for a value of the given type.
     *
     * @param message the error message
     * @param failedType the runtime type of the value that failed (may be null)
     */
    public SQLGenerationException(String message, Class<?> failedType) {
        this(message, null, failedType);
    }

    /**
     * Creates a SQL generation exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     * @param failedType the runtime type of the value that failed (may be null)
     */
    public SQLGenerationException(String message, Throwable cause, Class<?> failedType) {
        super(message, cause);
        this.failedType = failedType;
    }

    /**
     * Returns the runtime type of the value that could not be rendered.
     *
     * @return the failed type, or null if not available
     */
    public Class<?> getFailedType() {
        return failedType;
    }

    /**
     * Returns a user-friendly error message.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        if (failedType == null) {
            return "Cannot build this query: " + getMessage();
        }
        return "Cannot build this query: values of type " + failedType.getSimpleName() +
               " cannot be written as SQL. Convert the value to a string, number or " +
               "timestamp, or implement TextualValue.";
    }
}
