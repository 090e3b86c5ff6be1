package com.color.x.exceptions;

/**
 * Exception thrown when a coloring task cannot complete because the coloring strategy itself failed.
 * <p>
 * Timeouts are not reported through this exception; they surface as unsolved summaries.
 * </p>
 */
public class ColoringExecutionException extends RuntimeException {

    /**
     * Constructs a new {@link ColoringExecutionException} with the specified error message.
     *
     * @param m the detail message explaining the error.
     */
    public ColoringExecutionException(String m) {
        super(m);
    }

    public ColoringExecutionException(String m, Throwable cause) {
        super(m, cause);
    }
}
