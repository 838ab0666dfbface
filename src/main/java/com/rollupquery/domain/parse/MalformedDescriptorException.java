package com.rollupquery.domain.parse;

/**
 * Thrown when a query descriptor cannot be understood: no select list,
 * unknown operator, wrongly shaped value or an illegal identifier.
 *
 * This is the caller's error; nothing downstream guesses a repair.
 */
public class MalformedDescriptorException extends IllegalArgumentException {

    public MalformedDescriptorException(String message) {
        super(message);
    }

    public MalformedDescriptorException(String message, Throwable cause) {
        super(message, cause);
    }
}
