package com.github.bnbjava.model;

/**
 * Thrown before any search begins when a problem instance is malformed: inconsistent dimensions, missing or
 * duplicated domain values, invalid records.
 */
public class InvalidInputException extends IllegalArgumentException {
    /**
     * Constructor.
     *
     * @param message what is wrong with the input
     */
    public InvalidInputException(String message) {
        super(message);
    }

    /**
     * Constructor.
     *
     * @param message what is wrong with the input
     * @param cause   the underlying parse failure
     */
    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
