package com.diagnosis.correlation.api;

/**
 * Thrown when an engine operation receives empty or malformed input.
 * Engine entry points convert it to an {@link ErrorKind#INVALID_INPUT} result.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
