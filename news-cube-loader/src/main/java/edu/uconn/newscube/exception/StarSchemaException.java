package edu.uconn.newscube.exception;

/**
 * Fatal pipeline failure. Raised before any output table is written, so a
 * run that throws it leaves no partial star schema behind.
 */
public class StarSchemaException extends RuntimeException {

    public StarSchemaException(String message) {
        super(message);
    }

    public StarSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
