package org.modelplatform.api.exceptions;

/**
 * Wraps a failure of the underlying storage engine (connection loss, SQL errors, I/O)
 * with the context of the operation that triggered it.
 */
public class BackendException extends ModelPlatformException {

    /**
     * Creates a BackendException with the specified message.
     *
     * @param message description of the failure
     */
    public BackendException(String message) {
        super(message);
    }

    /**
     * Creates a BackendException with the specified message and cause.
     *
     * @param message description of the failure
     * @param cause the underlying exception
     */
    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
