package org.modelplatform.api.exceptions;

/**
 * Thrown for malformed arguments: unsupported element shapes, mismatched lengths,
 * duplicate initialization, keys outside their index sets.
 * <p>
 * Raised before any partial write reaches the backend.
 */
public class ValidationException extends ModelPlatformException {

    /**
     * Creates a ValidationException with the specified message.
     *
     * @param message description of the failure
     */
    public ValidationException(String message) {
        super(message);
    }

    /**
     * Creates a ValidationException with the specified message and cause.
     *
     * @param message description of the failure
     * @param cause the underlying exception
     */
    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
