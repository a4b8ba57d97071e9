package org.modelplatform.api.exceptions;

/**
 * Thrown when a backend does not implement an operation or argument combination, for example
 * cloning between engines that cannot exchange scenario snapshots.
 * <p>
 * Distinct from {@link ItemNotFoundException} so that callers can tell an engine that is too
 * limited apart from missing data.
 */
public class UnsupportedBackendOperationException extends ModelPlatformException {

    /**
     * Creates a UnsupportedBackendOperationException with the specified message.
     *
     * @param message description of the failure
     */
    public UnsupportedBackendOperationException(String message) {
        super(message);
    }

    /**
     * Creates a UnsupportedBackendOperationException with the specified message and cause.
     *
     * @param message description of the failure
     * @param cause the underlying exception
     */
    public UnsupportedBackendOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
