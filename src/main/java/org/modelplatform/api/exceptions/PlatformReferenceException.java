package org.modelplatform.api.exceptions;

/**
 * Thrown when a session handle is used after its platform was closed or garbage collected.
 */
public class PlatformReferenceException extends ModelPlatformException {

    /**
     * Creates a PlatformReferenceException with the specified message.
     *
     * @param message description of the failure
     */
    public PlatformReferenceException(String message) {
        super(message);
    }

    /**
     * Creates a PlatformReferenceException with the specified message and cause.
     *
     * @param message description of the failure
     * @param cause the underlying exception
     */
    public PlatformReferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
