package org.modelplatform.api.exceptions;

/**
 * Thrown when an item, session, unit or region does not exist in the backend.
 * <p>
 * Never retried; missing data is always surfaced to the caller.
 */
public class ItemNotFoundException extends ModelPlatformException {

    /**
     * Creates a ItemNotFoundException with the specified message.
     *
     * @param message description of the failure
     */
    public ItemNotFoundException(String message) {
        super(message);
    }

    /**
     * Creates a ItemNotFoundException with the specified message and cause.
     *
     * @param message description of the failure
     * @param cause the underlying exception
     */
    public ItemNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
