package org.modelplatform.api.exceptions;

/**
 * Thrown when an operation is attempted in a session state that does not allow it.
 * The message names the call that resolves the situation.
 */
public class PreconditionException extends ModelPlatformException {

    /**
     * Creates a PreconditionException with the specified message.
     *
     * @param message description of the failure
     */
    public PreconditionException(String message) {
        super(message);
    }

    /**
     * Creates a PreconditionException with the specified message and cause.
     *
     * @param message description of the failure
     * @param cause the underlying exception
     */
    public PreconditionException(String message, Throwable cause) {
        super(message, cause);
    }
}
