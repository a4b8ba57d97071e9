package org.modelplatform.api.exceptions;

/**
 * Thrown when data is written to a session that is not checked out.
 */
public class CheckoutRequiredException extends PreconditionException {

    public CheckoutRequiredException(String message) {
        super(message);
    }
}
