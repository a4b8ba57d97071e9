package org.modelplatform.api.exceptions;

/**
 * Thrown when checking out a run that another session already holds checked out.
 */
public class SessionLockedException extends PreconditionException {

    private final String lockedBy;

    /**
     * @param message  description including the remedy
     * @param lockedBy user holding the lock, or null if unknown
     */
    public SessionLockedException(String message, String lockedBy) {
        super(message);
        this.lockedBy = lockedBy;
    }

    /**
     * @return the user holding the lock, or null if the engine does not record it
     */
    public String getLockedBy() {
        return lockedBy;
    }
}
