package org.modelplatform.api.exceptions;

/**
 * Base class of all errors raised by the platform client and its backends.
 * <p>
 * Subclasses distinguish the error categories callers react to differently:
 * <ul>
 *   <li>{@link ItemNotFoundException}: requested data does not exist</li>
 *   <li>{@link PreconditionException}: the session is in the wrong state for the call</li>
 *   <li>{@link ValidationException}: malformed arguments, rejected before any write</li>
 *   <li>{@link BackendException}: the storage engine failed</li>
 *   <li>{@link UnsupportedBackendOperationException}: the engine cannot perform the call</li>
 *   <li>{@link PlatformReferenceException}: the owning platform is gone</li>
 * </ul>
 */
public class ModelPlatformException extends RuntimeException {

    /**
     * Creates a ModelPlatformException with the specified message.
     *
     * @param message description of the failure
     */
    public ModelPlatformException(String message) {
        super(message);
    }

    /**
     * Creates a ModelPlatformException with the specified message and cause.
     *
     * @param message description of the failure
     * @param cause the underlying exception
     */
    public ModelPlatformException(String message, Throwable cause) {
        super(message, cause);
    }
}
