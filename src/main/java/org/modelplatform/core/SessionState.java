package org.modelplatform.core;

/**
 * Lifecycle state of a {@link TimeSeries} handle.
 */
public enum SessionState {
    /** Not yet bound to a run. */
    UNBOUND,
    /** Bound to a new run that has not been committed. */
    NEW,
    /** Bound to a committed run and checked in. */
    LOADED,
    /** Locked for editing by this handle. */
    CHECKED_OUT,
    /** The owning platform is gone or the handle was closed. Terminal. */
    DETACHED
}
