package org.modelplatform.api.backend;

/**
 * Capability of a backend to export runs as {@link ScenarioSnapshot}s and to create runs from
 * them. Cloning between two backend instances requires both to implement it.
 */
public interface ISnapshotExchange {

    /**
     * Exports the current content of a session.
     *
     * @param session         source session
     * @param keepSolution    whether variable and equation values are included
     * @param firstModelYear  if non-null, non-metadata time series from this year on are omitted
     * @return the snapshot
     */
    ScenarioSnapshot exportSnapshot(SessionRef session, boolean keepSolution, Integer firstModelYear);

    /**
     * Creates and commits a new run from a snapshot.
     *
     * @param snapshot   content to import
     * @param model      model name of the new run
     * @param scenario   scenario name of the new run
     * @param annotation commit annotation
     * @return a loaded session for the new run with its assigned version
     */
    SessionRef importSnapshot(ScenarioSnapshot snapshot, String model, String scenario, String annotation);
}
