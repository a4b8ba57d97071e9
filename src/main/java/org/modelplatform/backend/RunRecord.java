package org.modelplatform.backend;

import java.time.Instant;

import org.modelplatform.api.backend.ScenarioInfo;

/**
 * Stored bookkeeping of one run, as kept by an engine.
 * <p>
 * {@code version} is {@code 0} until the run is committed for the first time.
 */
public record RunRecord(
        long id,
        String model,
        String scenario,
        String scheme,
        int version,
        String annotation,
        boolean isDefault,
        String creatingUser,
        Instant creationDate,
        String updatingUser,
        Instant updateDate,
        String lockingUser,
        Instant lockDate) {

    public boolean isLocked() {
        return lockingUser != null;
    }

    public boolean isCommitted() {
        return version > 0;
    }

    public String label() {
        return model + "/" + scenario + "#" + version;
    }

    public ScenarioInfo toInfo() {
        return new ScenarioInfo(model, scenario, scheme, isDefault, isLocked(), creatingUser, creationDate,
                updatingUser, updateDate, lockingUser, lockDate, annotation, version);
    }
}
