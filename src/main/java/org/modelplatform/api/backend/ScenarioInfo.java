package org.modelplatform.api.backend;

import java.time.Instant;
import java.util.List;

/**
 * One row of a scenario listing.
 * <p>
 * Component order is part of the public contract and matches {@link #FIELDS}.
 */
public record ScenarioInfo(
        String model,
        String scenario,
        String scheme,
        boolean isDefault,
        boolean isLocked,
        String creatingUser,
        Instant creationDate,
        String updatingUser,
        Instant updateDate,
        String lockingUser,
        Instant lockDate,
        String annotation,
        int version) {

    public static final List<String> FIELDS = List.of(
            "model", "scenario", "scheme", "is_default", "is_locked", "cre_user", "cre_date",
            "upd_user", "upd_date", "lock_user", "lock_date", "annotation", "version");
}
