package org.modelplatform.api.backend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.modelplatform.api.exceptions.ValidationException;

/**
 * Scope a meta entry is attached to.
 * <p>
 * Only four combinations exist; {@link #of(String, String, Integer)} rejects all others.
 */
public record MetaTarget(String model, String scenario, Integer version) {

    /**
     * Granularity of a target, from coarse to fine.
     */
    public enum Level {
        MODEL,
        SCENARIO,
        MODEL_SCENARIO,
        RUN
    }

    public MetaTarget {
        level(model, scenario, version);
    }

    public static MetaTarget of(String model, String scenario, Integer version) {
        return new MetaTarget(model, scenario, version);
    }

    public static MetaTarget model(String model) {
        return new MetaTarget(model, null, null);
    }

    public static MetaTarget scenario(String scenario) {
        return new MetaTarget(null, scenario, null);
    }

    public static MetaTarget modelScenario(String model, String scenario) {
        return new MetaTarget(model, scenario, null);
    }

    public static MetaTarget run(String model, String scenario, int version) {
        return new MetaTarget(model, scenario, version);
    }

    public Level level() {
        return level(model, scenario, version);
    }

    /**
     * Returns this target and every coarser target whose entries apply to it, coarsest first.
     *
     * @return e.g. (model), (scenario), (model, scenario), (model, scenario, version) for a run
     */
    public List<MetaTarget> withAncestors() {
        List<MetaTarget> targets = new ArrayList<>();
        switch (level()) {
            case MODEL, SCENARIO -> targets.add(this);
            case MODEL_SCENARIO -> {
                targets.add(model(model));
                targets.add(scenario(scenario));
                targets.add(this);
            }
            case RUN -> {
                targets.add(model(model));
                targets.add(scenario(scenario));
                targets.add(modelScenario(model, scenario));
                targets.add(this);
            }
        }
        return Collections.unmodifiableList(targets);
    }

    /**
     * @return message fragment identifying the target, e.g. {@code model m, scenario null, version null}
     */
    public String describe() {
        return "model " + model + ", scenario " + scenario + ", version " + version;
    }

    private static Level level(String model, String scenario, Integer version) {
        if (model != null && scenario == null && version == null) {
            return Level.MODEL;
        }
        if (model == null && scenario != null && version == null) {
            return Level.SCENARIO;
        }
        if (model != null && scenario != null) {
            return Objects.isNull(version) ? Level.MODEL_SCENARIO : Level.RUN;
        }
        throw new ValidationException("Invalid arguments. Valid combinations are: (model), (scenario), "
                + "(model, scenario), (model, scenario, version)");
    }
}
