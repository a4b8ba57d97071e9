package org.modelplatform.api.backend;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Backend-side identity of one open session handle.
 * <p>
 * Every handle gets its own reference with a process-unique {@link #id()}, even when two
 * handles point at the same stored run. Backends key their per-session state and cache
 * entries by this id. The version is written back by the backend: {@code init} leaves it at
 * {@code 0} until the first commit, {@code get} replaces an unset version with the default one.
 */
public final class SessionRef {

    private static final AtomicLong NEXT_ID = new AtomicLong(1);

    private final long id;
    private final String model;
    private final String scenario;
    private Integer version;
    private String scheme;
    private String annotation;

    /**
     * @param model    model name
     * @param scenario scenario name
     * @param version  requested version, or null for the default version
     */
    public SessionRef(String model, String scenario, Integer version) {
        this.id = NEXT_ID.getAndIncrement();
        this.model = Objects.requireNonNull(model, "model");
        this.scenario = Objects.requireNonNull(scenario, "scenario");
        this.version = version;
    }

    public long id() {
        return id;
    }

    public String model() {
        return model;
    }

    public String scenario() {
        return scenario;
    }

    /**
     * @return the resolved version, {@code 0} for an uncommitted new run, null before resolution
     */
    public Integer version() {
        return version;
    }

    public void setVersion(Integer version) {
        this.version = version;
    }

    public String scheme() {
        return scheme;
    }

    public void setScheme(String scheme) {
        this.scheme = scheme;
    }

    public String annotation() {
        return annotation;
    }

    public void setAnnotation(String annotation) {
        this.annotation = annotation;
    }

    @Override
    public String toString() {
        return "SessionRef[" + id + ": " + model + "/" + scenario + "#" + version + "]";
    }
}
