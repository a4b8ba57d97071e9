package org.modelplatform.backend.memory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import org.modelplatform.api.backend.DocDomain;
import org.modelplatform.api.backend.MetaTarget;
import org.modelplatform.api.backend.RegionInfo;
import org.modelplatform.api.backend.TimeSliceInfo;
import org.modelplatform.api.exceptions.ItemNotFoundException;
import org.modelplatform.backend.AbstractBackend;
import org.modelplatform.backend.MetaEntry;
import org.modelplatform.backend.RunContent;
import org.modelplatform.backend.RunRecord;

import com.typesafe.config.Config;

/**
 * Backend keeping all data in process memory.
 * <p>
 * Data lives as long as the instance; closing and reopening keeps it. Suited for tests and
 * throw-away platforms.
 * <p>
 * Options:
 * <pre>
 * user = "analyst"   # name recorded as creating/updating/locking user
 * </pre>
 */
public class InMemoryBackend extends AbstractBackend {

    private static final Set<String> OPTIONS = Set.of("user");

    private final AtomicLong nextRunId = new AtomicLong(1);
    private final Map<Long, RunRecord> runs = new LinkedHashMap<>();
    private final Map<Long, RunContent> contents = new HashMap<>();
    private final Map<MetaTarget, Map<String, Object>> meta = new LinkedHashMap<>();
    private final Map<DocDomain, Map<String, String>> docs = new EnumMap<>(DocDomain.class);
    private final List<String> modelNames = new ArrayList<>();
    private final List<String> scenarioNames = new ArrayList<>();
    private final Map<String, String> units = new LinkedHashMap<>();
    private final Map<String, RegionInfo> nodes = new LinkedHashMap<>();
    private final Map<String, TimeSliceInfo> timeslices = new LinkedHashMap<>();

    public InMemoryBackend(Config options) {
        super("memory", options, OPTIONS);
        nodes.put(WORLD, new RegionInfo(WORLD, null, WORLD, "common"));
        timeslices.put(TimeSliceInfo.YEAR.name(), TimeSliceInfo.YEAR);
        openDb();
    }

    @Override
    protected void doOpen() {
        // nothing to connect to
    }

    @Override
    protected void doClose() {
        // data is kept for a later openDb()
    }

    // ==================== Registries ====================

    @Override
    public synchronized void setDoc(DocDomain domain, Map<String, String> entries) {
        ensureOpen();
        docs.computeIfAbsent(domain, d -> new LinkedHashMap<>()).putAll(entries);
    }

    @Override
    public synchronized Map<String, String> getDoc(DocDomain domain) {
        ensureOpen();
        return new LinkedHashMap<>(docs.getOrDefault(domain, Map.of()));
    }

    @Override
    public synchronized void addModelName(String name) {
        ensureOpen();
        if (!modelNames.contains(name)) {
            modelNames.add(name);
        }
    }

    @Override
    public synchronized List<String> getModelNames() {
        ensureOpen();
        return new ArrayList<>(modelNames);
    }

    @Override
    public synchronized void addScenarioName(String name) {
        ensureOpen();
        if (!scenarioNames.contains(name)) {
            scenarioNames.add(name);
        }
    }

    @Override
    public synchronized List<String> getScenarioNames() {
        ensureOpen();
        return new ArrayList<>(scenarioNames);
    }

    @Override
    public synchronized void setUnit(String name, String comment) {
        ensureOpen();
        units.putIfAbsent(name, comment);
    }

    @Override
    public synchronized List<String> getUnits() {
        ensureOpen();
        return new ArrayList<>(units.keySet());
    }

    @Override
    public synchronized void setNode(String name, String parent, String hierarchy) {
        ensureOpen();
        nodes.put(name, new RegionInfo(name, null, parent, hierarchy));
    }

    @Override
    public synchronized void setNodeSynonym(String synonym, String mappedTo) {
        ensureOpen();
        RegionInfo target = nodes.get(mappedTo);
        if (target == null) {
            throw new ItemNotFoundException("Region '" + mappedTo + "' does not exist; add it before its synonym '"
                    + synonym + "'");
        }
        nodes.put(synonym, new RegionInfo(synonym, mappedTo, target.parent(), target.hierarchy()));
    }

    @Override
    public synchronized List<RegionInfo> getNodes() {
        ensureOpen();
        return new ArrayList<>(nodes.values());
    }

    @Override
    public synchronized void setTimeslice(String name, String category, double duration) {
        ensureOpen();
        timeslices.put(name, new TimeSliceInfo(name, category, duration));
    }

    @Override
    public synchronized List<TimeSliceInfo> getTimeslices() {
        ensureOpen();
        return new ArrayList<>(timeslices.values());
    }

    // ==================== Runs ====================

    @Override
    protected synchronized RunRecord createRun(String model, String scenario, String scheme, String annotation,
                                               String user) {
        Instant now = Instant.now();
        RunRecord run = new RunRecord(nextRunId.getAndIncrement(), model, scenario, scheme, 0, annotation, false,
                user, now, null, null, null, null);
        runs.put(run.id(), run);
        contents.put(run.id(), new RunContent());
        return run;
    }

    @Override
    protected synchronized RunRecord findRun(String model, String scenario, Integer version) {
        for (RunRecord run : runs.values()) {
            if (!run.model().equals(model) || !run.scenario().equals(scenario) || !run.isCommitted()) {
                continue;
            }
            if (version == null ? run.isDefault() : run.version() == version) {
                return run;
            }
        }
        throw new ItemNotFoundException("No run " + model + "/" + scenario
                + (version == null ? " with a default version" : "#" + version));
    }

    @Override
    protected synchronized RunRecord loadRun(long runId) {
        RunRecord run = runs.get(runId);
        if (run == null) {
            throw new ItemNotFoundException("No run with id " + runId);
        }
        return run;
    }

    @Override
    protected synchronized List<RunRecord> listRuns(boolean defaultOnly, String model, String scenario) {
        List<RunRecord> result = new ArrayList<>();
        for (RunRecord run : runs.values()) {
            if (run.isCommitted() && (!defaultOnly || run.isDefault())
                    && (model == null || model.equals(run.model()))
                    && (scenario == null || scenario.equals(run.scenario()))) {
                result.add(run);
            }
        }
        result.sort(Comparator.comparing(RunRecord::model).thenComparing(RunRecord::scenario)
                .thenComparingInt(RunRecord::version));
        return result;
    }

    @Override
    protected synchronized RunContent readContent(long runId) {
        loadRun(runId);
        return contents.get(runId).copy();
    }

    @Override
    protected synchronized RunRecord writeContent(long runId, RunContent content, String user, String comment,
                                                  boolean assignVersion) {
        RunRecord run = loadRun(runId);
        int version = run.version();
        if (assignVersion) {
            version = 1;
            for (RunRecord other : runs.values()) {
                if (other.model().equals(run.model()) && other.scenario().equals(run.scenario())) {
                    version = Math.max(version, other.version() + 1);
                }
            }
        }
        contents.put(runId, content.copy());
        RunRecord updated = new RunRecord(run.id(), run.model(), run.scenario(), run.scheme(), version,
                run.annotation(), run.isDefault(), run.creatingUser(), run.creationDate(), user, Instant.now(),
                run.lockingUser(), run.lockDate());
        runs.put(runId, updated);
        return updated;
    }

    @Override
    protected synchronized boolean tryLock(long runId, String user) {
        RunRecord run = loadRun(runId);
        if (run.isLocked()) {
            return false;
        }
        runs.put(runId, withLock(run, user, Instant.now()));
        return true;
    }

    @Override
    protected synchronized void unlock(long runId) {
        runs.put(runId, withLock(loadRun(runId), null, null));
    }

    @Override
    protected synchronized void markDefault(long runId) {
        RunRecord target = loadRun(runId);
        for (RunRecord run : new ArrayList<>(runs.values())) {
            if (run.model().equals(target.model()) && run.scenario().equals(target.scenario())) {
                runs.put(run.id(), withDefault(run, run.id() == runId));
            }
        }
    }

    // ==================== Meta ====================

    @Override
    protected synchronized Map<String, Object> readMeta(MetaTarget target) {
        return new LinkedHashMap<>(meta.getOrDefault(target, Map.of()));
    }

    @Override
    protected synchronized List<MetaEntry> findMetaEntries(String key) {
        List<MetaEntry> entries = new ArrayList<>();
        meta.forEach((target, values) -> {
            if (values.containsKey(key)) {
                entries.add(new MetaEntry(target, key, values.get(key)));
            }
        });
        return entries;
    }

    @Override
    protected synchronized void writeMetaEntry(MetaTarget target, String key, Object value) {
        meta.computeIfAbsent(target, t -> new LinkedHashMap<>()).put(key, value);
    }

    @Override
    protected synchronized void deleteMetaEntry(MetaTarget target, String key) {
        Map<String, Object> values = meta.get(target);
        if (values != null) {
            values.remove(key);
        }
    }

    private static RunRecord withLock(RunRecord run, String user, Instant when) {
        return new RunRecord(run.id(), run.model(), run.scenario(), run.scheme(), run.version(), run.annotation(),
                run.isDefault(), run.creatingUser(), run.creationDate(), run.updatingUser(), run.updateDate(),
                user, when);
    }

    private static RunRecord withDefault(RunRecord run, boolean isDefault) {
        return new RunRecord(run.id(), run.model(), run.scenario(), run.scheme(), run.version(), run.annotation(),
                isDefault, run.creatingUser(), run.creationDate(), run.updatingUser(), run.updateDate(),
                run.lockingUser(), run.lockDate());
    }
}
