package org.modelplatform.backend;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import org.modelplatform.api.backend.GeoRow;
import org.modelplatform.api.backend.IBackend;
import org.modelplatform.api.backend.ISnapshotExchange;
import org.modelplatform.api.backend.MetaTarget;
import org.modelplatform.api.backend.RegionInfo;
import org.modelplatform.api.backend.ScenarioInfo;
import org.modelplatform.api.backend.ScenarioSnapshot;
import org.modelplatform.api.backend.SessionRef;
import org.modelplatform.api.backend.TimeSeriesEntry;
import org.modelplatform.api.backend.TimeSeriesRow;
import org.modelplatform.api.backend.TimeSliceInfo;
import org.modelplatform.api.exceptions.BackendException;
import org.modelplatform.api.exceptions.CheckoutRequiredException;
import org.modelplatform.api.exceptions.ItemNotFoundException;
import org.modelplatform.api.exceptions.PreconditionException;
import org.modelplatform.api.exceptions.SessionLockedException;
import org.modelplatform.api.exceptions.UnsupportedBackendOperationException;
import org.modelplatform.api.exceptions.ValidationException;
import org.modelplatform.api.item.Element;
import org.modelplatform.api.item.IndexAttribute;
import org.modelplatform.api.item.IndexSetData;
import org.modelplatform.api.item.ItemData;
import org.modelplatform.api.item.ItemDefinition;
import org.modelplatform.api.item.ItemRow;
import org.modelplatform.api.item.ItemType;
import org.modelplatform.api.item.ItemTypeSet;
import org.modelplatform.api.item.ScalarData;
import org.modelplatform.api.item.TableData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Shared session and item logic for engines that store runs as a whole.
 * <p>
 * Each open session holds a working copy of its run's {@link RunContent}. Reads are served from
 * the working copy; writes require a check-out and change only the working copy until
 * {@link #commit(SessionRef, String)} hands it to {@link #writeContent} in one piece. Discarding
 * reloads the stored content. Engines implement run bookkeeping, locking, persistence, meta
 * storage and the registries.
 */
public abstract class AbstractBackend implements IBackend, ISnapshotExchange {

    private static final Logger log = LoggerFactory.getLogger(AbstractBackend.class);

    /** Default unit of parameter values stored without one. */
    public static final String UNKNOWN_UNIT = "???";

    /** Region every engine defines and the default parent of new regions. */
    public static final String WORLD = "World";

    private final String name;
    private final String user;
    private final Map<Long, OpenSession> sessions = new ConcurrentHashMap<>();
    private volatile boolean open;
    private volatile String logLevel = "INFO";

    /**
     * Per-handle state of an open session.
     */
    private static final class OpenSession {
        private RunRecord run;
        private RunContent content;
        private boolean checkedOut;
        private boolean timeseriesOnly;
        private boolean uncommitted;

        private OpenSession(RunRecord run, RunContent content, boolean uncommitted) {
            this.run = run;
            this.content = content;
            this.uncommitted = uncommitted;
        }
    }

    /**
     * @param name         engine name used in messages
     * @param options      engine options
     * @param acceptedKeys option keys this engine understands; others are rejected
     * @throws ValidationException if {@code options} contains keys not in {@code acceptedKeys}
     */
    protected AbstractBackend(String name, Config options, Set<String> acceptedKeys) {
        this.name = name;
        Set<String> unknown = new TreeSet<>(options.root().keySet());
        unknown.removeAll(acceptedKeys);
        if (!unknown.isEmpty()) {
            throw new ValidationException("Unknown option(s) " + unknown + " for backend '" + name
                    + "'; accepted options are " + new TreeSet<>(acceptedKeys));
        }
        this.user = options.hasPath("user") ? options.getString("user") : System.getProperty("user.name", "unknown");
    }

    // ==================== Engine hooks ====================

    protected abstract void doOpen();

    protected abstract void doClose();

    /**
     * Creates an uncommitted run record with version {@code 0}.
     */
    protected abstract RunRecord createRun(String model, String scenario, String scheme, String annotation,
                                           String user);

    /**
     * @param version committed version, or null for the default version
     * @throws ItemNotFoundException if no such run exists
     */
    protected abstract RunRecord findRun(String model, String scenario, Integer version);

    protected abstract RunRecord loadRun(long runId);

    /**
     * @return committed runs matching the filters, ordered by model, scenario and version
     */
    protected abstract List<RunRecord> listRuns(boolean defaultOnly, String model, String scenario);

    protected abstract RunContent readContent(long runId);

    /**
     * Replaces the stored content of a run atomically.
     *
     * @param assignVersion assign {@code max(version) + 1} of the (model, scenario) pair
     * @return the updated record
     */
    protected abstract RunRecord writeContent(long runId, RunContent content, String user, String comment,
                                              boolean assignVersion);

    /**
     * Locks a run if it is not locked yet.
     *
     * @return false if the run is already locked
     */
    protected abstract boolean tryLock(long runId, String user);

    protected abstract void unlock(long runId);

    /**
     * Marks a run as default and clears the flag of all other versions of its (model, scenario).
     */
    protected abstract void markDefault(long runId);

    /**
     * @return entries attached exactly at {@code target}
     */
    protected abstract Map<String, Object> readMeta(MetaTarget target);

    /**
     * @return all entries with the given key, at any target
     */
    protected abstract List<MetaEntry> findMetaEntries(String key);

    protected abstract void writeMetaEntry(MetaTarget target, String key, Object value);

    protected abstract void deleteMetaEntry(MetaTarget target, String key);

    // ==================== Engine lifecycle ====================

    @Override
    public synchronized void openDb() {
        if (open) {
            return;
        }
        doOpen();
        open = true;
        log.debug("Backend '{}' opened", name);
    }

    @Override
    public synchronized void closeDb() {
        if (!open) {
            return;
        }
        open = false;
        doClose();
        log.debug("Backend '{}' closed", name);
    }

    public boolean isOpen() {
        return open;
    }

    @Override
    public void setLogLevel(String level) {
        this.logLevel = level;
    }

    @Override
    public String getLogLevel() {
        return logLevel;
    }

    protected String getName() {
        return name;
    }

    protected String getUser() {
        return user;
    }

    protected void ensureOpen() {
        if (!open) {
            throw new BackendException("Backend '" + name + "' is closed; call openDb() first");
        }
    }

    // ==================== Scenario listing ====================

    @Override
    public List<ScenarioInfo> getScenarios(boolean defaultOnly, String model, String scenario) {
        ensureOpen();
        List<ScenarioInfo> result = new ArrayList<>();
        for (RunRecord run : listRuns(defaultOnly, model, scenario)) {
            result.add(run.toInfo());
        }
        return result;
    }

    // ==================== Session lifecycle ====================

    @Override
    public void init(SessionRef session, String annotation) {
        ensureOpen();
        addModelName(session.model());
        addScenarioName(session.scenario());
        RunRecord run = createRun(session.model(), session.scenario(), session.scheme(), annotation, user);
        sessions.put(session.id(), new OpenSession(run, new RunContent(), true));
        session.setVersion(0);
        session.setAnnotation(annotation);
        log.debug("Initialized new run {} for session {}", run.id(), session.id());
    }

    @Override
    public void get(SessionRef session) {
        ensureOpen();
        RunRecord run = findRun(session.model(), session.scenario(), session.version());
        sessions.put(session.id(), new OpenSession(run, readContent(run.id()), false));
        session.setVersion(run.version());
        session.setScheme(run.scheme());
        session.setAnnotation(run.annotation());
    }

    @Override
    public void checkOut(SessionRef session, boolean timeseriesOnly) {
        OpenSession s = open(session);
        if (s.checkedOut) {
            throw new PreconditionException("Session " + s.run.label() + " is already checked out; "
                    + "call commit() or discardChanges() first");
        }
        if (!tryLock(s.run.id(), user)) {
            RunRecord current = loadRun(s.run.id());
            throw new SessionLockedException("Run " + current.label() + " is checked out by '"
                    + current.lockingUser() + "' since " + current.lockDate()
                    + "; wait until it is committed or discarded", current.lockingUser());
        }
        if (!s.uncommitted) {
            try {
                s.content = readContent(s.run.id());
            } catch (RuntimeException e) {
                unlock(s.run.id());
                throw e;
            }
        }
        s.checkedOut = true;
        s.timeseriesOnly = timeseriesOnly;
        log.debug("Checked out {} (timeseriesOnly={})", s.run.label(), timeseriesOnly);
    }

    @Override
    public boolean commit(SessionRef session, String comment) {
        OpenSession s = open(session);
        if (!s.checkedOut && !s.uncommitted) {
            log.debug("Nothing to commit for {}", s.run.label());
            return false;
        }
        RunRecord updated = writeContent(s.run.id(), s.content, user, comment, s.uncommitted);
        if (s.checkedOut) {
            s.checkedOut = false;
            s.timeseriesOnly = false;
            unlock(updated.id());
        }
        s.run = loadRun(updated.id());
        s.uncommitted = false;
        session.setVersion(s.run.version());
        log.debug("Committed {}: {}", s.run.label(), comment);
        return true;
    }

    @Override
    public void discardChanges(SessionRef session) {
        OpenSession s = open(session);
        try {
            s.content = s.uncommitted ? new RunContent() : readContent(s.run.id());
        } finally {
            if (s.checkedOut) {
                s.checkedOut = false;
                s.timeseriesOnly = false;
                unlock(s.run.id());
            }
        }
        log.debug("Discarded changes of {}", s.run.label());
    }

    @Override
    public boolean isCheckedOut(SessionRef session) {
        return open(session).checkedOut;
    }

    @Override
    public void setAsDefault(SessionRef session) {
        OpenSession s = open(session);
        if (s.uncommitted) {
            throw new PreconditionException("Run " + s.run.label() + " has no version yet; call commit() before "
                    + "setAsDefault()");
        }
        markDefault(s.run.id());
        s.run = loadRun(s.run.id());
    }

    @Override
    public boolean isDefault(SessionRef session) {
        OpenSession s = open(session);
        return loadRun(s.run.id()).isDefault();
    }

    @Override
    public Instant lastUpdate(SessionRef session) {
        OpenSession s = open(session);
        return loadRun(s.run.id()).updateDate();
    }

    @Override
    public long runId(SessionRef session) {
        return open(session).run.id();
    }

    @Override
    public void releaseSession(SessionRef session) {
        OpenSession removed = sessions.remove(session.id());
        if (removed != null && removed.checkedOut) {
            log.debug("Session {} released while {} is still checked out", session.id(), removed.run.label());
        }
    }

    // ==================== Time-series data ====================

    @Override
    public void setData(SessionRef session, String region, String variable, Map<Integer, Double> data, String unit,
                        String subannual, boolean meta) {
        OpenSession s = writable(session, false);
        String resolved = resolveRegion(region);
        String slice = subannual == null ? TimeSliceInfo.YEAR.name() : subannual;
        for (Map.Entry<Integer, Double> entry : data.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new ValidationException("Time series " + region + "/" + variable
                        + " contains a null year or value");
            }
        }
        for (Map.Entry<Integer, Double> entry : data.entrySet()) {
            s.content.putSeries(new TimeSeriesEntry(
                    new TimeSeriesRow(resolved, variable, unit, slice, entry.getKey(), entry.getValue()), meta));
        }
    }

    @Override
    public List<TimeSeriesRow> getData(SessionRef session, Collection<String> regions, Collection<String> variables,
                                       Collection<String> units, Collection<Integer> years) {
        OpenSession s = open(session);
        List<TimeSeriesRow> rows = new ArrayList<>();
        for (TimeSeriesEntry entry : s.content.timeseries().values()) {
            TimeSeriesRow row = entry.row();
            if (accepts(regions, row.region()) && accepts(variables, row.variable()) && accepts(units, row.unit())
                    && accepts(years, row.year())) {
                rows.add(row);
            }
        }
        return rows;
    }

    @Override
    public List<TimeSeriesEntry> getDataEntries(SessionRef session) {
        return new ArrayList<>(open(session).content.timeseries().values());
    }

    @Override
    public void deleteData(SessionRef session, String region, String variable, String subannual,
                           Collection<Integer> years, String unit) {
        OpenSession s = writable(session, false);
        String resolved = resolveRegion(region);
        String slice = subannual == null ? TimeSliceInfo.YEAR.name() : subannual;
        s.content.timeseries().values().removeIf(entry -> {
            TimeSeriesRow row = entry.row();
            return row.region().equals(resolved) && row.variable().equals(variable) && row.subannual().equals(slice)
                    && (unit == null || unit.equals(row.unit())) && accepts(years, row.year());
        });
    }

    @Override
    public void setGeo(SessionRef session, String region, String variable, String subannual, int year, String value,
                       String unit, boolean meta) {
        OpenSession s = writable(session, false);
        String slice = subannual == null ? TimeSliceInfo.YEAR.name() : subannual;
        s.content.putGeo(new GeoRow(resolveRegion(region), variable, slice, year, value, unit, meta));
    }

    @Override
    public List<GeoRow> getGeo(SessionRef session) {
        return new ArrayList<>(open(session).content.geodata().values());
    }

    @Override
    public void deleteGeo(SessionRef session, String region, String variable, String subannual,
                          Collection<Integer> years, String unit) {
        OpenSession s = writable(session, false);
        String resolved = resolveRegion(region);
        String slice = subannual == null ? TimeSliceInfo.YEAR.name() : subannual;
        s.content.geodata().values().removeIf(row -> row.region().equals(resolved)
                && row.variable().equals(variable) && row.subannual().equals(slice)
                && (unit == null || unit.equals(row.unit())) && accepts(years, row.year()));
    }

    // ==================== Item data ====================

    @Override
    public List<String> listItems(SessionRef session, ItemType type) {
        OpenSession s = open(session);
        List<String> names = new ArrayList<>();
        for (ItemState state : s.content.items().values()) {
            if (state.definition().type() == type) {
                names.add(state.definition().name());
            }
        }
        return names;
    }

    @Override
    public void initItem(SessionRef session, ItemType type, String name, List<String> indexSets,
                         List<String> indexNames) {
        OpenSession s = writable(session, true);
        if (!ItemTypeSet.MODEL.contains(type)) {
            throw new ValidationException("Cannot initialize an item of type " + type.displayName());
        }
        ItemState existing = s.content.items().get(name);
        if (existing != null) {
            throw new ValidationException("An item named '" + name + "' already exists as a "
                    + existing.definition().type().displayName() + " in " + s.run.label());
        }
        List<String> sets = indexSets == null ? List.of() : List.copyOf(indexSets);
        List<String> names = indexNames == null ? sets : List.copyOf(indexNames);
        if (names.size() != sets.size()) {
            throw new ValidationException("Index names " + names + " of '" + name + "' must have the same length as "
                    + "index sets " + sets);
        }
        if (new HashSet<>(names).size() != names.size()) {
            throw new ValidationException("Index names " + names + " of '" + name + "' must be unique");
        }
        for (String set : sets) {
            ItemState indexSet = s.content.items().get(set);
            if (indexSet == null || indexSet.definition().type() != ItemType.SET) {
                throw new ItemNotFoundException("Index set '" + set + "' of '" + name + "' is not a set in "
                        + s.run.label());
            }
            if (!indexSet.definition().isIndexSet()) {
                throw new ValidationException("Set '" + set + "' is itself indexed and cannot index '" + name + "'");
            }
        }
        s.content.items().put(name, new ItemState(new ItemDefinition(type, name, sets, names)));
    }

    @Override
    public void deleteItem(SessionRef session, ItemType type, String name) {
        OpenSession s = writable(session, true);
        item(s, type, name);
        for (ItemState other : s.content.items().values()) {
            if (other.definition().indexSets().contains(name)) {
                throw new ValidationException("Set '" + name + "' indexes " + other.definition().type().displayName()
                        + " '" + other.definition().name() + "'; delete that item first");
            }
        }
        s.content.items().remove(name);
    }

    @Override
    public List<String> itemIndex(SessionRef session, String name, IndexAttribute attribute) {
        OpenSession s = open(session);
        ItemState state = s.content.items().get(name);
        if (state == null) {
            throw new ItemNotFoundException("No item named '" + name + "' in " + s.run.label());
        }
        return attribute == IndexAttribute.SETS ? state.definition().indexSets() : state.definition().indexNames();
    }

    @Override
    public ItemData itemGetElements(SessionRef session, ItemType type, String name,
                                    Map<String, ? extends Collection<?>> filters) {
        OpenSession s = open(session);
        ItemState state = item(s, type, name);
        ItemDefinition definition = state.definition();
        SortedMap<String, List<String>> normalized = ElementFilters.normalize(filters);

        List<String> dimensions = definition.isIndexSet() ? List.of(name) : definition.indexNames();
        List<ItemRow> rows = new ArrayList<>();
        for (ItemRow row : state.rows().values()) {
            if (matches(row, dimensions, normalized)) {
                rows.add(row);
            }
        }

        if (definition.isIndexSet()) {
            List<String> keys = new ArrayList<>(rows.size());
            for (ItemRow row : rows) {
                keys.add(row.keyAt(0));
            }
            return new IndexSetData(keys);
        }
        if (definition.dimension() == 0) {
            ItemRow row = rows.isEmpty() ? null : rows.get(0);
            if (type == ItemType.PAR) {
                return ScalarData.ofParameter(row == null ? null : row.value(), row == null ? null : row.unit());
            }
            return ScalarData.ofSolution(type, row == null ? null : row.level(), row == null ? null : row.marginal());
        }
        return new TableData(type, definition.indexNames(), rows);
    }

    @Override
    public void itemSetElements(SessionRef session, ItemType type, String name, List<Element> elements) {
        OpenSession s = writable(session, true);
        ItemState state = item(s, type, name);
        if (type.isSolution()) {
            throw new ValidationException("Values of " + type.displayName() + " '" + name + "' are produced by "
                    + "solving the model and cannot be set directly");
        }
        ItemDefinition definition = state.definition();

        List<ItemRow> rows = new ArrayList<>(elements.size());
        for (Element element : elements) {
            List<String> key = element.key() == null ? List.of() : element.key();
            if (type == ItemType.SET) {
                if (element.value() != null || element.unit() != null) {
                    throw new ValidationException("Set '" + name + "' does not take values or units");
                }
                validateKey(s, definition, definition.isIndexSet() ? 1 : definition.dimension(), key);
                rows.add(ItemRow.ofSet(key));
            } else {
                validateKey(s, definition, definition.dimension(), key);
                if (element.value() == null) {
                    throw new ValidationException("No value given for key " + key + " of parameter '" + name + "'");
                }
                rows.add(ItemRow.ofParameter(key, element.value(),
                        element.unit() == null ? UNKNOWN_UNIT : element.unit()));
            }
        }
        for (int i = 0; i < rows.size(); i++) {
            state.put(rows.get(i), elements.get(i).comment());
        }
    }

    @Override
    public void itemDeleteElements(SessionRef session, ItemType type, String name, List<List<String>> keys) {
        OpenSession s = writable(session, true);
        ItemState state = item(s, type, name);
        ItemDefinition definition = state.definition();
        int expected = definition.isIndexSet() ? 1 : definition.dimension();
        for (List<String> key : keys) {
            if (key.size() != expected) {
                throw new ValidationException(key.size() + "-D key " + key + " invalid for " + expected + "-D "
                        + definition.type().displayName() + " '" + name + "'");
            }
        }
        for (List<String> key : keys) {
            state.remove(List.copyOf(key));
        }
        if (state.definition().isIndexSet()) {
            Set<String> removed = new HashSet<>();
            for (List<String> key : keys) {
                removed.add(key.get(0));
            }
            cascadeRemovedElements(s, name, removed);
        }
    }

    @Override
    public void itemSetSolution(SessionRef session, ItemType type, String name, List<ItemRow> rows) {
        OpenSession s = writable(session, true);
        if (!type.isSolution()) {
            throw new ValidationException("Solution values can only be stored for variables and equations, not "
                    + type.displayName() + " '" + name + "'");
        }
        ItemState state = item(s, type, name);
        for (ItemRow row : rows) {
            validateKey(s, state.definition(), state.definition().dimension(), row.key());
        }
        state.rows().clear();
        state.comments().clear();
        for (ItemRow row : rows) {
            state.put(ItemRow.ofSolution(row.key(), row.level(), row.marginal()), null);
        }
        s.content.setHasSolution(true);
    }

    // ==================== Scenario lifecycle ====================

    @Override
    public boolean hasSolution(SessionRef session) {
        return open(session).content.hasSolution();
    }

    @Override
    public void clearSolution(SessionRef session, Integer fromYear) {
        OpenSession s = open(session);
        if (s.checkedOut || s.uncommitted) {
            removeSolution(s.content, fromYear);
            return;
        }
        if (!tryLock(s.run.id(), user)) {
            throw new SessionLockedException("Run " + s.run.label() + " is checked out by another session; "
                    + "its solution cannot be removed now", loadRun(s.run.id()).lockingUser());
        }
        try {
            RunContent updated = readContent(s.run.id());
            removeSolution(updated, fromYear);
            s.run = writeContent(s.run.id(), updated, user, "remove solution", false);
            s.content = updated;
        } finally {
            unlock(s.run.id());
        }
    }

    @Override
    public SessionRef cloneSession(SessionRef session, IBackend destination, String model, String scenario,
                                   String annotation, boolean keepSolution, Integer firstModelYear) {
        IBackend target = destination;
        while (target instanceof CachingBackend caching) {
            target = caching.getDelegate();
        }
        if (!(target instanceof ISnapshotExchange exchange)) {
            throw new UnsupportedBackendOperationException("Cannot clone " + open(session).run.label() + " from "
                    + getClass().getSimpleName() + " to " + target.getClass().getSimpleName()
                    + ": the destination does not accept scenario snapshots");
        }
        ScenarioSnapshot snapshot = exportSnapshot(session, keepSolution, firstModelYear);
        return exchange.importSnapshot(snapshot, model, scenario, annotation);
    }

    @Override
    public ScenarioSnapshot exportSnapshot(SessionRef session, boolean keepSolution, Integer firstModelYear) {
        OpenSession s = open(session);
        List<ItemDefinition> definitions = new ArrayList<>();
        Map<String, List<ItemRow>> elements = new LinkedHashMap<>();
        for (ItemState state : s.content.items().values()) {
            definitions.add(state.definition());
            boolean dropValues = !keepSolution && state.definition().type().isSolution();
            elements.put(state.definition().name(),
                    dropValues ? List.of() : new ArrayList<>(state.rows().values()));
        }
        List<TimeSeriesEntry> series = new ArrayList<>();
        for (TimeSeriesEntry entry : s.content.timeseries().values()) {
            if (keepsRow(entry.meta(), entry.row().year(), keepSolution, firstModelYear)) {
                series.add(entry);
            }
        }
        List<GeoRow> geo = new ArrayList<>();
        for (GeoRow row : s.content.geodata().values()) {
            if (keepsRow(row.meta(), row.year(), keepSolution, firstModelYear)) {
                geo.add(row);
            }
        }
        Map<String, Object> meta = s.run.isCommitted()
                ? readMeta(MetaTarget.run(s.run.model(), s.run.scenario(), s.run.version()))
                : Map.of();
        return new ScenarioSnapshot(s.run.scheme(), definitions, elements, series, geo,
                keepSolution && s.content.hasSolution(), meta);
    }

    @Override
    public SessionRef importSnapshot(ScenarioSnapshot snapshot, String model, String scenario, String annotation) {
        SessionRef session = new SessionRef(model, scenario, null);
        session.setScheme(snapshot.scheme());
        init(session, annotation);
        OpenSession s = open(session);
        RunContent content = new RunContent();
        for (ItemDefinition definition : snapshot.items()) {
            ItemState state = new ItemState(definition);
            for (ItemRow row : snapshot.elements().getOrDefault(definition.name(), List.of())) {
                state.put(row, null);
            }
            content.items().put(definition.name(), state);
        }
        snapshot.timeseries().forEach(content::putSeries);
        snapshot.geodata().forEach(content::putGeo);
        content.setHasSolution(snapshot.hasSolution());
        s.content = content;
        commit(session, annotation);
        if (!snapshot.meta().isEmpty()) {
            setMeta(MetaTarget.run(model, scenario, session.version()), snapshot.meta());
        }
        return session;
    }

    // ==================== Meta ====================

    @Override
    public Map<String, Object> getMeta(MetaTarget target, boolean strict) {
        ensureOpen();
        if (strict) {
            return readMeta(target);
        }
        Map<String, Object> merged = new LinkedHashMap<>();
        for (MetaTarget scope : target.withAncestors()) {
            merged.putAll(readMeta(scope));
        }
        return merged;
    }

    @Override
    public void setMeta(MetaTarget target, Map<String, ?> meta) {
        ensureOpen();
        Map<String, Object> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : meta.entrySet()) {
            Object value = MetaValues.normalize(entry.getKey(), entry.getValue());
            for (MetaEntry existing : findMetaEntries(entry.getKey())) {
                boolean otherLevel = existing.target().level() != target.level();
                boolean otherType = !existing.target().equals(target)
                        && !MetaValues.typeOf(existing.value()).equals(MetaValues.typeOf(value));
                if (otherLevel || otherType) {
                    throw new ValidationException("The meta category '" + entry.getKey()
                            + "' is already used at another level: " + existing.target().describe());
                }
            }
            normalized.put(entry.getKey(), value);
        }
        normalized.forEach((key, value) -> writeMetaEntry(target, key, value));
    }

    @Override
    public void removeMeta(MetaTarget target, Collection<String> names) {
        ensureOpen();
        for (String key : names) {
            deleteMetaEntry(target, key);
        }
    }

    // ==================== Helpers ====================

    private OpenSession open(SessionRef session) {
        ensureOpen();
        OpenSession s = sessions.get(session.id());
        if (s == null) {
            throw new ItemNotFoundException("Session " + session + " is not open on backend '" + name
                    + "'; it must be created with init() or loaded with get()");
        }
        return s;
    }

    private OpenSession writable(SessionRef session, boolean itemWrite) {
        OpenSession s = open(session);
        if (!s.checkedOut) {
            throw new CheckoutRequiredException("Session " + s.run.label() + " is not checked out; call checkOut() "
                    + "before modifying data");
        }
        if (itemWrite && s.timeseriesOnly) {
            throw new PreconditionException("Session " + s.run.label() + " is checked out for time-series edits "
                    + "only; discard and check out without timeseriesOnly to modify items");
        }
        return s;
    }

    private ItemState item(OpenSession s, ItemType type, String name) {
        ItemState state = s.content.items().get(name);
        if (state == null) {
            throw new ItemNotFoundException("No " + type.displayName() + " named '" + name + "' in " + s.run.label());
        }
        if (state.definition().type() != type) {
            throw new ItemNotFoundException("No " + type.displayName() + " named '" + name + "' in " + s.run.label()
                    + "; '" + name + "' is a " + state.definition().type().displayName());
        }
        return state;
    }

    private void validateKey(OpenSession s, ItemDefinition definition, int expectedLength, List<String> key) {
        if (key.size() != expectedLength) {
            throw new ValidationException(key.size() + "-D key " + key + " invalid for " + expectedLength + "-D "
                    + definition.type().displayName() + " '" + definition.name() + "'");
        }
        for (int i = 0; i < definition.indexSets().size(); i++) {
            String set = definition.indexSets().get(i);
            ItemState indexSet = s.content.items().get(set);
            if (indexSet == null || !indexSet.rows().containsKey(List.of(key.get(i)))) {
                throw new ValidationException("Key component '" + key.get(i) + "' of " + key + " is not an element "
                        + "of index set '" + set + "' of '" + definition.name() + "'");
            }
        }
    }

    private static boolean matches(ItemRow row, List<String> dimensions, SortedMap<String, List<String>> filters) {
        for (int i = 0; i < dimensions.size(); i++) {
            List<String> allowed = filters.get(dimensions.get(i));
            if (allowed != null && !allowed.contains(row.keyAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static void cascadeRemovedElements(OpenSession s, String setName, Set<String> removed) {
        for (ItemState other : s.content.items().values()) {
            List<String> sets = other.definition().indexSets();
            if (!sets.contains(setName)) {
                continue;
            }
            List<List<String>> orphaned = new ArrayList<>();
            for (List<String> key : other.rows().keySet()) {
                for (int i = 0; i < sets.size(); i++) {
                    if (sets.get(i).equals(setName) && removed.contains(key.get(i))) {
                        orphaned.add(key);
                        break;
                    }
                }
            }
            orphaned.forEach(other::remove);
            if (!orphaned.isEmpty()) {
                log.debug("Removed {} element(s) of '{}' referencing deleted elements of '{}'",
                        orphaned.size(), other.definition().name(), setName);
            }
        }
    }

    private static void removeSolution(RunContent content, Integer fromYear) {
        for (ItemState state : content.items().values()) {
            if (state.definition().type().isSolution()) {
                state.rows().clear();
                state.comments().clear();
            }
        }
        content.setHasSolution(false);
        if (fromYear != null) {
            content.timeseries().values().removeIf(entry -> !entry.meta() && entry.row().year() >= fromYear);
            content.geodata().values().removeIf(row -> !row.meta() && row.year() >= fromYear);
        }
    }

    private static boolean keepsRow(boolean meta, int year, boolean keepSolution, Integer firstModelYear) {
        if (meta) {
            return true;
        }
        if (firstModelYear != null) {
            return year < firstModelYear;
        }
        return keepSolution;
    }

    private String resolveRegion(String region) {
        for (RegionInfo node : getNodes()) {
            if (node.region().equals(region) && node.isSynonym()) {
                return node.mappedTo();
            }
        }
        return region;
    }

    private static <T> boolean accepts(Collection<T> allowed, T value) {
        return allowed == null || allowed.isEmpty() || allowed.contains(value);
    }
}
