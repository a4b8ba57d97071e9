package org.modelplatform.core;

import java.lang.ref.WeakReference;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;

import org.modelplatform.api.backend.GeoRow;
import org.modelplatform.api.backend.IBackend;
import org.modelplatform.api.backend.MetaTarget;
import org.modelplatform.api.backend.SessionRef;
import org.modelplatform.api.backend.TimeSeriesEntry;
import org.modelplatform.api.backend.TimeSeriesRow;
import org.modelplatform.api.exceptions.ItemNotFoundException;
import org.modelplatform.api.exceptions.PlatformReferenceException;
import org.modelplatform.api.exceptions.PreconditionException;
import org.modelplatform.api.exceptions.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle on one run of a (model, scenario) pair holding time-series data.
 * <p>
 * A handle is either bound to a new run, which gets its version on the first
 * {@link #commit(String)}, or to a stored version. Data can only be changed while the handle is
 * checked out:
 * <pre>
 * ts.checkOut();
 * ts.addTimeseries(rows);
 * ts.commit("add historical data");
 * </pre>
 * or, equivalently, {@code ts.transact("add historical data", () -> ts.addTimeseries(rows))}.
 * <p>
 * The handle refers to its {@link Platform} weakly. Once the platform is closed or collected,
 * every call that needs the backend fails with {@link PlatformReferenceException}.
 */
public class TimeSeries implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TimeSeries.class);

    private final WeakReference<Platform> platform;
    private final String platformName;
    private final SessionRef session;
    private SessionState state = SessionState.UNBOUND;
    private boolean closed;

    protected TimeSeries(Platform platform, SessionRef session) {
        this.platform = new WeakReference<>(platform);
        this.platformName = platform.getName();
        this.session = session;
    }

    // ==================== Factories ====================

    /**
     * Loads the default version of a stored run.
     *
     * @throws ItemNotFoundException if there is no such run or no default version
     */
    public static TimeSeries load(Platform platform, String model, String scenario) {
        return load(platform, model, scenario, null);
    }

    /**
     * @param version stored version, or null for the default version
     */
    public static TimeSeries load(Platform platform, String model, String scenario, Integer version) {
        TimeSeries ts = new TimeSeries(platform, new SessionRef(model, scenario, version));
        ts.bindExisting();
        return ts;
    }

    /**
     * Creates a new run. It gets its version on the first commit.
     *
     * @param annotation description of the run; null is replaced by an empty string
     */
    public static TimeSeries createNew(Platform platform, String model, String scenario, String annotation) {
        TimeSeries ts = new TimeSeries(platform, new SessionRef(model, scenario, null));
        ts.bindNew(annotation);
        return ts;
    }

    /**
     * Opens the run named by an identity URL.
     *
     * @param platforms resolves the platform part of the URL; receives null for the bare form
     */
    public static TimeSeries fromUrl(String url, Function<String, Platform> platforms) {
        ScenarioUrl parsed = ScenarioUrl.parse(url);
        Platform target = resolvePlatform(parsed, platforms);
        return parsed.isNew()
                ? createNew(target, parsed.model(), parsed.scenario(), null)
                : load(target, parsed.model(), parsed.scenario(), parsed.version());
    }

    static Platform resolvePlatform(ScenarioUrl url, Function<String, Platform> platforms) {
        Platform target = platforms.apply(url.platform());
        if (target == null) {
            throw new ItemNotFoundException("No platform for URL " + url);
        }
        return target;
    }

    protected final void bindExisting() {
        backend().get(session);
        state = SessionState.LOADED;
    }

    protected final void bindNew(String annotation) {
        String text = annotation;
        if (text == null) {
            log.info("No annotation given for new {} {}/{}; using ''", kind(), session.model(), session.scenario());
            text = "";
        }
        backend().init(session, text);
        state = SessionState.NEW;
    }

    /**
     * Marks a handle whose session was opened by the backend itself, e.g. by a clone.
     */
    protected final void markLoaded() {
        state = SessionState.LOADED;
    }

    // ==================== Identity ====================

    public String model() {
        return session.model();
    }

    public String scenario() {
        return session.scenario();
    }

    /**
     * @return the version, {@code 0} while a new run is not committed
     */
    public int version() {
        return session.version() == null ? 0 : session.version();
    }

    public String scheme() {
        return session.scheme();
    }

    public String annotation() {
        return session.annotation();
    }

    /**
     * @return {@code model/scenario#version}
     */
    public String url() {
        return new ScenarioUrl(null, model(), scenario(), version(), false).path();
    }

    /**
     * @return {@code ixmp://platform/model/scenario#version}
     */
    public String fullUrl() {
        return new ScenarioUrl(platformName, model(), scenario(), version(), false).format();
    }

    public SessionState state() {
        if (state != SessionState.DETACHED && !closed) {
            Platform owner = platform.get();
            if (owner == null || owner.isClosed()) {
                state = SessionState.DETACHED;
            }
        }
        return state;
    }

    /**
     * @return the owning platform
     * @throws PlatformReferenceException if it has been closed or collected
     */
    public Platform platform() {
        if (closed) {
            throw new PreconditionException(this + " has been closed");
        }
        Platform owner = platform.get();
        if (owner == null || owner.isClosed()) {
            state = SessionState.DETACHED;
            throw new PlatformReferenceException("Weak reference to platform '" + platformName
                    + "' no longer valid; keep the platform open while using " + this);
        }
        return owner;
    }

    protected IBackend backend() {
        return platform().getBackend();
    }

    protected SessionRef session() {
        return session;
    }

    protected String kind() {
        return "TimeSeries";
    }

    // ==================== Lifecycle ====================

    public void checkOut() {
        checkOut(false);
    }

    /**
     * Locks the run for editing by this handle.
     *
     * @param timeseriesOnly only time-series and geodata edits are intended
     * @throws org.modelplatform.api.exceptions.SessionLockedException if another handle holds the lock
     * @throws PreconditionException if this handle is checked out already
     */
    public void checkOut(boolean timeseriesOnly) {
        backend().checkOut(session, timeseriesOnly);
        state = SessionState.CHECKED_OUT;
    }

    /**
     * Stores all changes and releases the lock. A new run gets its version here.
     * <p>
     * On failure the handle stays checked out, so the commit can be retried or the changes
     * discarded.
     *
     * @param comment description of the changes
     * @return false if there was nothing to commit
     */
    public boolean commit(String comment) {
        boolean committed = backend().commit(session, comment);
        if (committed) {
            state = SessionState.LOADED;
        }
        return committed;
    }

    /**
     * Drops all changes since the last commit and releases the lock.
     */
    public void discardChanges() {
        try {
            backend().discardChanges(session);
        } finally {
            if (state == SessionState.CHECKED_OUT) {
                state = version() == 0 ? SessionState.NEW : SessionState.LOADED;
            }
        }
    }

    public boolean isCheckedOut() {
        return backend().isCheckedOut(session);
    }

    /**
     * Runs {@code body} inside check-out and commit.
     *
     * @see #transact(String, boolean, boolean, Runnable)
     */
    public void transact(String message, Runnable body) {
        transact(message, true, false, body);
    }

    /**
     * Runs {@code body} as one edit.
     * <p>
     * With {@code condition} false the body simply runs. Otherwise the handle is checked out
     * unless it already is, and if it was checked out here it is committed with {@code message}
     * afterwards. If the body fails and {@code discardOnError} is set, changes are discarded as by
     * {@link #discardOnError(Runnable)}; without it whatever the body changed is committed before the
     * failure propagates.
     */
    public void transact(String message, boolean condition, boolean discardOnError, Runnable body) {
        if (!condition) {
            body.run();
            return;
        }
        boolean checkedOutHere = false;
        if (!isCheckedOut()) {
            checkOut();
            checkedOutHere = true;
        }
        try {
            if (discardOnError) {
                discardOnError(body);
            } else {
                body.run();
            }
        } catch (RuntimeException e) {
            if (checkedOutHere && !discardOnError) {
                try {
                    commit(message);
                } catch (RuntimeException commitError) {
                    e.addSuppressed(commitError);
                }
            }
            throw e;
        }
        if (checkedOutHere) {
            commit(message);
        }
    }

    /**
     * Runs {@code body}; if it fails, discards the changes so the run is not left locked, closes
     * the engine connection and rethrows. Reopen with {@link Platform#openDb()} to continue.
     */
    public void discardOnError(Runnable body) {
        try {
            body.run();
        } catch (RuntimeException e) {
            log.info("Avoid locking {} before raising {}", this, e.getClass().getSimpleName());
            try {
                discardChanges();
                log.info("Discarded changes of {}", this);
            } catch (RuntimeException discardError) {
                log.info("Could not discard changes of {}: {}", this, discardError.getMessage());
                e.addSuppressed(discardError);
            }
            try {
                platform().closeDb();
                log.info("Closed database connection of platform '{}'", platformName);
            } catch (RuntimeException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
    }

    // ==================== Run attributes ====================

    /**
     * Makes this version the default of its (model, scenario).
     *
     * @throws PreconditionException if the run has not been committed yet
     */
    public void setAsDefault() {
        backend().setAsDefault(session);
    }

    public boolean isDefault() {
        return backend().isDefault(session);
    }

    /**
     * @return time of the last commit, null if never committed
     */
    public Instant lastUpdate() {
        return backend().lastUpdate(session);
    }

    public long runId() {
        return backend().runId(session);
    }

    /**
     * Tells the backend that the data of this run will be read soon.
     */
    public void preload() {
        backend().preload(session);
    }

    // ==================== Time-series data ====================

    public void addTimeseries(List<TimeSeriesRow> rows) {
        addTimeseries(rows, false, null, null);
    }

    /**
     * Adds or replaces time-series values.
     *
     * @param meta    flag the rows as metadata; metadata rows survive solution removal and
     *                clones without solution
     * @param yearMin skip rows before this year, or null
     * @param yearMax skip rows after this year, or null
     * @throws ValidationException if a row lacks region, variable or sub-annual slice
     */
    public void addTimeseries(List<TimeSeriesRow> rows, boolean meta, Integer yearMin, Integer yearMax) {
        Map<SeriesKey, Map<Integer, Double>> series = new LinkedHashMap<>();
        for (TimeSeriesRow row : rows) {
            if (row.region() == null || row.variable() == null) {
                throw new ValidationException("Time-series row " + row + " needs a region and a variable");
            }
            if ((yearMin != null && row.year() < yearMin) || (yearMax != null && row.year() > yearMax)) {
                continue;
            }
            SeriesKey key = new SeriesKey(row.region(), row.variable(), row.unit(), row.subannual());
            series.computeIfAbsent(key, k -> new TreeMap<>()).put(row.year(), row.value());
        }
        IBackend backend = backend();
        series.forEach((key, values) -> backend.setData(session, key.region(), key.variable(), values, key.unit(),
                key.subannual(), meta));
    }

    /**
     * Adds values given in wide format, one row per series.
     */
    public void addTimeseriesWide(List<IamcRow> rows, boolean meta) {
        List<TimeSeriesRow> longRows = new ArrayList<>();
        for (IamcRow row : rows) {
            longRows.addAll(row.toRows());
        }
        addTimeseries(longRows, meta, null, null);
    }

    /**
     * @return all time-series rows of this run
     */
    public List<TimeSeriesRow> timeseries() {
        return timeseries(null, null, null, null);
    }

    /**
     * Reads time-series rows. Null or empty filters do not restrict.
     */
    public List<TimeSeriesRow> timeseries(Collection<String> regions, Collection<String> variables,
                                          Collection<String> units, Collection<Integer> years) {
        return backend().getData(session, regions, variables, units, years);
    }

    /**
     * @return all time-series rows of this run with their metadata flags
     */
    public List<TimeSeriesEntry> timeseriesEntries() {
        return backend().getDataEntries(session);
    }

    /**
     * Reads time-series rows pivoted to one row per (region, variable, unit, sub-annual) series.
     */
    public List<IamcRow> timeseriesWide(Collection<String> regions, Collection<String> variables,
                                        Collection<String> units, Collection<Integer> years) {
        Map<SeriesKey, SortedMap<Integer, Double>> series = new LinkedHashMap<>();
        for (TimeSeriesRow row : timeseries(regions, variables, units, years)) {
            SeriesKey key = new SeriesKey(row.region(), row.variable(), row.unit(), row.subannual());
            series.computeIfAbsent(key, k -> new TreeMap<>()).put(row.year(), row.value());
        }
        List<IamcRow> result = new ArrayList<>(series.size());
        series.forEach((key, values) -> result.add(
                new IamcRow(key.region(), key.variable(), key.unit(), key.subannual(), values)));
        return result;
    }

    /**
     * Removes the (region, variable, sub-annual, year) points named by {@code rows}; values and
     * units of the rows are ignored.
     */
    public void removeTimeseries(List<TimeSeriesRow> rows) {
        Map<SeriesKey, Set<Integer>> points = new LinkedHashMap<>();
        for (TimeSeriesRow row : rows) {
            points.computeIfAbsent(new SeriesKey(row.region(), row.variable(), null, row.subannual()),
                    k -> new TreeSet<>()).add(row.year());
        }
        IBackend backend = backend();
        points.forEach((key, years) -> backend.deleteData(session, key.region(), key.variable(), key.subannual(),
                years, null));
    }

    // ==================== Geodata ====================

    public void addGeodata(List<GeoRow> rows) {
        for (GeoRow row : rows) {
            if (row.region() == null || row.variable() == null) {
                throw new ValidationException("Geodata row " + row + " needs a region and a variable");
            }
        }
        IBackend backend = backend();
        for (GeoRow row : rows) {
            backend.setGeo(session, row.region(), row.variable(), row.subannual(), row.year(), row.value(),
                    row.unit(), row.meta());
        }
    }

    public List<GeoRow> geodata() {
        return backend().getGeo(session);
    }

    /**
     * Removes the (region, variable, sub-annual, unit, year) points named by {@code rows}.
     */
    public void removeGeodata(List<GeoRow> rows) {
        Map<SeriesKey, Set<Integer>> points = new LinkedHashMap<>();
        for (GeoRow row : rows) {
            points.computeIfAbsent(new SeriesKey(row.region(), row.variable(), row.unit(), row.subannual()),
                    k -> new TreeSet<>()).add(row.year());
        }
        IBackend backend = backend();
        points.forEach((key, years) -> backend.deleteGeo(session, key.region(), key.variable(), key.subannual(),
                years, key.unit()));
    }

    // ==================== Meta ====================

    /**
     * @return meta entries of this run merged with those of its model, its scenario name and the
     *         (model, scenario) pair
     */
    public Map<String, Object> getMeta() {
        return backend().getMeta(metaTarget(), false);
    }

    /**
     * @throws ItemNotFoundException if there is no such entry
     */
    public Object getMeta(String name) {
        Map<String, Object> all = getMeta();
        if (!all.containsKey(name)) {
            throw new ItemNotFoundException("No meta entry '" + name + "' for " + this);
        }
        return all.get(name);
    }

    public void setMeta(String name, Object value) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put(name, value);
        setMeta(entry);
    }

    public void setMeta(Map<String, ?> meta) {
        backend().setMeta(metaTarget(), meta);
    }

    public void removeMeta(Collection<String> names) {
        backend().removeMeta(metaTarget(), names);
    }

    public void removeMeta(String name) {
        removeMeta(List.of(name));
    }

    private MetaTarget metaTarget() {
        if (version() == 0) {
            throw new PreconditionException(this + " has no version yet; commit() before attaching meta data");
        }
        return MetaTarget.run(model(), scenario(), version());
    }

    // ==================== Release ====================

    /**
     * Releases the handle. Its cached data is dropped; stored data is not affected. Further calls
     * fail.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        Platform owner = platform.get();
        if (owner != null && !owner.isClosed()) {
            owner.getBackend().releaseSession(session);
        }
        closed = true;
        state = SessionState.DETACHED;
    }

    @Override
    public String toString() {
        return "<" + kind() + " " + url() + ">";
    }

    /**
     * One series of time-series or geodata rows.
     */
    private record SeriesKey(String region, String variable, String unit, String subannual) {
    }
}
