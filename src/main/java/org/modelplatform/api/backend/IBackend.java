package org.modelplatform.api.backend;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.modelplatform.api.item.Element;
import org.modelplatform.api.item.IndexAttribute;
import org.modelplatform.api.item.ItemData;
import org.modelplatform.api.item.ItemRow;
import org.modelplatform.api.item.ItemType;

/**
 * Contract every storage engine implements to back platforms, time series and scenarios.
 * <p>
 * Callers only ever hold this interface; the concrete engine is chosen once when a platform is
 * constructed. Session-scoped calls take the {@link SessionRef} of the calling handle.
 * <p>
 * Error contract:
 * <ul>
 *   <li>missing items, sessions, units or regions: {@code ItemNotFoundException}</li>
 *   <li>writes to a session that is not checked out: {@code CheckoutRequiredException}</li>
 *   <li>malformed arguments: {@code ValidationException}</li>
 *   <li>engine failures: {@code BackendException}</li>
 *   <li>operations the engine cannot perform: {@code UnsupportedBackendOperationException}</li>
 * </ul>
 */
public interface IBackend extends AutoCloseable {

    // ==================== Engine lifecycle ====================

    /**
     * Opens the connection to the engine. Called on construction; calling it again after
     * {@link #closeDb()} reopens the connection.
     */
    void openDb();

    /**
     * Closes the connection. Idempotent.
     */
    void closeDb();

    /**
     * Sets the verbosity of engine-side logging. Engines may ignore the value.
     *
     * @param level an SLF4J level name such as {@code "DEBUG"}
     */
    void setLogLevel(String level);

    String getLogLevel();

    @Override
    default void close() {
        closeDb();
    }

    // ==================== Documentation ====================

    void setDoc(DocDomain domain, Map<String, String> docs);

    /**
     * @return all documentation strings of the domain, keyed by name
     */
    Map<String, String> getDoc(DocDomain domain);

    // ==================== Registries ====================

    void addModelName(String name);

    List<String> getModelNames();

    void addScenarioName(String name);

    List<String> getScenarioNames();

    void setUnit(String name, String comment);

    List<String> getUnits();

    /**
     * Adds a region as child of {@code parent} within {@code hierarchy}.
     */
    void setNode(String name, String parent, String hierarchy);

    /**
     * Adds {@code synonym} as an alias of the existing region {@code mappedTo}.
     *
     * @throws org.modelplatform.api.exceptions.ItemNotFoundException if {@code mappedTo} is not defined
     */
    void setNodeSynonym(String synonym, String mappedTo);

    /**
     * @return all regions including synonyms, in definition order
     */
    List<RegionInfo> getNodes();

    void setTimeslice(String name, String category, double duration);

    List<TimeSliceInfo> getTimeslices();

    /**
     * Lists stored runs.
     *
     * @param defaultOnly only default versions
     * @param model       model filter or null
     * @param scenario    scenario filter or null
     * @return matching runs ordered by model, scenario and version
     */
    List<ScenarioInfo> getScenarios(boolean defaultOnly, String model, String scenario);

    // ==================== Access control ====================

    /**
     * Checks access of {@code user} to each model. Grants everything unless overridden.
     *
     * @param access access kind, e.g. {@code "view"} or {@code "edit"}
     * @return one entry per model, in input order
     */
    default Map<String, Boolean> getAuth(String user, Collection<String> models, String access) {
        Map<String, Boolean> result = new LinkedHashMap<>();
        for (String model : models) {
            result.put(model, true);
        }
        return result;
    }

    // ==================== Session lifecycle ====================

    /**
     * Creates a new run for the session's (model, scenario). The session version stays
     * {@code 0} until the first {@link #commit}.
     */
    void init(SessionRef session, String annotation);

    /**
     * Loads an existing run. If the session version is null, the default version is resolved
     * and written back to the session.
     */
    void get(SessionRef session);

    /**
     * Locks the run for editing by this session.
     *
     * @param timeseriesOnly restrict edits to time-series data
     * @throws org.modelplatform.api.exceptions.SessionLockedException if another session holds the lock
     */
    void checkOut(SessionRef session, boolean timeseriesOnly);

    /**
     * Persists pending changes and releases the lock. For a new run, assigns the version.
     *
     * @return false if there was nothing to commit (session neither checked out nor new)
     */
    boolean commit(SessionRef session, String comment);

    /**
     * Drops pending changes, reloads the stored state and releases the lock.
     */
    void discardChanges(SessionRef session);

    boolean isCheckedOut(SessionRef session);

    void setAsDefault(SessionRef session);

    boolean isDefault(SessionRef session);

    Instant lastUpdate(SessionRef session);

    long runId(SessionRef session);

    /**
     * Hint that the session's data will be read soon. No-op unless an engine benefits from it.
     */
    default void preload(SessionRef session) {
    }

    /**
     * Forgets all client-side state of a handle that is being destroyed.
     */
    void releaseSession(SessionRef session);

    // ==================== Time-series data ====================

    /**
     * Stores values for one (region, variable, unit, subannual) series.
     *
     * @param data year to value
     * @param meta flag the rows as metadata
     */
    void setData(SessionRef session, String region, String variable, Map<Integer, Double> data, String unit,
                 String subannual, boolean meta);

    /**
     * Reads time-series rows. Each empty or null collection means "no restriction".
     */
    List<TimeSeriesRow> getData(SessionRef session, Collection<String> regions, Collection<String> variables,
                                Collection<String> units, Collection<Integer> years);

    /**
     * @return rows including their metadata flag; used when copying data between sessions
     */
    List<TimeSeriesEntry> getDataEntries(SessionRef session);

    void deleteData(SessionRef session, String region, String variable, String subannual, Collection<Integer> years,
                    String unit);

    void setGeo(SessionRef session, String region, String variable, String subannual, int year, String value,
                String unit, boolean meta);

    List<GeoRow> getGeo(SessionRef session);

    void deleteGeo(SessionRef session, String region, String variable, String subannual, Collection<Integer> years,
                   String unit);

    // ==================== Item data ====================

    /**
     * @return item names of the kind, in creation order
     */
    List<String> listItems(SessionRef session, ItemType type);

    void initItem(SessionRef session, ItemType type, String name, List<String> indexSets, List<String> indexNames);

    void deleteItem(SessionRef session, ItemType type, String name);

    /**
     * @return index sets or index names of an item of any kind
     */
    List<String> itemIndex(SessionRef session, String name, IndexAttribute attribute);

    /**
     * Reads elements of an item.
     *
     * @param filters index name to allowed values; values compare by string form; names that
     *                are not dimensions of the item are ignored; null or empty returns all rows
     * @return data shaped by kind and dimensionality, see {@link ItemData}
     */
    ItemData itemGetElements(SessionRef session, ItemType type, String name, Map<String, ? extends Collection<?>> filters);

    /**
     * Adds or updates elements. Either all elements are written or, on a validation failure,
     * none.
     */
    void itemSetElements(SessionRef session, ItemType type, String name, List<Element> elements);

    void itemDeleteElements(SessionRef session, ItemType type, String name, List<List<String>> keys);

    /**
     * Stores solution values of a variable or equation and marks the session as solved.
     * Entry point for external solvers.
     */
    void itemSetSolution(SessionRef session, ItemType type, String name, List<ItemRow> rows);

    // ==================== Scenario lifecycle ====================

    /**
     * Copies a run into a new run, possibly on another backend instance.
     *
     * @param destination    backend receiving the copy; may be this backend
     * @param firstModelYear if non-null, non-metadata time series from this year on are dropped
     * @return a loaded session for the new run
     * @throws org.modelplatform.api.exceptions.UnsupportedBackendOperationException if the engines
     *         cannot exchange snapshots
     */
    SessionRef cloneSession(SessionRef session, IBackend destination, String model, String scenario,
                            String annotation, boolean keepSolution, Integer firstModelYear);

    boolean hasSolution(SessionRef session);

    /**
     * Removes solution values, and with {@code fromYear} also non-metadata time series from that
     * year on.
     */
    void clearSolution(SessionRef session, Integer fromYear);

    // ==================== Meta ====================

    /**
     * @param strict only entries attached exactly at the target; otherwise entries of coarser
     *               targets are merged in
     */
    Map<String, Object> getMeta(MetaTarget target, boolean strict);

    void setMeta(MetaTarget target, Map<String, ?> meta);

    void removeMeta(MetaTarget target, Collection<String> names);
}
