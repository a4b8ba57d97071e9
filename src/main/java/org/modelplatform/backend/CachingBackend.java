package org.modelplatform.backend;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.modelplatform.api.backend.DocDomain;
import org.modelplatform.api.backend.GeoRow;
import org.modelplatform.api.backend.IBackend;
import org.modelplatform.api.backend.MetaTarget;
import org.modelplatform.api.backend.RegionInfo;
import org.modelplatform.api.backend.ScenarioInfo;
import org.modelplatform.api.backend.SessionRef;
import org.modelplatform.api.backend.TimeSeriesEntry;
import org.modelplatform.api.backend.TimeSeriesRow;
import org.modelplatform.api.backend.TimeSliceInfo;
import org.modelplatform.api.item.Element;
import org.modelplatform.api.item.IndexAttribute;
import org.modelplatform.api.item.ItemData;
import org.modelplatform.api.item.ItemRow;
import org.modelplatform.api.item.ItemType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.typesafe.config.Config;

/**
 * Decorator memoizing item reads of any {@link IBackend}.
 * <p>
 * Entries are keyed by {@link CacheKey}: session, kind, name and an optional filter signature,
 * so sessions never see each other's values. Every call that can change what a read returns
 * invalidates the affected entries:
 * <ul>
 *   <li>element writes and deletes, item init/delete, solution import: the item's entries</li>
 *   <li>check-out, discard, solution removal, session release: all entries of the session</li>
 *   <li>closing the backend: everything</li>
 * </ul>
 * Deleting elements of an index set can remove rows of items indexed by it, so it invalidates
 * the whole session.
 * <p>
 * Configuration:
 * <ul>
 *   <li>{@code enabled} - cache reads at all (default: true)</li>
 *   <li>{@code maximum-size} - maximum number of cached reads (default: 10000)</li>
 *   <li>{@code expire-after-access} - expiration time in seconds (default: 3600)</li>
 * </ul>
 */
public class CachingBackend implements IBackend {

    private static final Logger log = LoggerFactory.getLogger(CachingBackend.class);

    private final IBackend delegate;
    private final boolean enabled;
    private final Cache<CacheKey, ItemData> cache;
    private final Map<CacheKey, Long> hits = new ConcurrentHashMap<>();

    public CachingBackend(IBackend delegate, Config options) {
        this.delegate = delegate;
        this.enabled = !options.hasPath("enabled") || options.getBoolean("enabled");
        long maxSize = options.hasPath("maximum-size") ? options.getLong("maximum-size") : 10_000L;
        long expireAfterAccessSeconds = options.hasPath("expire-after-access")
                ? options.getLong("expire-after-access")
                : 3600L;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterAccess(Duration.ofSeconds(expireAfterAccessSeconds))
                .executor(Runnable::run)
                .evictionListener((CacheKey key, ItemData value, RemovalCause cause) -> {
                    if (key != null) {
                        hits.remove(key);
                    }
                })
                .build();
        log.debug("Item cache over {} {} (maximum-size={})", delegate.getClass().getSimpleName(),
                enabled ? "enabled" : "disabled", maxSize);
    }

    public IBackend getDelegate() {
        return delegate;
    }

    public boolean isCacheEnabled() {
        return enabled;
    }

    // ==================== Cache operations ====================

    /**
     * @return a copy of the cached value; empty on a miss or if caching is disabled
     */
    public Optional<ItemData> cacheGet(CacheKey key) {
        if (!enabled) {
            return Optional.empty();
        }
        ItemData value = cache.getIfPresent(key);
        if (value == null) {
            return Optional.empty();
        }
        hits.merge(key, 1L, Long::sum);
        return Optional.of(value.copy());
    }

    /**
     * Stores a copy of {@code value}. Does nothing if caching is disabled.
     *
     * @return true if an entry for exactly this key was replaced
     */
    public boolean cachePut(CacheKey key, ItemData value) {
        if (!enabled) {
            return false;
        }
        return cache.asMap().put(key, value.copy()) != null;
    }

    /**
     * Removes cached reads of a session.
     * <ul>
     *   <li>{@code filters} non-null: exactly the key of (session, type, name, filters)</li>
     *   <li>{@code type} and {@code name} null: every key of the session</li>
     *   <li>otherwise: every key of the item, filtered or not</li>
     * </ul>
     *
     * @throws org.modelplatform.api.exceptions.ValidationException if a filter value cannot be normalized;
     *         the cache is left untouched
     */
    public void cacheInvalidate(SessionRef session, ItemType type, String name,
                                Map<String, ? extends Collection<?>> filters) {
        CacheKeyPattern pattern;
        if (filters != null) {
            pattern = CacheKeyPattern.exact(CacheKey.of(session, type, name, filters));
        } else if (type == null && name == null) {
            pattern = CacheKeyPattern.forSession(session.id());
        } else {
            pattern = CacheKeyPattern.forItem(session.id(), type, name);
        }
        invalidate(pattern);
    }

    /**
     * @return number of hits on {@code key} since it was cached; evicted and invalidated keys
     *         start over at zero
     */
    public long getHits(CacheKey key) {
        return hits.getOrDefault(key, 0L);
    }

    public long size() {
        return cache.estimatedSize();
    }

    /**
     * @return number of keys with a hit counter; never more than the number of cached entries
     */
    long trackedHits() {
        return hits.size();
    }

    void cleanUp() {
        cache.cleanUp();
    }

    private void invalidate(CacheKeyPattern pattern) {
        cache.asMap().keySet().removeIf(pattern::matches);
        hits.keySet().removeIf(pattern::matches);
    }

    private void invalidateSession(SessionRef session) {
        invalidate(CacheKeyPattern.forSession(session.id()));
    }

    private void invalidateItem(SessionRef session, ItemType type, String name) {
        invalidate(CacheKeyPattern.forItem(session.id(), type, name));
    }

    // ==================== Engine lifecycle ====================

    @Override
    public void openDb() {
        delegate.openDb();
    }

    @Override
    public void closeDb() {
        cache.invalidateAll();
        hits.clear();
        delegate.closeDb();
    }

    @Override
    public void setLogLevel(String level) {
        delegate.setLogLevel(level);
    }

    @Override
    public String getLogLevel() {
        return delegate.getLogLevel();
    }

    // ==================== Registries ====================

    @Override
    public void setDoc(DocDomain domain, Map<String, String> docs) {
        delegate.setDoc(domain, docs);
    }

    @Override
    public Map<String, String> getDoc(DocDomain domain) {
        return delegate.getDoc(domain);
    }

    @Override
    public void addModelName(String name) {
        delegate.addModelName(name);
    }

    @Override
    public List<String> getModelNames() {
        return delegate.getModelNames();
    }

    @Override
    public void addScenarioName(String name) {
        delegate.addScenarioName(name);
    }

    @Override
    public List<String> getScenarioNames() {
        return delegate.getScenarioNames();
    }

    @Override
    public void setUnit(String name, String comment) {
        delegate.setUnit(name, comment);
    }

    @Override
    public List<String> getUnits() {
        return delegate.getUnits();
    }

    @Override
    public void setNode(String name, String parent, String hierarchy) {
        delegate.setNode(name, parent, hierarchy);
    }

    @Override
    public void setNodeSynonym(String synonym, String mappedTo) {
        delegate.setNodeSynonym(synonym, mappedTo);
    }

    @Override
    public List<RegionInfo> getNodes() {
        return delegate.getNodes();
    }

    @Override
    public void setTimeslice(String name, String category, double duration) {
        delegate.setTimeslice(name, category, duration);
    }

    @Override
    public List<TimeSliceInfo> getTimeslices() {
        return delegate.getTimeslices();
    }

    @Override
    public List<ScenarioInfo> getScenarios(boolean defaultOnly, String model, String scenario) {
        return delegate.getScenarios(defaultOnly, model, scenario);
    }

    @Override
    public Map<String, Boolean> getAuth(String user, Collection<String> models, String access) {
        return delegate.getAuth(user, models, access);
    }

    // ==================== Session lifecycle ====================

    @Override
    public void init(SessionRef session, String annotation) {
        delegate.init(session, annotation);
    }

    @Override
    public void get(SessionRef session) {
        delegate.get(session);
    }

    @Override
    public void checkOut(SessionRef session, boolean timeseriesOnly) {
        delegate.checkOut(session, timeseriesOnly);
        invalidateSession(session);
    }

    @Override
    public boolean commit(SessionRef session, String comment) {
        return delegate.commit(session, comment);
    }

    @Override
    public void discardChanges(SessionRef session) {
        try {
            delegate.discardChanges(session);
        } finally {
            invalidateSession(session);
        }
    }

    @Override
    public boolean isCheckedOut(SessionRef session) {
        return delegate.isCheckedOut(session);
    }

    @Override
    public void setAsDefault(SessionRef session) {
        delegate.setAsDefault(session);
    }

    @Override
    public boolean isDefault(SessionRef session) {
        return delegate.isDefault(session);
    }

    @Override
    public Instant lastUpdate(SessionRef session) {
        return delegate.lastUpdate(session);
    }

    @Override
    public long runId(SessionRef session) {
        return delegate.runId(session);
    }

    @Override
    public void preload(SessionRef session) {
        delegate.preload(session);
    }

    @Override
    public void releaseSession(SessionRef session) {
        invalidateSession(session);
        delegate.releaseSession(session);
    }

    // ==================== Time-series data ====================

    @Override
    public void setData(SessionRef session, String region, String variable, Map<Integer, Double> data, String unit,
                        String subannual, boolean meta) {
        delegate.setData(session, region, variable, data, unit, subannual, meta);
    }

    @Override
    public List<TimeSeriesRow> getData(SessionRef session, Collection<String> regions, Collection<String> variables,
                                       Collection<String> units, Collection<Integer> years) {
        return delegate.getData(session, regions, variables, units, years);
    }

    @Override
    public List<TimeSeriesEntry> getDataEntries(SessionRef session) {
        return delegate.getDataEntries(session);
    }

    @Override
    public void deleteData(SessionRef session, String region, String variable, String subannual,
                           Collection<Integer> years, String unit) {
        delegate.deleteData(session, region, variable, subannual, years, unit);
    }

    @Override
    public void setGeo(SessionRef session, String region, String variable, String subannual, int year, String value,
                       String unit, boolean meta) {
        delegate.setGeo(session, region, variable, subannual, year, value, unit, meta);
    }

    @Override
    public List<GeoRow> getGeo(SessionRef session) {
        return delegate.getGeo(session);
    }

    @Override
    public void deleteGeo(SessionRef session, String region, String variable, String subannual,
                          Collection<Integer> years, String unit) {
        delegate.deleteGeo(session, region, variable, subannual, years, unit);
    }

    // ==================== Item data ====================

    @Override
    public List<String> listItems(SessionRef session, ItemType type) {
        return delegate.listItems(session, type);
    }

    @Override
    public void initItem(SessionRef session, ItemType type, String name, List<String> indexSets,
                         List<String> indexNames) {
        delegate.initItem(session, type, name, indexSets, indexNames);
        invalidateItem(session, type, name);
    }

    @Override
    public void deleteItem(SessionRef session, ItemType type, String name) {
        delegate.deleteItem(session, type, name);
        invalidateItem(session, type, name);
    }

    @Override
    public List<String> itemIndex(SessionRef session, String name, IndexAttribute attribute) {
        return delegate.itemIndex(session, name, attribute);
    }

    @Override
    public ItemData itemGetElements(SessionRef session, ItemType type, String name,
                                    Map<String, ? extends Collection<?>> filters) {
        CacheKey key = CacheKey.of(session, type, name, filters);
        Optional<ItemData> cached = cacheGet(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        ItemData data = delegate.itemGetElements(session, type, name, filters);
        cachePut(key, data);
        return data;
    }

    @Override
    public void itemSetElements(SessionRef session, ItemType type, String name, List<Element> elements) {
        delegate.itemSetElements(session, type, name, elements);
        invalidateItem(session, type, name);
    }

    @Override
    public void itemDeleteElements(SessionRef session, ItemType type, String name, List<List<String>> keys) {
        delegate.itemDeleteElements(session, type, name, keys);
        if (type == ItemType.SET) {
            invalidateSession(session);
        } else {
            invalidateItem(session, type, name);
        }
    }

    @Override
    public void itemSetSolution(SessionRef session, ItemType type, String name, List<ItemRow> rows) {
        delegate.itemSetSolution(session, type, name, rows);
        invalidateItem(session, type, name);
    }

    // ==================== Scenario lifecycle ====================

    @Override
    public SessionRef cloneSession(SessionRef session, IBackend destination, String model, String scenario,
                                   String annotation, boolean keepSolution, Integer firstModelYear) {
        return delegate.cloneSession(session, destination, model, scenario, annotation, keepSolution, firstModelYear);
    }

    @Override
    public boolean hasSolution(SessionRef session) {
        return delegate.hasSolution(session);
    }

    @Override
    public void clearSolution(SessionRef session, Integer fromYear) {
        delegate.clearSolution(session, fromYear);
        invalidateSession(session);
    }

    // ==================== Meta ====================

    @Override
    public Map<String, Object> getMeta(MetaTarget target, boolean strict) {
        return delegate.getMeta(target, strict);
    }

    @Override
    public void setMeta(MetaTarget target, Map<String, ?> meta) {
        delegate.setMeta(target, meta);
    }

    @Override
    public void removeMeta(MetaTarget target, Collection<String> names) {
        delegate.removeMeta(target, names);
    }
}
