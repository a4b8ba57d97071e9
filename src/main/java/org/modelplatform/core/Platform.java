package org.modelplatform.core;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.modelplatform.api.backend.DocDomain;
import org.modelplatform.api.backend.IBackend;
import org.modelplatform.api.backend.MetaTarget;
import org.modelplatform.api.backend.RegionInfo;
import org.modelplatform.api.backend.ScenarioInfo;
import org.modelplatform.api.backend.TimeSliceInfo;
import org.modelplatform.api.exceptions.PlatformReferenceException;
import org.modelplatform.api.exceptions.ValidationException;
import org.modelplatform.backend.AbstractBackend;
import org.modelplatform.backend.BackendRegistry;
import org.modelplatform.backend.CachingBackend;
import org.modelplatform.config.ConfigLoader;
import org.modelplatform.io.TimeSeriesCsvExport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Entry point to one data store.
 * <p>
 * A platform owns exactly one {@link IBackend} for its whole lifetime and holds no data itself.
 * {@link TimeSeries} and {@link Scenario} handles refer to it weakly; once the platform is
 * closed or collected their backend calls fail with {@link PlatformReferenceException}.
 * <p>
 * Platforms are usually built from configuration:
 * <pre>
 * try (Platform mp = Platform.fromConfig("local")) {
 *     Scenario s = Scenario.createNew(mp, "model", "baseline", "first draft");
 * }
 * </pre>
 */
public class Platform implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Platform.class);

    static final String CONFIG_ROOT = "modelplatform";
    private static final String LOGGER_NAME = "org.modelplatform";

    private final String name;
    private final IBackend backend;
    private volatile boolean closed;

    /**
     * @param name    name used in messages and URLs
     * @param backend opened backend; the platform takes ownership and closes it in {@link #close()}
     */
    public Platform(String name, IBackend backend) {
        this.name = name;
        this.backend = backend;
    }

    /**
     * Creates a platform over a registered backend with the item cache enabled.
     *
     * @param backendName registered backend name or implementation class name
     * @param options     engine options
     */
    public static Platform create(String backendName, Config options) {
        return create(backendName, backendName, options, ConfigFactory.empty());
    }

    /**
     * @param cacheOptions options of the item cache, see {@link CachingBackend}
     */
    public static Platform create(String name, String backendName, Config options, Config cacheOptions) {
        IBackend engine = BackendRegistry.create(backendName, options);
        return new Platform(name, new CachingBackend(engine, cacheOptions));
    }

    /**
     * Creates the named platform from the configuration found by {@link ConfigLoader}.
     */
    public static Platform fromConfig(String name) {
        return fromConfig(ConfigLoader.resolve(), name);
    }

    /**
     * Creates a platform from an entry under {@code modelplatform.platforms}.
     * <p>
     * Each entry names its engine with {@code backend} (a registered name) or {@code className}
     * and passes {@code options} to it. Cache settings come from {@code modelplatform.cache}.
     *
     * @param config configuration containing the {@code modelplatform} tree
     * @param name   platform entry, or null for {@code modelplatform.default-platform}
     * @throws ValidationException if the entry does not exist or names no engine
     */
    public static Platform fromConfig(Config config, String name) {
        String platformName = name;
        if (platformName == null) {
            String defaultPath = CONFIG_ROOT + ".default-platform";
            if (!config.hasPath(defaultPath)) {
                throw new ValidationException("No platform name given and " + defaultPath + " is not configured");
            }
            platformName = config.getString(defaultPath);
        }
        String path = CONFIG_ROOT + ".platforms." + platformName;
        if (!config.hasPath(path)) {
            List<String> known = config.hasPath(CONFIG_ROOT + ".platforms")
                    ? List.copyOf(config.getConfig(CONFIG_ROOT + ".platforms").root().keySet())
                    : List.of();
            throw new ValidationException("No platform named '" + platformName + "' in configuration; known platforms: "
                    + known);
        }
        Config entry = config.getConfig(path);
        String backendName;
        if (entry.hasPath("backend")) {
            backendName = entry.getString("backend");
        } else if (entry.hasPath("className")) {
            backendName = entry.getString("className");
        } else {
            throw new ValidationException("Platform '" + platformName + "' must set 'backend' or 'className'");
        }
        Config options = entry.hasPath("options") ? entry.getConfig("options") : ConfigFactory.empty();
        Config cacheOptions = config.hasPath(CONFIG_ROOT + ".cache")
                ? config.getConfig(CONFIG_ROOT + ".cache")
                : ConfigFactory.empty();
        log.debug("Creating platform '{}' with backend '{}'", platformName, backendName);
        return create(platformName, backendName, options, cacheOptions);
    }

    public String getName() {
        return name;
    }

    /**
     * @throws PlatformReferenceException if the platform has been closed
     */
    public IBackend getBackend() {
        if (closed) {
            throw new PlatformReferenceException("Platform '" + name + "' has been closed");
        }
        return backend;
    }

    public boolean isClosed() {
        return closed;
    }

    // ==================== Engine connection ====================

    public void openDb() {
        getBackend().openDb();
    }

    /**
     * Closes the engine connection; {@link #openDb()} reopens it. Handles stay usable after
     * reopening.
     */
    public void closeDb() {
        getBackend().closeDb();
    }

    /**
     * Closes the backend. All handles of this platform become detached.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        backend.close();
        log.debug("Platform '{}' closed", name);
    }

    /**
     * Sets the level of the {@code org.modelplatform} loggers and forwards it to the backend.
     *
     * @param level a level name such as {@code "DEBUG"} or {@code "warn"}
     * @throws ValidationException if the name is not a log level
     */
    public void setLogLevel(String level) {
        Level parsed = Level.toLevel(level, null);
        if (parsed == null) {
            throw new ValidationException("Invalid log level '" + level + "'; expected one of TRACE, DEBUG, INFO, "
                    + "WARN, ERROR, OFF");
        }
        logbackLogger().setLevel(parsed);
        getBackend().setLogLevel(parsed.toString());
    }

    public String getLogLevel() {
        return logbackLogger().getEffectiveLevel().toString();
    }

    // ==================== Documentation ====================

    public void setDoc(DocDomain domain, Map<String, String> docs) {
        getBackend().setDoc(domain, docs);
    }

    public Map<String, String> getDoc(DocDomain domain) {
        return getBackend().getDoc(domain);
    }

    /**
     * @return the documentation of one name, or null if there is none
     */
    public String getDoc(DocDomain domain, String docName) {
        return getBackend().getDoc(domain).get(docName);
    }

    // ==================== Models and scenarios ====================

    /**
     * @param defaultOnly only default versions
     * @param model       model filter or null
     * @param scenario    scenario filter or null
     */
    public List<ScenarioInfo> scenarioList(boolean defaultOnly, String model, String scenario) {
        return getBackend().getScenarios(defaultOnly, model, scenario);
    }

    /**
     * @return the default version of every stored (model, scenario)
     */
    public List<ScenarioInfo> scenarioList() {
        return scenarioList(true, null, null);
    }

    /**
     * Writes time-series rows of the selected runs to a CSV file.
     *
     * @param variables     variables to export, null or empty for all; same for units and regions
     * @param exportAllRuns every version of every run; cannot be combined with a model or scenario
     * @return number of data lines written
     * @throws ValidationException if the path does not end in {@code .csv} or the arguments conflict
     */
    public int exportTimeseriesData(Path path, boolean defaultOnly, String model, String scenario,
                                    Collection<String> variables, Collection<String> units,
                                    Collection<String> regions, boolean exportAllRuns) throws IOException {
        return new TimeSeriesCsvExport(defaultOnly, model, scenario, variables, units, regions, exportAllRuns)
                .write(this, path);
    }

    /**
     * Exports all time series of the default version of every run matching {@code model} and
     * {@code scenario}.
     */
    public int exportTimeseriesData(Path path, String model, String scenario) throws IOException {
        return exportTimeseriesData(path, true, model, scenario, null, null, null, false);
    }

    public void addModelName(String modelName) {
        getBackend().addModelName(modelName);
    }

    public List<String> getModelNames() {
        return getBackend().getModelNames();
    }

    public void addScenarioName(String scenarioName) {
        getBackend().addScenarioName(scenarioName);
    }

    public List<String> getScenarioNames() {
        return getBackend().getScenarioNames();
    }

    /**
     * @param access access kind, e.g. {@code "view"} or {@code "edit"}
     * @return per model whether access is granted, in input order
     * @throws ValidationException if {@code models} is empty
     */
    public Map<String, Boolean> checkAccess(String user, Collection<String> models, String access) {
        if (models == null || models.isEmpty()) {
            throw new ValidationException("checkAccess() needs at least one model name");
        }
        return getBackend().getAuth(user, models, access);
    }

    public boolean checkAccess(String user, String model, String access) {
        return checkAccess(user, List.of(model), access).getOrDefault(model, false);
    }

    // ==================== Units ====================

    /**
     * Defines a unit unless it exists already.
     */
    public void addUnit(String unit, String comment) {
        if (units().contains(unit)) {
            log.info("Unit '{}' is already defined on the platform", unit);
            return;
        }
        getBackend().setUnit(unit, comment == null ? "None" : comment);
    }

    public void addUnit(String unit) {
        addUnit(unit, null);
    }

    public List<String> units() {
        return getBackend().getUnits();
    }

    // ==================== Regions ====================

    /**
     * Defines a region below {@code parent}. Existing regions and synonyms are left untouched.
     *
     * @param parent parent region, null for {@code World}
     */
    public void addRegion(String region, String hierarchy, String parent) {
        RegionInfo existing = findRegion(region);
        if (existing != null) {
            log.warn("Region '{}' is already defined{}; not adding it again", region,
                    existing.isSynonym() ? " as synonym of '" + existing.mappedTo() + "'" : "");
            return;
        }
        getBackend().setNode(region, parent == null ? AbstractBackend.WORLD : parent, hierarchy);
    }

    public void addRegion(String region, String hierarchy) {
        addRegion(region, hierarchy, null);
    }

    /**
     * Defines {@code synonym} as another name of {@code mappedTo}. Time-series data written with
     * the synonym is stored under {@code mappedTo}.
     */
    public void addRegionSynonym(String synonym, String mappedTo) {
        RegionInfo existing = findRegion(synonym);
        if (existing != null) {
            log.warn("Region '{}' is already defined; not adding it as synonym of '{}'", synonym, mappedTo);
            return;
        }
        getBackend().setNodeSynonym(synonym, mappedTo);
    }

    /**
     * @return regions and synonyms; field order follows {@link RegionInfo#FIELDS}
     */
    public List<RegionInfo> regions() {
        return getBackend().getNodes();
    }

    // ==================== Time slices ====================

    /**
     * Defines a sub-annual time slice.
     *
     * @param duration fraction of a year
     * @throws ValidationException if the slice exists with a different duration
     */
    public void addTimeslice(String timeslice, String category, double duration) {
        for (TimeSliceInfo existing : timeslices()) {
            if (existing.name().equals(timeslice)) {
                if (Double.compare(existing.duration(), duration) != 0) {
                    throw new ValidationException("Timeslice '" + timeslice + "' is already defined with duration "
                            + existing.duration() + ", not " + duration);
                }
                log.info("Timeslice '{}' is already defined", timeslice);
                return;
            }
        }
        getBackend().setTimeslice(timeslice, category, duration);
    }

    public List<TimeSliceInfo> timeslices() {
        return getBackend().getTimeslices();
    }

    // ==================== Meta ====================

    /**
     * Reads meta entries at one of (model), (scenario), (model, scenario) or
     * (model, scenario, version).
     *
     * @param strict only entries attached exactly at the target; otherwise entries of coarser
     *               targets are merged in, finer ones winning
     * @throws ValidationException for any other combination of arguments
     */
    public Map<String, Object> getMeta(String model, String scenario, Integer version, boolean strict) {
        return getBackend().getMeta(MetaTarget.of(model, scenario, version), strict);
    }

    public void setMeta(String model, String scenario, Integer version, Map<String, ?> meta) {
        getBackend().setMeta(MetaTarget.of(model, scenario, version), meta);
    }

    public void removeMeta(String model, String scenario, Integer version, Collection<String> names) {
        getBackend().removeMeta(MetaTarget.of(model, scenario, version), names);
    }

    // ==================== Helpers ====================

    private RegionInfo findRegion(String region) {
        for (RegionInfo info : regions()) {
            if (info.region().equals(region)) {
                return info;
            }
        }
        return null;
    }

    private static ch.qos.logback.classic.Logger logbackLogger() {
        return (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(LOGGER_NAME);
    }

    @Override
    public String toString() {
        return "<Platform " + name + ": " + backend.getClass().getSimpleName() + ">";
    }
}
