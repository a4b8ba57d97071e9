package org.modelplatform.backend.h2;

import java.lang.reflect.Type;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.modelplatform.api.backend.DocDomain;
import org.modelplatform.api.backend.GeoRow;
import org.modelplatform.api.backend.MetaTarget;
import org.modelplatform.api.backend.RegionInfo;
import org.modelplatform.api.backend.TimeSeriesEntry;
import org.modelplatform.api.backend.TimeSeriesRow;
import org.modelplatform.api.backend.TimeSliceInfo;
import org.modelplatform.api.exceptions.BackendException;
import org.modelplatform.api.exceptions.ItemNotFoundException;
import org.modelplatform.api.item.ItemDefinition;
import org.modelplatform.api.item.ItemRow;
import org.modelplatform.api.item.ItemType;
import org.modelplatform.backend.AbstractBackend;
import org.modelplatform.backend.ItemState;
import org.modelplatform.backend.MetaEntry;
import org.modelplatform.backend.MetaValues;
import org.modelplatform.backend.RunContent;
import org.modelplatform.backend.RunRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Backend storing runs in an H2 database, accessed through a HikariCP connection pool.
 * <p>
 * The JDBC URL selects the flavour: {@code jdbc:h2:file:/path/db} for an embedded file database,
 * {@code jdbc:h2:tcp://host/db} for a networked server, {@code jdbc:h2:mem:name} for a private
 * in-memory database. Each commit replaces the stored content of a run in a single transaction.
 * <p>
 * Options:
 * <pre>
 * jdbcUrl     = "jdbc:h2:file:./data/platform"   # default: fresh in-memory database
 * username    = "sa"
 * password    = ""
 * maxPoolSize = 4
 * minIdle     = 1
 * user        = "analyst"
 * </pre>
 * <p>
 * Implements {@link AutoCloseable} through the backend interface; closing shuts down the pool.
 */
public class H2Backend extends AbstractBackend {

    private static final Logger log = LoggerFactory.getLogger(H2Backend.class);

    private static final Set<String> OPTIONS = Set.of("jdbcUrl", "username", "password", "maxPoolSize", "minIdle",
            "user");
    private static final Gson GSON = new Gson();
    private static final Type STRING_LIST = new TypeToken<List<String>>() { }.getType();

    private static final String RUN_COLUMNS = "id, model, scenario, scheme, version, annotation, is_default, "
            + "cre_user, cre_date, upd_user, upd_date, lock_user, lock_date";

    private final String jdbcUrl;
    private final String username;
    private final String password;
    private final int maxPoolSize;
    private final int minIdle;
    private HikariDataSource dataSource;

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }

    public H2Backend(Config options) {
        super("h2", options, OPTIONS);
        this.jdbcUrl = options.hasPath("jdbcUrl")
                ? options.getString("jdbcUrl")
                : "jdbc:h2:mem:modelplatform-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        this.username = options.hasPath("username") ? options.getString("username") : "sa";
        this.password = options.hasPath("password") ? options.getString("password") : "";
        this.maxPoolSize = options.hasPath("maxPoolSize") ? options.getInt("maxPoolSize") : 4;
        this.minIdle = options.hasPath("minIdle") ? options.getInt("minIdle") : 1;
        openDb();
    }

    // ==================== Engine lifecycle ====================

    @Override
    protected void doOpen() {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setDriverClassName("org.h2.Driver");
        hikariConfig.setMaximumPoolSize(maxPoolSize);
        hikariConfig.setMinimumIdle(minIdle);
        hikariConfig.setUsername(username);
        hikariConfig.setPassword(password);
        hikariConfig.setPoolName("modelplatform-h2");

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
            log.debug("H2 connection pool started for {} (max={}, minIdle={})", jdbcUrl, maxPoolSize, minIdle);
        } catch (Exception e) {
            Throwable cause = e;
            while (cause.getCause() != null && cause.getCause() != cause) {
                cause = cause.getCause();
            }
            String causeMsg = cause.getMessage() != null ? cause.getMessage() : "";
            if (causeMsg.contains("already in use") || causeMsg.contains("file is locked")) {
                String errorMsg = String.format("Cannot open H2 database %s: file already in use by another process. "
                        + "Close the other platform or use a jdbc:h2:tcp URL to share the database", jdbcUrl);
                log.error(errorMsg);
                throw new BackendException(errorMsg, e);
            }
            if (causeMsg.contains("Wrong user name or password")) {
                String errorMsg = String.format("Failed to connect to H2 database %s: wrong username/password (user=%s)",
                        jdbcUrl, username.isEmpty() ? "(empty)" : username);
                log.error(errorMsg);
                throw new BackendException(errorMsg, e);
            }
            String errorMsg = String.format("Failed to initialize H2 database %s: %s: %s",
                    jdbcUrl, cause.getClass().getSimpleName(), causeMsg);
            log.error(errorMsg);
            throw new BackendException(errorMsg, e);
        }

        try (Connection conn = dataSource.getConnection()) {
            H2Schema.create(conn);
            seedDefaults(conn);
        } catch (SQLException e) {
            dataSource.close();
            throw new BackendException("Failed to create schema in H2 database " + jdbcUrl + ": " + e.getMessage(), e);
        }
    }

    @Override
    protected void doClose() {
        if (dataSource != null) {
            dataSource.close();
            log.debug("H2 connection pool for {} closed", jdbcUrl);
        }
    }

    private void seedDefaults(Connection conn) throws SQLException {
        try (PreparedStatement node = conn.prepareStatement(
                "MERGE INTO node (name, mapped_to, parent, hierarchy) KEY(name) VALUES (?, NULL, ?, ?)")) {
            node.setString(1, WORLD);
            node.setString(2, WORLD);
            node.setString(3, "common");
            node.executeUpdate();
        }
        try (PreparedStatement slice = conn.prepareStatement(
                "MERGE INTO timeslice (name, category, duration) KEY(name) VALUES (?, ?, ?)")) {
            slice.setString(1, TimeSliceInfo.YEAR.name());
            slice.setString(2, TimeSliceInfo.YEAR.category());
            slice.setDouble(3, TimeSliceInfo.YEAR.duration());
            slice.executeUpdate();
        }
    }

    // ==================== Registries ====================

    @Override
    public void setDoc(DocDomain domain, Map<String, String> docs) {
        transaction("store documentation", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "MERGE INTO documentation (doc_domain, name, doc) KEY(doc_domain, name) VALUES (?, ?, ?)")) {
                for (Map.Entry<String, String> entry : docs.entrySet()) {
                    stmt.setString(1, domain.name());
                    stmt.setString(2, entry.getKey());
                    stmt.setString(3, entry.getValue());
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }
            return null;
        });
    }

    @Override
    public Map<String, String> getDoc(DocDomain domain) {
        return query("read documentation", conn -> {
            Map<String, String> docs = new LinkedHashMap<>();
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT name, doc FROM documentation WHERE doc_domain = ? ORDER BY name")) {
                stmt.setString(1, domain.name());
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        docs.put(rs.getString("name"), rs.getString("doc"));
                    }
                }
            }
            return docs;
        });
    }

    @Override
    public void addModelName(String name) {
        mergeName("model_name", name);
    }

    @Override
    public List<String> getModelNames() {
        return listNames("model_name");
    }

    @Override
    public void addScenarioName(String name) {
        mergeName("scenario_name", name);
    }

    @Override
    public List<String> getScenarioNames() {
        return listNames("scenario_name");
    }

    @Override
    public void setUnit(String name, String comment) {
        query("add unit " + name, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "MERGE INTO unit_def (name, unit_comment) KEY(name) VALUES (?, ?)")) {
                stmt.setString(1, name);
                stmt.setString(2, comment);
                stmt.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public List<String> getUnits() {
        return listNames("unit_def");
    }

    @Override
    public void setNode(String name, String parent, String hierarchy) {
        query("add region " + name, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "MERGE INTO node (name, mapped_to, parent, hierarchy) KEY(name) VALUES (?, NULL, ?, ?)")) {
                stmt.setString(1, name);
                stmt.setString(2, parent);
                stmt.setString(3, hierarchy);
                stmt.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public void setNodeSynonym(String synonym, String mappedTo) {
        transaction("add region synonym " + synonym, conn -> {
            String parent;
            String hierarchy;
            try (PreparedStatement stmt = conn.prepareStatement("SELECT parent, hierarchy FROM node WHERE name = ?")) {
                stmt.setString(1, mappedTo);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        throw new ItemNotFoundException("Region '" + mappedTo + "' does not exist; add it before its "
                                + "synonym '" + synonym + "'");
                    }
                    parent = rs.getString("parent");
                    hierarchy = rs.getString("hierarchy");
                }
            }
            try (PreparedStatement stmt = conn.prepareStatement(
                    "MERGE INTO node (name, mapped_to, parent, hierarchy) KEY(name) VALUES (?, ?, ?, ?)")) {
                stmt.setString(1, synonym);
                stmt.setString(2, mappedTo);
                stmt.setString(3, parent);
                stmt.setString(4, hierarchy);
                stmt.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public List<RegionInfo> getNodes() {
        return query("list regions", conn -> {
            List<RegionInfo> nodes = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT name, mapped_to, parent, hierarchy FROM node ORDER BY id");
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    nodes.add(new RegionInfo(rs.getString("name"), rs.getString("mapped_to"),
                            rs.getString("parent"), rs.getString("hierarchy")));
                }
            }
            return nodes;
        });
    }

    @Override
    public void setTimeslice(String name, String category, double duration) {
        query("add timeslice " + name, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "MERGE INTO timeslice (name, category, duration) KEY(name) VALUES (?, ?, ?)")) {
                stmt.setString(1, name);
                stmt.setString(2, category);
                stmt.setDouble(3, duration);
                stmt.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public List<TimeSliceInfo> getTimeslices() {
        return query("list timeslices", conn -> {
            List<TimeSliceInfo> slices = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT name, category, duration FROM timeslice ORDER BY id");
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    slices.add(new TimeSliceInfo(rs.getString("name"), rs.getString("category"),
                            rs.getDouble("duration")));
                }
            }
            return slices;
        });
    }

    // ==================== Runs ====================

    @Override
    protected RunRecord createRun(String model, String scenario, String scheme, String annotation, String user) {
        long id = transaction("create run " + model + "/" + scenario, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "INSERT INTO run (model, scenario, scheme, version, annotation, cre_user, cre_date) "
                            + "VALUES (?, ?, ?, 0, ?, ?, ?)", new String[] {"ID"})) {
                stmt.setString(1, model);
                stmt.setString(2, scenario);
                stmt.setString(3, scheme);
                stmt.setString(4, annotation);
                stmt.setString(5, user);
                stmt.setTimestamp(6, Timestamp.from(Instant.now()));
                stmt.executeUpdate();
                try (ResultSet keys = stmt.getGeneratedKeys()) {
                    keys.next();
                    return keys.getLong(1);
                }
            }
        });
        return loadRun(id);
    }

    @Override
    protected RunRecord findRun(String model, String scenario, Integer version) {
        return query("find run " + model + "/" + scenario, conn -> {
            String sql = "SELECT " + RUN_COLUMNS + " FROM run WHERE model = ? AND scenario = ? AND version > 0 AND "
                    + (version == null ? "is_default = TRUE" : "version = ?");
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, model);
                stmt.setString(2, scenario);
                if (version != null) {
                    stmt.setInt(3, version);
                }
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        throw new ItemNotFoundException("No run " + model + "/" + scenario
                                + (version == null ? " with a default version" : "#" + version));
                    }
                    return readRun(rs);
                }
            }
        });
    }

    @Override
    protected RunRecord loadRun(long runId) {
        return query("load run " + runId, conn -> loadRun(conn, runId));
    }

    @Override
    protected List<RunRecord> listRuns(boolean defaultOnly, String model, String scenario) {
        return query("list runs", conn -> {
            StringBuilder sql = new StringBuilder("SELECT ").append(RUN_COLUMNS).append(" FROM run WHERE version > 0");
            if (defaultOnly) {
                sql.append(" AND is_default = TRUE");
            }
            if (model != null) {
                sql.append(" AND model = ?");
            }
            if (scenario != null) {
                sql.append(" AND scenario = ?");
            }
            sql.append(" ORDER BY model, scenario, version");
            try (PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
                int index = 1;
                if (model != null) {
                    stmt.setString(index++, model);
                }
                if (scenario != null) {
                    stmt.setString(index, scenario);
                }
                List<RunRecord> runs = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        runs.add(readRun(rs));
                    }
                }
                return runs;
            }
        });
    }

    @Override
    protected RunContent readContent(long runId) {
        return query("read content of run " + runId, conn -> {
            RunContent content = new RunContent();
            try (PreparedStatement stmt = conn.prepareStatement("SELECT has_solution FROM run WHERE id = ?")) {
                stmt.setLong(1, runId);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        throw new ItemNotFoundException("No run with id " + runId);
                    }
                    content.setHasSolution(rs.getBoolean(1));
                }
            }
            readItems(conn, runId, content);
            readSeries(conn, runId, content);
            readGeo(conn, runId, content);
            return content;
        });
    }

    @Override
    protected RunRecord writeContent(long runId, RunContent content, String user, String comment,
                                     boolean assignVersion) {
        return transaction("write content of run " + runId, conn -> {
            RunRecord run = loadRun(conn, runId);
            for (String table : List.of("item", "item_data", "ts_data", "geo_data")) {
                try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM " + table + " WHERE run_id = ?")) {
                    stmt.setLong(1, runId);
                    stmt.executeUpdate();
                }
            }
            writeItems(conn, runId, content);
            writeSeries(conn, runId, content);
            writeGeo(conn, runId, content);

            int version = run.version();
            if (assignVersion) {
                try (PreparedStatement stmt = conn.prepareStatement(
                        "SELECT COALESCE(MAX(version), 0) + 1 FROM run WHERE model = ? AND scenario = ?")) {
                    stmt.setString(1, run.model());
                    stmt.setString(2, run.scenario());
                    try (ResultSet rs = stmt.executeQuery()) {
                        rs.next();
                        version = rs.getInt(1);
                    }
                }
            }
            try (PreparedStatement stmt = conn.prepareStatement(
                    "UPDATE run SET version = ?, has_solution = ?, upd_user = ?, upd_date = ? WHERE id = ?")) {
                stmt.setInt(1, version);
                stmt.setBoolean(2, content.hasSolution());
                stmt.setString(3, user);
                stmt.setTimestamp(4, Timestamp.from(Instant.now()));
                stmt.setLong(5, runId);
                stmt.executeUpdate();
            }
            log.debug("Stored run {} ({} items, {} series values): {}", runId, content.items().size(),
                    content.timeseries().size(), comment);
            return loadRun(conn, runId);
        });
    }

    @Override
    protected boolean tryLock(long runId, String user) {
        return transaction("lock run " + runId, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "UPDATE run SET lock_user = ?, lock_date = ? WHERE id = ? AND lock_user IS NULL")) {
                stmt.setString(1, user);
                stmt.setTimestamp(2, Timestamp.from(Instant.now()));
                stmt.setLong(3, runId);
                return stmt.executeUpdate() == 1;
            }
        });
    }

    @Override
    protected void unlock(long runId) {
        transaction("unlock run " + runId, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "UPDATE run SET lock_user = NULL, lock_date = NULL WHERE id = ?")) {
                stmt.setLong(1, runId);
                stmt.executeUpdate();
            }
            return null;
        });
    }

    @Override
    protected void markDefault(long runId) {
        transaction("set default version for run " + runId, conn -> {
            RunRecord run = loadRun(conn, runId);
            try (PreparedStatement stmt = conn.prepareStatement(
                    "UPDATE run SET is_default = (id = ?) WHERE model = ? AND scenario = ?")) {
                stmt.setLong(1, runId);
                stmt.setString(2, run.model());
                stmt.setString(3, run.scenario());
                stmt.executeUpdate();
            }
            return null;
        });
    }

    // ==================== Meta ====================

    @Override
    protected Map<String, Object> readMeta(MetaTarget target) {
        return query("read meta", conn -> {
            Map<String, Object> meta = new LinkedHashMap<>();
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT meta_key, meta_value FROM meta WHERE model IS NOT DISTINCT FROM ? "
                            + "AND scenario IS NOT DISTINCT FROM ? AND version IS NOT DISTINCT FROM ? ORDER BY id")) {
                bindTarget(stmt, 1, target);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        meta.put(rs.getString("meta_key"), MetaValues.decode(rs.getString("meta_value")));
                    }
                }
            }
            return meta;
        });
    }

    @Override
    protected List<MetaEntry> findMetaEntries(String key) {
        return query("find meta " + key, conn -> {
            List<MetaEntry> entries = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT model, scenario, version, meta_value FROM meta WHERE meta_key = ? ORDER BY id")) {
                stmt.setString(1, key);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        Integer version = (Integer) rs.getObject("version");
                        MetaTarget target = MetaTarget.of(rs.getString("model"), rs.getString("scenario"), version);
                        entries.add(new MetaEntry(target, key, MetaValues.decode(rs.getString("meta_value"))));
                    }
                }
            }
            return entries;
        });
    }

    @Override
    protected void writeMetaEntry(MetaTarget target, String key, Object value) {
        transaction("write meta " + key, conn -> {
            deleteMeta(conn, target, key);
            try (PreparedStatement stmt = conn.prepareStatement(
                    "INSERT INTO meta (model, scenario, version, meta_key, meta_value) VALUES (?, ?, ?, ?, ?)")) {
                bindTarget(stmt, 1, target);
                stmt.setString(4, key);
                stmt.setString(5, MetaValues.encode(value));
                stmt.executeUpdate();
            }
            return null;
        });
    }

    @Override
    protected void deleteMetaEntry(MetaTarget target, String key) {
        transaction("remove meta " + key, conn -> {
            deleteMeta(conn, target, key);
            return null;
        });
    }

    // ==================== SQL helpers ====================

    private <T> T query(String context, SqlWork<T> work) {
        ensureOpen();
        try (Connection conn = dataSource.getConnection()) {
            return work.run(conn);
        } catch (SQLException e) {
            throw new BackendException("Failed to " + context + " in H2 database " + jdbcUrl + ": " + e.getMessage(), e);
        }
    }

    private <T> T transaction(String context, SqlWork<T> work) {
        ensureOpen();
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.run(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    log.warn("Rollback failed (connection may be closed): {}", rollbackEx.getMessage());
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new BackendException("Failed to " + context + " in H2 database " + jdbcUrl + ": " + e.getMessage(), e);
        }
    }

    private void mergeName(String table, String name) {
        query("add " + name + " to " + table, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("MERGE INTO " + table + " (name) KEY(name) VALUES (?)")) {
                stmt.setString(1, name);
                stmt.executeUpdate();
            }
            return null;
        });
    }

    private List<String> listNames(String table) {
        return query("list " + table, conn -> {
            List<String> names = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement("SELECT name FROM " + table + " ORDER BY id");
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    names.add(rs.getString(1));
                }
            }
            return names;
        });
    }

    private static RunRecord loadRun(Connection conn, long runId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("SELECT " + RUN_COLUMNS + " FROM run WHERE id = ?")) {
            stmt.setLong(1, runId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new ItemNotFoundException("No run with id " + runId);
                }
                return readRun(rs);
            }
        }
    }

    private static RunRecord readRun(ResultSet rs) throws SQLException {
        return new RunRecord(
                rs.getLong("id"),
                rs.getString("model"),
                rs.getString("scenario"),
                rs.getString("scheme"),
                rs.getInt("version"),
                rs.getString("annotation"),
                rs.getBoolean("is_default"),
                rs.getString("cre_user"),
                toInstant(rs.getTimestamp("cre_date")),
                rs.getString("upd_user"),
                toInstant(rs.getTimestamp("upd_date")),
                rs.getString("lock_user"),
                toInstant(rs.getTimestamp("lock_date")));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private static void readItems(Connection conn, long runId, RunContent content) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT name, item_type, index_sets, index_names FROM item WHERE run_id = ? ORDER BY pos")) {
            stmt.setLong(1, runId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    ItemDefinition definition = new ItemDefinition(
                            ItemType.valueOf(rs.getString("item_type")),
                            rs.getString("name"),
                            GSON.fromJson(rs.getString("index_sets"), STRING_LIST),
                            GSON.fromJson(rs.getString("index_names"), STRING_LIST));
                    content.items().put(definition.name(), new ItemState(definition));
                }
            }
        }
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT item_name, item_key, item_value, unit, lvl, mrg, elem_comment FROM item_data "
                        + "WHERE run_id = ? ORDER BY item_name, pos")) {
            stmt.setLong(1, runId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    ItemState state = content.items().get(rs.getString("item_name"));
                    List<String> key = GSON.fromJson(rs.getString("item_key"), STRING_LIST);
                    ItemRow row = new ItemRow(key, getDouble(rs, "item_value"), rs.getString("unit"),
                            getDouble(rs, "lvl"), getDouble(rs, "mrg"));
                    state.put(row, rs.getString("elem_comment"));
                }
            }
        }
    }

    private static void writeItems(Connection conn, long runId, RunContent content) throws SQLException {
        try (PreparedStatement items = conn.prepareStatement(
                "INSERT INTO item (run_id, pos, name, item_type, index_sets, index_names) VALUES (?, ?, ?, ?, ?, ?)");
             PreparedStatement data = conn.prepareStatement(
                "INSERT INTO item_data (run_id, item_name, pos, item_key, item_value, unit, lvl, mrg, elem_comment) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            int itemPos = 0;
            for (ItemState state : content.items().values()) {
                ItemDefinition definition = state.definition();
                items.setLong(1, runId);
                items.setInt(2, itemPos++);
                items.setString(3, definition.name());
                items.setString(4, definition.type().name());
                items.setString(5, GSON.toJson(definition.indexSets()));
                items.setString(6, GSON.toJson(definition.indexNames()));
                items.addBatch();

                int rowPos = 0;
                for (ItemRow row : state.rows().values()) {
                    data.setLong(1, runId);
                    data.setString(2, definition.name());
                    data.setInt(3, rowPos++);
                    data.setString(4, GSON.toJson(row.key()));
                    setDouble(data, 5, row.value());
                    data.setString(6, row.unit());
                    setDouble(data, 7, row.level());
                    setDouble(data, 8, row.marginal());
                    data.setString(9, state.comments().get(row.key()));
                    data.addBatch();
                }
            }
            items.executeBatch();
            data.executeBatch();
        }
    }

    private static void readSeries(Connection conn, long runId, RunContent content) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT region, variable, unit, subannual, yr, item_value, is_meta FROM ts_data "
                        + "WHERE run_id = ? ORDER BY pos")) {
            stmt.setLong(1, runId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    TimeSeriesRow row = new TimeSeriesRow(rs.getString("region"), rs.getString("variable"),
                            rs.getString("unit"), rs.getString("subannual"), rs.getInt("yr"),
                            rs.getDouble("item_value"));
                    content.putSeries(new TimeSeriesEntry(row, rs.getBoolean("is_meta")));
                }
            }
        }
    }

    private static void writeSeries(Connection conn, long runId, RunContent content) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT INTO ts_data (run_id, pos, region, variable, unit, subannual, yr, item_value, is_meta) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            int pos = 0;
            for (TimeSeriesEntry entry : content.timeseries().values()) {
                TimeSeriesRow row = entry.row();
                stmt.setLong(1, runId);
                stmt.setInt(2, pos++);
                stmt.setString(3, row.region());
                stmt.setString(4, row.variable());
                stmt.setString(5, row.unit());
                stmt.setString(6, row.subannual());
                stmt.setInt(7, row.year());
                stmt.setDouble(8, row.value());
                stmt.setBoolean(9, entry.meta());
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private static void readGeo(Connection conn, long runId, RunContent content) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT region, variable, subannual, yr, item_value, unit, is_meta FROM geo_data "
                        + "WHERE run_id = ? ORDER BY pos")) {
            stmt.setLong(1, runId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    content.putGeo(new GeoRow(rs.getString("region"), rs.getString("variable"),
                            rs.getString("subannual"), rs.getInt("yr"), rs.getString("item_value"),
                            rs.getString("unit"), rs.getBoolean("is_meta")));
                }
            }
        }
    }

    private static void writeGeo(Connection conn, long runId, RunContent content) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT INTO geo_data (run_id, pos, region, variable, subannual, yr, item_value, unit, is_meta) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            int pos = 0;
            for (GeoRow row : content.geodata().values()) {
                stmt.setLong(1, runId);
                stmt.setInt(2, pos++);
                stmt.setString(3, row.region());
                stmt.setString(4, row.variable());
                stmt.setString(5, row.subannual());
                stmt.setInt(6, row.year());
                stmt.setString(7, row.value());
                stmt.setString(8, row.unit());
                stmt.setBoolean(9, row.meta());
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private static void deleteMeta(Connection conn, MetaTarget target, String key) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "DELETE FROM meta WHERE model IS NOT DISTINCT FROM ? AND scenario IS NOT DISTINCT FROM ? "
                        + "AND version IS NOT DISTINCT FROM ? AND meta_key = ?")) {
            bindTarget(stmt, 1, target);
            stmt.setString(4, key);
            stmt.executeUpdate();
        }
    }

    private static void bindTarget(PreparedStatement stmt, int first, MetaTarget target) throws SQLException {
        stmt.setString(first, target.model());
        stmt.setString(first + 1, target.scenario());
        if (target.version() == null) {
            stmt.setNull(first + 2, Types.INTEGER);
        } else {
            stmt.setInt(first + 2, target.version());
        }
    }

    private static Double getDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static void setDouble(PreparedStatement stmt, int index, Double value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.DOUBLE);
        } else {
            stmt.setDouble(index, value);
        }
    }
}
