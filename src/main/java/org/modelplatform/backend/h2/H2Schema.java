package org.modelplatform.backend.h2;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * DDL of the H2 backend.
 * <p>
 * Item keys are stored as JSON arrays; row order within a run is kept in the {@code pos}
 * columns. All statements are idempotent.
 */
final class H2Schema {

    static final List<String> DDL = List.of(
            "CREATE TABLE IF NOT EXISTS run ("
                    + "id BIGINT AUTO_INCREMENT PRIMARY KEY, "
                    + "model VARCHAR NOT NULL, "
                    + "scenario VARCHAR NOT NULL, "
                    + "scheme VARCHAR, "
                    + "version INT NOT NULL, "
                    + "annotation VARCHAR, "
                    + "is_default BOOLEAN DEFAULT FALSE NOT NULL, "
                    + "has_solution BOOLEAN DEFAULT FALSE NOT NULL, "
                    + "cre_user VARCHAR, cre_date TIMESTAMP, "
                    + "upd_user VARCHAR, upd_date TIMESTAMP, "
                    + "lock_user VARCHAR, lock_date TIMESTAMP)",
            "CREATE INDEX IF NOT EXISTS idx_run_identity ON run (model, scenario, version)",
            "CREATE TABLE IF NOT EXISTS item ("
                    + "run_id BIGINT NOT NULL, pos INT NOT NULL, name VARCHAR NOT NULL, item_type VARCHAR NOT NULL, "
                    + "index_sets VARCHAR NOT NULL, index_names VARCHAR NOT NULL, "
                    + "PRIMARY KEY (run_id, name))",
            "CREATE TABLE IF NOT EXISTS item_data ("
                    + "run_id BIGINT NOT NULL, item_name VARCHAR NOT NULL, pos INT NOT NULL, item_key VARCHAR NOT NULL, "
                    + "item_value DOUBLE PRECISION, unit VARCHAR, lvl DOUBLE PRECISION, mrg DOUBLE PRECISION, "
                    + "elem_comment VARCHAR, "
                    + "PRIMARY KEY (run_id, item_name, pos))",
            "CREATE TABLE IF NOT EXISTS ts_data ("
                    + "run_id BIGINT NOT NULL, pos INT NOT NULL, region VARCHAR NOT NULL, variable VARCHAR NOT NULL, "
                    + "unit VARCHAR, subannual VARCHAR NOT NULL, yr INT NOT NULL, item_value DOUBLE PRECISION NOT NULL, "
                    + "is_meta BOOLEAN NOT NULL, "
                    + "PRIMARY KEY (run_id, pos))",
            "CREATE TABLE IF NOT EXISTS geo_data ("
                    + "run_id BIGINT NOT NULL, pos INT NOT NULL, region VARCHAR NOT NULL, variable VARCHAR NOT NULL, "
                    + "subannual VARCHAR NOT NULL, yr INT NOT NULL, item_value VARCHAR, unit VARCHAR, "
                    + "is_meta BOOLEAN NOT NULL, "
                    + "PRIMARY KEY (run_id, pos))",
            "CREATE TABLE IF NOT EXISTS model_name (id BIGINT AUTO_INCREMENT PRIMARY KEY, name VARCHAR NOT NULL UNIQUE)",
            "CREATE TABLE IF NOT EXISTS scenario_name (id BIGINT AUTO_INCREMENT PRIMARY KEY, name VARCHAR NOT NULL UNIQUE)",
            "CREATE TABLE IF NOT EXISTS unit_def ("
                    + "id BIGINT AUTO_INCREMENT PRIMARY KEY, name VARCHAR NOT NULL UNIQUE, unit_comment VARCHAR)",
            "CREATE TABLE IF NOT EXISTS node ("
                    + "id BIGINT AUTO_INCREMENT PRIMARY KEY, name VARCHAR NOT NULL UNIQUE, mapped_to VARCHAR, "
                    + "parent VARCHAR, hierarchy VARCHAR)",
            "CREATE TABLE IF NOT EXISTS timeslice ("
                    + "id BIGINT AUTO_INCREMENT PRIMARY KEY, name VARCHAR NOT NULL UNIQUE, category VARCHAR, "
                    + "duration DOUBLE PRECISION NOT NULL)",
            "CREATE TABLE IF NOT EXISTS meta ("
                    + "id BIGINT AUTO_INCREMENT PRIMARY KEY, model VARCHAR, scenario VARCHAR, version INT, "
                    + "meta_key VARCHAR NOT NULL, meta_value VARCHAR NOT NULL)",
            "CREATE INDEX IF NOT EXISTS idx_meta_key ON meta (meta_key)",
            "CREATE TABLE IF NOT EXISTS documentation ("
                    + "doc_domain VARCHAR NOT NULL, name VARCHAR NOT NULL, doc VARCHAR, "
                    + "PRIMARY KEY (doc_domain, name))");

    private H2Schema() {
    }

    /**
     * Creates all tables and indexes that do not exist yet.
     */
    static void create(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            for (String ddl : DDL) {
                stmt.execute(ddl);
            }
        }
    }
}
