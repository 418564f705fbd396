/*
 * Licensed to the Fintech Open Source Foundation (FINOS) under one or
 * more contributor license agreements. See the NOTICE file distributed
 * with this work for additional information regarding copyright ownership.
 * FINOS licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with the
 * License. You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.finos.parci.common.db.kv;

import org.finos.parci.common.db.JdbcBaseDal;
import org.finos.parci.common.db.JdbcDialect;
import org.finos.parci.common.db.JdbcErrorCode;
import org.finos.parci.common.db.JdbcException;
import org.finos.parci.common.exception.EParci;
import org.finos.parci.common.exception.EStorage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;


public class JdbcKeyValueStore extends JdbcBaseDal implements IKeyValueStore {

    private static final String KV_GET =
            "select kv_value from tkv\n" +
            "where table_name = ?\n" +
            "and kv_key = ?";

    private static final String KV_CONTAINS =
            "select count(*) from tkv\n" +
            "where table_name = ?\n" +
            "and kv_key = ?";

    private static final String KV_DELETE =
            "delete from tkv\n" +
            "where table_name = ?\n" +
            "and kv_key = ?";

    private static final String KV_ENUMERATE =
            "select kv_key, kv_value from tkv\n" +
            "where table_name = ?\n" +
            "order by kv_key";

    private final Logger log = LoggerFactory.getLogger(getClass());

    public JdbcKeyValueStore(DataSource source, JdbcDialect dialect) {
        super(source, dialect, JdbcKeyValueStore::storageError);
    }

    @Override
    public void start() {

        try {

            log.debug("Preparing key-value table ({})", dialect.dialectCode());

            executeDirect(conn -> {
                try (var stmt = conn.createStatement()) {
                    stmt.execute(dialect.keyValueTableDdl());
                }
            });
        }
        catch (SQLException e) {

            var errorCode = dialect.mapErrorCode(e);
            throw storageError(e, errorCode);
        }
    }

    @Override
    public void stop() {

        // The data source is owned by whoever created it
    }

    @Override
    public Optional<String> get(String table, String key) {

        return wrapTransaction(conn -> {
            return readValue(conn, table, key);
        });
    }

    @Override
    public void set(String table, String key, String value) {

        wrapTransaction(conn -> {
            writeValue(conn, table, key, value);
        });
    }

    @Override
    public void delete(String table, String key) {

        wrapTransaction(conn -> {
            deleteValue(conn, table, key);
        });
    }

    @Override
    public boolean contains(String table, String key) {

        return wrapTransaction(conn -> {
            return checkValue(conn, table, key);
        });
    }

    @Override
    public List<Map.Entry<String, String>> enumerate(String table) {

        return wrapTransaction(conn -> {
            return readTable(conn, table);
        });
    }

    private Optional<String> readValue(Connection conn, String table, String key) throws SQLException {

        try (var stmt = conn.prepareStatement(KV_GET)) {

            stmt.setString(1, table);
            stmt.setString(2, key);

            try (var rs = stmt.executeQuery()) {

                if (!rs.next())
                    return Optional.empty();

                var value = rs.getString(1);

                if (rs.next())
                    throw new JdbcException(JdbcErrorCode.TOO_MANY_ROWS);

                return Optional.of(value);
            }
        }
    }

    private void writeValue(Connection conn, String table, String key, String value) throws SQLException {

        try (var stmt = conn.prepareStatement(dialect.keyValueUpsert())) {

            stmt.setString(1, table);
            stmt.setString(2, key);
            stmt.setString(3, value);

            stmt.executeUpdate();
        }
    }

    private void deleteValue(Connection conn, String table, String key) throws SQLException {

        try (var stmt = conn.prepareStatement(KV_DELETE)) {

            stmt.setString(1, table);
            stmt.setString(2, key);

            stmt.executeUpdate();
        }
    }

    private boolean checkValue(Connection conn, String table, String key) throws SQLException {

        try (var stmt = conn.prepareStatement(KV_CONTAINS)) {

            stmt.setString(1, table);
            stmt.setString(2, key);

            try (var rs = stmt.executeQuery()) {

                if (!rs.next())
                    throw new JdbcException(JdbcErrorCode.NO_DATA);

                return rs.getLong(1) > 0;
            }
        }
    }

    private List<Map.Entry<String, String>> readTable(Connection conn, String table) throws SQLException {

        try (var stmt = conn.prepareStatement(KV_ENUMERATE)) {

            stmt.setString(1, table);

            try (var rs = stmt.executeQuery()) {

                var entries = new ArrayList<Map.Entry<String, String>>();

                while (rs.next()) {
                    var entry = new AbstractMap.SimpleImmutableEntry<>(rs.getString(1), rs.getString(2));
                    entries.add(entry);
                }

                return entries;
            }
        }
    }

    private static EParci storageError(SQLException error, JdbcErrorCode errorCode) {

        switch (errorCode) {

            case DATABASE_IN_USE:
                return new EStorage("Parameter store is in use by another process", error);

            case DATABASE_READ_ONLY:
                return new EStorage("Parameter store is read-only on disk", error);

            case TABLE_NOT_FOUND:
                return new EStorage("Parameter store has not been prepared", error);

            default:
                var message = String.format("Parameter store error (%s): %s", errorCode.name(), error.getMessage());
                return new EStorage(message, error);
        }
    }
}
