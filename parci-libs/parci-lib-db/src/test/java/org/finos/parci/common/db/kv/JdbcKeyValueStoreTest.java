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

import org.finos.parci.common.db.JdbcDialect;
import org.finos.parci.common.db.JdbcSetup;
import org.finos.parci.common.exception.EStartup;
import org.finos.parci.common.exception.EStorage;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;


class JdbcKeyValueStoreTest {

    @TempDir
    Path tempDir;

    private DataSource source;
    private IKeyValueStore store;

    @BeforeEach
    void setup() {

        var properties = new Properties();
        properties.setProperty(JdbcSetup.DIALECT_PROPERTY, "H2");
        properties.setProperty(JdbcSetup.JDBC_URL_PROPERTY, "mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");

        source = JdbcSetup.createDatasource(properties);
        store = new JdbcKeyValueStore(source, JdbcDialect.H2);
        store.start();
    }

    @AfterEach
    void teardown() {

        store.stop();
        JdbcSetup.destroyDatasource(source);
    }

    @Test
    void setAndGet() {

        store.set("t1", "k1", "v1");

        assertEquals("v1", store.get("t1", "k1").orElseThrow());
        assertTrue(store.contains("t1", "k1"));
    }

    @Test
    void getMissing() {

        assertTrue(store.get("t1", "missing").isEmpty());
        assertFalse(store.contains("t1", "missing"));
    }

    @Test
    void setOverwrites() {

        store.set("t1", "k1", "v1");
        store.set("t1", "k1", "v2");

        assertEquals("v2", store.get("t1", "k1").orElseThrow());
        assertEquals(1, store.enumerate("t1").size());
    }

    @Test
    void tablesAreSeparate() {

        store.set("t1", "k1", "v1");
        store.set("t2", "k1", "other");

        assertEquals("v1", store.get("t1", "k1").orElseThrow());
        assertEquals("other", store.get("t2", "k1").orElseThrow());

        store.delete("t2", "k1");

        assertTrue(store.contains("t1", "k1"));
        assertFalse(store.contains("t2", "k1"));
    }

    @Test
    void deleteMissingIsNoop() {

        assertDoesNotThrow(() -> store.delete("t1", "missing"));
    }

    @Test
    void enumerateTable() {

        var table = store.table("params");
        table.set("b", "2");
        table.set("a", "1");
        table.set("c", "3");
        store.set("config", "x", "y");

        var items = table.items();

        assertEquals(List.of(Map.entry("a", "1"), Map.entry("b", "2"), Map.entry("c", "3")), items);
        assertEquals(List.of("a", "b", "c"), table.keys());
        assertEquals(List.of("1", "2", "3"), table.values());
        assertTrue(store.table("empty").items().isEmpty());
    }

    @Test
    void largeValue() {

        var value = "x".repeat(100_000);
        store.set("t1", "big", value);

        assertEquals(value, store.get("t1", "big").orElseThrow());
    }

    @Test
    void startIsRepeatable() {

        store.set("t1", "k1", "v1");
        store.start();

        assertEquals("v1", store.get("t1", "k1").orElseThrow());
    }

    @Test
    void fileStoreSurvivesReopen() {

        var location = tempDir.resolve("store").resolve("params");
        var properties = JdbcSetup.embeddedStoreProperties(location);

        var source1 = JdbcSetup.createDatasource(properties);
        var store1 = new JdbcKeyValueStore(source1, JdbcDialect.H2);
        store1.start();
        store1.set("params", "k1", "v1");
        JdbcSetup.destroyDatasource(source1);

        var source2 = JdbcSetup.createDatasource(properties);
        var store2 = new JdbcKeyValueStore(source2, JdbcDialect.H2);
        store2.start();

        try {
            assertEquals("v1", store2.get("params", "k1").orElseThrow());
        }
        finally {
            JdbcSetup.destroyDatasource(source2);
        }
    }

    @Test
    void fileStoreIsShared() throws Exception {

        var location = tempDir.resolve("store").resolve("params");
        var properties = JdbcSetup.embeddedStoreProperties(location);

        assertTrue(properties.getProperty(JdbcSetup.JDBC_URL_PROPERTY).contains("AUTO_SERVER=TRUE"));

        var source1 = JdbcSetup.createDatasource(properties);
        var source2 = JdbcSetup.createDatasource(properties);

        try {

            var store1 = new JdbcKeyValueStore(source1, JdbcDialect.H2);
            store1.start();
            store1.set("params", "k1", "v1");

            // First pool holds its only connection while the second one reads and writes
            try (var held = source1.getConnection()) {

                assertFalse(held.isClosed());

                var store2 = new JdbcKeyValueStore(source2, JdbcDialect.H2);
                store2.start();

                assertEquals("v1", store2.get("params", "k1").orElseThrow());
                store2.set("params", "k2", "v2");
            }

            assertEquals("v2", store1.get("params", "k2").orElseThrow());
        }
        finally {
            JdbcSetup.destroyDatasource(source2);
            JdbcSetup.destroyDatasource(source1);
        }
    }

    @Test
    void missingTable() {

        var properties = new Properties();
        properties.setProperty(JdbcSetup.DIALECT_PROPERTY, "H2");
        properties.setProperty(JdbcSetup.JDBC_URL_PROPERTY, "mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");

        var unpreparedSource = JdbcSetup.createDatasource(properties);
        var unprepared = new JdbcKeyValueStore(unpreparedSource, JdbcDialect.H2);

        try {
            assertThrows(EStorage.class, () -> unprepared.get("t1", "k1"));
        }
        finally {
            JdbcSetup.destroyDatasource(unpreparedSource);
        }
    }

    @Test
    void badDialect() {

        var properties = new Properties();
        properties.setProperty(JdbcSetup.DIALECT_PROPERTY, "SQLITE");
        properties.setProperty(JdbcSetup.JDBC_URL_PROPERTY, "params.db");

        assertThrows(EStartup.class, () -> JdbcSetup.createDatasource(properties));
    }
}
