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

package org.finos.parci.common.db;

import org.finos.parci.common.exception.EParciInternal;
import org.finos.parci.common.exception.EStartup;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.Properties;


public class JdbcSetup {

    public static final String DIALECT_PROPERTY = "dialect";
    public static final String JDBC_URL_PROPERTY = "jdbcUrl";
    public static final String POOL_SIZE_PROPERTY = "pool.size";

    static final String H2_SHARED_FILE_OPTIONS = ";AUTO_SERVER=TRUE";

    // One logical session per process, a single connection is all the store ever needs
    private static final String DEFAULT_POOL_SIZE = "1";

    public static JdbcDialect getSqlDialect(Properties properties) {

        var dialect = properties.getProperty(DIALECT_PROPERTY, null);
        return checkSqlDialect(dialect);
    }

    private static JdbcDialect checkSqlDialect(String dialect) {

        if (dialect == null || dialect.isBlank())
            throw new EStartup("Missing required config property: " + DIALECT_PROPERTY);

        try {
            return Enum.valueOf(JdbcDialect.class, dialect);
        }
        catch (IllegalArgumentException e) {
            throw new EStartup(String.format("Unsupported SQL dialect: [%s]", dialect));
        }
    }

    /**
     * Connection properties for an embedded H2 store at the given location.
     *
     * <p>H2 appends its own file suffix, so the location names the store, not the file on disk.
     * The first process to open the file serves it to any other process that opens it while it
     * is held (H2 automatic mixed mode), so a second tool invocation does not fail on the file lock.</p>
     *
     * @param storeLocation Location of the store
     * @return Properties suitable for {@link #createDatasource(Properties)}
     */
    public static Properties embeddedStoreProperties(Path storeLocation) {

        var properties = new Properties();
        properties.setProperty(DIALECT_PROPERTY, JdbcDialect.H2.name());
        properties.setProperty(JDBC_URL_PROPERTY, "file:" + storeLocation.toAbsolutePath() + H2_SHARED_FILE_OPTIONS);
        properties.setProperty(POOL_SIZE_PROPERTY, DEFAULT_POOL_SIZE);

        return properties;
    }

    public static DataSource createDatasource(Properties properties) {

        try {
            var hikariProps = createHikariProperties(properties);

            var config = new HikariConfig(hikariProps);
            var source = new HikariDataSource(config);

            var log = LoggerFactory.getLogger(JdbcSetup.class);
            log.debug("Database connection pool has {} connection(s)", source.getMaximumPoolSize());

            return source;
        }
        catch (RuntimeException e) {

            // For some error conditions, the original cause contains useful extra info
            // Particularly a database that is locked by another process
            if (e.getCause() instanceof SQLException)
                if (!e.getMessage().contains(e.getCause().getMessage())) {

                var messageTemplate = "Could not connect to database: %s (%s)";
                var message = String.format(messageTemplate, e.getMessage(), e.getCause().getMessage());

                throw new EStartup(message, e);
            }

            var messageTemplate = "Could not connect to database: %s";
            var message = String.format(messageTemplate, e.getMessage());

            throw new EStartup(message, e);
        }
    }

    public static void destroyDatasource(DataSource source) {

        if (!(source instanceof HikariDataSource))
            throw new EParciInternal("Datasource being destroyed was not created by JdbcSetup");

        var hikariSource = (HikariDataSource) source;
        hikariSource.close();
    }

    private static Properties createHikariProperties(Properties properties) {

        var dialect = getSqlDialect(properties);
        var jdbcUrl = buildJdbcUrl(properties, dialect);

        var hikariProps = new Properties();
        hikariProps.setProperty("jdbcUrl", jdbcUrl);

        hikariProps.setProperty("poolName", "parci_kv_pool");

        var poolSize = properties.getProperty(POOL_SIZE_PROPERTY);

        if (poolSize != null && !poolSize.isBlank())
            hikariProps.setProperty("maximumPoolSize", poolSize);

        return hikariProps;
    }

    private static String buildJdbcUrl(Properties rootProps, JdbcDialect dialect) {

        var jdbcUrlFromConfig = rootProps.getProperty(JDBC_URL_PROPERTY);

        if (jdbcUrlFromConfig == null || jdbcUrlFromConfig.isBlank())
            throw new EStartup("Missing required config property: " + JDBC_URL_PROPERTY);

        return String.format("jdbc:%s:%s", dialect.name().toLowerCase(), jdbcUrlFromConfig);
    }
}
