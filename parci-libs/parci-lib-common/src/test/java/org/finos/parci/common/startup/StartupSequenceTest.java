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

package org.finos.parci.common.startup;

import org.finos.parci.common.config.ConfigKeys;
import org.finos.parci.common.exception.EParciInternal;
import org.finos.parci.common.exception.EStartup;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;


class StartupSequenceTest {

    private static final String LOGGING_CONFIG = String.join("\n",
            "<?xml version=\"1.0\" encoding=\"UTF-8\"?>",
            "<Configuration status=\"WARN\">",
            "    <Appenders>",
            "        <Console name=\"STDERR\" target=\"SYSTEM_ERR\">",
            "            <PatternLayout pattern=\"%-5level %logger{1} - %msg%n\"/>",
            "        </Console>",
            "    </Appenders>",
            "    <Loggers>",
            "        <Root level=\"info\">",
            "            <AppenderRef ref=\"STDERR\"/>",
            "        </Root>",
            "    </Loggers>",
            "</Configuration>",
            "");

    @TempDir
    Path tempDir;

    @Test
    void configBeforeStartup() {

        var startup = Startup.useConfigFile(StartupSequenceTest.class, null, Map.of());

        assertThrows(EParciInternal.class, startup::getConfig);
        assertNull(startup.getArgs().getConfigFile());
    }

    @Test
    void startupWithoutConfigFile() {

        var startup = Startup.useConfigFile(StartupSequenceTest.class, null, Map.of(ConfigKeys.PARCI_DEBUG, "1"));
        startup.runStartupSequence();

        var config = startup.getConfig();

        assertFalse(config.hasRootConfig());
        assertTrue(config.isDebug());
    }

    @Test
    void startupWithLoggingConfig() throws Exception {

        Files.write(tempDir.resolve("log4j2.xml"), LOGGING_CONFIG.getBytes(StandardCharsets.UTF_8));
        Files.write(tempDir.resolve("parci.yaml"), "config:\n  logging: log4j2.xml\n".getBytes(StandardCharsets.UTF_8));

        var configFile = tempDir.resolve("parci.yaml").toString();
        var startup = Startup.useConfigFile(StartupSequenceTest.class, configFile, Map.of());
        startup.runStartupSequence();

        var config = startup.getConfig();

        assertTrue(config.hasRootConfig());
        assertEquals("log4j2.xml", config.getConfigOrDefault(ConfigKeys.LOGGING_CONFIG_KEY, null));
    }

    @Test
    void startupWithMissingConfigFile() {

        var configFile = tempDir.resolve("missing.yaml").toString();
        var startup = Startup.useConfigFile(StartupSequenceTest.class, configFile, Map.of());

        assertThrows(EStartup.class, startup::runStartupSequence);
    }
}
