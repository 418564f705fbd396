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
import org.finos.parci.common.config.ConfigManager;
import org.finos.parci.common.exception.EParciInternal;
import org.finos.parci.common.exception.EStartup;
import org.finos.parci.common.exception.EUnexpected;
import org.finos.parci.common.util.VersionInfo;

import org.apache.logging.log4j.core.config.ConfigurationSource;
import org.apache.logging.log4j.core.config.Configurator;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;


public class StartupSequence {

    private final Class<?> serviceClass;
    private final StandardArgs standardArgs;
    private final Map<String, String> environment;

    private boolean sequenceComplete = false;
    private ConfigManager config;

    /** Create a startup sequence for the given service class and command line arguments **/
    StartupSequence(Class<?> serviceClass, StandardArgs standardArgs, Map<String, String> environment) {
        this.serviceClass = serviceClass;
        this.standardArgs = standardArgs;
        this.environment = environment;
    }

    /** Run the startup sequence **/
    public void runStartupSequence() {

        loadConfig();
        initLogging();

        printFirstLogLine();

        sequenceComplete = true;
    }

    /**
     * Get the config manager that was configured during the startup sequence
     *
     * @return The ConfigManager instance
     **/
    public ConfigManager getConfig() {

        if (!sequenceComplete)
            throw new EParciInternal("Startup sequence has not been run");

        return config;
    }

    /**
     * Get the standard args that were used for this startup sequence
     *
     * @return The StandardArgs instance
     **/
    public StandardArgs getArgs() {
        return standardArgs;
    }

    private void printFirstLogLine() {

        if (serviceClass != null) {

            var componentName = VersionInfo.getComponentName(serviceClass);
            var componentVersion = VersionInfo.getComponentVersion(serviceClass);

            var log = LoggerFactory.getLogger(serviceClass);
            log.debug("{} {}", componentName, componentVersion);
        }
        else {

            // Used by tests, which do not have a main class or version info
            var log = LoggerFactory.getLogger(StartupSequence.class);
            log.debug("NO SERVICE REGISTERED (this should not happen in production)");
        }
    }

    private void loadConfig() {

        var configFile = standardArgs.getConfigFile();
        var workingDir = standardArgs.getWorkingDir();

        config = new ConfigManager(configFile, workingDir, environment);
    }

    /**
     * Initialize the logging framework.
     *
     * <p>Logging can be configured by setting the logging property in the config
     * section of the root configuration, to point to the location of a logging config file.
     * Parci uses Log4j2 as a backend for slf4j, so the logging config file must be a valid
     * log4j2 config file. If no logging config is provided, the log4j2.xml packaged with
     * the tool is used, which writes to stderr.</p>
     *
     * <p>Setting PARCI_DEBUG in the environment raises the root log level to DEBUG.</p>
     *
     * @throws EStartup There was an error processing the logging config
     */
    @SuppressWarnings("resource")
    private void initLogging() {

        var loggingConfigPath = config.getConfigOrDefault(ConfigKeys.LOGGING_CONFIG_KEY, "");

        if (!loggingConfigPath.isBlank()) {

            var loggingConfig = config.loadTextConfig(loggingConfigPath);

            try (var configStream = new ByteArrayInputStream(loggingConfig.getBytes(StandardCharsets.UTF_8))) {

                var configSource = new ConfigurationSource(configStream);

                StartupLog.log(this, Level.DEBUG, "Initialize logging...");

                // Invalid logging configuration cause the startup sequence to bomb out
                Configurator.initialize(getClass().getClassLoader(), configSource);
            }
            catch (IOException e) {

                // Unexpected error condition - IO error reading from a byte buffer
                throw new EUnexpected(e);
            }
        }
        else {

            StartupLog.log(this, Level.DEBUG, "No logging config provided, using default...");
            Configurator.reconfigure();
        }

        if (config.isDebug())
            Configurator.setRootLevel(org.apache.logging.log4j.Level.DEBUG);

        // Components that use start-up logging can write to the main logs after this point
        StartupLog.setLogSystemActive();
    }
}
