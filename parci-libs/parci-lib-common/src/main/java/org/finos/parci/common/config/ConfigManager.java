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

package org.finos.parci.common.config;

import org.finos.parci.common.exception.EConfigLoad;
import org.finos.parci.common.exception.EStartup;
import org.finos.parci.common.startup.StartupLog;

import org.slf4j.event.Level;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;


/**
 * Resolve configuration for Parci components.
 *
 * <p>Configuration comes from three places, in order of priority: environment variables,
 * the root config file (optional) and built-in defaults. Command line overrides are applied
 * by the caller on top of the StoreConfig produced here.</p>
 */
public class ConfigManager {

    private static final Map<String, String> ENV_OVERRIDES = Map.of(
            ConfigKeys.PARAMETER_DRIVER_KEY, ConfigKeys.PARCI_PARAMETER_DRIVER,
            ConfigKeys.PARAMETER_DB_KEY, ConfigKeys.PARCI_PARAMETER_DB,
            ConfigKeys.PARAMETER_METHOD_KEY, ConfigKeys.PARCI_PARAMETER_METHOD);

    private final Path workingDir;
    private final Map<String, String> environment;

    private final URI rootConfigFile;
    private final URI rootConfigDir;

    private RootConfig rootConfigCache = null;

    /**
     * Create a ConfigManager for the root config file
     *
     * @param configFile Location of the root config file, as supplied by the user, or null for no config file
     * @param workingDir Working dir of the current process, used to resolve relative paths
     * @param environment Environment variables visible to the process
     * @throws EStartup The supplied settings are not valid
     */
    public ConfigManager(String configFile, Path workingDir, Map<String, String> environment) {

        this.workingDir = workingDir;
        this.environment = Map.copyOf(environment);

        if (configFile != null && !configFile.isBlank()) {

            this.rootConfigFile = resolvePath(configFile, workingDir).toUri();
            this.rootConfigDir = rootConfigFile.resolve(".").normalize();

            StartupLog.log(this, Level.DEBUG, String.format("Using config root: %s", Paths.get(rootConfigDir)));
        }
        else {

            this.rootConfigFile = null;
            this.rootConfigDir = workingDir.toUri();

            StartupLog.log(this, Level.DEBUG, "No config file supplied, using defaults and environment");
        }
    }

    /**
     * Get the root config directory, used for resolving relative paths.
     *
     * @return The root config directory (the working directory if there is no config file)
     */
    public URI configRoot() {
        return rootConfigDir;
    }

    public boolean hasRootConfig() {
        return rootConfigFile != null;
    }

    /**
     * Resolve a config path relative to the config root
     *
     * @param configPath Path of the config file, relative or absolute
     * @return The resolved absolute path
     */
    public Path resolveConfigFile(String configPath) {

        return resolvePath(configPath, Paths.get(rootConfigDir));
    }


    // -----------------------------------------------------------------------------------------------------------------
    // Config loading
    // -----------------------------------------------------------------------------------------------------------------


    public byte[] loadBinaryConfig(String configPath) {

        var resolved = resolveConfigFile(configPath);
        return loadFile(resolved);
    }

    public String loadTextConfig(String configPath) {

        var bytes = loadBinaryConfig(configPath);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * Load the root config file, or an empty config if no root config file was supplied
     *
     * <p>The root config is cached after the first load.</p>
     *
     * @return The root configuration
     */
    public RootConfig loadRootConfig() {

        if (rootConfigCache != null)
            return rootConfigCache;

        if (rootConfigFile == null) {
            rootConfigCache = new RootConfig();
            return rootConfigCache;
        }

        var rootPath = Paths.get(rootConfigFile);
        var bytes = loadFile(rootPath);
        var format = ConfigFormat.fromExtension(rootConfigFile);

        // Unknown keys in the root config are allowed, components only read what they need
        rootConfigCache = ConfigParser.parseConfig(bytes, format, RootConfig.class, /* leniency = */ true);

        return rootConfigCache;
    }

    /**
     * Look up a single config property
     *
     * <p>Properties that have an environment override (e.g. PARCI_PARAMETER_DB for parameter.db)
     * take the environment value if it is set.</p>
     *
     * @param configKey The config key to look up
     * @param defaultValue Value to return if the key is not set anywhere
     * @return The config value, or the default
     */
    public String getConfigOrDefault(String configKey, String defaultValue) {

        var envKey = ENV_OVERRIDES.get(configKey);

        if (envKey != null) {
            var envValue = environment.get(envKey);
            if (envValue != null && !envValue.isBlank())
                return envValue;
        }

        var configValue = loadRootConfig().getConfig().get(configKey);

        if (configValue != null && !configValue.isBlank())
            return configValue;

        return defaultValue;
    }

    public boolean isDebug() {

        var debug = environment.get(ConfigKeys.PARCI_DEBUG);
        return debug != null && !debug.isBlank() && !debug.equalsIgnoreCase("false") && !debug.equals("0");
    }

    /**
     * Build the store configuration for the local parameter store
     *
     * <p>The builder that is returned can be modified by the caller, e.g. to apply
     * command line overrides or to opt out of read-only mode.</p>
     *
     * @return A StoreConfig builder populated from config, environment and defaults
     * @throws EStartup The parameter driver is not supported
     * @throws EConfigLoad A config property has an invalid value
     */
    public StoreConfig.Builder storeConfig() {

        var driver = getConfigOrDefault(ConfigKeys.PARAMETER_DRIVER_KEY, ConfigDefaults.PARAMETER_DRIVER);

        if (!ConfigDefaults.PARAMETER_DRIVER.equals(driver)) {
            var message = String.format("Parameter driver is not supported: [%s]", driver);
            StartupLog.log(this, Level.ERROR, message);
            throw new EStartup(message);
        }

        var builder = StoreConfig.newBuilder()
                .setStoreLocation(storeLocation())
                .setOpenMethod(getConfigOrDefault(ConfigKeys.PARAMETER_METHOD_KEY, null))
                .setKdfTimeCost(intConfig(ConfigKeys.KDF_TIME_COST_KEY, ConfigDefaults.KDF_TIME_COST))
                .setKdfMemoryCost(intConfig(ConfigKeys.KDF_MEMORY_COST_KEY, ConfigDefaults.KDF_MEMORY_COST))
                .setKdfParallelism(intConfig(ConfigKeys.KDF_PARALLELISM_KEY, ConfigDefaults.KDF_PARALLELISM))
                .setKeyringService(getConfigOrDefault(ConfigKeys.KEYRING_SERVICE_KEY, ConfigDefaults.KEYRING_SERVICE))
                .setKeyringAccount(getConfigOrDefault(ConfigKeys.KEYRING_ACCOUNT_KEY, ConfigDefaults.KEYRING_ACCOUNT))
                .setYubikeySlot(intConfig(ConfigKeys.YUBIKEY_SLOT_KEY, ConfigDefaults.YUBIKEY_SLOT))
                .setYubikeyCommand(getConfigOrDefault(ConfigKeys.YUBIKEY_COMMAND_KEY, ConfigDefaults.YUBIKEY_COMMAND));

        var password = environment.get(ConfigKeys.PARCI_PARAMETER_DB_PASSWORD);

        if (password != null)
            builder.setPassword(password.toCharArray());

        return builder;
    }

    private Path storeLocation() {

        var envLocation = environment.get(ConfigKeys.PARCI_PARAMETER_DB);

        if (envLocation != null && !envLocation.isBlank())
            return resolvePath(envLocation, workingDir);

        var configLocation = loadRootConfig().getConfig().get(ConfigKeys.PARAMETER_DB_KEY);

        if (configLocation != null && !configLocation.isBlank())
            return resolveConfigFile(configLocation);

        return defaultStoreLocation();
    }

    private Path defaultStoreLocation() {

        var userHome = Paths.get(System.getProperty("user.home"));
        var osName = System.getProperty("os.name", "").toLowerCase();

        if (osName.contains("mac")) {

            return userHome
                    .resolve("Library")
                    .resolve(ConfigDefaults.STORE_DIR_NAME_MACOS)
                    .resolve(ConfigDefaults.STORE_FILE_NAME);
        }

        var xdgDataHome = environment.get(ConfigKeys.XDG_DATA_HOME);
        var dataHome = xdgDataHome != null && !xdgDataHome.isBlank()
                ? Paths.get(xdgDataHome)
                : userHome.resolve(".local").resolve("share");

        return dataHome
                .resolve(ConfigDefaults.STORE_DIR_NAME)
                .resolve(ConfigDefaults.STORE_FILE_NAME);
    }

    private int intConfig(String configKey, int defaultValue) {

        var value = getConfigOrDefault(configKey, null);

        if (value == null)
            return defaultValue;

        try {
            return Integer.parseInt(value.strip());
        }
        catch (NumberFormatException e) {
            var message = String.format("Invalid config value for [%s]: expected an integer, got [%s]", configKey, value);
            StartupLog.log(this, Level.ERROR, message);
            throw new EConfigLoad(message, e);
        }
    }

    private byte[] loadFile(Path path) {

        try {
            return Files.readAllBytes(path);
        }
        catch (IOException e) {
            var message = String.format("Failed to load config file [%s]: %s", path, e.getMessage());
            StartupLog.log(this, Level.ERROR, message);
            throw new EConfigLoad(message, e);
        }
    }

    private static Path resolvePath(String path, Path base) {

        try {

            var parsed = Paths.get(path);

            return parsed.isAbsolute()
                    ? parsed.normalize()
                    : base.resolve(parsed).toAbsolutePath().normalize();
        }
        catch (InvalidPathException e) {
            throw new EStartup(String.format("Invalid path: [%s]", path), e);
        }
    }
}
