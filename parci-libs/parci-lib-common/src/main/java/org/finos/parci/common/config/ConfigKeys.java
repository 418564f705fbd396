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

public class ConfigKeys {

    // Root config keys
    public static final String LOGGING_CONFIG_KEY = "logging";
    public static final String PARAMETER_DRIVER_KEY = "parameter.driver";
    public static final String PARAMETER_DB_KEY = "parameter.db";
    public static final String PARAMETER_METHOD_KEY = "parameter.method";

    // Key derivation cost, applied to newly written unlock records only
    public static final String KDF_TIME_COST_KEY = "kdf.timeCost";
    public static final String KDF_MEMORY_COST_KEY = "kdf.memoryCost";
    public static final String KDF_PARALLELISM_KEY = "kdf.parallelism";

    // Unlock devices
    public static final String KEYRING_SERVICE_KEY = "keyring.service";
    public static final String KEYRING_ACCOUNT_KEY = "keyring.account";
    public static final String YUBIKEY_SLOT_KEY = "yubikey.slot";
    public static final String YUBIKEY_COMMAND_KEY = "yubikey.command";

    // Environment variables
    public static final String PARCI_PARAMETER_DRIVER = "PARCI_PARAMETER_DRIVER";
    public static final String PARCI_PARAMETER_DB = "PARCI_PARAMETER_DB";
    public static final String PARCI_PARAMETER_DB_PASSWORD = "PARCI_PARAMETER_DB_PASSWORD";
    public static final String PARCI_PARAMETER_METHOD = "PARCI_PARAMETER_METHOD";
    public static final String PARCI_DEBUG = "PARCI_DEBUG";
    public static final String XDG_DATA_HOME = "XDG_DATA_HOME";

    // Tables in the persistent KV store
    public static final String CONFIG_TABLE = "config";
    public static final String PARAMS_TABLE = "params";

    // Well-known entries in the config table
    public static final String DEFAULT_OPEN_METHOD = "default-open-method";
}
