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


public class ConfigDefaults {

    public static final String PARAMETER_DRIVER = "local";

    // Argon2id "sensitive" cost level, memory cost is in KiB (1 GiB)
    public static final int KDF_TIME_COST = 4;
    public static final int KDF_MEMORY_COST = 1024 * 1024;
    public static final int KDF_PARALLELISM = 1;

    public static final String KEYRING_SERVICE = "parci";
    public static final String KEYRING_ACCOUNT = "parci";

    public static final int YUBIKEY_SLOT = 2;
    public static final String YUBIKEY_COMMAND = "ykman";

    public static final String STORE_DIR_NAME = "parci";
    public static final String STORE_DIR_NAME_MACOS = "Parci";
    public static final String STORE_FILE_NAME = "params";
}
