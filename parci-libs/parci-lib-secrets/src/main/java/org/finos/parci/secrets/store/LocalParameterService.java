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

package org.finos.parci.secrets.store;

import org.finos.parci.common.config.ConfigKeys;
import org.finos.parci.common.config.StoreConfig;
import org.finos.parci.common.db.JdbcDialect;
import org.finos.parci.common.db.JdbcSetup;
import org.finos.parci.common.db.kv.IKeyValueStore;
import org.finos.parci.common.db.kv.JdbcKeyValueStore;
import org.finos.parci.common.exception.EParciInternal;
import org.finos.parci.common.exception.EStorage;
import org.finos.parci.secrets.crypto.KdfParams;
import org.finos.parci.secrets.device.UnlockDevices;
import org.finos.parci.secrets.unlock.IUnlockMethod;
import org.finos.parci.secrets.unlock.KeyringUnlockMethod;
import org.finos.parci.secrets.unlock.PasswordUnlockMethod;
import org.finos.parci.secrets.unlock.UnlockMethodRegistry;
import org.finos.parci.secrets.unlock.YubikeyUnlockMethod;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.util.List;


/**
 * The local parameter store, backed by an embedded H2 database at the configured location.
 */
public class LocalParameterService implements AutoCloseable {

    private final Logger log = LoggerFactory.getLogger(getClass());

    private final StoreConfig config;
    private final UnlockDevices devices;

    private DataSource dataSource;
    private IKeyValueStore kvStore;
    private UnlockMethodRegistry registry;
    private ParameterStore store;

    public LocalParameterService(StoreConfig config, UnlockDevices devices) {
        this.config = config;
        this.devices = devices;
    }

    public void start() {

        if (dataSource != null)
            throw new EParciInternal("Parameter service is already started");

        var storeLocation = config.getStoreLocation();

        log.debug("Opening parameter store [{}]", storeLocation);

        try {
            var storeDir = storeLocation.toAbsolutePath().getParent();
            if (storeDir != null)
                Files.createDirectories(storeDir);
        }
        catch (IOException e) {
            var message = String.format("Cannot create parameter store directory for [%s]: %s", storeLocation, e.getMessage());
            throw new EStorage(message, e);
        }

        var properties = JdbcSetup.embeddedStoreProperties(storeLocation);

        dataSource = JdbcSetup.createDatasource(properties);
        kvStore = new JdbcKeyValueStore(dataSource, JdbcDialect.H2);
        kvStore.start();

        var kdfParams = KdfParams.fromConfig(config);

        List<IUnlockMethod> methods = List.of(
                new PasswordUnlockMethod(devices.getPasswordSource(), kdfParams),
                new KeyringUnlockMethod(devices.getKeyring(), config.getKeyringService(), config.getKeyringAccount()),
                new YubikeyUnlockMethod(devices.getChallengeResponse(), config.getYubikeySlot(), kdfParams));

        registry = new UnlockMethodRegistry(kvStore.table(ConfigKeys.CONFIG_TABLE), methods);
        store = new ParameterStore(config, kvStore, registry);
    }

    @Override
    public void close() {

        if (store != null)
            store.lock();

        if (kvStore != null)
            kvStore.stop();

        if (dataSource != null)
            JdbcSetup.destroyDatasource(dataSource);

        store = null;
        registry = null;
        kvStore = null;
        dataSource = null;
    }

    public StoreConfig getConfig() {
        return config;
    }

    public UnlockMethodRegistry getRegistry() {

        if (registry == null)
            throw new EParciInternal("Parameter service is not started");

        return registry;
    }

    public ParameterStore getStore() {

        if (store == null)
            throw new EParciInternal("Parameter service is not started");

        return store;
    }
}
