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

package org.finos.parci.secrets.unlock;

import org.finos.parci.common.config.ConfigKeys;
import org.finos.parci.common.db.kv.KeyValueTable;
import org.finos.parci.common.exception.EAlreadyInitialized;
import org.finos.parci.common.exception.EInvalidMethod;
import org.finos.parci.common.exception.ENotInitialized;
import org.finos.parci.common.exception.EParciInternal;
import org.finos.parci.common.exception.EStorage;
import org.finos.parci.secrets.crypto.CryptoHelpers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;


/**
 * Manage the unlock records in the config table.
 *
 * <p>The password record is created when the store is initialized and acts as the root of
 * trust, other methods are registered by wrapping the keys it resolves. The config table also
 * holds the default open method, which always names the most recently registered method.</p>
 *
 * <p>Every register writes the complete record first, then any part of the secret held outside
 * the store, and moves the default pointer last. A failed register leaves the previous record
 * and the default pointer in place.</p>
 */
public class UnlockMethodRegistry {

    private static final ObjectMapper MAPPER = JsonMapper.builder().build();

    private final Logger log = LoggerFactory.getLogger(getClass());

    private final KeyValueTable configTable;
    private final Map<String, IUnlockMethod> methods;

    public UnlockMethodRegistry(KeyValueTable configTable, List<IUnlockMethod> methods) {

        this.configTable = configTable;
        this.methods = new LinkedHashMap<>();

        for (var method : methods)
            this.methods.put(method.methodName(), method);

        if (!(this.methods.get(PasswordUnlockMethod.METHOD_NAME) instanceof PasswordUnlockMethod))
            throw new EParciInternal("Password unlock method is required");
    }

    public boolean isInitialized() {
        return configTable.contains(PasswordUnlockMethod.METHOD_NAME);
    }

    /**
     * Initialize a new store, prompting for the password through the password source.
     *
     * @return The keys of the new store
     * @throws EAlreadyInitialized The store already has a password record
     */
    public StoreKeys initialize() {

        checkNotInitialized();

        var passwordMethod = passwordMethod();
        var password = passwordMethod.readNewPassword();

        try {
            return initialize(password, password);
        }
        finally {
            CryptoHelpers.wipe(password);
        }
    }

    /**
     * Initialize a new store with the given password.
     *
     * <p>Generates the name key and value key, wraps both under a key derived from the password
     * and stores the password record. The default open method is set to password.</p>
     *
     * @param password The password
     * @param confirmation The password again, as entered by the user
     * @return The keys of the new store
     * @throws EAlreadyInitialized The store already has a password record
     * @throws org.finos.parci.common.exception.EInputMismatch The password and confirmation differ
     */
    public StoreKeys initialize(char[] password, char[] confirmation) {

        checkNotInitialized();
        PasswordUnlockMethod.checkConfirmation(password, confirmation);

        var keys = StoreKeys.generate();
        var record = passwordMethod().createRecord(keys, password);

        writeRecord(PasswordUnlockMethod.METHOD_NAME, PasswordUnlockMethod.METHOD_NAME, record);

        log.info("Parameter store initialized");

        return keys;
    }

    /**
     * Register an additional unlock method.
     *
     * @param keys Keys resolved from a method that is already registered
     * @param methodName The method to register
     * @throws EInvalidMethod The method is not known
     * @throws ENotInitialized The store has not been initialized
     */
    public void register(StoreKeys keys, String methodName) {

        var method = lookupMethod(methodName);

        if (!isInitialized())
            throw new ENotInitialized("Parameter store has not been initialized");

        var recordName = method.recordName();
        var pending = method.createRecord(keys);
        var previous = configTable.get(recordName);

        configTable.set(recordName, pending.getRecord().toJson());

        try {
            pending.commit();
        }
        catch (RuntimeException e) {
            log.warn("Unlock method [{}] could not be registered, restoring the previous record", recordName);
            restoreRecord(recordName, previous);
            throw e;
        }

        writeDefaultMethod(method.methodName());

        log.info("Registered unlock method [{}]", recordName);
    }

    /**
     * Resolve the store keys through an unlock method.
     *
     * @param methodName The method to use, or null for the default open method
     * @return The store keys
     * @throws EInvalidMethod The method is not known
     * @throws ENotInitialized The store, or the requested method, has not been set up
     * @throws org.finos.parci.common.exception.EAuthenticationFailed Unlock failed
     */
    public StoreKeys resolve(String methodName) {

        if (methodName != null)
            lookupMethod(methodName);

        if (!isInitialized())
            throw new ENotInitialized("Parameter store has not been initialized");

        var effectiveName = methodName != null ? methodName : defaultOpenMethod();
        var method = lookupMethod(effectiveName);
        var recordName = method.recordName();

        var recordJson = configTable.get(recordName);

        if (recordJson.isEmpty()) {
            var message = String.format("Unlock method [%s] has not been registered", recordName);
            throw new ENotInitialized(message);
        }

        log.debug("Unlocking with [{}]", recordName);

        var record = UnlockRecord.fromJson(recordName, recordJson.get());

        return method.unlock(record);
    }

    /** The default open method, password if no default has been recorded **/
    public String defaultOpenMethod() {

        var pointer = configTable.get(ConfigKeys.DEFAULT_OPEN_METHOD);

        if (pointer.isEmpty())
            return PasswordUnlockMethod.METHOD_NAME;

        try {
            return MAPPER.readValue(pointer.get(), String.class);
        }
        catch (JsonProcessingException e) {
            throw new EStorage("Default open method is corrupt", e);
        }
    }

    private void writeRecord(String methodName, String recordName, UnlockRecord record) {

        configTable.set(recordName, record.toJson());
        writeDefaultMethod(methodName);
    }

    private void writeDefaultMethod(String methodName) {

        try {
            configTable.set(ConfigKeys.DEFAULT_OPEN_METHOD, MAPPER.writeValueAsString(methodName));
        }
        catch (JsonProcessingException e) {
            throw new EParciInternal("Failed to encode default open method", e);
        }
    }

    private void restoreRecord(String recordName, Optional<String> previous) {

        if (previous.isPresent())
            configTable.set(recordName, previous.get());
        else
            configTable.delete(recordName);
    }

    private void checkNotInitialized() {

        if (isInitialized())
            throw new EAlreadyInitialized("Parameter store is already initialized");
    }

    private IUnlockMethod lookupMethod(String methodName) {

        var method = methods.get(methodName);

        if (method == null) {
            var message = String.format("Unknown unlock method: [%s] (available: %s)", methodName, String.join(", ", methods.keySet()));
            throw new EInvalidMethod(message);
        }

        return method;
    }

    private PasswordUnlockMethod passwordMethod() {
        return (PasswordUnlockMethod) methods.get(PasswordUnlockMethod.METHOD_NAME);
    }
}
