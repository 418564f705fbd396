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
import org.finos.parci.common.db.kv.IKeyValueStore;
import org.finos.parci.common.db.kv.KeyValueTable;
import org.finos.parci.common.exception.EInputValidation;
import org.finos.parci.common.exception.EPermissionDenied;
import org.finos.parci.common.exception.ESecretNotFound;
import org.finos.parci.secrets.codec.SecretItem;
import org.finos.parci.secrets.codec.SecretRecordCodec;
import org.finos.parci.secrets.unlock.StoreKeys;
import org.finos.parci.secrets.unlock.UnlockMethodRegistry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.Stream;


/**
 * Encrypted parameter store over the params table.
 *
 * <p>The store is created locked and unlocks itself on first use, through the open method named
 * in the store config or else the default open method of the registry. If unlocking fails the
 * store stays locked and the next operation tries again. Once unlocked it stays unlocked until
 * {@link #lock()} is called.</p>
 *
 * <p>Mutating operations are refused while the store config is read-only, before any unlock is
 * attempted. Instances are not thread safe.</p>
 */
public class ParameterStore {

    private enum State { LOCKED, UNLOCKED }

    private final Logger log = LoggerFactory.getLogger(getClass());

    private final StoreConfig config;
    private final KeyValueTable params;
    private final UnlockMethodRegistry registry;

    private State state;
    private StoreKeys keys;
    private SecretRecordCodec codec;

    public ParameterStore(StoreConfig config, IKeyValueStore kvStore, UnlockMethodRegistry registry) {

        this.config = config;
        this.params = kvStore.table(ConfigKeys.PARAMS_TABLE);
        this.registry = registry;

        this.state = State.LOCKED;
    }

    public boolean isReadOnly() {
        return config.isReadOnly();
    }

    public boolean isUnlocked() {
        return state == State.UNLOCKED;
    }

    /** Unlock now rather than on first use **/
    public void unlock() {

        if (state == State.UNLOCKED)
            return;

        var openMethod = config.hasOpenMethod() ? config.getOpenMethod() : null;
        var resolved = registry.resolve(openMethod);

        keys = resolved;
        codec = resolved.codec();
        state = State.UNLOCKED;
    }

    public void lock() {

        if (codec != null)
            codec.wipe();

        if (keys != null)
            keys.destroy();

        codec = null;
        keys = null;
        state = State.LOCKED;
    }

    /**
     * Get the text value of a secret.
     *
     * <p>Values that were stored as JSON are returned as compact JSON text.</p>
     *
     * @param name Name of the secret
     * @return The secret value
     * @throws ESecretNotFound The secret does not exist
     * @throws org.finos.parci.common.exception.EAuthenticationFailed The stored record cannot be opened
     */
    public String get(String name) {

        return getItem(name).getText();
    }

    public JsonNode getJson(String name) {

        return getItem(name).getValue();
    }

    public void set(String name, String value) {

        if (value == null)
            throw new EInputValidation("Secret value must not be null");

        setJson(name, TextNode.valueOf(value));
    }

    /**
     * Store a secret, replacing any existing value.
     *
     * @param name Name of the secret
     * @param value Any JSON value
     * @throws EPermissionDenied The store is read-only
     */
    public void setJson(String name, JsonNode value) {

        checkWritable("set");
        checkName(name);

        if (value == null)
            throw new EInputValidation("Secret value must not be null");

        var codec = codec();
        var digest = codec.digest(name);
        var ciphertext = codec.encode(digest, name, value);

        log.debug("Set secret [{}]", digest);

        params.set(digest, ciphertext);
    }

    /**
     * Delete a secret. Deleting a secret that does not exist is not an error.
     *
     * @param name Name of the secret
     * @throws EPermissionDenied The store is read-only
     */
    public void delete(String name) {

        checkWritable("delete");
        checkName(name);

        var digest = codec().digest(name);

        log.debug("Delete secret [{}]", digest);

        params.delete(digest);
    }

    public boolean contains(String name) {

        checkName(name);

        var digest = codec().digest(name);
        return params.contains(digest);
    }

    /**
     * All stored secrets.
     *
     * <p>The table is read when this method is called, each row is decrypted as the stream
     * reaches it. The stream can be consumed once, call again for a fresh read.</p>
     *
     * @return Stream of decrypted (name, value) pairs
     */
    public Stream<SecretItem> items() {

        var codec = codec();
        var rows = params.items();

        return rows.stream().map(row -> codec.decode(row.getKey(), row.getValue()));
    }

    public Stream<String> keys() {
        return items().map(SecretItem::getName);
    }

    public Stream<String> values() {
        return items().map(SecretItem::getText);
    }

    private SecretItem getItem(String name) {

        checkName(name);

        var codec = codec();
        var digest = codec.digest(name);
        var ciphertext = params.get(digest);

        log.debug("Get secret [{}]", digest);

        if (ciphertext.isEmpty())
            throw new ESecretNotFound(String.format("Secret not found: [%s]", name));

        return codec.decode(digest, ciphertext.get());
    }

    private SecretRecordCodec codec() {

        if (state == State.LOCKED)
            unlock();

        return codec;
    }

    private void checkWritable(String operation) {

        if (config.isReadOnly()) {
            var message = String.format("Cannot %s secrets, the parameter store is read-only", operation);
            throw new EPermissionDenied(message);
        }
    }

    private static void checkName(String name) {

        if (name == null)
            throw new EInputValidation("Secret name must not be null");
    }
}
