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

import org.finos.parci.common.config.StoreConfig;
import org.finos.parci.common.exception.*;
import org.finos.parci.secrets.codec.SecretItem;
import org.finos.parci.secrets.device.IPasswordSource;
import org.finos.parci.secrets.test.FakeChallengeResponseDevice;
import org.finos.parci.secrets.test.FakeKeyringBackend;
import org.finos.parci.secrets.test.StoreFixture;

import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.finos.parci.secrets.test.StoreFixture.password;
import static org.junit.jupiter.api.Assertions.*;


class ParameterStoreTest {

    private static final Path UNUSED_LOCATION = Path.of("unused.db");

    private StoreFixture fixture;
    private FakeKeyringBackend keyring;
    private FakeChallengeResponseDevice yubikey;

    @BeforeEach
    void setup() {

        fixture = new StoreFixture();
        keyring = new FakeKeyringBackend();
        yubikey = new FakeChallengeResponseDevice("1000001", "secret");

        fixture.registry(password("pw")).initialize("pw".toCharArray(), "pw".toCharArray());
    }

    @AfterEach
    void teardown() {
        fixture.close();
    }

    private ParameterStore store(IPasswordSource passwordSource, boolean readOnly) {

        var config = StoreFixture.fastConfig(UNUSED_LOCATION).setReadOnly(readOnly).build();
        return store(passwordSource, config);
    }

    private ParameterStore store(IPasswordSource passwordSource, StoreConfig config) {

        var registry = fixture.registry(passwordSource, keyring, yubikey, 2);
        return new ParameterStore(config, fixture.kvStore(), registry);
    }

    private ParameterStore writableStore() {
        return store(password("pw"), false);
    }

    @Test
    void roundTrip() {

        var store = writableStore();

        store.set("db_password", "hunter2");

        assertEquals("hunter2", store.get("db_password"));
        assertTrue(store.contains("db_password"));
        assertFalse(store.contains("api_key"));
    }

    @Test
    void roundTripNewStore() {

        writableStore().set("db_password", "hunter2");

        var readOnlyStore = store(password("pw"), true);

        assertEquals("hunter2", readOnlyStore.get("db_password"));
    }

    @Test
    void namesAreNotStoredInClear() {

        var store = writableStore();
        store.set("db_password", "hunter2");

        var rows = fixture.paramsTable().items();

        assertEquals(1, rows.size());
        assertFalse(rows.get(0).getKey().contains("db_password"));
        assertEquals(64, rows.get(0).getKey().length());
        assertFalse(rows.get(0).getValue().contains("hunter2"));
    }

    @Test
    void overwrite() {

        var store = writableStore();

        store.set("key", "v1");
        store.set("key", "v2");

        assertEquals("v2", store.get("key"));
        assertEquals(1, fixture.paramsTable().items().size());
    }

    @Test
    void jsonValues() {

        var store = writableStore();
        var mapper = JsonMapper.builder().build();

        store.setJson("n", IntNode.valueOf(42));
        store.setJson("obj", mapper.createObjectNode().put("host", "localhost").put("port", 5432));

        assertEquals(IntNode.valueOf(42), store.getJson("n"));
        assertEquals("42", store.get("n"));
        assertEquals(5432, store.getJson("obj").get("port").intValue());
        assertEquals("{\"host\":\"localhost\",\"port\":5432}", store.get("obj"));
    }

    @Test
    void emptyAndUnicodeValues() {

        var store = writableStore();

        store.set("", "");
        store.set("caf\u00e9", "\u00fcber \u2603");

        assertEquals("", store.get(""));
        assertEquals("\u00fcber \u2603", store.get("caf\u00e9"));
    }

    @Test
    void nullNameOrValue() {

        var store = writableStore();

        assertThrows(EInputValidation.class, () -> store.set(null, "x"));
        assertThrows(EInputValidation.class, () -> store.set("x", null));
        assertThrows(EInputValidation.class, () -> store.setJson("x", null));
        assertThrows(EInputValidation.class, () -> store.get(null));
    }

    @Test
    void readOnlyRejectsWrites() {

        writableStore().set("existing", "value");
        var rowsBefore = fixture.paramsTable().items();

        var store = store(password("pw"), true);

        assertTrue(store.isReadOnly());
        assertThrows(EPermissionDenied.class, () -> store.set("new", "value"));
        assertThrows(EPermissionDenied.class, () -> store.delete("existing"));

        // Writes are refused without unlocking
        assertFalse(store.isUnlocked());
        assertEquals(rowsBefore, fixture.paramsTable().items());

        assertEquals("value", store.get("existing"));
        assertTrue(store.isUnlocked());
    }

    @Test
    void readOnlyWithoutPassword() {

        IPasswordSource noPassword = prompt -> { throw new AssertionError("Password should not be requested"); };
        var store = store(noPassword, true);

        assertThrows(EPermissionDenied.class, () -> store.set("new", "value"));
    }

    @Test
    void getMissing() {

        var store = writableStore();

        assertThrows(ESecretNotFound.class, () -> store.get("missing"));
        assertThrows(ESecretNotFound.class, () -> store.getJson("missing"));
    }

    @Test
    void deleteIsIdempotent() {

        var store = writableStore();
        store.set("key", "value");

        store.delete("key");
        store.delete("key");
        store.delete("never-existed");

        assertFalse(store.contains("key"));
        assertThrows(ESecretNotFound.class, () -> store.get("key"));
    }

    @Test
    void wrongPassword() {

        var store = store(password("wrong"), true);

        assertThrows(EAuthenticationFailed.class, () -> store.get("anything"));
        assertFalse(store.isUnlocked());
    }

    @Test
    void retryAfterFailedUnlock() {

        var answers = new ArrayDeque<>(List.of("wrong", "pw"));
        var store = store(prompt -> answers.pop().toCharArray(), false);

        assertThrows(EAuthenticationFailed.class, () -> store.set("key", "value"));
        assertFalse(store.isUnlocked());
        assertTrue(fixture.paramsTable().items().isEmpty());

        store.set("key", "value");

        assertTrue(store.isUnlocked());
        assertEquals("value", store.get("key"));
    }

    @Test
    void unlockOnce() {

        var prompts = new int[] { 0 };
        var store = store(prompt -> { prompts[0]++; return "pw".toCharArray(); }, false);

        store.set("a", "1");
        store.set("b", "2");
        store.get("a");
        store.items().count();

        assertEquals(1, prompts[0]);
    }

    @Test
    void lockAndUnlock() {

        var prompts = new int[] { 0 };
        var store = store(prompt -> { prompts[0]++; return "pw".toCharArray(); }, false);

        store.unlock();
        assertTrue(store.isUnlocked());

        store.set("key", "value");
        store.lock();

        assertFalse(store.isUnlocked());
        assertEquals("value", store.get("key"));
        assertTrue(store.isUnlocked());
        assertEquals(2, prompts[0]);
    }

    @Test
    void tamperedRecord() {

        var store = writableStore();
        store.set("key", "value");

        var row = fixture.paramsTable().items().get(0);
        var blob = Base64.getDecoder().decode(row.getValue());
        blob[blob.length / 2] ^= 0x01;
        fixture.paramsTable().set(row.getKey(), Base64.getEncoder().encodeToString(blob));

        assertThrows(EAuthenticationFailed.class, () -> store.get("key"));
    }

    @Test
    void movedRecord() {

        var store = writableStore();
        store.set("a", "value-a");
        store.set("b", "value-b");

        var codec = fixture.registry(password("pw")).resolve("password").codec();
        var digestA = codec.digest("a");
        var digestB = codec.digest("b");

        // Copy the record for a into the row for b
        fixture.paramsTable().set(digestB, fixture.paramsTable().get(digestA).orElseThrow());

        assertThrows(EAuthenticationFailed.class, () -> store.get("b"));
        assertEquals("value-a", store.get("a"));
    }

    @Test
    void items() {

        var store = writableStore();

        store.setJson("a", IntNode.valueOf(1));
        store.setJson("b", IntNode.valueOf(2));
        store.setJson("c", IntNode.valueOf(3));

        var items = store.items().collect(Collectors.toMap(SecretItem::getName, item -> item.getValue().intValue()));

        assertEquals(Map.of("a", 1, "b", 2, "c", 3), items);

        var keys = store.keys().sorted().collect(Collectors.toList());
        var values = store.values().sorted().collect(Collectors.toList());

        assertEquals(List.of("a", "b", "c"), keys);
        assertEquals(List.of("1", "2", "3"), values);
    }

    @Test
    void itemsEmpty() {

        var store = store(password("pw"), true);

        assertEquals(0, store.items().count());
    }

    @Test
    void itemsStreamIsSingleUse() {

        var store = writableStore();
        store.set("a", "1");

        var stream = store.items();
        assertEquals(1, stream.count());
        assertThrows(IllegalStateException.class, stream::count);

        assertEquals(1, store.items().count());
    }

    @Test
    void itemsReadsAtCallTime() {

        var store = writableStore();
        store.set("a", "1");

        var stream = store.items();
        store.set("b", "2");

        assertEquals(1, stream.count());
    }

    @Test
    void itemsTampered() {

        var store = writableStore();
        store.set("a", "1");

        var row = fixture.paramsTable().items().get(0);
        fixture.paramsTable().set(row.getKey(), Base64.getEncoder().encodeToString(new byte[64]));

        assertThrows(EAuthenticationFailed.class, () -> store.items().collect(Collectors.toList()));
    }

    @Test
    void secretsSurviveRegister() {

        var store = writableStore();
        store.set("key", "value");

        var registry = fixture.registry(password("pw"), keyring, yubikey, 2);
        registry.register(registry.resolve("password"), "keyring");

        var keyringStore = store(password("wrong"), true);

        assertEquals("value", keyringStore.get("key"));
    }

    @Test
    void openMethodOverride() {

        var registry = fixture.registry(password("pw"), keyring, yubikey, 2);
        registry.register(registry.resolve("password"), "keyring");
        writableStore().set("key", "value");

        keyring.clear();

        // Default method is now the keyring, which has lost its entry
        assertThrows(EAuthenticationFailed.class, () -> store(password("pw"), true).get("key"));

        var config = StoreFixture.fastConfig(UNUSED_LOCATION).setOpenMethod("password").build();
        assertEquals("value", store(password("pw"), config).get("key"));

        var badConfig = StoreFixture.fastConfig(UNUSED_LOCATION).setOpenMethod("fingerprint").build();
        assertThrows(EInvalidMethod.class, () -> store(password("pw"), badConfig).get("key"));
    }

    @Test
    void notInitialized() {

        try (var emptyFixture = new StoreFixture()) {

            var config = StoreFixture.fastConfig(UNUSED_LOCATION).build();
            var store = new ParameterStore(config, emptyFixture.kvStore(), emptyFixture.registry(password("pw")));

            assertThrows(ENotInitialized.class, () -> store.get("key"));
        }
    }
}
