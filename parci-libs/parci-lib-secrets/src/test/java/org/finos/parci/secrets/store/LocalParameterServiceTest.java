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


import org.finos.parci.common.exception.EAuthenticationFailed;
import org.finos.parci.common.exception.ENotInitialized;
import org.finos.parci.common.exception.EParciInternal;
import org.finos.parci.secrets.device.UnlockDevices;
import org.finos.parci.secrets.test.FakeChallengeResponseDevice;
import org.finos.parci.secrets.test.FakeKeyringBackend;
import org.finos.parci.secrets.test.StoreFixture;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.finos.parci.secrets.test.StoreFixture.password;
import static org.junit.jupiter.api.Assertions.*;


class LocalParameterServiceTest {

    @TempDir
    Path tempDir;

    private final FakeKeyringBackend keyring = new FakeKeyringBackend();
    private final FakeChallengeResponseDevice yubikey = new FakeChallengeResponseDevice("1000001", "secret");

    private LocalParameterService service(Path storeLocation, String password, boolean readOnly) {

        var config = StoreFixture.fastConfig(storeLocation).setReadOnly(readOnly).build();
        var devices = new UnlockDevices(password(password), keyring, yubikey);

        var service = new LocalParameterService(config, devices);
        service.start();

        return service;
    }

    @Test
    void reopenStore() {

        var storeLocation = tempDir.resolve("nested/dir/parameters.db");

        try (var service = service(storeLocation, "pw", false)) {
            service.getRegistry().initialize("pw".toCharArray(), "pw".toCharArray());
            service.getStore().set("db_password", "hunter2");
        }

        assertTrue(Files.exists(storeLocation.getParent()));

        try (var service = service(storeLocation, "pw", true)) {
            assertEquals("hunter2", service.getStore().get("db_password"));
        }

        try (var service = service(storeLocation, "wrong", true)) {
            assertThrows(EAuthenticationFailed.class, () -> service.getStore().get("db_password"));
        }
    }

    @Test
    void reopenWithKeyring() {

        var storeLocation = tempDir.resolve("parameters.db");

        try (var service = service(storeLocation, "pw", false)) {
            var keys = service.getRegistry().initialize("pw".toCharArray(), "pw".toCharArray());
            service.getRegistry().register(keys, "keyring");
            service.getStore().set("key", "value");
        }

        try (var service = service(storeLocation, "wrong", true)) {
            assertEquals("value", service.getStore().get("key"));
        }
    }

    @Test
    void twoServicesOpenAtOnce() {

        var storeLocation = tempDir.resolve("parameters.db");

        try (var first = service(storeLocation, "pw", false)) {

            first.getRegistry().initialize("pw".toCharArray(), "pw".toCharArray());
            first.getStore().set("key", "value");

            try (var second = service(storeLocation, "pw", false)) {

                assertEquals("value", second.getStore().get("key"));
                second.getStore().set("other", "value2");
            }

            assertEquals("value2", first.getStore().get("other"));
        }
    }

    @Test
    void uninitializedStore() {

        try (var service = service(tempDir.resolve("parameters.db"), "pw", true)) {

            assertFalse(service.getRegistry().isInitialized());
            assertThrows(ENotInitialized.class, () -> service.getStore().get("key"));
        }
    }

    @Test
    void notStarted() {

        var config = StoreFixture.fastConfig(tempDir.resolve("parameters.db")).build();
        var service = new LocalParameterService(config, new UnlockDevices(password("pw"), keyring, yubikey));

        assertThrows(EParciInternal.class, service::getStore);
        assertThrows(EParciInternal.class, service::getRegistry);

        // Closing a service that never started is fine
        service.close();
    }

    @Test
    void startTwice() {

        try (var service = service(tempDir.resolve("parameters.db"), "pw", true)) {
            assertThrows(EParciInternal.class, service::start);
        }
    }
}
