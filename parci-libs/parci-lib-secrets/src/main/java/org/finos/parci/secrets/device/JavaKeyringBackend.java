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

package org.finos.parci.secrets.device;

import org.finos.parci.common.exception.EDeviceUnavailable;

import com.github.javakeyring.BackendNotSupportedException;
import com.github.javakeyring.Keyring;
import com.github.javakeyring.PasswordAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;


/**
 * OS keyring access through java-keyring (macOS Keychain, Windows Credential Manager,
 * freedesktop Secret Service).
 */
public class JavaKeyringBackend implements IKeyringBackend {

    private final Logger log = LoggerFactory.getLogger(getClass());

    private Keyring keyring;

    @Override
    public Optional<String> getPassword(String service, String account) {

        try {

            var password = keyring().getPassword(service, account);
            return Optional.ofNullable(password);
        }
        catch (PasswordAccessException e) {

            // Backends report a missing entry as an access error
            log.debug("No keyring entry for [{}/{}]: {}", service, account, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void setPassword(String service, String account, String password) {

        try {
            keyring().setPassword(service, account, password);
        }
        catch (PasswordAccessException e) {
            var message = String.format("Failed to write keyring entry [%s/%s]: %s", service, account, e.getMessage());
            throw new EDeviceUnavailable(message, e);
        }
    }

    private Keyring keyring() {

        if (keyring != null)
            return keyring;

        try {
            keyring = Keyring.create();
            return keyring;
        }
        catch (BackendNotSupportedException e) {
            throw new EDeviceUnavailable("No OS keyring is available on this system: " + e.getMessage(), e);
        }
    }
}
