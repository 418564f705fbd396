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

import org.finos.parci.common.exception.EAuthenticationFailed;
import org.finos.parci.secrets.crypto.CryptoHelpers;
import org.finos.parci.secrets.device.IKeyringBackend;


/**
 * Unlock with a random key held in the OS keyring.
 *
 * <p>The keyring entry is the key-encryption key itself, so no KDF is involved.</p>
 */
public class KeyringUnlockMethod implements IUnlockMethod {

    public static final String METHOD_NAME = "keyring";

    private final IKeyringBackend keyring;
    private final String service;
    private final String account;

    public KeyringUnlockMethod(IKeyringBackend keyring, String service, String account) {
        this.keyring = keyring;
        this.service = service;
        this.account = account;
    }

    @Override
    public String methodName() {
        return METHOD_NAME;
    }

    @Override
    public String recordName() {
        return METHOD_NAME;
    }

    @Override
    public PendingRecord createRecord(StoreKeys keys) {

        var kek = CryptoHelpers.randomKey();

        try {

            var record = new UnlockRecord();
            KeyWrapping.wrap(kek, keys, record);

            // The keyring entry replaces any previous one, so it is only written once the record is saved
            var storedKey = CryptoHelpers.encodeBase64(kek);

            return new PendingRecord(record, () -> keyring.setPassword(service, account, storedKey));
        }
        finally {
            CryptoHelpers.wipe(kek);
        }
    }

    @Override
    public StoreKeys unlock(UnlockRecord record) {

        var storedKey = keyring.getPassword(service, account);

        if (storedKey.isEmpty())
            throw new EAuthenticationFailed(String.format("No key found in the OS keyring for [%s/%s]", service, account));

        var kek = CryptoHelpers.decodeStoredBase64(storedKey.get());

        try {

            if (kek.length != CryptoHelpers.KEY_SIZE)
                throw new EAuthenticationFailed();

            return KeyWrapping.unwrap(kek, record);
        }
        finally {
            CryptoHelpers.wipe(kek);
        }
    }
}
