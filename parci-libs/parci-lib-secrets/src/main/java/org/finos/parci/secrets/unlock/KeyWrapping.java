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
import org.finos.parci.secrets.crypto.SecretBox;

import java.nio.charset.StandardCharsets;


class KeyWrapping {

    // Bound as associated data, so the two wrapped keys cannot be swapped
    private static final byte[] NAME_KEY_LABEL = "name_key".getBytes(StandardCharsets.UTF_8);
    private static final byte[] VALUE_KEY_LABEL = "value_key".getBytes(StandardCharsets.UTF_8);

    static void wrap(byte[] kek, StoreKeys keys, UnlockRecord record) {

        var nameKey = SecretBox.seal(kek, keys.nameKey(), NAME_KEY_LABEL);
        var valueKey = SecretBox.seal(kek, keys.valueKey(), VALUE_KEY_LABEL);

        record.setKeySize(CryptoHelpers.KEY_SIZE);
        record.setNameKey(new WrappedKey(nameKey));
        record.setValueKey(new WrappedKey(valueKey));
    }

    static StoreKeys unwrap(byte[] kek, UnlockRecord record) {

        if (record.getKeySize() != null && record.getKeySize() != CryptoHelpers.KEY_SIZE)
            throw new EAuthenticationFailed();

        var nameKey = unwrapKey(kek, record.getNameKey(), NAME_KEY_LABEL);

        try {
            var valueKey = unwrapKey(kek, record.getValueKey(), VALUE_KEY_LABEL);
            return new StoreKeys(nameKey, valueKey);
        }
        catch (EAuthenticationFailed e) {
            CryptoHelpers.wipe(nameKey);
            throw e;
        }
    }

    private static byte[] unwrapKey(byte[] kek, WrappedKey wrapped, byte[] label) {

        if (wrapped == null)
            throw new EAuthenticationFailed();

        var nonce = CryptoHelpers.decodeStoredBase64(wrapped.getNonce());
        var ciphertext = CryptoHelpers.decodeStoredBase64(wrapped.getCiphertext());

        var key = SecretBox.open(kek, nonce, ciphertext, label);

        if (key.length != CryptoHelpers.KEY_SIZE) {
            CryptoHelpers.wipe(key);
            throw new EAuthenticationFailed();
        }

        return key;
    }
}
