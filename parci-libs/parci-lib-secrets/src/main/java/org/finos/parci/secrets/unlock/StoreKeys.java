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

import org.finos.parci.secrets.codec.SecretRecordCodec;
import org.finos.parci.secrets.crypto.CryptoHelpers;


/**
 * The resolved name key and value key of an unlocked store.
 *
 * <p>Instances only come out of {@link UnlockMethodRegistry}, by initializing a new store or
 * unlocking an existing one. Registering a new unlock method requires an instance, so a method
 * can only be added by someone who has already unlocked the store.</p>
 */
public final class StoreKeys {

    private final byte[] nameKey;
    private final byte[] valueKey;

    StoreKeys(byte[] nameKey, byte[] valueKey) {
        this.nameKey = nameKey;
        this.valueKey = valueKey;
    }

    static StoreKeys generate() {
        return new StoreKeys(CryptoHelpers.randomKey(), CryptoHelpers.randomKey());
    }

    byte[] nameKey() {
        return nameKey;
    }

    byte[] valueKey() {
        return valueKey;
    }

    public SecretRecordCodec codec() {
        return new SecretRecordCodec(nameKey, valueKey);
    }

    public boolean matches(StoreKeys other) {

        return CryptoHelpers.constantTimeEquals(nameKey, other.nameKey) &
                CryptoHelpers.constantTimeEquals(valueKey, other.valueKey);
    }

    public void destroy() {
        CryptoHelpers.wipe(nameKey);
        CryptoHelpers.wipe(valueKey);
    }

    @Override
    public String toString() {
        return "StoreKeys{***}";
    }
}
