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
import org.finos.parci.common.exception.EInputValidation;
import org.finos.parci.secrets.crypto.CryptoHelpers;
import org.finos.parci.secrets.crypto.KdfParams;
import org.finos.parci.secrets.crypto.KeyDerivation;
import org.finos.parci.secrets.device.IChallengeResponseDevice;


/**
 * Unlock with the HMAC-SHA1 challenge-response slot of a YubiKey.
 *
 * <p>The device response to a stored random challenge is fed through Argon2id with its own salt.
 * Each device gets its own record, named after its serial number.</p>
 */
public class YubikeyUnlockMethod implements IUnlockMethod {

    public static final String METHOD_NAME = "yubikey";
    public static final int CHALLENGE_SIZE = 64;

    private static final String RECORD_PREFIX = METHOD_NAME + ":";

    private final IChallengeResponseDevice device;
    private final int slot;
    private final KdfParams kdfParams;

    public YubikeyUnlockMethod(IChallengeResponseDevice device, int slot, KdfParams kdfParams) {

        if (slot != 1 && slot != 2)
            throw new EInputValidation(String.format("Invalid YubiKey slot: [%d] (must be 1 or 2)", slot));

        this.device = device;
        this.slot = slot;
        this.kdfParams = kdfParams;
    }

    @Override
    public String methodName() {
        return METHOD_NAME;
    }

    @Override
    public String recordName() {
        return RECORD_PREFIX + device.serial();
    }

    @Override
    public PendingRecord createRecord(StoreKeys keys) {

        var challenge = CryptoHelpers.randomBytes(CHALLENGE_SIZE);
        var salt = CryptoHelpers.randomSalt();

        var response = device.challengeResponse(slot, challenge);
        byte[] kek = null;

        try {

            kek = KeyDerivation.derive(response, salt, kdfParams);

            var record = new UnlockRecord();
            record.setSalt(CryptoHelpers.encodeBase64(salt));
            record.setKdfParams(kdfParams);
            record.setChallenge(CryptoHelpers.encodeBase64(challenge));
            record.setSlot(slot);

            KeyWrapping.wrap(kek, keys, record);

            return new PendingRecord(record);
        }
        finally {
            CryptoHelpers.wipe(response);
            CryptoHelpers.wipe(kek);
        }
    }

    @Override
    public StoreKeys unlock(UnlockRecord record) {

        var challenge = CryptoHelpers.decodeStoredBase64(record.getChallenge());
        var salt = CryptoHelpers.decodeStoredBase64(record.getSalt());
        var recordSlot = record.getSlot() != null ? record.getSlot() : slot;

        if (recordSlot != 1 && recordSlot != 2)
            throw new EAuthenticationFailed();

        var params = record.getKdfParams();
        var response = device.challengeResponse(recordSlot, challenge);
        byte[] kek = null;

        try {
            kek = KeyDerivation.derive(response, salt, params);
            return KeyWrapping.unwrap(kek, record);
        }
        finally {
            CryptoHelpers.wipe(response);
            CryptoHelpers.wipe(kek);
        }
    }
}
