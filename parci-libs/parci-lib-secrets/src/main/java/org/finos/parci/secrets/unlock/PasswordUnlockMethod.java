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

import org.finos.parci.common.exception.EInputMismatch;
import org.finos.parci.secrets.crypto.CryptoHelpers;
import org.finos.parci.secrets.crypto.KdfParams;
import org.finos.parci.secrets.crypto.KeyDerivation;
import org.finos.parci.secrets.device.IPasswordSource;


public class PasswordUnlockMethod implements IUnlockMethod {

    public static final String METHOD_NAME = "password";

    private static final String PASSWORD_PROMPT = "Password: ";
    private static final String NEW_PASSWORD_PROMPT = "New password: ";
    private static final String CONFIRM_PROMPT = "Confirm password: ";

    private final IPasswordSource passwordSource;
    private final KdfParams kdfParams;

    public PasswordUnlockMethod(IPasswordSource passwordSource, KdfParams kdfParams) {
        this.passwordSource = passwordSource;
        this.kdfParams = kdfParams;
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

        var password = readNewPassword();

        try {
            return new PendingRecord(createRecord(keys, password));
        }
        finally {
            CryptoHelpers.wipe(password);
        }
    }

    public UnlockRecord createRecord(StoreKeys keys, char[] password) {

        var salt = CryptoHelpers.randomSalt();
        var kek = KeyDerivation.deriveFromPassword(password, salt, kdfParams);

        try {

            var record = new UnlockRecord();
            record.setSalt(CryptoHelpers.encodeBase64(salt));
            record.setKdfParams(kdfParams);

            KeyWrapping.wrap(kek, keys, record);

            return record;
        }
        finally {
            CryptoHelpers.wipe(kek);
        }
    }

    /**
     * Read a new password twice from the password source.
     *
     * @return The password, owned by the caller
     * @throws EInputMismatch The two entries differ
     */
    public char[] readNewPassword() {

        var password = passwordSource.readPassword(NEW_PASSWORD_PROMPT);
        var confirmation = passwordSource.readPassword(CONFIRM_PROMPT);

        try {
            checkConfirmation(password, confirmation);
            return password;
        }
        catch (EInputMismatch e) {
            CryptoHelpers.wipe(password);
            throw e;
        }
        finally {
            CryptoHelpers.wipe(confirmation);
        }
    }

    @Override
    public StoreKeys unlock(UnlockRecord record) {

        var password = passwordSource.readPassword(PASSWORD_PROMPT);

        try {
            return unlock(record, password);
        }
        finally {
            CryptoHelpers.wipe(password);
        }
    }

    public StoreKeys unlock(UnlockRecord record, char[] password) {

        var salt = CryptoHelpers.decodeStoredBase64(record.getSalt());
        var kek = KeyDerivation.deriveFromPassword(password, salt, record.getKdfParams());

        try {
            return KeyWrapping.unwrap(kek, record);
        }
        finally {
            CryptoHelpers.wipe(kek);
        }
    }

    static void checkConfirmation(char[] password, char[] confirmation) {

        if (!CryptoHelpers.constantTimeEquals(password, confirmation))
            throw new EInputMismatch("Password and confirmation do not match");
    }
}
