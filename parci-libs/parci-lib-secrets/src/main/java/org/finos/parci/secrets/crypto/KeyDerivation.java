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

package org.finos.parci.secrets.crypto;

import org.finos.parci.common.exception.EAuthenticationFailed;

import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;


public class KeyDerivation {

    // Argon2 minimum
    private static final int MIN_SALT_SIZE = 8;

    /**
     * Derive a 256-bit key from a passphrase.
     *
     * <p>The passphrase is NFKC normalized and UTF-8 encoded before derivation.</p>
     *
     * @param password The passphrase
     * @param salt Salt stored with the unlock record
     * @param params Cost parameters stored with the unlock record
     * @return The derived key
     */
    public static byte[] deriveFromPassword(char[] password, byte[] salt, KdfParams params) {

        var passwordBytes = CryptoHelpers.normalizePassword(password);

        try {
            return derive(passwordBytes, salt, params);
        }
        finally {
            CryptoHelpers.wipe(passwordBytes);
        }
    }

    /**
     * Derive a 256-bit key from raw factor bytes, e.g. a hardware token response.
     *
     * @param factor The factor bytes
     * @param salt Salt stored with the unlock record
     * @param params Cost parameters stored with the unlock record
     * @return The derived key
     */
    public static byte[] derive(byte[] factor, byte[] salt, KdfParams params) {

        if (salt == null || salt.length < MIN_SALT_SIZE)
            throw new EAuthenticationFailed();

        var argonParams = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
                .withVersion(Argon2Parameters.ARGON2_VERSION_13)
                .withIterations(params.getTimeCost())
                .withMemoryAsKB(params.getMemoryCost())
                .withParallelism(params.getParallelism())
                .withSalt(salt)
                .build();

        var generator = new Argon2BytesGenerator();
        generator.init(argonParams);

        var key = new byte[CryptoHelpers.KEY_SIZE];
        generator.generateBytes(factor, key);

        return key;
    }
}
