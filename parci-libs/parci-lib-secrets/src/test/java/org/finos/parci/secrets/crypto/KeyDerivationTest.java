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
import org.finos.parci.common.exception.EInputValidation;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;


class KeyDerivationTest {

    private static final KdfParams FAST_KDF = new KdfParams(1, 1024, 1);

    @Test
    void deterministic() {

        var salt = CryptoHelpers.randomSalt();

        var key1 = KeyDerivation.deriveFromPassword("correct horse".toCharArray(), salt, FAST_KDF);
        var key2 = KeyDerivation.deriveFromPassword("correct horse".toCharArray(), salt, FAST_KDF);

        assertEquals(CryptoHelpers.KEY_SIZE, key1.length);
        assertArrayEquals(key1, key2);
    }

    @Test
    void saltMatters() {

        var key1 = KeyDerivation.deriveFromPassword("correct horse".toCharArray(), CryptoHelpers.randomSalt(), FAST_KDF);
        var key2 = KeyDerivation.deriveFromPassword("correct horse".toCharArray(), CryptoHelpers.randomSalt(), FAST_KDF);

        assertFalse(Arrays.equals(key1, key2));
    }

    @Test
    void costMatters() {

        var salt = CryptoHelpers.randomSalt();

        var key1 = KeyDerivation.deriveFromPassword("correct horse".toCharArray(), salt, FAST_KDF);
        var key2 = KeyDerivation.deriveFromPassword("correct horse".toCharArray(), salt, new KdfParams(2, 1024, 1));

        assertFalse(Arrays.equals(key1, key2));
    }

    @Test
    void passwordIsNormalized() {

        var salt = CryptoHelpers.randomSalt();

        // Precomposed and decomposed forms of the same text
        var composed = KeyDerivation.deriveFromPassword("caf\u00e9".toCharArray(), salt, FAST_KDF);
        var decomposed = KeyDerivation.deriveFromPassword("cafe\u0301".toCharArray(), salt, FAST_KDF);

        assertArrayEquals(composed, decomposed);

        // Compatibility forms fold too under NFKC
        var ligature = KeyDerivation.deriveFromPassword("\ufb01sh".toCharArray(), salt, FAST_KDF);
        var plain = KeyDerivation.deriveFromPassword("fish".toCharArray(), salt, FAST_KDF);

        assertArrayEquals(ligature, plain);
    }

    @Test
    void differentPasswords() {

        var salt = CryptoHelpers.randomSalt();

        var key1 = KeyDerivation.deriveFromPassword("pw".toCharArray(), salt, FAST_KDF);
        var key2 = KeyDerivation.deriveFromPassword("wrong".toCharArray(), salt, FAST_KDF);

        assertFalse(Arrays.equals(key1, key2));
    }

    @Test
    void rawFactor() {

        var salt = CryptoHelpers.randomSalt();
        var factor = CryptoHelpers.randomBytes(20);

        var key1 = KeyDerivation.derive(factor, salt, FAST_KDF);
        var key2 = KeyDerivation.derive(factor.clone(), salt, FAST_KDF);

        assertArrayEquals(key1, key2);
    }

    @Test
    void badSalt() {

        assertThrows(EAuthenticationFailed.class, () -> KeyDerivation.derive(new byte[20], new byte[4], FAST_KDF));
        assertThrows(EAuthenticationFailed.class, () -> KeyDerivation.derive(new byte[20], null, FAST_KDF));
    }

    @Test
    void badParams() {

        assertThrows(EInputValidation.class, () -> new KdfParams(0, 1024, 1));
        assertThrows(EInputValidation.class, () -> new KdfParams(1, 4, 1));
        assertThrows(EInputValidation.class, () -> new KdfParams(1, 1024, 0));
        assertThrows(EInputValidation.class, () -> new KdfParams(1, 16, 4));
    }
}
