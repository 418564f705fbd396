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
import org.finos.parci.common.exception.EParciInternal;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.util.Arrays;


/**
 * Authenticated encryption with AES-256-GCM.
 *
 * <p>Every seal uses a fresh random 96-bit nonce. Opening a box with the wrong key, the wrong
 * associated data or a modified ciphertext fails with {@link EAuthenticationFailed}, which
 * carries no detail about what went wrong.</p>
 */
public class SecretBox {

    public static final String ALGORITHM = "AES/GCM/NoPadding";
    public static final int NONCE_SIZE = 12;
    public static final int TAG_BITS = 128;

    public static Sealed seal(byte[] key, byte[] plaintext, byte[] associatedData) {

        checkKey(key);

        var nonce = CryptoHelpers.randomBytes(NONCE_SIZE);

        try {

            var cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_BITS, nonce));

            if (associatedData != null)
                cipher.updateAAD(associatedData);

            var ciphertext = cipher.doFinal(plaintext);

            return new Sealed(nonce, ciphertext);
        }
        catch (GeneralSecurityException e) {

            // AES-GCM is a mandatory JCE algorithm, failure to encrypt is a platform problem
            throw new EParciInternal("Encryption failed: " + e.getMessage(), e);
        }
    }

    public static byte[] open(byte[] key, byte[] nonce, byte[] ciphertext, byte[] associatedData) {

        if (key == null || key.length != CryptoHelpers.KEY_SIZE)
            throw new EAuthenticationFailed();

        if (nonce == null || nonce.length != NONCE_SIZE || ciphertext == null || ciphertext.length < TAG_BITS / 8)
            throw new EAuthenticationFailed();

        try {

            var cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_BITS, nonce));

            if (associatedData != null)
                cipher.updateAAD(associatedData);

            return cipher.doFinal(ciphertext);
        }
        catch (GeneralSecurityException e) {

            // Bad tag, wrong key and malformed input all look the same from outside
            throw new EAuthenticationFailed();
        }
    }

    /** Seal and encode as a single blob, nonce followed by ciphertext **/
    public static byte[] sealCombined(byte[] key, byte[] plaintext, byte[] associatedData) {

        var sealed = seal(key, plaintext, associatedData);
        var nonce = sealed.getNonce();
        var ciphertext = sealed.getCiphertext();

        var combined = Arrays.copyOf(nonce, nonce.length + ciphertext.length);
        System.arraycopy(ciphertext, 0, combined, nonce.length, ciphertext.length);

        return combined;
    }

    public static byte[] openCombined(byte[] key, byte[] combined, byte[] associatedData) {

        if (combined == null || combined.length < NONCE_SIZE + TAG_BITS / 8)
            throw new EAuthenticationFailed();

        var nonce = Arrays.copyOfRange(combined, 0, NONCE_SIZE);
        var ciphertext = Arrays.copyOfRange(combined, NONCE_SIZE, combined.length);

        return open(key, nonce, ciphertext, associatedData);
    }

    private static void checkKey(byte[] key) {

        if (key == null || key.length != CryptoHelpers.KEY_SIZE)
            throw new EParciInternal("Encryption key must be " + CryptoHelpers.KEY_SIZE + " bytes");
    }

    public static final class Sealed {

        private final byte[] nonce;
        private final byte[] ciphertext;

        public Sealed(byte[] nonce, byte[] ciphertext) {
            this.nonce = nonce;
            this.ciphertext = ciphertext;
        }

        public byte[] getNonce() {
            return nonce;
        }

        public byte[] getCiphertext() {
            return ciphertext;
        }
    }
}
