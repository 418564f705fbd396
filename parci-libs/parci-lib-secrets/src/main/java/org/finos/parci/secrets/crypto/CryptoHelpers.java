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

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.text.Normalizer;
import java.util.Arrays;
import java.util.Base64;


public class CryptoHelpers {

    public static final int KEY_SIZE = 32;
    public static final int SALT_SIZE = 16;

    private static final SecureRandom RANDOM = new SecureRandom();

    public static byte[] randomBytes(int size) {

        var bytes = new byte[size];
        RANDOM.nextBytes(bytes);

        return bytes;
    }

    public static byte[] randomKey() {
        return randomBytes(KEY_SIZE);
    }

    public static byte[] randomSalt() {
        return randomBytes(SALT_SIZE);
    }

    public static String encodeBase64(byte[] bytes) {
        return Base64.getEncoder().encodeToString(bytes);
    }

    /**
     * Decode base64 held in the store.
     *
     * <p>Stored data that is not valid base64 has been tampered with, so this reports
     * an authentication failure rather than a parsing error.</p>
     */
    public static byte[] decodeStoredBase64(String encoded) {

        if (encoded == null)
            throw new EAuthenticationFailed();

        try {
            return Base64.getDecoder().decode(encoded);
        }
        catch (IllegalArgumentException e) {
            throw new EAuthenticationFailed();
        }
    }

    /**
     * Normalize a passphrase to NFKC and encode it as UTF-8.
     *
     * <p>The caller owns the returned array and should wipe it after use.</p>
     */
    public static byte[] normalizePassword(char[] password) {

        var normalized = Normalizer.normalize(CharBuffer.wrap(password), Normalizer.Form.NFKC);
        var buffer = StandardCharsets.UTF_8.encode(CharBuffer.wrap(normalized));

        var bytes = new byte[buffer.remaining()];
        buffer.get(bytes);

        wipe(buffer);

        return bytes;
    }

    public static boolean constantTimeEquals(byte[] a, byte[] b) {
        return MessageDigest.isEqual(a, b);
    }

    public static boolean constantTimeEquals(char[] a, char[] b) {

        var aBytes = StandardCharsets.UTF_8.encode(CharBuffer.wrap(a));
        var bBytes = StandardCharsets.UTF_8.encode(CharBuffer.wrap(b));

        var aArray = new byte[aBytes.remaining()];
        var bArray = new byte[bBytes.remaining()];
        aBytes.get(aArray);
        bBytes.get(bArray);

        try {
            return MessageDigest.isEqual(aArray, bArray);
        }
        finally {
            wipe(aBytes);
            wipe(bBytes);
            wipe(aArray);
            wipe(bArray);
        }
    }

    public static void wipe(byte[] bytes) {

        if (bytes != null)
            Arrays.fill(bytes, (byte) 0);
    }

    public static void wipe(char[] chars) {

        if (chars != null)
            Arrays.fill(chars, '\0');
    }

    private static void wipe(ByteBuffer buffer) {

        if (buffer.hasArray())
            Arrays.fill(buffer.array(), (byte) 0);
    }
}
