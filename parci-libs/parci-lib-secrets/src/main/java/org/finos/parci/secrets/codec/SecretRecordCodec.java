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

package org.finos.parci.secrets.codec;

import org.finos.parci.common.exception.EAuthenticationFailed;
import org.finos.parci.common.exception.EParciInternal;
import org.finos.parci.secrets.crypto.CryptoHelpers;
import org.finos.parci.secrets.crypto.SecretBox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.google.common.io.BaseEncoding;
import org.bouncycastle.crypto.digests.Blake2bDigest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;


/**
 * Translate (name, value) pairs to and from the rows of the params table.
 *
 * <p>Rows are keyed by a digest of the name under the name key: keyed BLAKE2b-256 over the
 * JSON encoding of the name, hex encoded. The row value is the base64 of nonce and ciphertext
 * for the JSON object <code>{"name": ..., "value": ...}</code> sealed under the value key,
 * with the row digest as associated data. A row copied to another digest does not open.</p>
 */
public class SecretRecordCodec {

    static final String NAME_FIELD = "name";
    static final String VALUE_FIELD = "value";

    private static final int DIGEST_SIZE = 32;

    private static final ObjectMapper MAPPER = JsonMapper.builder().build();

    private final byte[] nameKey;
    private final byte[] valueKey;

    public SecretRecordCodec(byte[] nameKey, byte[] valueKey) {

        if (nameKey == null || nameKey.length != CryptoHelpers.KEY_SIZE)
            throw new EParciInternal("Name key must be " + CryptoHelpers.KEY_SIZE + " bytes");

        if (valueKey == null || valueKey.length != CryptoHelpers.KEY_SIZE)
            throw new EParciInternal("Value key must be " + CryptoHelpers.KEY_SIZE + " bytes");

        this.nameKey = nameKey.clone();
        this.valueKey = valueKey.clone();
    }

    public String digest(String name) {

        var digest = new Blake2bDigest(nameKey, DIGEST_SIZE, null, null);
        var input = encodeName(name);

        digest.update(input, 0, input.length);

        var output = new byte[DIGEST_SIZE];
        digest.doFinal(output, 0);

        return BaseEncoding.base16().lowerCase().encode(output);
    }

    public String encode(String name, JsonNode value) {

        return encode(digest(name), name, value);
    }

    public String encode(String digest, String name, JsonNode value) {

        var pair = JsonNodeFactory.instance.objectNode();
        pair.put(NAME_FIELD, name);
        pair.set(VALUE_FIELD, value);

        byte[] plaintext = null;

        try {

            plaintext = MAPPER.writeValueAsBytes(pair);

            var sealed = SecretBox.sealCombined(valueKey, plaintext, digest.getBytes(StandardCharsets.UTF_8));

            return CryptoHelpers.encodeBase64(sealed);
        }
        catch (IOException e) {
            throw new EParciInternal("Failed to encode secret record", e);
        }
        finally {
            CryptoHelpers.wipe(plaintext);
        }
    }

    /**
     * Decode a row of the params table.
     *
     * @param digest Key of the row
     * @param ciphertext Value of the row
     * @return The decoded pair
     * @throws EAuthenticationFailed The row cannot be opened with this key, or does not belong under this digest
     */
    public SecretItem decode(String digest, String ciphertext) {

        var sealed = CryptoHelpers.decodeStoredBase64(ciphertext);
        var plaintext = SecretBox.openCombined(valueKey, sealed, digest.getBytes(StandardCharsets.UTF_8));

        try {

            var pair = MAPPER.readTree(plaintext);

            if (pair == null || !pair.isObject())
                throw new EAuthenticationFailed();

            var name = pair.get(NAME_FIELD);
            var value = pair.get(VALUE_FIELD);

            if (name == null || !name.isTextual() || value == null)
                throw new EAuthenticationFailed();

            // Authenticated, but check the name really lives under this digest
            var expectedDigest = digest(name.textValue()).getBytes(StandardCharsets.UTF_8);

            if (!CryptoHelpers.constantTimeEquals(expectedDigest, digest.getBytes(StandardCharsets.UTF_8)))
                throw new EAuthenticationFailed();

            return new SecretItem(name.textValue(), value);
        }
        catch (IOException e) {
            throw new EAuthenticationFailed();
        }
        finally {
            CryptoHelpers.wipe(plaintext);
        }
    }

    public void wipe() {
        CryptoHelpers.wipe(nameKey);
        CryptoHelpers.wipe(valueKey);
    }

    private static byte[] encodeName(String name) {

        try {
            return MAPPER.writeValueAsBytes(name);
        }
        catch (IOException e) {
            throw new EParciInternal("Failed to encode secret name", e);
        }
    }
}
