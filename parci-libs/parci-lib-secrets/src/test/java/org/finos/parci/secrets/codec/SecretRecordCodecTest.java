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
import org.finos.parci.secrets.crypto.CryptoHelpers;

import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;


class SecretRecordCodecTest {

    private byte[] nameKey;
    private byte[] valueKey;
    private SecretRecordCodec codec;

    @BeforeEach
    void setup() {

        nameKey = CryptoHelpers.randomKey();
        valueKey = CryptoHelpers.randomKey();
        codec = new SecretRecordCodec(nameKey, valueKey);
    }

    @Test
    void digestIsStable() {

        var digest1 = codec.digest("db:password");
        var digest2 = new SecretRecordCodec(nameKey, valueKey).digest("db:password");

        assertEquals(digest1, digest2);
        assertEquals(64, digest1.length());
        assertTrue(digest1.matches("[0-9a-f]+"));
    }

    @Test
    void digestDependsOnNameAndKey() {

        var otherCodec = new SecretRecordCodec(CryptoHelpers.randomKey(), valueKey);

        assertNotEquals(codec.digest("token"), codec.digest("token2"));
        assertNotEquals(codec.digest("token"), otherCodec.digest("token"));
    }

    @Test
    void encodeAndDecode() {

        var digest = codec.digest("token");
        var ciphertext = codec.encode(digest, "token", TextNode.valueOf("abc123"));

        var item = codec.decode(digest, ciphertext);

        assertEquals("token", item.getName());
        assertEquals("abc123", item.getText());
        assertTrue(item.getValue().isTextual());
    }

    @Test
    void encodeJsonValue() throws Exception {

        var value = JsonMapper.builder().build().readTree("{\"user\": \"admin\", \"port\": 5432}");
        var digest = codec.digest("db");

        var item = codec.decode(digest, codec.encode("db", value));

        assertEquals(value, item.getValue());
        assertEquals("{\"user\":\"admin\",\"port\":5432}", item.getText());
    }

    @Test
    void freshCiphertextEveryEncode() {

        var digest = codec.digest("token");

        var ciphertext1 = codec.encode(digest, "token", TextNode.valueOf("abc123"));
        var ciphertext2 = codec.encode(digest, "token", TextNode.valueOf("abc123"));

        assertNotEquals(ciphertext1, ciphertext2);
    }

    @Test
    void wrongValueKey() {

        var digest = codec.digest("token");
        var ciphertext = codec.encode(digest, "token", TextNode.valueOf("abc123"));

        var otherCodec = new SecretRecordCodec(nameKey, CryptoHelpers.randomKey());

        assertThrows(EAuthenticationFailed.class, () -> otherCodec.decode(digest, ciphertext));
    }

    @Test
    void tamperedCiphertext() {

        var digest = codec.digest("token");
        var ciphertext = codec.encode(digest, "token", TextNode.valueOf("abc123"));

        var bytes = Base64.getDecoder().decode(ciphertext);
        bytes[bytes.length / 2] ^= 0x01;
        var tampered = Base64.getEncoder().encodeToString(bytes);

        assertThrows(EAuthenticationFailed.class, () -> codec.decode(digest, tampered));
    }

    @Test
    void rowMovedToAnotherDigest() {

        var ciphertext = codec.encode("token", TextNode.valueOf("abc123"));
        var otherDigest = codec.digest("other");

        assertThrows(EAuthenticationFailed.class, () -> codec.decode(otherDigest, ciphertext));
    }

    @Test
    void notBase64() {

        var digest = codec.digest("token");

        assertThrows(EAuthenticationFailed.class, () -> codec.decode(digest, "not base64 !!!"));
        assertThrows(EAuthenticationFailed.class, () -> codec.decode(digest, null));
    }

    @Test
    void wipedCodecCannotDecode() {

        var digest = codec.digest("token");
        var ciphertext = codec.encode(digest, "token", TextNode.valueOf("abc123"));

        codec.wipe();

        assertThrows(EAuthenticationFailed.class, () -> codec.decode(digest, ciphertext));
    }
}
