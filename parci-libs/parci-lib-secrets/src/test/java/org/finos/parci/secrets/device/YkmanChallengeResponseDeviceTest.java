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

package org.finos.parci.secrets.device;


import org.finos.parci.common.exception.EDeviceUnavailable;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;


class YkmanChallengeResponseDeviceTest {

    private static final String RESPONSE_HEX = "00112233445566778899aabbccddeeff00112233";

    @TempDir
    Path tempDir;

    private String fakeYkman(String script) throws IOException {

        var scriptFile = tempDir.resolve("ykman");
        Files.writeString(scriptFile, "#!/bin/sh\n" + script);

        assertTrue(scriptFile.toFile().setExecutable(true));

        return scriptFile.toString();
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void challengeResponse() throws Exception {

        var command = fakeYkman(
                "if [ \"$1\" = \"list\" ]; then echo 1234567; exit 0; fi\n" +
                "if [ \"$2\" = \"1234567\" ] && [ \"$5\" = \"2\" ] && [ \"$6\" = \"0a0b\" ]; then\n" +
                "  echo " + RESPONSE_HEX + "; exit 0\n" +
                "fi\n" +
                "exit 3\n");

        var device = new YkmanChallengeResponseDevice(command);

        assertEquals("1234567", device.serial());

        var response = device.challengeResponse(2, new byte[] { 0x0a, 0x0b });

        assertEquals(IChallengeResponseDevice.RESPONSE_SIZE, response.length);
        assertEquals((byte) 0x11, response[1]);
        assertEquals((byte) 0xff, response[15]);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void firstSerialIsUsed() throws Exception {

        var command = fakeYkman("printf '\\n  7654321  \\n1234567\\n'\n");
        var device = new YkmanChallengeResponseDevice(command);

        assertEquals("7654321", device.serial());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void noDeviceConnected() throws Exception {

        var command = fakeYkman("exit 0\n");
        var device = new YkmanChallengeResponseDevice(command);

        assertThrows(EDeviceUnavailable.class, device::serial);
        assertThrows(EDeviceUnavailable.class, () -> device.challengeResponse(2, new byte[64]));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void commandFails() throws Exception {

        var command = fakeYkman(
                "if [ \"$1\" = \"list\" ]; then echo 1234567; exit 0; fi\n" +
                "echo 'Slot 2 is not configured' >&2\n" +
                "exit 1\n");

        var device = new YkmanChallengeResponseDevice(command);

        assertThrows(EDeviceUnavailable.class, () -> device.challengeResponse(2, new byte[64]));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void badResponse() throws Exception {

        var command = fakeYkman(
                "if [ \"$1\" = \"list\" ]; then echo 1234567; exit 0; fi\n" +
                "echo not-hex\n");

        var device = new YkmanChallengeResponseDevice(command);

        assertThrows(EDeviceUnavailable.class, () -> device.challengeResponse(2, new byte[64]));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void shortResponse() throws Exception {

        var command = fakeYkman(
                "if [ \"$1\" = \"list\" ]; then echo 1234567; exit 0; fi\n" +
                "echo 0011\n");

        var device = new YkmanChallengeResponseDevice(command);

        assertThrows(EDeviceUnavailable.class, () -> device.challengeResponse(2, new byte[64]));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void listTimesOut() throws Exception {

        var command = fakeYkman("exec sleep 30\n");
        var device = new YkmanChallengeResponseDevice(command, Duration.ofMillis(500));

        var error = assertTimeoutPreemptively(Duration.ofSeconds(10),
                () -> assertThrows(EDeviceUnavailable.class, device::serial));

        assertTrue(error.getMessage().contains("Timed out"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void listTimesOutWithOutputPending() throws Exception {

        // Output written but the process never exits
        var command = fakeYkman("echo 1234567\nexec sleep 30\n");
        var device = new YkmanChallengeResponseDevice(command, Duration.ofMillis(500));

        assertTimeoutPreemptively(Duration.ofSeconds(10),
                () -> assertThrows(EDeviceUnavailable.class, device::serial));
    }

    @Test
    void commandNotInstalled() {

        var command = tempDir.resolve("no-such-ykman").toString();
        var device = new YkmanChallengeResponseDevice(command);

        assertThrows(EDeviceUnavailable.class, device::serial);
    }
}
