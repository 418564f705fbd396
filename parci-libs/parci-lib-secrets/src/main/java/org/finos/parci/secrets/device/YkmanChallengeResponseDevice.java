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

import com.google.common.io.BaseEncoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;


/**
 * YubiKey challenge-response through the YubiKey Manager command line (ykman).
 */
public class YkmanChallengeResponseDevice implements IChallengeResponseDevice {

    public static final Duration DEFAULT_LIST_TIMEOUT = Duration.ofSeconds(10);

    private final Logger log = LoggerFactory.getLogger(getClass());

    private final String command;
    private final Duration listTimeout;

    public YkmanChallengeResponseDevice(String command) {
        this(command, DEFAULT_LIST_TIMEOUT);
    }

    public YkmanChallengeResponseDevice(String command, Duration listTimeout) {
        this.command = command;
        this.listTimeout = listTimeout;
    }

    @Override
    public String serial() {

        var output = runCommand(List.of(command, "list", "--serials"), /* waitForTouch = */ false);

        var serial = output.lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .findFirst();

        if (serial.isEmpty())
            throw new EDeviceUnavailable("No YubiKey is connected");

        return serial.get();
    }

    @Override
    public byte[] challengeResponse(int slot, byte[] challenge) {

        var serial = serial();
        var challengeHex = BaseEncoding.base16().lowerCase().encode(challenge);

        log.info("Sending challenge to YubiKey [{}], slot {} (touch the key if it blinks)", serial, slot);

        var output = runCommand(
                List.of(command, "--device", serial, "otp", "calculate", String.valueOf(slot), challengeHex),
                /* waitForTouch = */ true);

        try {

            var response = BaseEncoding.base16().lowerCase().decode(output.strip().toLowerCase());

            if (response.length != RESPONSE_SIZE)
                throw new EDeviceUnavailable(String.format("Unexpected response size from YubiKey: %d bytes", response.length));

            return response;
        }
        catch (IllegalArgumentException e) {
            throw new EDeviceUnavailable("Unexpected response from YubiKey", e);
        }
    }

    private String runCommand(List<String> commandLine, boolean waitForTouch) {

        var pb = new ProcessBuilder();
        pb.command(commandLine);
        pb.redirectError(ProcessBuilder.Redirect.INHERIT);

        Process proc;

        try {
            proc = pb.start();
        }
        catch (IOException e) {
            var message = String.format("Could not run [%s], is YubiKey Manager installed? (%s)", command, e.getMessage());
            throw new EDeviceUnavailable(message, e);
        }

        // Output is drained on a separate thread so the timeout applies even if ykman hangs
        var procOutput = CompletableFuture.supplyAsync(() -> readOutput(proc));

        try {

            // Waiting for a touch has no timeout
            if (waitForTouch)
                proc.waitFor();

            else if (!proc.waitFor(listTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                proc.destroyForcibly();
                throw new EDeviceUnavailable(String.format("Timed out waiting for [%s]", command));
            }

            if (proc.exitValue() != 0) {
                var message = String.format("[%s %s] failed with exit code %d", command, commandLine.get(1), proc.exitValue());
                throw new EDeviceUnavailable(message);
            }

            var procResult = procOutput.get(listTimeout.toMillis(), TimeUnit.MILLISECONDS);

            return new String(procResult, StandardCharsets.UTF_8);
        }
        catch (ExecutionException e) {
            var cause = e.getCause() != null ? e.getCause() : e;
            throw new EDeviceUnavailable(String.format("Error talking to [%s]: %s", command, cause.getMessage()), cause);
        }
        catch (TimeoutException e) {
            throw new EDeviceUnavailable(String.format("Timed out reading output from [%s]", command), e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EDeviceUnavailable(String.format("Interrupted waiting for [%s]", command), e);
        }
        finally {
            proc.destroy();
        }
    }

    private static byte[] readOutput(Process proc) {

        try (var stream = proc.getInputStream()) {
            return stream.readAllBytes();
        }
        catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
