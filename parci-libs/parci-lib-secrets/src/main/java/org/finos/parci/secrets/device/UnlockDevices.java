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

import org.finos.parci.common.config.StoreConfig;

import java.io.BufferedReader;
import java.io.PrintStream;


/**
 * The factor sources available to unlock methods.
 */
public class UnlockDevices {

    private final IPasswordSource passwordSource;
    private final IKeyringBackend keyring;
    private final IChallengeResponseDevice challengeResponse;

    public UnlockDevices(IPasswordSource passwordSource, IKeyringBackend keyring, IChallengeResponseDevice challengeResponse) {
        this.passwordSource = passwordSource;
        this.keyring = keyring;
        this.challengeResponse = challengeResponse;
    }

    /**
     * Devices of the local system.
     *
     * <p>A password in the store config is used for every password prompt, otherwise the user
     * is prompted on the console.</p>
     *
     * @param config The store config
     * @param input Input to read passwords from when there is no console
     * @param prompts Stream for prompts when there is no console
     * @return The system devices
     */
    public static UnlockDevices system(StoreConfig config, BufferedReader input, PrintStream prompts) {

        IPasswordSource passwordSource = config.hasPassword()
                ? new StaticPasswordSource(config.getPassword())
                : new ConsolePasswordSource(input, prompts);

        var keyring = new JavaKeyringBackend();
        var challengeResponse = new YkmanChallengeResponseDevice(config.getYubikeyCommand());

        return new UnlockDevices(passwordSource, keyring, challengeResponse);
    }

    public IPasswordSource getPasswordSource() {
        return passwordSource;
    }

    public IKeyringBackend getKeyring() {
        return keyring;
    }

    public IChallengeResponseDevice getChallengeResponse() {
        return challengeResponse;
    }
}
