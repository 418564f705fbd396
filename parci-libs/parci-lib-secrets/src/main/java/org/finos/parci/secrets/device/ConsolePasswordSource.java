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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;


/**
 * Prompt for passwords on the console.
 *
 * <p>When no console is attached (input is piped) the prompt goes to the prompt stream and
 * the password is read as one line of input, without echo suppression.</p>
 */
public class ConsolePasswordSource implements IPasswordSource {

    private final BufferedReader input;
    private final PrintStream promptStream;

    public ConsolePasswordSource(BufferedReader input, PrintStream promptStream) {
        this.input = input;
        this.promptStream = promptStream;
    }

    @Override
    public char[] readPassword(String prompt) {

        var console = System.console();

        if (console != null) {

            var password = console.readPassword("%s", prompt);

            if (password == null)
                throw new EDeviceUnavailable("No password entered (end of input)");

            return password;
        }

        try {

            promptStream.print(prompt);
            promptStream.flush();

            var line = input.readLine();

            if (line == null)
                throw new EDeviceUnavailable("No password entered (end of input)");

            return line.toCharArray();
        }
        catch (IOException e) {
            throw new EDeviceUnavailable("Failed to read password: " + e.getMessage(), e);
        }
    }
}
