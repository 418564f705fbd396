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

package org.finos.parci.tools.param;


import org.finos.parci.common.config.ConfigManager;
import org.finos.parci.common.config.StoreConfig;
import org.finos.parci.common.exception.EDeviceUnavailable;
import org.finos.parci.common.exception.EInputValidation;
import org.finos.parci.common.exception.EParciPublic;
import org.finos.parci.common.exception.EStartup;
import org.finos.parci.common.startup.StandardArgs;
import org.finos.parci.common.startup.Startup;
import org.finos.parci.secrets.device.ConsolePasswordSource;
import org.finos.parci.secrets.device.UnlockDevices;
import org.finos.parci.secrets.store.LocalParameterService;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.common.io.CharStreams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.function.BiFunction;
import java.util.stream.Collectors;


public class ParamTool {

    public final static String INIT = "init";
    public final static String REGISTER_KEYRING = "register_keyring";
    public final static String REGISTER_YUBIKEY = "register_yubikey";
    public final static String LIST = "list";
    public final static String GET = "get";
    public final static String SET = "set";
    public final static String RM = "rm";

    private final static List<StandardArgs.Task> PARAM_TOOL_TASKS = List.of(
            StandardArgs.task(INIT, "Initialize the parameter store (you will be prompted for a password)"),
            StandardArgs.task(REGISTER_KEYRING, "Unlock the store with a key held in the OS keyring"),
            StandardArgs.task(REGISTER_YUBIKEY, "Unlock the store with a YubiKey (challenge-response, see --slot)"),
            StandardArgs.task(LIST, "List the names of all secrets"),
            StandardArgs.task(GET, List.of("name"), "Print the value of a secret"),
            StandardArgs.task(SET, List.of("name", "[value]"), "Store a secret (value from the command line, a prompt or piped input)"),
            StandardArgs.task(RM, List.of("name"), "Delete a secret"));

    private static final ObjectMapper MAPPER = JsonMapper.builder().build();

    private final Logger log = LoggerFactory.getLogger(getClass());

    private final ConfigManager configManager;
    private final StandardArgs args;
    private final BufferedReader input;
    private final PrintStream output;
    private final PrintStream prompts;
    private final boolean interactive;
    private final BiFunction<StoreConfig, BufferedReader, UnlockDevices> devices;

    /**
     * Construct a param tool that talks to the system console, OS keyring and YubiKey.
     *
     * @param configManager A prepared instance of ConfigManager
     * @param args Command line args, for store location and method overrides
     */
    public ParamTool(ConfigManager configManager, StandardArgs args) {

        this(configManager, args,
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                System.out, System.err,
                System.console() != null,
                (config, input) -> UnlockDevices.system(config, input, System.err));
    }

    /**
     * Construct a param tool with explicit streams and devices.
     *
     * @param interactive True to prompt for secret values, false to read them from the rest of the input
     */
    public ParamTool(
            ConfigManager configManager, StandardArgs args,
            BufferedReader input, PrintStream output, PrintStream prompts,
            boolean interactive,
            BiFunction<StoreConfig, BufferedReader, UnlockDevices> devices) {

        this.configManager = configManager;
        this.args = args;
        this.input = input;
        this.output = output;
        this.prompts = prompts;
        this.interactive = interactive;
        this.devices = devices;
    }

    public void runTasks(List<StandardArgs.Task> tasks) {

        try {
            for (var task : tasks) {

                log.info("Running task: {}", task.getTaskName());

                if (INIT.equals(task.getTaskName()))
                    initStore();

                else if (REGISTER_KEYRING.equals(task.getTaskName()))
                    registerMethod("keyring");

                else if (REGISTER_YUBIKEY.equals(task.getTaskName()))
                    registerMethod("yubikey");

                else if (LIST.equals(task.getTaskName()))
                    listSecrets();

                else if (GET.equals(task.getTaskName()))
                    getSecret(task.getTaskArg(0));

                else if (SET.equals(task.getTaskName()))
                    setSecret(task.getTaskArg(0), task.argCount() > 1 ? task.getTaskArg(1) : null);

                else if (RM.equals(task.getTaskName()))
                    deleteSecret(task.getTaskArg(0));

                else
                    throw new EStartup(String.format("Unknown task: [%s]", task.getTaskName()));
            }

            log.info("All tasks complete");
        }
        catch (EStartup e) {
            throw e;
        }
        catch (EParciPublic e) {

            // Expected failures (wrong password, missing secret) get a message, not a stack trace
            log.debug("Task failed: {}", e.getMessage(), e);
            throw new EStartup(e.getMessage(), 1, e);
        }
        catch (Exception e) {
            var message = "There was an error processing the task: " + e.getMessage();
            log.error(message, e);
            throw new EStartup(message, e);
        }
    }

    private void initStore() {

        try (var service = openService(/* readOnly = */ true)) {

            var keys = service.getRegistry().initialize();
            keys.destroy();

            prompts.println("Parameter store initialized: " + service.getConfig().getStoreLocation());
        }
    }

    private void registerMethod(String methodName) {

        try (var service = openService(/* readOnly = */ true)) {

            var registry = service.getRegistry();
            var keys = registry.resolve("password");

            try {
                registry.register(keys, methodName);
            }
            finally {
                keys.destroy();
            }

            prompts.printf("Registered unlock method [%s], it is now the default%n", methodName);
        }
    }

    private void listSecrets() {

        try (var service = openService(/* readOnly = */ true)) {

            var names = service.getStore().keys().sorted().collect(Collectors.toList());

            for (var name : names)
                output.println(name);
        }
    }

    private void getSecret(String name) {

        try (var service = openService(/* readOnly = */ true)) {
            output.println(service.getStore().get(name));
        }
    }

    private void setSecret(String name, String valueArg) {

        try (var service = openService(/* readOnly = */ false)) {

            var store = service.getStore();

            // Unlock first so the password prompt comes before the value prompt
            store.unlock();

            var value = readValue(name, valueArg);

            try {

                if (args.isJson())
                    store.setJson(name, parseJson(value));
                else
                    store.set(name, new String(value));
            }
            finally {
                Arrays.fill(value, '\0');
            }
        }
    }

    private char[] readValue(String name, String valueArg) {

        if (valueArg != null)
            return valueArg.toCharArray();

        if (interactive) {
            var valueSource = new ConsolePasswordSource(input, prompts);
            return valueSource.readPassword(String.format("Value for [%s]: ", name));
        }

        // Piped values can span several lines (certificates, keys), only the final line break is dropped
        try {

            var value = CharStreams.toString(input);

            if (value.isEmpty())
                throw new EDeviceUnavailable(String.format("No value entered for [%s] (end of input)", name));

            if (value.endsWith("\r\n"))
                value = value.substring(0, value.length() - 2);
            else if (value.endsWith("\n"))
                value = value.substring(0, value.length() - 1);

            return value.toCharArray();
        }
        catch (IOException e) {
            throw new EDeviceUnavailable("Failed to read value: " + e.getMessage(), e);
        }
    }

    private void deleteSecret(String name) {

        try (var service = openService(/* readOnly = */ false)) {
            service.getStore().delete(name);
        }
    }

    private LocalParameterService openService(boolean readOnly) {

        var config = storeConfig(readOnly);
        var service = new LocalParameterService(config, devices.apply(config, input));

        try {
            service.start();
            return service;
        }
        catch (RuntimeException e) {
            service.close();
            throw e;
        }
    }

    StoreConfig storeConfig(boolean readOnly) {

        var builder = configManager.storeConfig();

        if (args.getStoreLocation() != null)
            builder.setStoreLocation(args.getWorkingDir().resolve(args.getStoreLocation()).normalize());

        if (args.getOpenMethod() != null)
            builder.setOpenMethod(args.getOpenMethod());

        if (args.getSlot() != null)
            builder.setYubikeySlot(args.getSlot());

        return builder.setReadOnly(readOnly).build();
    }

    private static JsonNode parseJson(char[] value) {

        try {
            return MAPPER.readTree(new String(value));
        }
        catch (JsonProcessingException e) {
            // Parser messages can quote the input, keep them out of the error
            throw new EInputValidation("Value is not valid JSON");
        }
    }

    /**
     * Entry point for the ParamTool utility.
     *
     * @param args Command line args
     */
    public static void main(String[] args) {

        try {

            var startup = Startup.useCommandLine(ParamTool.class, args, PARAM_TOOL_TASKS);
            startup.runStartupSequence();

            var config = startup.getConfig();
            var standardArgs = startup.getArgs();

            var tool = new ParamTool(config, standardArgs);
            tool.runTasks(standardArgs.getTasks());

            System.exit(0);
        }
        catch (EStartup e) {

            if (e.isQuiet())
                System.exit(e.getExitCode());

            System.err.println("param-tool: " + e.getMessage());

            System.exit(e.getExitCode());
        }
        catch (Exception e) {

            System.err.println("There was an unexpected error on the main thread: " + e.getMessage());
            e.printStackTrace(System.err);

            System.exit(-1);
        }
    }
}
