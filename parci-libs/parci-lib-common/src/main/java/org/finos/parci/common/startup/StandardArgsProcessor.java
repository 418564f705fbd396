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

package org.finos.parci.common.startup;

import org.finos.parci.common.exception.EStartup;
import org.apache.commons.cli.*;

import java.io.PrintWriter;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;


public class StandardArgsProcessor {

    /**
     * Read standard args from the command line.
     *
     * <p>This variant of processArgs() does not enable task processing.</p>
     *
     * @param appName Name of the application, displayed in help messages
     * @param args The command line args received on startup
     * @return A set of standard args suitable for creating a ConfigManager
     * @throws EStartup The command line args could not be parsed, or --help was specified
     */
    public static StandardArgs processArgs(String appName, String[] args) {

        return processArgs(appName, args, null);
    }

    /**
     * Read standard args from the command line.
     *
     * <p>This variant of processArgs() can be used to enable task processing.</p>
     *
     * @param appName Name of the application, displayed in help messages
     * @param args The command line args received on startup
     * @param availableTasks If present, enable task processing and supply the list of available tasks
     * @return A set of standard args suitable for creating a ConfigManager
     * @throws EStartup The command line args could not be parsed, or --help was specified
     */
    public static StandardArgs processArgs(String appName, String[] args, List<StandardArgs.Task> availableTasks) {

        var usingTasks = availableTasks != null && !availableTasks.isEmpty();
        var helpOptions = helpOptions(usingTasks);
        var options = standardOptions(usingTasks);

        try {

            var parser = new DefaultParser();
            var helpCommand = parser.parse(helpOptions, args, true);

            handleHelpCommands(appName, helpCommand, options, availableTasks);

            var command = parser.parse(options, args, false);
            var workingDir = Paths.get(".").toAbsolutePath().normalize();
            var configFile = command.getOptionValue("config");
            var storeLocation = command.getOptionValue("db");
            var openMethod = command.getOptionValue("method");
            var slot = processSlot(command.getOptionValue("slot"));
            var json = command.hasOption("json");

            var tasks = usingTasks
                    ? processTasks(command, availableTasks)
                    : List.<StandardArgs.Task>of();

            return new StandardArgs(workingDir, configFile, storeLocation, openMethod, slot, json, tasks);
        }
        catch (ParseException e) {

            var message = "Invalid command line: " + e.getMessage();
            System.err.println(message);

            var formatter = new HelpFormatter();
            formatter.printUsage(new PrintWriter(System.err, true), 80, appName, options);

            throw EStartup.quietShutdown(-1);
        }
    }

    private static void handleHelpCommands(
            String appName, CommandLine helpCommand,
            Options options, List<StandardArgs.Task> tasks) {

        if (helpCommand.hasOption("help")) {

            var formatter = new HelpFormatter();
            formatter.printHelp(appName, options);

            throw EStartup.quietShutdown(0);
        }

        if (helpCommand.hasOption("task-list")) {

            System.out.println(appName + " - available tasks:");

            for (var task : tasks) {

                var taskInfoFormat = "%-35s %s";
                var taskUsage = task.hasArg()
                        ? task.getTaskName() + " " + String.join(" ", task.getTaskArgList())
                        : task.getTaskName();

                System.out.printf(taskInfoFormat, taskUsage, task.getTaskDescription());
                System.out.println();
            }

            throw EStartup.quietShutdown(0);
        }
    }

    private static Integer processSlot(String slotArg) {

        if (slotArg == null)
            return null;

        try {
            return Integer.parseInt(slotArg);
        }
        catch (NumberFormatException e) {
            throw new EStartup(String.format("Invalid slot: [%s]", slotArg));
        }
    }

    private static List<StandardArgs.Task> processTasks(CommandLine command, List<StandardArgs.Task> availableTasks) {

        var taskMap = availableTasks.stream()
                .collect(Collectors.toMap(StandardArgs.Task::getTaskName, task -> task));

        var taskArgs = command.getOptionValues("task");
        var tasks = new ArrayList<StandardArgs.Task>();

        for (var argIndex = 0; argIndex < taskArgs.length; argIndex++) {

            var taskName = taskArgs[argIndex];

            if (!taskMap.containsKey(taskName))
                throw new EStartup(String.format("Unknown task: [%s]", taskName));

            var taskDef = taskMap.get(taskName);

            if (taskDef.hasArg()) {

                var required = taskDef.requiredArgCount();

                if (required > taskArgs.length - argIndex - 1) {

                    var message = String.format(
                            "Task [%s] requires %d argument(s): %s",
                            taskName, required, String.join(" ", taskDef.getTaskArgList()));

                    throw new EStartup(message);
                }

                var args = new ArrayList<>(Arrays.asList(taskArgs).subList(argIndex + 1, argIndex + 1 + required));
                argIndex += required;

                // An optional arg is taken unless the next word is another task
                for (var optional = required; optional < taskDef.argCount(); optional++) {

                    var next = argIndex + 1;

                    if (next >= taskArgs.length || taskMap.containsKey(taskArgs[next]))
                        break;

                    args.add(taskArgs[next]);
                    argIndex = next;
                }

                var task = new StandardArgs.Task(taskName, List.copyOf(args), "");
                tasks.add(task);
            }
            else {

                var task = new StandardArgs.Task(taskName);
                tasks.add(task);
            }
        }

        return List.copyOf(tasks);
    }

    private static Options standardOptions(boolean usingTasks) {

        return buildOptions(usingTasks, false);
    }

    private static Options helpOptions(boolean usingTasks) {

        return buildOptions(usingTasks, true);
    }

    private static Options buildOptions(boolean usingTasks, boolean buildingHelp) {

        var options = new Options();

        options.addOption(Option.builder()
                .desc("Location of the root config file (optional)")
                .longOpt("config")
                .hasArg()
                .argName("config_file")
                .build());

        options.addOption(Option.builder()
                .desc("Location of the parameter database (overrides config and environment)")
                .longOpt("db")
                .hasArg()
                .argName("db_path")
                .build());

        options.addOption(Option.builder()
                .desc("Unlock method to open the store with (password, keyring or yubikey)")
                .longOpt("method")
                .hasArg()
                .argName("method")
                .build());

        options.addOption(Option.builder()
                .desc("Challenge-response slot for YubiKey registration (1 or 2)")
                .longOpt("slot")
                .hasArg()
                .argName("slot")
                .build());

        options.addOption(Option.builder()
                .desc("Parse the secret as JSON before storing it")
                .longOpt("json")
                .build());

        options.addOption(Option.builder()
                .desc("Display this help and then quit")
                .longOpt("help")
                .build());

        if (usingTasks) {

            options.addOption(Option.builder()
                    .desc("Perform a specific task")
                    .longOpt("task")
                    .hasArgs()
                    .argName("task")
                    .required(!buildingHelp)
                    .build());

            options.addOption(Option.builder()
                    .desc("Display the list of available tasks and then quit")
                    .longOpt("task-list")
                    .build());
        }

        return options;
    }
}
