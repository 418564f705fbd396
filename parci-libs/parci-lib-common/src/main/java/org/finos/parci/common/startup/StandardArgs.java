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

import java.nio.file.Path;
import java.util.List;


public class StandardArgs {

    private final Path workingDir;
    private final String configFile;
    private final String storeLocation;
    private final String openMethod;
    private final Integer slot;
    private final boolean json;
    private final List<Task> tasks;

    public StandardArgs(
            Path workingDir, String configFile,
            String storeLocation, String openMethod,
            Integer slot, boolean json,
            List<Task> tasks) {

        this.workingDir = workingDir;
        this.configFile = configFile;
        this.storeLocation = storeLocation;
        this.openMethod = openMethod;
        this.slot = slot;
        this.json = json;
        this.tasks = tasks;
    }

    public StandardArgs(Path workingDir, String configFile) {
        this(workingDir, configFile, null, null, null, false, List.of());
    }

    public Path getWorkingDir() {
        return workingDir;
    }

    public String getConfigFile() {
        return configFile;
    }

    /** Store location given with --db, or null **/
    public String getStoreLocation() {
        return storeLocation;
    }

    /** Unlock method given with --method, or null **/
    public String getOpenMethod() {
        return openMethod;
    }

    /** Challenge-response slot given with --slot, or null **/
    public Integer getSlot() {
        return slot;
    }

    public boolean isJson() {
        return json;
    }

    public List<Task> getTasks() {
        return tasks;
    }

    public static Task task(String taskName, String taskDescription) {
        return new Task(taskName, List.of(), taskDescription);
    }

    public static Task task(String taskName, List<String> taskArgs, String taskDescription) {
        return new Task(taskName, taskArgs, taskDescription);
    }

    public static class Task {

        private final String taskName;
        private final List<String> taskArgs;
        private final String taskDescription;

        public Task(String taskName, List<String> taskArgs, String taskDescription) {
            this.taskName = taskName;
            this.taskArgs = taskArgs;
            this.taskDescription = taskDescription;
        }

        public Task(String taskName) {
            this(taskName, List.of(), null);
        }

        public String getTaskName() {
            return taskName;
        }

        public boolean hasArg() {
            return !taskArgs.isEmpty();
        }

        public int argCount() {
            return taskArgs.size();
        }

        /** Args named in square brackets, e.g. "[value]", are optional and come last **/
        public int requiredArgCount() {
            return (int) taskArgs.stream().filter(arg -> !isOptionalArg(arg)).count();
        }

        public static boolean isOptionalArg(String argName) {
            return argName.startsWith("[") && argName.endsWith("]");
        }

        public String getTaskArg(int index) {
            return taskArgs.get(index);
        }

        public List<String> getTaskArgList() {
            return taskArgs;
        }

        public String getTaskDescription() {
            return taskDescription;
        }
    }
}
