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

import org.finos.parci.common.util.VersionInfo;

import java.nio.file.Paths;
import java.util.List;
import java.util.Map;


public class Startup {

    public static StartupSequence useCommandLine(Class<?> serviceClass, String[] args) {

        return useCommandLine(serviceClass, args, List.of());
    }

    public static StartupSequence useCommandLine(Class<?> serviceClass, String[] args, List<StandardArgs.Task> tasks) {

        var componentName = VersionInfo.getComponentName(serviceClass);
        var standardArgs = StandardArgsProcessor.processArgs(componentName, args, tasks);

        return new StartupSequence(serviceClass, standardArgs, System.getenv());
    }

    public static StartupSequence useConfigFile(Class<?> serviceClass, String configFile, Map<String, String> environment) {

        var workingDir = Paths.get(".").toAbsolutePath().normalize();
        var standardArgs = new StandardArgs(workingDir, configFile);

        return new StartupSequence(serviceClass, standardArgs, environment);
    }
}
