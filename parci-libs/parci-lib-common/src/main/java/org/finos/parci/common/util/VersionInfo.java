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

package org.finos.parci.common.util;


import org.finos.parci.common.exception.EStartup;

import java.io.IOException;
import java.util.Properties;


public class VersionInfo {

    private static final String VERSION_INFO_PROPS = "version.properties";
    private static final String COMPONENT_NAME_KEY = "parci.component.name";
    private static final String COMPONENT_VERSION_KEY = "parci.component.version";
    private static final String UNPACKED_SUFFIX = " (Unpackaged)";
    private static final String UNKNOWN_VERSION = "unknown";

    public static String getComponentName(Class<?> component) {

        var packedName = component.getPackage().getImplementationTitle();

        if (packedName != null && !packedName.isBlank())
            return packedName;

        var unpackedName = readVersionInfo(component, COMPONENT_NAME_KEY);

        // Tools built without resource filtering fall back to the class name
        return unpackedName != null ? unpackedName : component.getSimpleName();
    }

    public static String getComponentVersion(Class<?> component) {

        var packedVersion = component.getPackage().getImplementationVersion();

        if (packedVersion != null && !packedVersion.isBlank())
            return packedVersion;

        var unpackedVersion = readVersionInfo(component, COMPONENT_VERSION_KEY);

        return (unpackedVersion != null ? unpackedVersion : UNKNOWN_VERSION) + UNPACKED_SUFFIX;
    }

    private static String readVersionInfo(Class<?> component, String propKey) {

        try (var versionInfoStream = component.getClassLoader().getResourceAsStream(VERSION_INFO_PROPS)) {

            if (versionInfoStream == null)
                return null;

            var versionInfo = new Properties();
            versionInfo.load(versionInfoStream);

            var value = versionInfo.getProperty(propKey);

            // Unfiltered resources still hold the maven placeholder
            if (value == null || value.isBlank() || value.startsWith("${"))
                return null;

            return value;
        }
        catch (IOException e) {
            throw new EStartup("Error reading component version info", e);
        }
    }
}
