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

package org.finos.parci.common.config;

import org.finos.parci.common.exception.EConfigParse;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import java.io.IOException;


public class ConfigParser {

    public static <TConfig> TConfig parseConfig(byte[] configData, ConfigFormat configFormat, Class<TConfig> configClass) {

        return parseConfig(configData, configFormat, configClass, /* leniency = */ false);
    }

    public static <TConfig> TConfig parseConfig(
            byte[] configData, ConfigFormat configFormat,
            Class<TConfig> configClass, boolean leniency) {

        var mapper = mapperForFormat(configFormat)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, !leniency);

        try {

            var config = mapper.readValue(configData, configClass);

            // An empty document parses to null
            if (config == null)
                throw new EConfigParse("Invalid config: The config file is empty");

            return config;
        }
        catch (IOException e) {

            throw new EConfigParse("Invalid config: " + e.getMessage(), e);
        }
    }

    private static ObjectMapper mapperForFormat(ConfigFormat configFormat) {

        switch (configFormat) {

            case JSON:
                return JsonMapper.builder().build();

            case YAML:
                return YAMLMapper.builder().build();

            default:
                throw new EConfigParse(String.format("Unknown config format [%s]", configFormat));
        }
    }
}
