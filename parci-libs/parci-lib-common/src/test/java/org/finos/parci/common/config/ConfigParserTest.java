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
import org.finos.parci.common.exception.EStartup;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;


class ConfigParserTest {

    @Test
    void parseYaml() {

        var yaml = "config:\n  parameter.db: /var/lib/parci/params\n  kdf.parallelism: 2\n";
        var bytes = yaml.getBytes(StandardCharsets.UTF_8);

        var config = ConfigParser.parseConfig(bytes, ConfigFormat.YAML, RootConfig.class);

        assertEquals("/var/lib/parci/params", config.getConfig().get("parameter.db"));
        assertEquals("2", config.getConfig().get("kdf.parallelism"));
    }

    @Test
    void parseJson() {

        var json = "{ \"config\": { \"parameter.method\": \"keyring\" } }";
        var bytes = json.getBytes(StandardCharsets.UTF_8);

        var config = ConfigParser.parseConfig(bytes, ConfigFormat.JSON, RootConfig.class);

        assertEquals("keyring", config.getConfig().get("parameter.method"));
    }

    @Test
    void parseUnknownProperty() {

        var yaml = "config: {}\nunknown_section: 1\n";
        var bytes = yaml.getBytes(StandardCharsets.UTF_8);

        assertThrows(EConfigParse.class, () -> ConfigParser.parseConfig(bytes, ConfigFormat.YAML, RootConfig.class));

        var lenient = ConfigParser.parseConfig(bytes, ConfigFormat.YAML, RootConfig.class, true);
        assertTrue(lenient.getConfig().isEmpty());
    }

    @Test
    void parseGarbage() {

        var bytes = "{ not json".getBytes(StandardCharsets.UTF_8);

        assertThrows(EConfigParse.class, () -> ConfigParser.parseConfig(bytes, ConfigFormat.JSON, RootConfig.class));
    }

    @Test
    void formatFromExtension() {

        assertEquals(ConfigFormat.YAML, ConfigFormat.fromExtension(URI.create("file:///etc/parci.yml")));
        assertEquals(ConfigFormat.YAML, ConfigFormat.fromExtension(URI.create("file:///etc/parci.YAML")));
        assertEquals(ConfigFormat.JSON, ConfigFormat.fromExtension(URI.create("file:///etc/parci.json")));
        assertThrows(EStartup.class, () -> ConfigFormat.fromExtension(URI.create("file:///etc/parci.xml")));
        assertThrows(EStartup.class, () -> ConfigFormat.fromExtension(URI.create("file:///etc/parci")));
    }
}
