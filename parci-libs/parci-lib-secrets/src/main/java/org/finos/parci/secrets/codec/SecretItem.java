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

package org.finos.parci.secrets.codec;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;


/**
 * A decrypted (name, value) pair.
 *
 * <p>Values can be any JSON value, {@link #getText()} gives the text form.</p>
 */
public final class SecretItem {

    private final String name;
    private final JsonNode value;

    public SecretItem(String name, JsonNode value) {
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public JsonNode getValue() {
        return value;
    }

    /** Text values as-is, anything else as compact JSON **/
    public String getText() {
        return value.isTextual() ? value.textValue() : value.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        var other = (SecretItem) o;
        return name.equals(other.name) && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value);
    }

    @Override
    public String toString() {

        // Never include the value
        return "SecretItem{name=***}";
    }
}
