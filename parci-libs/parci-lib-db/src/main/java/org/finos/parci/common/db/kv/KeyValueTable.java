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

package org.finos.parci.common.db.kv;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;


public class KeyValueTable {

    private final IKeyValueStore store;
    private final String tableName;

    public KeyValueTable(IKeyValueStore store, String tableName) {
        this.store = store;
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }

    public Optional<String> get(String key) {
        return store.get(tableName, key);
    }

    public void set(String key, String value) {
        store.set(tableName, key, value);
    }

    public void delete(String key) {
        store.delete(tableName, key);
    }

    public boolean contains(String key) {
        return store.contains(tableName, key);
    }

    public List<Map.Entry<String, String>> items() {
        return store.enumerate(tableName);
    }

    public List<String> keys() {
        return items().stream().map(Map.Entry::getKey).collect(Collectors.toList());
    }

    public List<String> values() {
        return items().stream().map(Map.Entry::getValue).collect(Collectors.toList());
    }
}
