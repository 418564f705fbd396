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


/**
 * Durable string-to-string mapping, scoped by table name.
 *
 * <p>Every write is committed before the call returns. Keys and values are opaque to the store,
 * binary payloads are expected to be encoded (e.g. base64) by the caller.</p>
 *
 * @see KeyValueTable
 */
public interface IKeyValueStore {

    void start();

    void stop();

    Optional<String> get(String table, String key);

    void set(String table, String key, String value);

    void delete(String table, String key);

    boolean contains(String table, String key);

    /**
     * Read every entry of a table in a single query.
     *
     * <p>Ordering is by key. No snapshot is held after the call returns.</p>
     *
     * @param table The table to read
     * @return All (key, value) pairs of the table
     */
    List<Map.Entry<String, String>> enumerate(String table);

    default KeyValueTable table(String table) {
        return new KeyValueTable(this, table);
    }
}
