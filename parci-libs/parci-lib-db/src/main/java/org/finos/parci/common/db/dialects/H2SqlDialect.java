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

package org.finos.parci.common.db.dialects;

import org.finos.parci.common.db.JdbcDialect;
import org.finos.parci.common.db.JdbcErrorCode;

import java.sql.SQLException;
import java.util.Map;


public class H2SqlDialect extends Dialect {

    private static final String KV_TABLE_DDL = "db/h2/kv_table.ddl";

    private static final String KV_UPSERT =
            "merge into tkv (table_name, kv_key, kv_value)\n" +
            "key (table_name, kv_key)\n" +
            "values (?, ?, ?)";

    private static final Map<Integer, JdbcErrorCode> dialectErrorCodes = Map.ofEntries(
            Map.entry(42102, JdbcErrorCode.TABLE_NOT_FOUND),
            Map.entry(42103, JdbcErrorCode.TABLE_NOT_FOUND),
            Map.entry(42104, JdbcErrorCode.TABLE_NOT_FOUND),
            Map.entry(90020, JdbcErrorCode.DATABASE_IN_USE),
            Map.entry(90097, JdbcErrorCode.DATABASE_READ_ONLY));

    private final String kvTableDdl;

    public H2SqlDialect() {
        kvTableDdl = loadDdl(KV_TABLE_DDL);
    }

    @Override
    public JdbcDialect dialectCode() {
        return JdbcDialect.H2;
    }

    @Override
    public JdbcErrorCode mapDialectErrorCode(SQLException error) {
        return dialectErrorCodes.getOrDefault(error.getErrorCode(), JdbcErrorCode.UNKNOWN_ERROR_CODE);
    }

    @Override
    public String keyValueTableDdl() {
        return kvTableDdl;
    }

    @Override
    public String keyValueUpsert() {
        return KV_UPSERT;
    }
}
