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

package org.finos.parci.secrets.unlock;


/**
 * An unlock record that has been created but not yet committed.
 *
 * <p>Some methods hold part of their secret outside the store, e.g. in the OS keyring.
 * That part is only written by {@link #commit()}, which runs after the record itself
 * has been saved.</p>
 */
public class PendingRecord {

    private static final Runnable NO_ACTION = () -> {};

    private final UnlockRecord record;
    private final Runnable commitAction;

    public PendingRecord(UnlockRecord record) {
        this(record, NO_ACTION);
    }

    public PendingRecord(UnlockRecord record, Runnable commitAction) {
        this.record = record;
        this.commitAction = commitAction;
    }

    public UnlockRecord getRecord() {
        return record;
    }

    public void commit() {
        commitAction.run();
    }
}
