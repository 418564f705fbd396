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
 * One way of turning a human or device factor into the store keys.
 *
 * @see UnlockMethodRegistry
 */
public interface IUnlockMethod {

    /** Name used to select this method, e.g. "password" **/
    String methodName();

    /** Name of the unlock record in the config table, may depend on the connected device **/
    String recordName();

    /**
     * Derive a fresh key-encryption key for this method and wrap the store keys with it.
     *
     * <p>Nothing is written anywhere. The caller persists the record, then calls
     * {@link PendingRecord#commit()} to write any part of the secret held outside the store.</p>
     *
     * @param keys The store keys, resolved through a method that is already registered
     * @return A complete unlock record for this method, with its pending external writes
     */
    PendingRecord createRecord(StoreKeys keys);

    /**
     * Recover the store keys from a stored record.
     *
     * @param record The stored unlock record for this method
     * @return The store keys
     * @throws org.finos.parci.common.exception.EAuthenticationFailed The factor is wrong or the record has been tampered with
     */
    StoreKeys unlock(UnlockRecord record);
}
