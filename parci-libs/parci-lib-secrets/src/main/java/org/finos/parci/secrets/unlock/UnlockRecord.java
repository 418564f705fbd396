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

import org.finos.parci.common.exception.EAuthenticationFailed;
import org.finos.parci.common.exception.EInputValidation;
import org.finos.parci.common.exception.EParciInternal;
import org.finos.parci.common.exception.EStorage;
import org.finos.parci.secrets.crypto.KdfParams;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.databind.json.JsonMapper;


/**
 * Stored form of one registered unlock method, kept as JSON in the config table.
 *
 * <p>Password and hardware token records carry the KDF salt and costs, hardware token records
 * also carry the challenge and slot. Keyring records hold only the wrapped keys.</p>
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class UnlockRecord {

    private static final ObjectMapper MAPPER = JsonMapper.builder().build();

    private String salt;
    private Integer kdfTimeCost;
    private Integer kdfMemoryCost;
    private Integer kdfParallelism;
    private Integer keySize;

    private WrappedKey nameKey;
    private WrappedKey valueKey;

    private String challenge;
    private Integer slot;

    public static UnlockRecord fromJson(String recordName, String json) {

        try {
            var record = MAPPER.readValue(json, UnlockRecord.class);

            if (record == null)
                throw new EStorage(String.format("Unlock record for [%s] is empty", recordName));

            return record;
        }
        catch (JsonProcessingException e) {
            throw new EStorage(String.format("Unlock record for [%s] is corrupt", recordName), e);
        }
    }

    public String toJson() {

        try {
            return MAPPER.writeValueAsString(this);
        }
        catch (JsonProcessingException e) {
            throw new EParciInternal("Failed to encode unlock record", e);
        }
    }

    /**
     * KDF costs stored with this record.
     *
     * @throws EAuthenticationFailed The record has missing or invalid costs
     */
    @JsonIgnore
    public KdfParams getKdfParams() {

        if (kdfTimeCost == null || kdfMemoryCost == null || kdfParallelism == null)
            throw new EAuthenticationFailed();

        try {
            return new KdfParams(kdfTimeCost, kdfMemoryCost, kdfParallelism);
        }
        catch (EInputValidation e) {
            throw new EAuthenticationFailed();
        }
    }

    @JsonIgnore
    public void setKdfParams(KdfParams params) {
        this.kdfTimeCost = params.getTimeCost();
        this.kdfMemoryCost = params.getMemoryCost();
        this.kdfParallelism = params.getParallelism();
    }

    public String getSalt() {
        return salt;
    }

    public void setSalt(String salt) {
        this.salt = salt;
    }

    public Integer getKdfTimeCost() {
        return kdfTimeCost;
    }

    public void setKdfTimeCost(Integer kdfTimeCost) {
        this.kdfTimeCost = kdfTimeCost;
    }

    public Integer getKdfMemoryCost() {
        return kdfMemoryCost;
    }

    public void setKdfMemoryCost(Integer kdfMemoryCost) {
        this.kdfMemoryCost = kdfMemoryCost;
    }

    public Integer getKdfParallelism() {
        return kdfParallelism;
    }

    public void setKdfParallelism(Integer kdfParallelism) {
        this.kdfParallelism = kdfParallelism;
    }

    public Integer getKeySize() {
        return keySize;
    }

    public void setKeySize(Integer keySize) {
        this.keySize = keySize;
    }

    public WrappedKey getNameKey() {
        return nameKey;
    }

    public void setNameKey(WrappedKey nameKey) {
        this.nameKey = nameKey;
    }

    public WrappedKey getValueKey() {
        return valueKey;
    }

    public void setValueKey(WrappedKey valueKey) {
        this.valueKey = valueKey;
    }

    public String getChallenge() {
        return challenge;
    }

    public void setChallenge(String challenge) {
        this.challenge = challenge;
    }

    public Integer getSlot() {
        return slot;
    }

    public void setSlot(Integer slot) {
        this.slot = slot;
    }
}
