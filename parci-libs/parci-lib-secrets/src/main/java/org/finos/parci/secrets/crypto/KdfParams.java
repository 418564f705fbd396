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

package org.finos.parci.secrets.crypto;

import org.finos.parci.common.config.StoreConfig;
import org.finos.parci.common.exception.EInputValidation;


/**
 * Argon2id cost parameters. Memory cost is in KiB.
 */
public final class KdfParams {

    public static final int MIN_TIME_COST = 1;
    public static final int MIN_MEMORY_COST = 8;
    public static final int MIN_PARALLELISM = 1;

    private final int timeCost;
    private final int memoryCost;
    private final int parallelism;

    public KdfParams(int timeCost, int memoryCost, int parallelism) {

        if (timeCost < MIN_TIME_COST)
            throw new EInputValidation(String.format("Invalid KDF time cost: [%d]", timeCost));

        if (parallelism < MIN_PARALLELISM)
            throw new EInputValidation(String.format("Invalid KDF parallelism: [%d]", parallelism));

        // Argon2 needs at least 8 KiB of memory per lane
        if (memoryCost < MIN_MEMORY_COST * parallelism)
            throw new EInputValidation(String.format("Invalid KDF memory cost: [%d] KiB", memoryCost));

        this.timeCost = timeCost;
        this.memoryCost = memoryCost;
        this.parallelism = parallelism;
    }

    public static KdfParams fromConfig(StoreConfig config) {

        return new KdfParams(
                config.getKdfTimeCost(),
                config.getKdfMemoryCost(),
                config.getKdfParallelism());
    }

    public int getTimeCost() {
        return timeCost;
    }

    public int getMemoryCost() {
        return memoryCost;
    }

    public int getParallelism() {
        return parallelism;
    }

    @Override
    public String toString() {
        return String.format("argon2id(t=%d, m=%d KiB, p=%d)", timeCost, memoryCost, parallelism);
    }
}
