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

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;


/**
 * Session configuration for a local parameter store.
 *
 * <p>Everything the store needs to know about its environment is carried here explicitly,
 * including the read-only flag (on by default) and the optional unlock method override.
 * Instances are immutable, use {@link #newBuilder()} or {@link #toBuilder()} to make one.</p>
 */
public final class StoreConfig {

    private final Path storeLocation;
    private final boolean readOnly;
    private final char[] password;
    private final String openMethod;

    private final int kdfTimeCost;
    private final int kdfMemoryCost;
    private final int kdfParallelism;

    private final String keyringService;
    private final String keyringAccount;
    private final int yubikeySlot;
    private final String yubikeyCommand;

    private StoreConfig(Builder builder) {

        this.storeLocation = Objects.requireNonNull(builder.storeLocation, "storeLocation");
        this.readOnly = builder.readOnly;
        this.password = builder.password != null ? builder.password.clone() : null;
        this.openMethod = builder.openMethod;
        this.kdfTimeCost = builder.kdfTimeCost;
        this.kdfMemoryCost = builder.kdfMemoryCost;
        this.kdfParallelism = builder.kdfParallelism;
        this.keyringService = builder.keyringService;
        this.keyringAccount = builder.keyringAccount;
        this.yubikeySlot = builder.yubikeySlot;
        this.yubikeyCommand = builder.yubikeyCommand;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public Builder toBuilder() {

        return new Builder()
                .setStoreLocation(storeLocation)
                .setReadOnly(readOnly)
                .setPassword(password)
                .setOpenMethod(openMethod)
                .setKdfTimeCost(kdfTimeCost)
                .setKdfMemoryCost(kdfMemoryCost)
                .setKdfParallelism(kdfParallelism)
                .setKeyringService(keyringService)
                .setKeyringAccount(keyringAccount)
                .setYubikeySlot(yubikeySlot)
                .setYubikeyCommand(yubikeyCommand);
    }

    public Path getStoreLocation() {
        return storeLocation;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    public boolean hasPassword() {
        return password != null;
    }

    /** Pre-supplied password for non-interactive use, a copy is returned each time **/
    public char[] getPassword() {
        return password != null ? password.clone() : null;
    }

    public boolean hasOpenMethod() {
        return openMethod != null && !openMethod.isBlank();
    }

    public String getOpenMethod() {
        return openMethod;
    }

    public int getKdfTimeCost() {
        return kdfTimeCost;
    }

    public int getKdfMemoryCost() {
        return kdfMemoryCost;
    }

    public int getKdfParallelism() {
        return kdfParallelism;
    }

    public String getKeyringService() {
        return keyringService;
    }

    public String getKeyringAccount() {
        return keyringAccount;
    }

    public int getYubikeySlot() {
        return yubikeySlot;
    }

    public String getYubikeyCommand() {
        return yubikeyCommand;
    }

    @Override
    public String toString() {

        // Never include the password
        return "StoreConfig{" +
                "storeLocation=" + storeLocation +
                ", readOnly=" + readOnly +
                ", openMethod=" + openMethod +
                ", kdfTimeCost=" + kdfTimeCost +
                ", kdfMemoryCost=" + kdfMemoryCost +
                ", kdfParallelism=" + kdfParallelism +
                '}';
    }

    public static final class Builder {

        private Path storeLocation;
        private boolean readOnly = true;
        private char[] password;
        private String openMethod;

        private int kdfTimeCost = ConfigDefaults.KDF_TIME_COST;
        private int kdfMemoryCost = ConfigDefaults.KDF_MEMORY_COST;
        private int kdfParallelism = ConfigDefaults.KDF_PARALLELISM;

        private String keyringService = ConfigDefaults.KEYRING_SERVICE;
        private String keyringAccount = ConfigDefaults.KEYRING_ACCOUNT;
        private int yubikeySlot = ConfigDefaults.YUBIKEY_SLOT;
        private String yubikeyCommand = ConfigDefaults.YUBIKEY_COMMAND;

        private Builder() {}

        public Builder setStoreLocation(Path storeLocation) {
            this.storeLocation = storeLocation;
            return this;
        }

        public Builder setReadOnly(boolean readOnly) {
            this.readOnly = readOnly;
            return this;
        }

        public Builder setPassword(char[] password) {
            if (this.password != null)
                Arrays.fill(this.password, '\0');
            this.password = password != null ? password.clone() : null;
            return this;
        }

        public Builder setOpenMethod(String openMethod) {
            this.openMethod = openMethod;
            return this;
        }

        public Builder setKdfTimeCost(int kdfTimeCost) {
            this.kdfTimeCost = kdfTimeCost;
            return this;
        }

        public Builder setKdfMemoryCost(int kdfMemoryCost) {
            this.kdfMemoryCost = kdfMemoryCost;
            return this;
        }

        public Builder setKdfParallelism(int kdfParallelism) {
            this.kdfParallelism = kdfParallelism;
            return this;
        }

        public Builder setKeyringService(String keyringService) {
            this.keyringService = keyringService;
            return this;
        }

        public Builder setKeyringAccount(String keyringAccount) {
            this.keyringAccount = keyringAccount;
            return this;
        }

        public Builder setYubikeySlot(int yubikeySlot) {
            this.yubikeySlot = yubikeySlot;
            return this;
        }

        public Builder setYubikeyCommand(String yubikeyCommand) {
            this.yubikeyCommand = yubikeyCommand;
            return this;
        }

        public StoreConfig build() {
            return new StoreConfig(this);
        }
    }
}
