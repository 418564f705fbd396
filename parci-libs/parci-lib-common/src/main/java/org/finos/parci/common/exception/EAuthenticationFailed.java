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

package org.finos.parci.common.exception;


/**
 * Decryption could not be authenticated.
 *
 * <p>Raised for a wrong password, a wrong keyring or device key, and for tampered ciphertext.
 * These cases are deliberately indistinguishable, so the exception never carries the underlying
 * crypto error as its cause.</p>
 */
public class EAuthenticationFailed extends EParciPublic {

    private static final String AUTHENTICATION_FAILED = "Authentication failed";

    public EAuthenticationFailed() {
        super(AUTHENTICATION_FAILED);
    }

    public EAuthenticationFailed(String message) {
        super(message);
    }
}
