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

package org.finos.parci.secrets.device;


/** Hardware token with an HMAC-SHA1 challenge-response slot **/
public interface IChallengeResponseDevice {

    int RESPONSE_SIZE = 20;

    /**
     * Serial number of the first connected device
     *
     * @return The serial number, as text
     * @throws org.finos.parci.common.exception.EDeviceUnavailable No device is connected
     */
    String serial();

    /**
     * Send a challenge to the given slot of the first connected device. May block waiting for a touch.
     *
     * @param slot Challenge-response slot, 1 or 2
     * @param challenge Challenge bytes
     * @return The 20-byte HMAC-SHA1 response
     */
    byte[] challengeResponse(int slot, byte[] challenge);
}
