/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.flowrun.core.exceptions;

/**
 * Exception thrown when a node references credentials that storage does not hold.
 */
public class CredentialsNotFoundException extends FlowrunException {

    private final String credentialType;
    private final String credentialName;

    public CredentialsNotFoundException(String credentialType, String credentialName) {
        super("Could not find credentials for type \"" + credentialType + "\" with name \"" + credentialName + "\".");
        this.credentialType = credentialType;
        this.credentialName = credentialName;
    }

    public String getCredentialType() {
        return credentialType;
    }

    public String getCredentialName() {
        return credentialName;
    }
}
