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

package dev.mars.flowrun.types;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of the credential types known at runtime.
 */
public class CredentialTypeRegistry {

    private static final Logger logger = LoggerFactory.getLogger(CredentialTypeRegistry.class);

    private final Map<String, CredentialType> credentialTypes = new ConcurrentHashMap<>();
    private volatile boolean initialized = false;

    public void init(Map<String, CredentialType> types) {
        Objects.requireNonNull(types, "Credential types cannot be null");
        credentialTypes.clear();
        credentialTypes.putAll(types);
        initialized = true;
        logger.info("Registered {} credential types", credentialTypes.size());
    }

    public boolean isKnown(String typeName) {
        return typeName != null && credentialTypes.containsKey(typeName);
    }

    public boolean isInitialized() {
        return initialized;
    }
}
