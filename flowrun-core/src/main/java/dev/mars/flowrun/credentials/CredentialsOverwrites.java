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

package dev.mars.flowrun.credentials;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deployment-wide values that fill in credential fields left empty in storage.
 *
 * <p>The overwrite data is a JSON object keyed by credential type, e.g.
 * {@code {"httpBasicAuth": {"user": "svc"}}}. {@link #apply(String, Map)} only replaces fields whose
 * stored value is absent, {@code null} or the empty string; stored values always win.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
public class CredentialsOverwrites {

    private static final Logger logger = LoggerFactory.getLogger(CredentialsOverwrites.class);

    private final String overwriteData;
    private final ObjectMapper objectMapper;
    private volatile Map<String, Map<String, Object>> overwrites = Map.of();

    public CredentialsOverwrites(String overwriteData) {
        this(overwriteData, new ObjectMapper());
    }

    public CredentialsOverwrites(String overwriteData, ObjectMapper objectMapper) {
        this.overwriteData = overwriteData;
        this.objectMapper = objectMapper;
    }

    /**
     * Parses the overwrite data.
     *
     * @throws IOException if the data is not a JSON object of objects
     */
    public void init() throws IOException {
        if (overwriteData == null || overwriteData.isBlank()) {
            overwrites = Map.of();
            logger.debug("No credentials overwrites configured");
            return;
        }
        Map<String, Map<String, Object>> parsed = objectMapper.readValue(overwriteData,
                new TypeReference<Map<String, Map<String, Object>>>() {});
        overwrites = Collections.unmodifiableMap(new LinkedHashMap<>(parsed));
        logger.info("Loaded credentials overwrites for types {}", overwrites.keySet());
    }

    public Map<String, Object> apply(String credentialType, Map<String, Object> data) {
        Map<String, Object> typeOverwrites = overwrites.get(credentialType);
        Map<String, Object> result = new LinkedHashMap<>(data != null ? data : Map.of());
        if (typeOverwrites == null) {
            return result;
        }
        typeOverwrites.forEach((key, value) -> {
            Object current = result.get(key);
            if (current == null || "".equals(current)) {
                result.put(key, value);
            }
        });
        return result;
    }

    public Map<String, Object> getOverwrites(String credentialType) {
        return overwrites.getOrDefault(credentialType, Map.of());
    }
}
