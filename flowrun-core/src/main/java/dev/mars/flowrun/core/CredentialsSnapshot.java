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

package dev.mars.flowrun.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolved credential data bound to a workflow's nodes at dispatch time, keyed by credential type
 * and then credential name. Opaque to the orchestration: it is only handed through to the engine.
 *
 * <p>{@link #toString()} lists the credential keys only, never their data.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
public final class CredentialsSnapshot {

    private static final CredentialsSnapshot EMPTY = new CredentialsSnapshot(Map.of());

    private final Map<String, Map<String, Map<String, Object>>> credentials;

    private CredentialsSnapshot(Map<String, Map<String, Map<String, Object>>> credentials) {
        Map<String, Map<String, Map<String, Object>>> copy = new LinkedHashMap<>();
        credentials.forEach((type, byName) -> {
            Map<String, Map<String, Object>> names = new LinkedHashMap<>();
            byName.forEach((name, data) ->
                    names.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(data))));
            copy.put(type, Collections.unmodifiableMap(names));
        });
        this.credentials = Collections.unmodifiableMap(copy);
    }

    public static CredentialsSnapshot empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Map<String, Object>> get(String type, String name) {
        Map<String, Map<String, Object>> byName = credentials.get(type);
        return byName == null ? Optional.empty() : Optional.ofNullable(byName.get(name));
    }

    public Map<String, Map<String, Map<String, Object>>> asMap() {
        return credentials;
    }

    public boolean isEmpty() {
        return credentials.isEmpty();
    }

    public int size() {
        return credentials.values().stream().mapToInt(Map::size).sum();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return credentials.equals(((CredentialsSnapshot) o).credentials);
    }

    @Override
    public int hashCode() {
        return credentials.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("CredentialsSnapshot{");
        boolean first = true;
        for (Map.Entry<String, Map<String, Map<String, Object>>> entry : credentials.entrySet()) {
            for (String name : entry.getValue().keySet()) {
                if (!first) {
                    sb.append(", ");
                }
                sb.append(entry.getKey()).append('/').append(name);
                first = false;
            }
        }
        return sb.append('}').toString();
    }

    /**
     * Builder for CredentialsSnapshot.
     */
    public static class Builder {
        private final Map<String, Map<String, Map<String, Object>>> credentials = new LinkedHashMap<>();

        public Builder add(String type, String name, Map<String, Object> data) {
            credentials.computeIfAbsent(type, t -> new LinkedHashMap<>())
                    .put(name, data != null ? data : Map.of());
            return this;
        }

        public CredentialsSnapshot build() {
            return credentials.isEmpty() ? EMPTY : new CredentialsSnapshot(credentials);
        }
    }
}
