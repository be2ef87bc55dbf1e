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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Node and credential types produced by a {@link TypeLoader}, keyed by type name.
 */
public final class LoadedTypes {

    private final Map<String, NodeType> nodeTypes;
    private final Map<String, CredentialType> credentialTypes;

    public LoadedTypes(Map<String, NodeType> nodeTypes, Map<String, CredentialType> credentialTypes) {
        this.nodeTypes = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(nodeTypes, "Node types cannot be null")));
        this.credentialTypes = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(credentialTypes, "Credential types cannot be null")));
    }

    public Map<String, NodeType> getNodeTypes() {
        return nodeTypes;
    }

    public Map<String, CredentialType> getCredentialTypes() {
        return credentialTypes;
    }

    @Override
    public String toString() {
        return "LoadedTypes{nodeTypes=" + nodeTypes.size() + ", credentialTypes=" + credentialTypes.size() + '}';
    }
}
