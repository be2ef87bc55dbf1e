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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Description of a node type known to the engine.
 */
public class NodeType {

    private final String name;
    private final String displayName;
    private final int version;
    private final List<String> credentials;

    @JsonCreator
    public NodeType(@JsonProperty("name") String name,
                    @JsonProperty("displayName") String displayName,
                    @JsonProperty("version") Integer version,
                    @JsonProperty("credentials") List<String> credentials) {
        this.name = Objects.requireNonNull(name, "Node type name cannot be null");
        this.displayName = displayName != null ? displayName : name;
        this.version = version != null ? version : 1;
        this.credentials = credentials != null ? List.copyOf(credentials) : List.of();
    }

    public String getName() {
        return name;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getVersion() {
        return version;
    }

    /**
     * Credential types this node type accepts.
     */
    public List<String> getCredentials() {
        return credentials;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeType nodeType = (NodeType) o;
        return version == nodeType.version &&
               name.equals(nodeType.name) &&
               Objects.equals(displayName, nodeType.displayName) &&
               Objects.equals(credentials, nodeType.credentials);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, displayName, version, credentials);
    }

    @Override
    public String toString() {
        return "NodeType{name='" + name + "', version=" + version + '}';
    }
}
