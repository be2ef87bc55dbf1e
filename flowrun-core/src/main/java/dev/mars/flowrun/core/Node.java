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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single node of a workflow definition.
 *
 * <p>Nodes are identified by name within their workflow. The type tag selects the node implementation
 * in the engine; this module only reads it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Node {

    @JsonProperty("name")
    private final String name;

    @JsonProperty("type")
    private final String type;

    @JsonProperty("parameters")
    private final Map<String, Object> parameters;

    // credential type -> credential name
    @JsonProperty("credentials")
    private final Map<String, String> credentials;

    @JsonProperty("disabled")
    private final boolean disabled;

    public Node(String name, String type, Map<String, Object> parameters) {
        this(name, type, parameters, Map.of(), false);
    }

    public Node(String name, String type, Map<String, Object> parameters,
                Map<String, String> credentials, boolean disabled) {
        this.name = Objects.requireNonNull(name, "Node name cannot be null");
        this.type = Objects.requireNonNull(type, "Node type cannot be null");
        // parameter values may be null in workflow documents, so Map.copyOf is not usable here
        this.parameters = parameters != null ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
        this.credentials = credentials != null ? Map.copyOf(credentials) : Map.of();
        this.disabled = disabled;
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public Map<String, String> getCredentials() {
        return credentials;
    }

    public boolean isDisabled() {
        return disabled;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node node = (Node) o;
        return disabled == node.disabled &&
               Objects.equals(name, node.name) &&
               Objects.equals(type, node.type) &&
               Objects.equals(parameters, node.parameters) &&
               Objects.equals(credentials, node.credentials);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, parameters, credentials, disabled);
    }

    @Override
    public String toString() {
        return "Node{" +
               "name='" + name + '\'' +
               ", type='" + type + '\'' +
               ", disabled=" + disabled +
               '}';
    }
}
