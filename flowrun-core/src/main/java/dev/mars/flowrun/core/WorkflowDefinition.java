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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only workflow definition as produced by a file parse or a storage lookup.
 *
 * <p>The connection graph is kept in its document form:
 * {@code { "<source>": { "<outputType>": [[{ "node": "<target>", "type": "main", "index": 0 }]] } }}.
 * {@link #getChildNodes(String)} interprets it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkflowDefinition {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("name")
    private final String name;

    @JsonProperty("nodes")
    private final List<Node> nodes;

    @JsonProperty("connections")
    private final Map<String, Object> connections;

    @JsonProperty("metadata")
    private final Map<String, Object> metadata;

    public WorkflowDefinition(String id, String name, List<Node> nodes,
                              Map<String, Object> connections, Map<String, Object> metadata) {
        this.id = id;
        this.name = name;
        this.nodes = List.copyOf(Objects.requireNonNull(nodes, "Nodes cannot be null"));
        this.connections = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(connections, "Connections cannot be null")));
        this.metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public List<Node> getNodes() {
        return nodes;
    }

    public Map<String, Object> getConnections() {
        return connections;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Optional<Node> getNode(String nodeName) {
        return nodes.stream()
                .filter(node -> node.getName().equals(nodeName))
                .findFirst();
    }

    /**
     * Returns the names of the nodes directly connected to the outputs of the given node,
     * in document order and without duplicates. Malformed connection entries are ignored.
     */
    public List<String> getChildNodes(String nodeName) {
        Object outputs = connections.get(nodeName);
        if (!(outputs instanceof Map)) {
            return List.of();
        }

        Set<String> children = new LinkedHashSet<>();
        for (Object outputConnections : ((Map<?, ?>) outputs).values()) {
            if (!(outputConnections instanceof List)) {
                continue;
            }
            for (Object outputIndex : (List<?>) outputConnections) {
                if (!(outputIndex instanceof List)) {
                    continue;
                }
                for (Object connection : (List<?>) outputIndex) {
                    if (connection instanceof Map) {
                        Object target = ((Map<?, ?>) connection).get("node");
                        if (target instanceof String) {
                            children.add((String) target);
                        }
                    }
                }
            }
        }
        return new ArrayList<>(children);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowDefinition that = (WorkflowDefinition) o;
        return Objects.equals(id, that.id) &&
               Objects.equals(name, that.name) &&
               Objects.equals(nodes, that.nodes) &&
               Objects.equals(connections, that.connections) &&
               Objects.equals(metadata, that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, nodes, connections, metadata);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" +
               "id='" + id + '\'' +
               ", name='" + name + '\'' +
               ", nodes=" + nodes.size() +
               '}';
    }
}
