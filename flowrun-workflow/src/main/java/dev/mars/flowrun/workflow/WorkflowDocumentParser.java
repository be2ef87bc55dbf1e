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

package dev.mars.flowrun.workflow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.flowrun.core.Node;
import dev.mars.flowrun.core.WorkflowDefinition;
import dev.mars.flowrun.core.exceptions.InvalidWorkflowFormatException;
import dev.mars.flowrun.core.exceptions.WorkflowNotFoundException;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parses workflow documents in JSON (Jackson) or YAML (SnakeYAML).
 *
 * <p>A document must carry a {@code nodes} list and a {@code connections} object. The identifier is
 * taken from {@code id} when it is a valid numeric id and dropped otherwise. All remaining top-level
 * keys are kept as metadata.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
public class WorkflowDocumentParser implements WorkflowDefinitionParser {

    private static final Set<String> STRUCTURAL_KEYS = Set.of("id", "name", "nodes", "connections");

    private final ObjectMapper objectMapper;
    private final Yaml yaml;

    public WorkflowDocumentParser() {
        this(new ObjectMapper());
    }

    public WorkflowDocumentParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    @Override
    public WorkflowDefinition parse(Path workflowFile)
            throws WorkflowNotFoundException, InvalidWorkflowFormatException, IOException {
        String content;
        try {
            content = Files.readString(workflowFile);
        } catch (NoSuchFileException e) {
            throw WorkflowNotFoundException.forFile(workflowFile.toString(), e);
        }

        try {
            return parseDocument(decode(content, isYaml(workflowFile)));
        } catch (InvalidWorkflowFormatException e) {
            throw e.withSource(workflowFile.toString());
        }
    }

    /**
     * Decodes and parses document content.
     *
     * @param content the raw document
     * @param yamlContent {@code true} to decode as YAML, {@code false} for JSON
     */
    public WorkflowDefinition parseFromString(String content, boolean yamlContent) throws InvalidWorkflowFormatException {
        return parseDocument(decode(content, yamlContent));
    }

    @Override
    public WorkflowDefinition parseDocument(Map<String, Object> document) throws InvalidWorkflowFormatException {
        if (document == null) {
            throw new InvalidWorkflowFormatException("Empty workflow document");
        }

        Object nodesValue = document.get("nodes");
        if (nodesValue == null) {
            throw new InvalidWorkflowFormatException(null, "nodes", "Node list is required");
        }
        if (!(nodesValue instanceof List)) {
            throw new InvalidWorkflowFormatException(null, "nodes", "Node list must be an array");
        }

        Object connectionsValue = document.get("connections");
        if (connectionsValue == null) {
            throw new InvalidWorkflowFormatException(null, "connections", "Connection graph is required");
        }
        if (!(connectionsValue instanceof Map)) {
            throw new InvalidWorkflowFormatException(null, "connections", "Connection graph must be an object");
        }

        List<Node> nodes = parseNodes((List<?>) nodesValue);
        Map<String, Object> connections = asStringKeyedMap((Map<?, ?>) connectionsValue);

        Map<String, Object> metadata = new LinkedHashMap<>();
        document.forEach((key, value) -> {
            if (!STRUCTURAL_KEYS.contains(key)) {
                metadata.put(key, value);
            }
        });

        String id = WorkflowIds.normalize(document.get("id"));
        Object name = document.get("name");

        return new WorkflowDefinition(id, name != null ? name.toString() : null, nodes, connections, metadata);
    }

    private Map<String, Object> decode(String content, boolean yamlContent) throws InvalidWorkflowFormatException {
        if (content == null || content.isBlank()) {
            throw new InvalidWorkflowFormatException("Empty workflow document");
        }
        if (yamlContent) {
            return decodeYaml(content);
        }
        try {
            return objectMapper.readValue(content, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new InvalidWorkflowFormatException("JSON parsing failed: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, Object> decodeYaml(String content) throws InvalidWorkflowFormatException {
        Object loaded;
        try {
            loaded = yaml.load(content);
        } catch (YAMLException e) {
            throw new InvalidWorkflowFormatException("YAML parsing failed: " + e.getMessage(), e);
        }
        if (!(loaded instanceof Map)) {
            throw new InvalidWorkflowFormatException("Workflow document must be an object");
        }
        return asStringKeyedMap((Map<?, ?>) loaded);
    }

    private List<Node> parseNodes(List<?> nodeList) throws InvalidWorkflowFormatException {
        List<Node> nodes = new ArrayList<>();
        for (int i = 0; i < nodeList.size(); i++) {
            String path = "nodes[" + i + "]";
            Object entry = nodeList.get(i);
            if (!(entry instanceof Map)) {
                throw new InvalidWorkflowFormatException(null, path, "Node must be an object");
            }
            nodes.add(parseNode(asStringKeyedMap((Map<?, ?>) entry), path));
        }
        return nodes;
    }

    private Node parseNode(Map<String, Object> data, String path) throws InvalidWorkflowFormatException {
        String name = getStringValue(data, "name");
        if (name == null || name.isEmpty()) {
            throw new InvalidWorkflowFormatException(null, path + ".name", "Node name is required");
        }
        String type = getStringValue(data, "type");
        if (type == null || type.isEmpty()) {
            throw new InvalidWorkflowFormatException(null, path + ".type", "Node type is required");
        }

        Map<String, Object> parameters = Map.of();
        Object parametersValue = data.get("parameters");
        if (parametersValue instanceof Map) {
            parameters = asStringKeyedMap((Map<?, ?>) parametersValue);
        } else if (parametersValue != null) {
            throw new InvalidWorkflowFormatException(null, path + ".parameters", "Parameters must be an object");
        }

        Map<String, String> credentials = new LinkedHashMap<>();
        Object credentialsValue = data.get("credentials");
        if (credentialsValue instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) credentialsValue).entrySet()) {
                credentials.put(String.valueOf(entry.getKey()),
                        credentialName(entry.getValue(), path + ".credentials." + entry.getKey()));
            }
        } else if (credentialsValue != null) {
            throw new InvalidWorkflowFormatException(null, path + ".credentials", "Credentials must be an object");
        }

        boolean disabled = Boolean.TRUE.equals(data.get("disabled"));

        return new Node(name, type, parameters, credentials, disabled);
    }

    // credentials are referenced either by name or as {"id": ..., "name": ...}
    private static String credentialName(Object reference, String path) throws InvalidWorkflowFormatException {
        if (reference instanceof String) {
            return (String) reference;
        }
        if (reference instanceof Map) {
            Object name = ((Map<?, ?>) reference).get("name");
            if (name != null) {
                return name.toString();
            }
        }
        throw new InvalidWorkflowFormatException(null, path, "Credential reference must name the credentials");
    }

    private static String getStringValue(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }

    private static Map<String, Object> asStringKeyedMap(Map<?, ?> source) {
        Map<String, Object> result = new LinkedHashMap<>();
        source.forEach((key, value) -> result.put(String.valueOf(key), value));
        return result;
    }

    private static boolean isYaml(Path file) {
        Path fileName = file.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }
}
