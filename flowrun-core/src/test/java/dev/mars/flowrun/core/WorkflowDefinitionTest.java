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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the workflow model: nodes, definitions and the connection graph.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
class WorkflowDefinitionTest {

    private static Map<String, Object> main(String... targets) {
        List<Map<String, Object>> connections = new ArrayList<>();
        for (String target : targets) {
            connections.add(Map.of("node", target, "type", "main", "index", 0));
        }
        return Map.of("main", List.of(connections));
    }

    private static WorkflowDefinition sample() {
        return new WorkflowDefinition("1", "sample",
                List.of(new Node("Start", "n8n-nodes-base.start", Map.of()),
                        new Node("Set", "n8n-nodes-base.set", Map.of("value", 1)),
                        new Node("NoOp", "n8n-nodes-base.noOp", Map.of())),
                Map.of("Start", main("Set", "NoOp"), "Set", main("NoOp")),
                Map.of("active", false));
    }

    @Nested
    @DisplayName("Child nodes")
    class ChildNodeTests {

        @Test
        void testChildNodesInDocumentOrder() {
            assertEquals(List.of("Set", "NoOp"), sample().getChildNodes("Start"));
            assertEquals(List.of("NoOp"), sample().getChildNodes("Set"));
        }

        @Test
        void testLeafNodeHasNoChildren() {
            assertTrue(sample().getChildNodes("NoOp").isEmpty());
            assertTrue(sample().getChildNodes("Unknown").isEmpty());
        }

        @Test
        void testDuplicateTargetsAreReportedOnce() {
            Map<String, Object> outputs = Map.of("main", List.of(
                    List.of(Map.of("node", "B", "type", "main", "index", 0)),
                    List.of(Map.of("node", "B", "type", "main", "index", 1))));
            WorkflowDefinition definition = new WorkflowDefinition(null, "dup",
                    List.of(new Node("A", "t", Map.of()), new Node("B", "t", Map.of())),
                    Map.of("A", outputs), null);

            assertEquals(List.of("B"), definition.getChildNodes("A"));
        }

        @Test
        void testMalformedConnectionsAreIgnored() {
            Map<String, Object> connections = new HashMap<>();
            connections.put("A", Map.of("main", "not-a-list"));
            connections.put("B", "not-a-map");
            connections.put("C", Map.of("main", List.of(List.of(Map.of("type", "main")))));
            WorkflowDefinition definition = new WorkflowDefinition(null, "broken", List.of(), connections, null);

            assertTrue(definition.getChildNodes("A").isEmpty());
            assertTrue(definition.getChildNodes("B").isEmpty());
            assertTrue(definition.getChildNodes("C").isEmpty());
        }
    }

    @Test
    void testGetNodeByName() {
        WorkflowDefinition definition = sample();

        assertEquals("n8n-nodes-base.set", definition.getNode("Set").orElseThrow().getType());
        assertTrue(definition.getNode("Missing").isEmpty());
    }

    @Test
    void testNodeParametersMayContainNulls() {
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("url", null);

        Node node = new Node("HTTP", "n8n-nodes-base.httpRequest", parameters);

        assertTrue(node.getParameters().containsKey("url"));
        assertNull(node.getParameters().get("url"));
        assertFalse(node.isDisabled());
        assertTrue(node.getCredentials().isEmpty());
    }

    @Test
    void testDefinitionIsReadOnly() {
        WorkflowDefinition definition = sample();

        assertThrows(UnsupportedOperationException.class, () -> definition.getNodes().clear());
        assertThrows(UnsupportedOperationException.class, () -> definition.getConnections().clear());
    }

    @Test
    void testConnectionsAreRequired() {
        assertThrows(NullPointerException.class,
                () -> new WorkflowDefinition(null, "x", List.of(), null, null));
    }
}
