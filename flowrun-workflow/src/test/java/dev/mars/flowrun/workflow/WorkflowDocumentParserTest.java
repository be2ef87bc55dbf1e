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

import dev.mars.flowrun.core.Node;
import dev.mars.flowrun.core.WorkflowDefinition;
import dev.mars.flowrun.core.exceptions.InvalidWorkflowFormatException;
import dev.mars.flowrun.core.exceptions.WorkflowNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for WorkflowDocumentParser.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
class WorkflowDocumentParserTest {

    @TempDir
    Path tempDir;

    private WorkflowDocumentParser parser;

    @BeforeEach
    void setUp() {
        parser = new WorkflowDocumentParser();
    }

    static Path fixture(String name) throws URISyntaxException {
        return Path.of(WorkflowDocumentParserTest.class.getResource("/workflows/" + name).toURI());
    }

    @Test
    void testParseJsonWorkflow() throws Exception {
        WorkflowDefinition definition = parser.parse(fixture("start-workflow.json"));

        assertEquals("12", definition.getId());
        assertEquals("Start and set", definition.getName());
        assertEquals(2, definition.getNodes().size());
        assertEquals("n8n-nodes-base.start", definition.getNodes().get(0).getType());
        assertEquals(List.of("Set"), definition.getChildNodes("Start"));
        assertEquals(Boolean.FALSE, definition.getMetadata().get("active"));
        assertTrue(definition.getMetadata().containsKey("settings"));
        assertFalse(definition.getMetadata().containsKey("nodes"));
    }

    @Test
    void testParseYamlWorkflow() throws Exception {
        WorkflowDefinition definition = parser.parse(fixture("start-workflow.yaml"));

        assertEquals("7", definition.getId());
        Node call = definition.getNode("Call API").orElseThrow();
        assertEquals(Map.of("httpBasicAuth", "prod"), call.getCredentials());
        assertEquals("https://example.com", call.getParameters().get("url"));
        assertEquals(List.of("Call API"), definition.getChildNodes("Start"));
        assertTrue(definition.getMetadata().containsKey("staticData"));
    }

    @Test
    void testMissingConnections() {
        InvalidWorkflowFormatException exception = assertThrows(InvalidWorkflowFormatException.class,
                () -> parser.parse(fixture("missing-connections.json")));

        assertEquals("connections", exception.getFieldPath());
        assertTrue(exception.getSource().endsWith("missing-connections.json"));
        assertTrue(exception.getMessage().startsWith("The file \""));
        assertTrue(exception.getMessage().contains("does not contain valid workflow data"));
    }

    @Test
    void testMissingNodes() {
        InvalidWorkflowFormatException exception = assertThrows(InvalidWorkflowFormatException.class,
                () -> parser.parseFromString("{\"connections\": {}}", false));

        assertEquals("nodes", exception.getFieldPath());
    }

    @Test
    void testNodeWithoutType() {
        InvalidWorkflowFormatException exception = assertThrows(InvalidWorkflowFormatException.class,
                () -> parser.parseFromString("{\"nodes\": [{\"name\": \"A\"}], \"connections\": {}}", false));

        assertEquals("nodes[0].type", exception.getFieldPath());
    }

    @Test
    void testMalformedJson() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{ \"nodes\": [");

        InvalidWorkflowFormatException exception =
                assertThrows(InvalidWorkflowFormatException.class, () -> parser.parse(file));

        assertEquals(file.toString(), exception.getSource());
        assertNotNull(exception.getCause());
    }

    @Test
    void testYamlScalarIsNotAWorkflow() throws Exception {
        Path file = tempDir.resolve("scalar.yml");
        Files.writeString(file, "just a string");

        assertThrows(InvalidWorkflowFormatException.class, () -> parser.parse(file));
    }

    @Test
    void testMissingFile() {
        Path file = tempDir.resolve("absent.json");

        WorkflowNotFoundException exception =
                assertThrows(WorkflowNotFoundException.class, () -> parser.parse(file));

        assertEquals(WorkflowNotFoundException.SourceKind.FILE, exception.getSourceKind());
        assertEquals("The file \"" + file + "\" could not be found.", exception.getMessage());
    }

    @Test
    void testMissingIdIsNull() throws Exception {
        WorkflowDefinition definition = parser.parseFromString(
                "{\"nodes\": [], \"connections\": {}}", false);

        assertNull(definition.getId());
        assertNull(definition.getName());
    }

    @Test
    void testDisabledFlagAndNullParameters() throws Exception {
        WorkflowDefinition definition = parser.parseFromString(
                "{\"nodes\": [{\"name\": \"A\", \"type\": \"t\", \"disabled\": true, "
                        + "\"parameters\": {\"x\": null}}], \"connections\": {}}", false);

        Node node = definition.getNodes().get(0);
        assertTrue(node.isDisabled());
        assertTrue(node.getParameters().containsKey("x"));
    }

    @ParameterizedTest(name = "id {0} -> {1}")
    @CsvSource(value = {
            "'5', 5",
            "' 42 ', 42",
            "'abc', NULL",
            "'5a', NULL",
            "'', NULL"
    }, nullValues = "NULL")
    void testIdNormalization(String rawId, String expected) {
        assertEquals(expected, WorkflowIds.normalize(rawId));
    }

    @Test
    void testNumericIdNormalization() {
        assertEquals("12", WorkflowIds.normalize(12));
        assertEquals("12", WorkflowIds.normalize(12.0));
        assertNull(WorkflowIds.normalize(1.5));
        assertNull(WorkflowIds.normalize(null));
        assertNull(WorkflowIds.normalize(Double.NaN));
        assertNull(WorkflowIds.normalize(-3));
    }

    @Test
    void testLargeNumericIdsAreKeptExact() throws InvalidWorkflowFormatException {
        WorkflowDefinition beyondLong = parser.parseFromString(
                "{\"id\": 18446744073709551621, \"nodes\": [], \"connections\": {}}", false);
        assertEquals("18446744073709551621", beyondLong.getId());

        WorkflowDefinition exponent = parser.parseFromString(
                "{\"id\": 1e30, \"nodes\": [], \"connections\": {}}", false);
        assertEquals("1000000000000000000000000000000", exponent.getId());

        WorkflowDefinition yaml = parser.parseFromString(
                "id: 98765432109876543210\nnodes: []\nconnections: {}\n", true);
        assertEquals("98765432109876543210", yaml.getId());

        assertEquals("18446744073709551621", WorkflowIds.normalize(new BigInteger("18446744073709551621")));
        assertNull(WorkflowIds.normalize(new BigDecimal("7.25")));
    }
}
