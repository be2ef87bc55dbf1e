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

package dev.mars.flowrun.workflow.store;

import dev.mars.flowrun.core.WorkflowDefinition;
import dev.mars.flowrun.core.exceptions.InvalidWorkflowFormatException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DirectoryWorkflowStore.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
class DirectoryWorkflowStoreTest {

    private static final String WORKFLOW = "{\"name\": \"stored\", \"nodes\": "
            + "[{\"name\": \"Start\", \"type\": \"n8n-nodes-base.start\", \"parameters\": {}}], \"connections\": {}}";

    @TempDir
    Path tempDir;

    private Path storageDir;
    private DirectoryWorkflowStore store;

    @BeforeEach
    void setUp() throws Exception {
        storageDir = tempDir.resolve("workflows");
        store = new DirectoryWorkflowStore(storageDir);
        store.init();
    }

    @Test
    void testInitCreatesDirectory() {
        assertTrue(Files.isDirectory(storageDir));
    }

    @Test
    void testLookupBeforeInitFails() {
        DirectoryWorkflowStore uninitialized = new DirectoryWorkflowStore(tempDir.resolve("other"));

        assertThrows(IllegalStateException.class, () -> uninitialized.findWorkflowById("1"));
    }

    @Test
    void testFindJsonWorkflowTakesIdFromFileName() throws Exception {
        Files.writeString(storageDir.resolve("5.json"), WORKFLOW);

        Optional<WorkflowDefinition> found = store.findWorkflowById("5");

        assertTrue(found.isPresent());
        assertEquals("5", found.get().getId());
        assertEquals("stored", found.get().getName());
    }

    @Test
    void testFindYamlWorkflow() throws Exception {
        Files.writeString(storageDir.resolve("8.yml"),
                "name: yaml\nnodes: []\nconnections: {}\n");

        assertEquals("yaml", store.findWorkflowById("8").orElseThrow().getName());
    }

    @Test
    void testUnknownId() throws Exception {
        assertTrue(store.findWorkflowById("404").isEmpty());
    }

    @Test
    void testNonNumericIdNeverTouchesFiles() throws Exception {
        Files.writeString(tempDir.resolve("secret.json"), WORKFLOW);

        assertTrue(store.findWorkflowById("../secret").isEmpty());
        assertTrue(store.findWorkflowById("abc").isEmpty());
    }

    @Test
    void testCorruptStoredWorkflow() throws Exception {
        Files.writeString(storageDir.resolve("6.json"), "{\"nodes\": []}");

        assertThrows(InvalidWorkflowFormatException.class, () -> store.findWorkflowById("6"));
    }

    @Test
    void testFindCredentials() throws Exception {
        Files.writeString(storageDir.resolve("credentials.json"), "["
                + "{\"name\": \"prod\", \"type\": \"httpBasicAuth\", \"data\": {\"user\": \"svc\", \"password\": \"pw\"}},"
                + "{\"name\": \"prod\", \"type\": \"httpHeaderAuth\", \"data\": {\"name\": \"X-Key\"}}"
                + "]");

        Optional<Map<String, Object>> basic = store.findCredentials("httpBasicAuth", "prod");
        Optional<Map<String, Object>> header = store.findCredentials("httpHeaderAuth", "prod");

        assertEquals("svc", basic.orElseThrow().get("user"));
        assertEquals("X-Key", header.orElseThrow().get("name"));
        assertTrue(store.findCredentials("httpBasicAuth", "staging").isEmpty());
    }

    @Test
    void testNoCredentialsFile() throws Exception {
        assertTrue(store.findCredentials("httpBasicAuth", "prod").isEmpty());
    }
}
