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

package dev.mars.flowrun.workflow.run;

import dev.mars.flowrun.core.CredentialsSnapshot;
import dev.mars.flowrun.core.ExecutionError;
import dev.mars.flowrun.core.ExecutionHandle;
import dev.mars.flowrun.core.ExecutionRequest;
import dev.mars.flowrun.core.ExecutionResult;
import dev.mars.flowrun.core.Node;
import dev.mars.flowrun.core.WorkflowDefinition;
import dev.mars.flowrun.credentials.CredentialsOverwrites;
import dev.mars.flowrun.credentials.CredentialsResolver;
import dev.mars.flowrun.engine.ExecutionEngine;
import dev.mars.flowrun.hooks.ExternalHooks;
import dev.mars.flowrun.storage.WorkflowStore;
import dev.mars.flowrun.types.CredentialTypeRegistry;
import dev.mars.flowrun.types.LoadedTypes;
import dev.mars.flowrun.types.NodeType;
import dev.mars.flowrun.types.NodeTypeRegistry;
import dev.mars.flowrun.types.TypeLoader;
import dev.mars.flowrun.workflow.CompletionWaiter;
import dev.mars.flowrun.workflow.ExecutionDispatcher;
import dev.mars.flowrun.workflow.OutcomeClassifier;
import dev.mars.flowrun.workflow.StartNodeValidator;
import dev.mars.flowrun.workflow.WorkflowDocumentParser;
import dev.mars.flowrun.workflow.WorkflowSourceResolver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.slf4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

/**
 * Tests the single-run state machine end to end with a mocked engine and storage.
 */
@DisplayName("WorkflowRunCoordinator")
class WorkflowRunCoordinatorTest {

    private static final ExecutionHandle HANDLE = ExecutionHandle.of("exec-1");

    @TempDir
    Path tempDir;

    @Mock
    private WorkflowStore store;
    @Mock
    private TypeLoader typeLoader;
    @Mock
    private ExecutionEngine engine;
    @Mock
    private CredentialsResolver credentialsResolver;
    @Mock
    private Logger executionLogger;

    private AutoCloseable mocks;
    private WorkflowDocumentParser parser;
    private NodeTypeRegistry nodeTypes;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private WorkflowRunCoordinator coordinator;

    @BeforeEach
    void setUp() throws Exception {
        mocks = MockitoAnnotations.openMocks(this);
        parser = spy(new WorkflowDocumentParser());
        nodeTypes = new NodeTypeRegistry();
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();

        when(typeLoader.load()).thenReturn(new LoadedTypes(
                Map.of("n8n-nodes-base.start", new NodeType("n8n-nodes-base.start", "Start", 1, null)),
                Map.of()));
        when(credentialsResolver.resolve(any())).thenReturn(CredentialsSnapshot.empty());

        PrintStream outStream = new PrintStream(out, true, StandardCharsets.UTF_8);
        coordinator = WorkflowRunCoordinator.builder()
                .store(store)
                .typeLoader(typeLoader)
                .nodeTypes(nodeTypes)
                .credentialTypes(new CredentialTypeRegistry())
                .credentialsOverwrites(new CredentialsOverwrites(""))
                .externalHooks(new ExternalHooks())
                .sourceResolver(new WorkflowSourceResolver(parser, store))
                .startNodeValidator(new StartNodeValidator())
                .dispatcher(new ExecutionDispatcher(credentialsResolver, engine))
                .completionWaiter(new CompletionWaiter(engine))
                .outcomeClassifier(new OutcomeClassifier(outStream,
                        new PrintStream(err, true, StandardCharsets.UTF_8), executionLogger))
                .out(outStream)
                .initThreads(2)
                .build();
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    private static String fixture(String name) throws URISyntaxException {
        return Path.of(WorkflowRunCoordinatorTest.class.getResource("/workflows/" + name).toURI()).toString();
    }

    private String console() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private void engineDelivers(ExecutionResult result) throws Exception {
        when(engine.dispatch(any())).thenReturn(HANDLE);
        when(engine.awaitResult(HANDLE)).thenReturn(CompletableFuture.completedFuture(result));
    }

    // ==================== Rejected before dispatch ====================

    @Nested
    @DisplayName("Runs rejected before dispatch")
    class RejectedRuns {

        @Test
        @DisplayName("Neither source: usage error, no lookup, no dispatch")
        void testNeitherSource() throws Exception {
            assertThat(coordinator.run(null, null)).isEqualTo(RunOutcome.USAGE_ERROR);

            assertThat(console()).contains("Either option \"--id\" or \"--file\" have to be set!");
            verify(store, never()).findWorkflowById(anyString());
            verify(engine, never()).dispatch(any());
        }

        @Test
        @DisplayName("Both sources: usage error, no lookup, no dispatch")
        void testBothSources() throws Exception {
            assertThat(coordinator.run(fixture("start-workflow.json"), "5")).isEqualTo(RunOutcome.USAGE_ERROR);

            assertThat(console()).contains("Either \"id\" or \"file\" can be set never both!");
            verify(store, never()).findWorkflowById(anyString());
            verify(parser, never()).parse(any());
            verify(engine, never()).dispatch(any());
        }

        @Test
        @DisplayName("Payload without connections fails before validation")
        void testMissingConnections() throws Exception {
            assertThat(coordinator.run(fixture("missing-connections.json"), null))
                    .isEqualTo(RunOutcome.INVALID_FORMAT);

            assertThat(console()).contains("does not contain valid workflow data");
            assertThat(coordinator.getState()).isEqualTo(RunState.RESOLVE_SOURCE);
            verify(engine, never()).dispatch(any());
        }

        @Test
        @DisplayName("Document that is not valid JSON is malformed")
        void testMalformedDocument() throws Exception {
            Path broken = Files.writeString(tempDir.resolve("broken.json"), "{ \"nodes\": [");

            assertThat(coordinator.run(broken.toString(), null)).isEqualTo(RunOutcome.MALFORMED_DOCUMENT);

            assertThat(console()).contains("JSON parsing failed");
            verify(engine, never()).dispatch(any());
        }

        @Test
        @DisplayName("Missing file is not found")
        void testMissingFile() throws Exception {
            String path = tempDir.resolve("nope.json").toString();

            assertThat(coordinator.run(path, null)).isEqualTo(RunOutcome.NOT_FOUND_FILE);

            assertThat(console()).contains("The file \"" + path + "\" could not be found.");
        }

        @Test
        @DisplayName("Unknown id is not found and no file is read")
        void testUnknownId() throws Exception {
            when(store.findWorkflowById("5")).thenReturn(Optional.empty());

            assertThat(coordinator.run(null, "5")).isEqualTo(RunOutcome.NOT_FOUND_ID);

            assertThat(console()).contains("The workflow with the id \"5\" does not exist.");
            verify(parser, never()).parse(any());
            verify(engine, never()).dispatch(any());
        }

        @Test
        @DisplayName("Workflow without start node is never dispatched")
        void testMissingStartNode() throws Exception {
            assertThat(coordinator.run(fixture("no-start.json"), null)).isEqualTo(RunOutcome.MISSING_ENTRY_POINT);

            assertThat(console()).contains("The workflow does not contain a \"Start\" node. So it can not be executed.");
            verify(engine, never()).dispatch(any());
            verify(credentialsResolver, never()).resolve(any());
        }
    }

    // ==================== Dispatched runs ====================

    @Nested
    @DisplayName("Dispatched runs")
    class DispatchedRuns {

        @Test
        @DisplayName("Start sample resolves, validates, dispatches and prints the payload")
        void testSuccessfulRun() throws Exception {
            engineDelivers(ExecutionResult.builder()
                    .executionId("exec-1")
                    .finished(true)
                    .data(Map.of("resultData", Map.of("lastNodeExecuted", "Set")))
                    .build());

            assertThat(coordinator.run(fixture("start-workflow.json"), null)).isEqualTo(RunOutcome.SUCCESS);

            ArgumentCaptor<ExecutionRequest> request = ArgumentCaptor.forClass(ExecutionRequest.class);
            verify(engine, times(1)).dispatch(request.capture());
            verify(engine, times(1)).awaitResult(HANDLE);
            assertThat(request.getValue().getStartNodes()).containsExactly("Start");
            assertThat(console())
                    .contains("Execution was successful:")
                    .contains("\"lastNodeExecuted\" : \"Set\"");
            assertThat(nodeTypes.isInitialized()).isTrue();
            assertThat(coordinator.getState()).isEqualTo(RunState.CLASSIFY);
        }

        @Test
        @DisplayName("Stored workflow runs after storage lookup")
        void testStoredWorkflowRun() throws Exception {
            WorkflowDefinition stored = new WorkflowDocumentParser().parseFromString(
                    "{\"nodes\": [{\"name\": \"Start\", \"type\": \"n8n-nodes-base.start\"}], \"connections\": {}}",
                    false);
            when(store.findWorkflowById("5")).thenReturn(Optional.of(stored));
            engineDelivers(ExecutionResult.builder().executionId("exec-1").finished(true).build());

            assertThat(coordinator.run(null, "5")).isEqualTo(RunOutcome.SUCCESS);

            verify(store).init();
            verify(store).findWorkflowById("5");
            verify(parser, never()).parse(any());
            verify(engine, times(1)).dispatch(any());
        }

        @Test
        @DisplayName("Engine error is logged and surfaced with its message")
        void testEngineError() throws Exception {
            engineDelivers(ExecutionResult.builder()
                    .executionId("exec-1")
                    .error(new ExecutionError("boom", "Error: boom\n    at Set.execute"))
                    .build());

            assertThat(coordinator.run(fixture("start-workflow.json"), null)).isEqualTo(RunOutcome.EXECUTION_ERROR);

            assertThat(console()).contains("Execution was NOT successful. See log message for details.");
            assertThat(err.toString(StandardCharsets.UTF_8))
                    .contains("Error executing workflow. See log messages for details.");
            verify(executionLogger).info(contains("\"message\" : \"boom\""));
            verify(executionLogger).error("boom");
            verify(executionLogger).error("Error: boom\n    at Set.execute");
        }

        @Test
        @DisplayName("Engine rejection is fatal")
        void testEngineRejection() throws Exception {
            when(engine.dispatch(any())).thenReturn(HANDLE);
            when(engine.awaitResult(HANDLE)).thenReturn(
                    CompletableFuture.failedFuture(new IllegalStateException("engine crashed")));

            assertThat(coordinator.run(fixture("start-workflow.json"), null)).isEqualTo(RunOutcome.FATAL);

            verify(executionLogger).error("engine crashed");
        }

        @Test
        @DisplayName("Null result is fatal")
        void testNullResult() throws Exception {
            when(engine.dispatch(any())).thenReturn(HANDLE);
            when(engine.awaitResult(HANDLE)).thenReturn(CompletableFuture.completedFuture(null));

            assertThat(coordinator.run(fixture("start-workflow.json"), null)).isEqualTo(RunOutcome.FATAL);

            verify(executionLogger).error("Workflow did not return any data!");
        }

        @Test
        @DisplayName("Failed type loading aborts the run before dispatch")
        void testInitializationFailure() throws Exception {
            when(typeLoader.load()).thenThrow(new IllegalStateException("catalogue unreadable"));

            assertThat(coordinator.run(fixture("start-workflow.json"), null)).isEqualTo(RunOutcome.FATAL);

            assertThat(coordinator.getState()).isEqualTo(RunState.AWAIT_BARRIER);
            verify(engine, never()).dispatch(any());
            verify(executionLogger, atLeastOnce()).error(contains("catalogue unreadable"));
        }
    }

    @Test
    @DisplayName("Missing collaborators are rejected at build time")
    void testBuilderRequiresCollaborators() {
        assertThatThrownBy(() -> WorkflowRunCoordinator.builder().build())
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Stored definition keeps its identity")
    void testStoredDefinitionPassedThrough() throws Exception {
        WorkflowDefinition stored = new WorkflowDefinition("5", "stored",
                List.of(new Node("Start", "n8n-nodes-base.start", Map.of())), Map.of(), null);
        when(store.findWorkflowById("5")).thenReturn(Optional.of(stored));
        engineDelivers(ExecutionResult.builder().executionId("exec-1").build());

        coordinator.run(null, "5");

        ArgumentCaptor<ExecutionRequest> request = ArgumentCaptor.forClass(ExecutionRequest.class);
        verify(engine).dispatch(request.capture());
        assertThat(request.getValue().getWorkflow()).isSameAs(stored);
    }
}
