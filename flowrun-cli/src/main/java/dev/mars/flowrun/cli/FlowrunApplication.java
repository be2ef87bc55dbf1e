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

package dev.mars.flowrun.cli;

import dev.mars.flowrun.config.FlowrunConfig;
import dev.mars.flowrun.credentials.CredentialsOverwrites;
import dev.mars.flowrun.credentials.StoredCredentialsResolver;
import dev.mars.flowrun.engine.ExecutionEngine;
import dev.mars.flowrun.engine.LocalExecutionEngine;
import dev.mars.flowrun.hooks.ExternalHooks;
import dev.mars.flowrun.storage.WorkflowStore;
import dev.mars.flowrun.types.ClasspathTypeLoader;
import dev.mars.flowrun.types.CredentialTypeRegistry;
import dev.mars.flowrun.types.NodeTypeRegistry;
import dev.mars.flowrun.workflow.CompletionWaiter;
import dev.mars.flowrun.workflow.EntryNodePredicate;
import dev.mars.flowrun.workflow.ExecutionDispatcher;
import dev.mars.flowrun.workflow.OutcomeClassifier;
import dev.mars.flowrun.workflow.StartNodeValidator;
import dev.mars.flowrun.workflow.WorkflowDocumentParser;
import dev.mars.flowrun.workflow.WorkflowSourceResolver;
import dev.mars.flowrun.workflow.run.RunOutcome;
import dev.mars.flowrun.workflow.run.WorkflowRunCoordinator;
import dev.mars.flowrun.workflow.store.DirectoryWorkflowStore;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Wires the default collaborators from a {@link FlowrunConfig} into a {@link WorkflowRunCoordinator}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
public class FlowrunApplication implements AutoCloseable {

    private final WorkflowRunCoordinator coordinator;
    private final ExecutionEngine engine;

    FlowrunApplication(WorkflowRunCoordinator coordinator, ExecutionEngine engine) {
        this.coordinator = Objects.requireNonNull(coordinator, "Coordinator cannot be null");
        this.engine = Objects.requireNonNull(engine, "Execution engine cannot be null");
    }

    public static FlowrunApplication create(FlowrunConfig config, PrintStream out, PrintStream err) {
        WorkflowDocumentParser parser = new WorkflowDocumentParser();
        WorkflowStore store = new DirectoryWorkflowStore(config.getStorageDirectory());
        NodeTypeRegistry nodeTypes = new NodeTypeRegistry();
        CredentialTypeRegistry credentialTypes = new CredentialTypeRegistry();
        CredentialsOverwrites overwrites = new CredentialsOverwrites(config.getCredentialsOverwriteData());
        ExternalHooks hooks = new ExternalHooks(config.getHookClasses());
        ExecutionEngine engine = new LocalExecutionEngine(nodeTypes, hooks, config.getEngineThreads());

        WorkflowRunCoordinator coordinator = WorkflowRunCoordinator.builder()
                .store(store)
                .typeLoader(new ClasspathTypeLoader(config.getTypesResource()))
                .nodeTypes(nodeTypes)
                .credentialTypes(credentialTypes)
                .credentialsOverwrites(overwrites)
                .externalHooks(hooks)
                .sourceResolver(new WorkflowSourceResolver(parser, store))
                .startNodeValidator(new StartNodeValidator(EntryNodePredicate.ofTypes(config.getEntryNodeTypes())))
                .dispatcher(new ExecutionDispatcher(new StoredCredentialsResolver(store, overwrites, credentialTypes), engine))
                .completionWaiter(new CompletionWaiter(engine))
                .outcomeClassifier(new OutcomeClassifier(out, err))
                .out(out)
                .initThreads(config.getInitThreads())
                .build();

        return new FlowrunApplication(coordinator, engine);
    }

    public RunOutcome run(CliOptions options) {
        return coordinator.run(options.getFilePath(), options.getWorkflowId());
    }

    @Override
    public void close() {
        engine.shutdown();
    }
}
