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

import dev.mars.flowrun.core.ExecutionHandle;
import dev.mars.flowrun.core.ExecutionResult;
import dev.mars.flowrun.core.Node;
import dev.mars.flowrun.core.exceptions.InvalidWorkflowFormatException;
import dev.mars.flowrun.core.exceptions.MissingEntryPointException;
import dev.mars.flowrun.core.exceptions.UsageException;
import dev.mars.flowrun.core.exceptions.WorkflowExecutionException;
import dev.mars.flowrun.core.exceptions.WorkflowNotFoundException;
import dev.mars.flowrun.credentials.CredentialsOverwrites;
import dev.mars.flowrun.hooks.ExternalHooks;
import dev.mars.flowrun.storage.WorkflowStore;
import dev.mars.flowrun.types.CredentialTypeRegistry;
import dev.mars.flowrun.types.LoadedTypes;
import dev.mars.flowrun.types.NodeTypeRegistry;
import dev.mars.flowrun.types.TypeLoader;
import dev.mars.flowrun.workflow.CompletionWaiter;
import dev.mars.flowrun.workflow.ExecutionDispatcher;
import dev.mars.flowrun.workflow.InitBarrier;
import dev.mars.flowrun.workflow.OutcomeClassifier;
import dev.mars.flowrun.workflow.Readiness;
import dev.mars.flowrun.workflow.ResolvedWorkflow;
import dev.mars.flowrun.workflow.StartNodeValidator;
import dev.mars.flowrun.workflow.WorkflowSourceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Runs one workflow from source resolution to the classified outcome.
 *
 * <p>The run is strictly linear:
 * {@code INIT -> RESOLVE_SOURCE -> VALIDATE_START_NODE -> AWAIT_BARRIER -> DISPATCH -> AWAIT_COMPLETION -> CLASSIFY}.
 * Initialization of storage, types, credential overwrites and external hooks starts in
 * {@code INIT} and overlaps with source resolution and validation. Storage is awaited early only
 * when the workflow is looked up by id. Nothing is retried.</p>
 *
 * <p>Usage, lookup, format and entry-point problems are reported as a single console line.
 * Everything that fails from the barrier onwards is reported through the
 * {@link OutcomeClassifier}.</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * WorkflowRunCoordinator coordinator = WorkflowRunCoordinator.builder()
 *     .store(store)
 *     .typeLoader(typeLoader)
 *     .nodeTypes(nodeTypes)
 *     .credentialTypes(credentialTypes)
 *     .credentialsOverwrites(overwrites)
 *     .externalHooks(hooks)
 *     .sourceResolver(resolver)
 *     .startNodeValidator(validator)
 *     .dispatcher(dispatcher)
 *     .completionWaiter(waiter)
 *     .outcomeClassifier(classifier)
 *     .out(System.out)
 *     .build();
 * RunOutcome outcome = coordinator.run("workflow.json", null);
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
public class WorkflowRunCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowRunCoordinator.class);

    static final String STORAGE = "storage";
    static final String TYPES = "types";
    static final String CREDENTIALS_OVERWRITES = "credentials-overwrites";
    static final String EXTERNAL_HOOKS = "external-hooks";

    private final WorkflowStore store;
    private final TypeLoader typeLoader;
    private final NodeTypeRegistry nodeTypes;
    private final CredentialTypeRegistry credentialTypes;
    private final CredentialsOverwrites credentialsOverwrites;
    private final ExternalHooks externalHooks;
    private final WorkflowSourceResolver sourceResolver;
    private final StartNodeValidator startNodeValidator;
    private final ExecutionDispatcher dispatcher;
    private final CompletionWaiter completionWaiter;
    private final OutcomeClassifier outcomeClassifier;
    private final PrintStream out;
    private final int initThreads;

    private volatile RunState state = RunState.INIT;

    private WorkflowRunCoordinator(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "Workflow store cannot be null");
        this.typeLoader = Objects.requireNonNull(builder.typeLoader, "Type loader cannot be null");
        this.nodeTypes = Objects.requireNonNull(builder.nodeTypes, "Node type registry cannot be null");
        this.credentialTypes = Objects.requireNonNull(builder.credentialTypes, "Credential type registry cannot be null");
        this.credentialsOverwrites = Objects.requireNonNull(builder.credentialsOverwrites, "Credentials overwrites cannot be null");
        this.externalHooks = Objects.requireNonNull(builder.externalHooks, "External hooks cannot be null");
        this.sourceResolver = Objects.requireNonNull(builder.sourceResolver, "Source resolver cannot be null");
        this.startNodeValidator = Objects.requireNonNull(builder.startNodeValidator, "Start node validator cannot be null");
        this.dispatcher = Objects.requireNonNull(builder.dispatcher, "Execution dispatcher cannot be null");
        this.completionWaiter = Objects.requireNonNull(builder.completionWaiter, "Completion waiter cannot be null");
        this.outcomeClassifier = Objects.requireNonNull(builder.outcomeClassifier, "Outcome classifier cannot be null");
        this.out = Objects.requireNonNull(builder.out, "Output stream cannot be null");
        if (builder.initThreads <= 0) {
            throw new IllegalArgumentException("Init threads must be positive: " + builder.initThreads);
        }
        this.initThreads = builder.initThreads;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs the workflow given by exactly one of {@code filePath} and {@code workflowId}.
     *
     * @return the terminal outcome; never {@code null}
     */
    public RunOutcome run(String filePath, String workflowId) {
        enter(RunState.INIT);
        try (InitBarrier barrier = new InitBarrier(initThreads)) {
            Readiness<Void> storageReady = barrier.start(STORAGE, () -> {
                store.init();
                return null;
            });
            Readiness<LoadedTypes> typesReady = barrier.start(TYPES, () -> {
                LoadedTypes loaded = typeLoader.load();
                nodeTypes.init(loaded.getNodeTypes());
                credentialTypes.init(loaded.getCredentialTypes());
                return loaded;
            });
            Readiness<Void> overwritesReady = barrier.start(CREDENTIALS_OVERWRITES, () -> {
                credentialsOverwrites.init();
                return null;
            });
            Readiness<Void> hooksReady = barrier.start(EXTERNAL_HOOKS, () -> {
                externalHooks.init();
                return null;
            });

            ResolvedWorkflow workflow;
            Node startNode;
            try {
                enter(RunState.RESOLVE_SOURCE);
                workflow = sourceResolver.resolve(filePath, workflowId, storageReady);

                enter(RunState.VALIDATE_START_NODE);
                startNode = startNodeValidator.validate(workflow.getDefinition());
            } catch (UsageException e) {
                out.println(e.getMessage());
                return RunOutcome.USAGE_ERROR;
            } catch (WorkflowNotFoundException e) {
                out.println(e.getMessage());
                return e.getSourceKind() == WorkflowNotFoundException.SourceKind.FILE
                        ? RunOutcome.NOT_FOUND_FILE
                        : RunOutcome.NOT_FOUND_ID;
            } catch (InvalidWorkflowFormatException e) {
                out.println(e.getMessage());
                return e.isMalformed() ? RunOutcome.MALFORMED_DOCUMENT : RunOutcome.INVALID_FORMAT;
            } catch (MissingEntryPointException e) {
                out.println(e.getMessage());
                return RunOutcome.MISSING_ENTRY_POINT;
            }

            logger.debug("Workflow {} resolved, start node {}", workflow, startNode.getName());

            enter(RunState.AWAIT_BARRIER);
            typesReady.await();
            overwritesReady.await();
            hooksReady.await();
            storageReady.await();

            enter(RunState.DISPATCH);
            ExecutionHandle handle = dispatcher.dispatch(workflow.getDefinition(), startNode);

            enter(RunState.AWAIT_COMPLETION);
            ExecutionResult result = completionWaiter.await(handle);

            enter(RunState.CLASSIFY);
            return outcomeClassifier.report(result);
        } catch (WorkflowExecutionException e) {
            outcomeClassifier.reportFailure(e);
            return RunOutcome.EXECUTION_ERROR;
        } catch (Exception e) {
            logger.debug("Run failed in state {}", state, e);
            outcomeClassifier.reportFailure(e);
            return RunOutcome.FATAL;
        }
    }

    public RunState getState() {
        return state;
    }

    private void enter(RunState next) {
        logger.debug("{} -> {}", state, next);
        state = next;
    }

    /**
     * Builder for WorkflowRunCoordinator.
     */
    public static class Builder {
        private WorkflowStore store;
        private TypeLoader typeLoader;
        private NodeTypeRegistry nodeTypes;
        private CredentialTypeRegistry credentialTypes;
        private CredentialsOverwrites credentialsOverwrites;
        private ExternalHooks externalHooks;
        private WorkflowSourceResolver sourceResolver;
        private StartNodeValidator startNodeValidator;
        private ExecutionDispatcher dispatcher;
        private CompletionWaiter completionWaiter;
        private OutcomeClassifier outcomeClassifier;
        private PrintStream out = System.out;
        private int initThreads = 4;

        public Builder store(WorkflowStore store) {
            this.store = store;
            return this;
        }

        public Builder typeLoader(TypeLoader typeLoader) {
            this.typeLoader = typeLoader;
            return this;
        }

        public Builder nodeTypes(NodeTypeRegistry nodeTypes) {
            this.nodeTypes = nodeTypes;
            return this;
        }

        public Builder credentialTypes(CredentialTypeRegistry credentialTypes) {
            this.credentialTypes = credentialTypes;
            return this;
        }

        public Builder credentialsOverwrites(CredentialsOverwrites credentialsOverwrites) {
            this.credentialsOverwrites = credentialsOverwrites;
            return this;
        }

        public Builder externalHooks(ExternalHooks externalHooks) {
            this.externalHooks = externalHooks;
            return this;
        }

        public Builder sourceResolver(WorkflowSourceResolver sourceResolver) {
            this.sourceResolver = sourceResolver;
            return this;
        }

        public Builder startNodeValidator(StartNodeValidator startNodeValidator) {
            this.startNodeValidator = startNodeValidator;
            return this;
        }

        public Builder dispatcher(ExecutionDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        public Builder completionWaiter(CompletionWaiter completionWaiter) {
            this.completionWaiter = completionWaiter;
            return this;
        }

        public Builder outcomeClassifier(OutcomeClassifier outcomeClassifier) {
            this.outcomeClassifier = outcomeClassifier;
            return this;
        }

        public Builder out(PrintStream out) {
            this.out = out;
            return this;
        }

        public Builder initThreads(int initThreads) {
            this.initThreads = initThreads;
            return this;
        }

        public WorkflowRunCoordinator build() {
            return new WorkflowRunCoordinator(this);
        }
    }
}
