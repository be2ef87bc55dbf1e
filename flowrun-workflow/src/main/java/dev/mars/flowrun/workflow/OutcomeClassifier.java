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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.flowrun.core.ExecutionError;
import dev.mars.flowrun.core.ExecutionResult;
import dev.mars.flowrun.core.exceptions.WorkflowExecutionException;
import dev.mars.flowrun.workflow.run.RunOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;

/**
 * Maps an {@link ExecutionResult} to its outcome and writes the user-visible report.
 *
 * <p>Console messages go to the given streams. The structured dump of a failed result and the
 * details of fatal errors go to the {@value #EXECUTION_LOGGER} logger.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
public class OutcomeClassifier {

    public static final String EXECUTION_LOGGER = "dev.mars.flowrun.execution";

    static final String SUCCESS_MESSAGE = "Execution was successful:";
    static final String FAILURE_MESSAGE = "Execution was NOT successful. See log message for details.";
    static final String FATAL_MESSAGE = "Error executing workflow. See log messages for details.";
    static final String SEPARATOR = "====================================";

    private final Logger executionLogger;
    private final ObjectMapper objectMapper;
    private final PrintStream out;
    private final PrintStream err;

    public OutcomeClassifier(PrintStream out, PrintStream err) {
        this(out, err, LoggerFactory.getLogger(EXECUTION_LOGGER));
    }

    public OutcomeClassifier(PrintStream out, PrintStream err, Logger executionLogger) {
        this.out = Objects.requireNonNull(out, "Output stream cannot be null");
        this.err = Objects.requireNonNull(err, "Error stream cannot be null");
        this.executionLogger = Objects.requireNonNull(executionLogger, "Execution logger cannot be null");
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Classifies a delivered result. Depends on nothing but the embedded error.
     */
    public static RunOutcome outcomeOf(ExecutionResult result) {
        Objects.requireNonNull(result, "Execution result cannot be null");
        return result.getError() != null ? RunOutcome.EXECUTION_ERROR : RunOutcome.SUCCESS;
    }

    /**
     * Reports a delivered result.
     *
     * @throws WorkflowExecutionException carrying the engine's message and stack if the result embeds an error
     * @throws JsonProcessingException if the result cannot be rendered
     */
    public RunOutcome report(ExecutionResult result) throws WorkflowExecutionException, JsonProcessingException {
        RunOutcome outcome = outcomeOf(result);
        String json = objectMapper.writeValueAsString(result);

        if (outcome == RunOutcome.EXECUTION_ERROR) {
            out.println(FAILURE_MESSAGE);
            executionLogger.info("Execution error:");
            executionLogger.info(SEPARATOR);
            executionLogger.info(json);

            ExecutionError error = result.getError();
            throw new WorkflowExecutionException(result.getExecutionId(), error.getMessage(), error.getStack());
        }

        out.println(SUCCESS_MESSAGE);
        out.println(SEPARATOR);
        out.println(json);
        return outcome;
    }

    /**
     * Reports a failure that ended the run after the workflow was resolved. For a
     * {@link WorkflowExecutionException} the engine's own stack is logged.
     */
    public void reportFailure(Throwable failure) {
        err.println(FATAL_MESSAGE);
        executionLogger.error("\nExecution error:");
        executionLogger.info(SEPARATOR);
        executionLogger.error(String.valueOf(failure.getMessage()));

        if (failure instanceof WorkflowExecutionException
                && ((WorkflowExecutionException) failure).getEngineStack() != null) {
            executionLogger.error(((WorkflowExecutionException) failure).getEngineStack());
        } else {
            StringWriter stack = new StringWriter();
            failure.printStackTrace(new PrintWriter(stack));
            executionLogger.error(stack.toString());
        }
    }
}
