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

import dev.mars.flowrun.config.ExitCodePolicy;
import dev.mars.flowrun.config.FlowrunConfig;
import dev.mars.flowrun.core.exceptions.UsageException;
import dev.mars.flowrun.workflow.run.RunOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Command line entry point. Executes exactly one workflow, given by file or by stored id, and
 * exits with the code of its outcome.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
public class FlowrunCli {

    private static final Logger logger = LoggerFactory.getLogger(FlowrunCli.class);

    private final FlowrunConfig config;
    private final PrintStream out;
    private final PrintStream err;

    public FlowrunCli(FlowrunConfig config, PrintStream out, PrintStream err) {
        this.config = Objects.requireNonNull(config, "Configuration cannot be null");
        this.out = Objects.requireNonNull(out, "Output stream cannot be null");
        this.err = Objects.requireNonNull(err, "Error stream cannot be null");
    }

    public static void main(String[] args) {
        FlowrunConfig config;
        try {
            config = FlowrunConfig.load();
            config.validate();
        } catch (IllegalStateException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            System.exit(1);
            return;
        }

        System.exit(new FlowrunCli(config, System.out, System.err).execute(args));
    }

    /**
     * Runs the command line and returns the process exit code.
     */
    public int execute(String[] args) {
        ExitCodePolicy policy = config.getExitCodePolicy();

        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (UsageException e) {
            err.println(e.getMessage());
            printUsage(err);
            return RunOutcome.USAGE_ERROR.exitCode(policy);
        }

        if (options.isHelp()) {
            printUsage(out);
            return 0;
        }

        logger.debug("Executing with {} and {}", options, config);
        try (FlowrunApplication application = FlowrunApplication.create(config, out, err)) {
            RunOutcome outcome = application.run(options);
            logger.debug("Run finished with {}", outcome);
            return outcome.exitCode(policy);
        }
    }

    static void printUsage(PrintStream stream) {
        stream.println();
        stream.println("Executes a given workflow");
        stream.println();
        stream.println("Usage: flowrun execute [options]");
        stream.println();
        stream.println("Options:");
        stream.println("  --file=<path>   path to a workflow file to execute");
        stream.println("  --id=<id>       id of the workflow to execute");
        stream.println("  -h, --help      show this help");
        stream.println();
        stream.println("Examples:");
        stream.println("  flowrun execute --id=5");
        stream.println("  flowrun execute --file=workflow.json");
    }
}
