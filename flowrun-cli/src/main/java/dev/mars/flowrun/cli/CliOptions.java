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

import dev.mars.flowrun.core.exceptions.UsageException;

/**
 * Parsed command line of {@code flowrun [execute] --id=<id> | --file=<path> [--help]}.
 *
 * <p>Flags take their value either inline ({@code --file=workflow.json}) or as the next argument
 * ({@code --file workflow.json}). Whether exactly one source is given is not checked here.</p>
 */
public final class CliOptions {

    static final String COMMAND = "execute";

    private final String filePath;
    private final String workflowId;
    private final boolean help;

    private CliOptions(String filePath, String workflowId, boolean help) {
        this.filePath = filePath;
        this.workflowId = workflowId;
        this.help = help;
    }

    public static CliOptions parse(String[] args) throws UsageException {
        String filePath = null;
        String workflowId = null;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String flag = arg;
            String inlineValue = null;
            int equals = arg.indexOf('=');
            if (arg.startsWith("--") && equals > 0) {
                flag = arg.substring(0, equals);
                inlineValue = arg.substring(equals + 1);
            }

            switch (flag) {
                case "--file":
                    if (inlineValue == null) {
                        inlineValue = nextValue(args, ++i, flag);
                    }
                    filePath = inlineValue;
                    break;
                case "--id":
                    if (inlineValue == null) {
                        inlineValue = nextValue(args, ++i, flag);
                    }
                    workflowId = inlineValue;
                    break;
                case "--help":
                case "-h":
                    help = true;
                    break;
                case COMMAND:
                    if (i != 0) {
                        throw new UsageException("Unexpected argument: " + arg);
                    }
                    break;
                default:
                    throw new UsageException(arg.startsWith("-")
                            ? "Unknown option: " + flag
                            : "Unexpected argument: " + arg);
            }
        }

        return new CliOptions(filePath, workflowId, help);
    }

    private static String nextValue(String[] args, int index, String flag) throws UsageException {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new UsageException("Option " + flag + " expects a value");
        }
        return args[index];
    }

    public String getFilePath() {
        return filePath;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public boolean isHelp() {
        return help;
    }

    @Override
    public String toString() {
        return "CliOptions{" +
               "filePath='" + filePath + '\'' +
               ", workflowId='" + workflowId + '\'' +
               ", help=" + help +
               '}';
    }
}
