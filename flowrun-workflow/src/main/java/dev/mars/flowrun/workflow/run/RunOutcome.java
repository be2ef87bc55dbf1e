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

import dev.mars.flowrun.config.ExitCodePolicy;

/**
 * Terminal outcome of a run and the process exit code it maps to under each {@link ExitCodePolicy}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
public enum RunOutcome {

    SUCCESS(0, 0),
    USAGE_ERROR(2, 0),
    NOT_FOUND_FILE(1, 0),
    NOT_FOUND_ID(1, 1),
    INVALID_FORMAT(1, 0),
    /** The document is not valid JSON or YAML. */
    MALFORMED_DOCUMENT(1, 1),
    MISSING_ENTRY_POINT(1, 0),
    EXECUTION_ERROR(1, 1),
    FATAL(1, 1);

    private final int strictExitCode;
    private final int legacyExitCode;

    RunOutcome(int strictExitCode, int legacyExitCode) {
        this.strictExitCode = strictExitCode;
        this.legacyExitCode = legacyExitCode;
    }

    public int exitCode(ExitCodePolicy policy) {
        return policy == ExitCodePolicy.LEGACY ? legacyExitCode : strictExitCode;
    }

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
