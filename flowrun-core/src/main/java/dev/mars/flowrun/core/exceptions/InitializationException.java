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

package dev.mars.flowrun.core.exceptions;

/**
 * Exception thrown when an asynchronous subsystem initialization failed. Carries the name of the
 * readiness point whose operation rejected.
 */
public class InitializationException extends FlowrunException {

    private final String readinessPoint;

    public InitializationException(String readinessPoint, Throwable cause) {
        super("Initialization of '" + readinessPoint + "' failed: " + describe(cause), cause);
        this.readinessPoint = readinessPoint;
    }

    public String getReadinessPoint() {
        return readinessPoint;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown cause";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
