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

package dev.mars.flowrun.config;

import java.util.Locale;

/**
 * How negative outcomes map to process exit codes.
 */
public enum ExitCodePolicy {
    /** Every negative branch exits nonzero. */
    STRICT,
    /**
     * Usage errors, a missing file, a document without node list or connection graph, and a
     * missing start node exit 0. Lookup, parse, execution and fatal failures exit nonzero.
     */
    LEGACY;

    public static ExitCodePolicy fromString(String value) {
        if (value == null || value.isBlank()) {
            return STRICT;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Unknown exit code policy '" + value + "', expected 'strict' or 'legacy'", e);
        }
    }
}
