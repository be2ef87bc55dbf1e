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

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Rules for workflow identifiers. Stored workflows are keyed by numeric ids.
 */
public final class WorkflowIds {

    private static final Pattern NUMERIC_ID = Pattern.compile("\\d+");

    private WorkflowIds() {
    }

    public static boolean isValid(String workflowId) {
        return workflowId != null && NUMERIC_ID.matcher(workflowId.trim()).matches();
    }

    /**
     * Converts an identifier as found in a document (string or number) to its string form.
     *
     * @return the identifier, or {@code null} if it is absent or not a valid id
     */
    public static String normalize(Object rawId) {
        if (rawId == null) {
            return null;
        }
        String candidate;
        if (rawId instanceof Number) {
            candidate = integralDigits((Number) rawId);
            if (candidate == null) {
                return null;
            }
        } else {
            candidate = rawId.toString().trim();
        }
        return isValid(candidate) ? candidate : null;
    }

    // exact decimal form, so large ids are never narrowed into a different id
    private static String integralDigits(Number number) {
        if ((number instanceof Double || number instanceof Float)
                && (Double.isNaN(number.doubleValue()) || Double.isInfinite(number.doubleValue()))) {
            return null;
        }
        BigDecimal decimal = new BigDecimal(number.toString()).stripTrailingZeros();
        if (decimal.scale() > 0) {
            return null;
        }
        return decimal.toBigInteger().toString();
    }
}
