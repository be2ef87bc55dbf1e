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

package dev.mars.flowrun.hooks;

import java.util.Set;

/**
 * A deployment-provided callback invoked at named lifecycle points such as
 * {@code workflow.preExecute} and {@code workflow.postExecute}.
 *
 * <p>Implementations are loaded by class name from configuration and need a public no-argument
 * constructor. A hook that throws aborts the operation it is attached to.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
public interface ExternalHook {

    /**
     * The lifecycle points this hook wants to be called for.
     */
    Set<String> getHookNames();

    void run(String hookName, Object... args) throws Exception;
}
