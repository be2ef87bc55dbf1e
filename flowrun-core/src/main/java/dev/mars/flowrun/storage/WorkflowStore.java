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

package dev.mars.flowrun.storage;

import dev.mars.flowrun.core.WorkflowDefinition;

import java.util.Map;
import java.util.Optional;

/**
 * Persistent storage of workflows and credentials.
 *
 * <p>{@link #init()} may be slow (connecting, migrating, scanning) and is meant to run in the
 * background while the caller does other work. Lookups may only be issued after it returned.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
public interface WorkflowStore {

    /**
     * Prepares the store for lookups.
     *
     * @throws Exception if the store is unavailable
     */
    void init() throws Exception;

    /**
     * Looks up a stored workflow.
     *
     * @param id the workflow id
     * @return the workflow, or empty if no record matches
     * @throws Exception if the lookup itself failed
     */
    Optional<WorkflowDefinition> findWorkflowById(String id) throws Exception;

    /**
     * Looks up the decrypted data of a stored credential.
     *
     * @param type the credential type
     * @param name the credential name
     * @return the credential data, or empty if no such credential is stored
     * @throws Exception if the lookup itself failed
     */
    Optional<Map<String, Object>> findCredentials(String type, String name) throws Exception;
}
