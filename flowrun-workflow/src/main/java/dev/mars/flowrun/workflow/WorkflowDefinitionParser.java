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

import dev.mars.flowrun.core.WorkflowDefinition;
import dev.mars.flowrun.core.exceptions.InvalidWorkflowFormatException;
import dev.mars.flowrun.core.exceptions.WorkflowNotFoundException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

public interface WorkflowDefinitionParser {

    /**
     * Reads and parses a workflow file. The format is chosen by file extension.
     *
     * @param workflowFile the file to read
     * @return the parsed definition
     * @throws WorkflowNotFoundException if the file does not exist
     * @throws InvalidWorkflowFormatException if the content is not a workflow document
     * @throws IOException if the file exists but cannot be read
     */
    WorkflowDefinition parse(Path workflowFile)
            throws WorkflowNotFoundException, InvalidWorkflowFormatException, IOException;

    /**
     * Builds a definition from an already decoded document.
     *
     * @param document the top-level object of the document
     * @return the parsed definition
     * @throws InvalidWorkflowFormatException if the node list or the connection graph is missing or malformed
     */
    WorkflowDefinition parseDocument(Map<String, Object> document) throws InvalidWorkflowFormatException;
}
