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

import dev.mars.flowrun.core.Node;
import dev.mars.flowrun.core.WorkflowDefinition;
import dev.mars.flowrun.core.exceptions.MissingEntryPointException;

import java.util.Objects;

/**
 * Finds the node a run starts from. The first node in document order that satisfies the
 * {@link EntryNodePredicate} wins.
 */
public class StartNodeValidator {

    static final String MISSING_START_NODE_MESSAGE =
            "The workflow does not contain a \"Start\" node. So it can not be executed.";

    private final EntryNodePredicate predicate;

    public StartNodeValidator() {
        this(EntryNodePredicate.defaultPredicate());
    }

    public StartNodeValidator(EntryNodePredicate predicate) {
        this.predicate = Objects.requireNonNull(predicate, "Entry node predicate cannot be null");
    }

    public Node validate(WorkflowDefinition definition) throws MissingEntryPointException {
        for (Node node : definition.getNodes()) {
            if (predicate.isEntryNode(node)) {
                return node;
            }
        }
        throw new MissingEntryPointException(definition.getId(), MISSING_START_NODE_MESSAGE);
    }
}
