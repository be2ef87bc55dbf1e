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

import dev.mars.flowrun.config.FlowrunConfig;
import dev.mars.flowrun.core.Node;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Decides whether a node may serve as the entry point of a run.
 */
@FunctionalInterface
public interface EntryNodePredicate {

    boolean isEntryNode(Node node);

    /**
     * Matches nodes whose type is one of the given types.
     */
    static EntryNodePredicate ofTypes(Collection<String> nodeTypes) {
        if (nodeTypes == null || nodeTypes.isEmpty()) {
            throw new IllegalArgumentException("At least one entry node type is required");
        }
        Set<String> types = Set.copyOf(nodeTypes);
        return node -> types.contains(node.getType());
    }

    static EntryNodePredicate defaultPredicate() {
        return ofTypes(List.of(FlowrunConfig.DEFAULT_ENTRY_NODE_TYPE));
    }
}
