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

package dev.mars.flowrun.types;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of the node types the engine can execute. Filled once at startup from the
 * {@link TypeLoader} output and read by the engine afterwards.
 */
public class NodeTypeRegistry {

    private static final Logger logger = LoggerFactory.getLogger(NodeTypeRegistry.class);

    private final Map<String, NodeType> nodeTypes = new ConcurrentHashMap<>();
    private volatile boolean initialized = false;

    public void init(Map<String, NodeType> types) {
        Objects.requireNonNull(types, "Node types cannot be null");
        nodeTypes.clear();
        nodeTypes.putAll(types);
        initialized = true;
        logger.info("Registered {} node types", nodeTypes.size());
    }

    public boolean isKnown(String typeName) {
        return typeName != null && nodeTypes.containsKey(typeName);
    }

    public Set<String> getTypeNames() {
        return Set.copyOf(nodeTypes.keySet());
    }

    public boolean isInitialized() {
        return initialized;
    }
}
