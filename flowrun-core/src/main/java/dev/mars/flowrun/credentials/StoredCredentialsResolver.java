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

package dev.mars.flowrun.credentials;

import dev.mars.flowrun.core.CredentialsSnapshot;
import dev.mars.flowrun.core.Node;
import dev.mars.flowrun.core.exceptions.CredentialsNotFoundException;
import dev.mars.flowrun.storage.WorkflowStore;
import dev.mars.flowrun.types.CredentialTypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves node credentials from the {@link WorkflowStore} and completes them with the
 * configured {@link CredentialsOverwrites}.
 *
 * <p>Disabled nodes are skipped. A reference to a credential type that is not registered, or to a
 * credential that is not stored, fails the whole resolution.</p>
 */
public class StoredCredentialsResolver implements CredentialsResolver {

    private static final Logger logger = LoggerFactory.getLogger(StoredCredentialsResolver.class);

    private final WorkflowStore store;
    private final CredentialsOverwrites overwrites;
    private final CredentialTypeRegistry credentialTypes;

    public StoredCredentialsResolver(WorkflowStore store, CredentialsOverwrites overwrites,
                                     CredentialTypeRegistry credentialTypes) {
        this.store = Objects.requireNonNull(store, "Workflow store cannot be null");
        this.overwrites = Objects.requireNonNull(overwrites, "Credentials overwrites cannot be null");
        this.credentialTypes = Objects.requireNonNull(credentialTypes, "Credential type registry cannot be null");
    }

    @Override
    public CredentialsSnapshot resolve(List<Node> nodes) throws Exception {
        CredentialsSnapshot.Builder snapshot = CredentialsSnapshot.builder();

        for (Node node : nodes) {
            if (node.isDisabled() || node.getCredentials().isEmpty()) {
                continue;
            }
            for (Map.Entry<String, String> reference : node.getCredentials().entrySet()) {
                String type = reference.getKey();
                String name = reference.getValue();
                if (!credentialTypes.isKnown(type)) {
                    throw new IllegalStateException("Credential type \"" + type + "\" used by node \""
                            + node.getName() + "\" is not known.");
                }
                Optional<Map<String, Object>> data = store.findCredentials(type, name);
                if (data.isEmpty()) {
                    throw new CredentialsNotFoundException(type, name);
                }
                snapshot.add(type, name, overwrites.apply(type, data.get()));
                logger.debug("Resolved credentials {}/{} for node {}", type, name, node.getName());
            }
        }

        return snapshot.build();
    }
}
