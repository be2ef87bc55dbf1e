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

import dev.mars.flowrun.core.CredentialsSnapshot;
import dev.mars.flowrun.core.ExecutionHandle;
import dev.mars.flowrun.core.ExecutionMode;
import dev.mars.flowrun.core.ExecutionRequest;
import dev.mars.flowrun.core.Node;
import dev.mars.flowrun.core.WorkflowDefinition;
import dev.mars.flowrun.core.exceptions.CredentialsNotFoundException;
import dev.mars.flowrun.credentials.CredentialsResolver;
import dev.mars.flowrun.engine.ExecutionEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ExecutionDispatcherTest {

    private CredentialsResolver credentialsResolver;
    private ExecutionEngine engine;
    private ExecutionDispatcher dispatcher;

    private final Node start = new Node("Start", "n8n-nodes-base.start", Map.of());
    private final WorkflowDefinition workflow = new WorkflowDefinition("3", "w",
            List.of(start, new Node("Set", "n8n-nodes-base.set", Map.of())), Map.of(), null);

    @BeforeEach
    void setUp() {
        credentialsResolver = mock(CredentialsResolver.class);
        engine = mock(ExecutionEngine.class);
        dispatcher = new ExecutionDispatcher(credentialsResolver, engine);
    }

    @Test
    void testBuildsCliRequest() throws Exception {
        CredentialsSnapshot credentials = CredentialsSnapshot.builder()
                .add("httpBasicAuth", "prod", Map.of("user", "svc"))
                .build();
        when(credentialsResolver.resolve(workflow.getNodes())).thenReturn(credentials);
        when(engine.dispatch(any())).thenReturn(ExecutionHandle.of("exec-1"));

        ExecutionHandle handle = dispatcher.dispatch(workflow, start);

        ArgumentCaptor<ExecutionRequest> captor = ArgumentCaptor.forClass(ExecutionRequest.class);
        verify(engine, times(1)).dispatch(captor.capture());
        ExecutionRequest request = captor.getValue();

        assertThat(handle).isEqualTo(ExecutionHandle.of("exec-1"));
        assertThat(request.getExecutionMode()).isEqualTo(ExecutionMode.CLI);
        assertThat(request.getStartNodes()).containsExactly("Start");
        assertThat(request.getCredentials()).isSameAs(credentials);
        assertThat(request.getWorkflow()).isSameAs(workflow);
        verify(engine, never()).awaitResult(any());
    }

    @Test
    void testCredentialFailurePreventsDispatch() throws Exception {
        when(credentialsResolver.resolve(any())).thenThrow(new CredentialsNotFoundException("httpBasicAuth", "gone"));

        assertThatThrownBy(() -> dispatcher.dispatch(workflow, start))
                .isInstanceOf(CredentialsNotFoundException.class);
        verify(engine, never()).dispatch(any());
    }

    @Test
    void testEngineMustReturnHandle() throws Exception {
        when(credentialsResolver.resolve(any())).thenReturn(CredentialsSnapshot.empty());
        when(engine.dispatch(any())).thenReturn(null);

        assertThatThrownBy(() -> dispatcher.dispatch(workflow, start))
                .isInstanceOf(IllegalStateException.class);
    }
}
