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

package dev.mars.stratus.operation;

import dev.mars.stratus.core.ErrorCode;
import dev.mars.stratus.core.exceptions.OperationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.CALLS_REAL_METHODS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OperationBackendTest {

    private RecordingBackend backend;

    @BeforeEach
    void setUp() {
        backend = new RecordingBackend();
    }

    @ParameterizedTest
    @CsvSource({
            "deploy, deploy",
            "apply, deploy",
            "APPLY, deploy",
            "destroy, destroy",
            "plan, plan",
            "synth, synth",
            "diff, diff"
    })
    void testExecuteDispatchesCommand(String command, String expectedOperation) throws Exception {
        OperationResult result = backend.execute(command, List.of(), Map.of());

        assertTrue(result.isSuccess());
        assertEquals(List.of(expectedOperation), backend.calls);
    }

    @Test
    void testExecutePassesArgsThroughOptions() throws Exception {
        backend.execute("plan", List.of("--refresh"), Map.of("stack", "network"));

        Map<String, Object> options = backend.lastOptions;
        assertEquals("network", options.get("stack"));
        assertEquals(List.of("--refresh"), options.get("args"));
    }

    @Test
    void testUnknownCommandIsUnsupported() {
        OperationException e = assertThrows(OperationException.class,
                () -> backend.execute("import", List.of(), Map.of()));

        assertTrue(e.hasErrorCode(ErrorCode.UNSUPPORTED_OPERATION));
        assertTrue(backend.calls.isEmpty());
    }

    @Test
    void testBackendFailurePropagatesUnchanged() throws Exception {
        OperationBackend failing = mock(OperationBackend.class, CALLS_REAL_METHODS);
        OperationException failure = new OperationException("deploy", ErrorCode.STATE_LOCK_ERROR, "state is locked");
        when(failing.deploy(anyMap())).thenThrow(failure);

        assertThatThrownBy(() -> failing.execute("apply", List.of(), Map.of("stack", "network")))
                .isSameAs(failure);
        verify(failing).deploy(anyMap());
        verify(failing, never()).destroy(anyMap());
    }

    @Test
    void testFailedResultDefaultsErrorCode() {
        OperationResult result = OperationResult.builder().operation("deploy").success(false).build();

        assertEquals("OPERATION_FAILED", result.getErrorCode());
        assertNull(OperationResult.success("deploy").getErrorCode());
    }

    @Test
    void testOperationTypeMutating() {
        assertTrue(OperationType.DEPLOY.isMutating());
        assertTrue(OperationType.DESTROY.isMutating());
        assertFalse(OperationType.PLAN.isMutating());
        assertTrue(OperationType.fromCommand(null).isEmpty());
    }

    private static class RecordingBackend implements OperationBackend {
        private final List<String> calls = new ArrayList<>();
        private Map<String, Object> lastOptions;

        private OperationResult record(String operation, Map<String, Object> options) {
            calls.add(operation);
            lastOptions = options;
            return OperationResult.success(operation);
        }

        @Override
        public OperationResult deploy(Map<String, Object> options) {
            return record("deploy", options);
        }

        @Override
        public OperationResult destroy(Map<String, Object> options) {
            return record("destroy", options);
        }

        @Override
        public OperationResult plan(Map<String, Object> options) {
            return record("plan", options);
        }

        @Override
        public OperationResult synth(Map<String, Object> options) {
            return record("synth", options);
        }

        @Override
        public OperationResult diff(Map<String, Object> options) {
            return record("diff", options);
        }
    }
}
