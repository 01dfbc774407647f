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

import dev.mars.stratus.core.exceptions.OperationException;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Access to the infrastructure state snapshot managed by the external tool.
 * The state format is opaque; the engine reads the {@code resources} and
 * {@code outputs} entries when present.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public interface StateBackend {

    Map<String, Object> loadState() throws OperationException;

    void saveState(Map<String, Object> state) throws OperationException;

    /**
     * Creates a backup of the current state.
     *
     * @return an opaque location that can later be passed to {@link #restoreBackup(String)}
     */
    String createBackup() throws OperationException;

    /**
     * Restores the backup at {@code location}.
     *
     * @return the restored state
     */
    Map<String, Object> restoreBackup(String location) throws OperationException;

    /**
     * Resource addresses listed under the state's {@code resources} entry, which may
     * be a list of addresses or a map keyed by address.
     */
    static Set<String> resourceAddresses(Map<String, Object> state) {
        Set<String> addresses = new LinkedHashSet<>();
        if (state == null) {
            return addresses;
        }
        Object resources = state.get("resources");
        if (resources instanceof Map<?, ?> map) {
            map.keySet().forEach(key -> addresses.add(String.valueOf(key)));
        } else if (resources instanceof Collection<?> list) {
            list.forEach(item -> {
                if (item instanceof Map<?, ?> entry && entry.get("address") != null) {
                    addresses.add(String.valueOf(entry.get("address")));
                } else if (item != null) {
                    addresses.add(String.valueOf(item));
                }
            });
        }
        return addresses;
    }
}
