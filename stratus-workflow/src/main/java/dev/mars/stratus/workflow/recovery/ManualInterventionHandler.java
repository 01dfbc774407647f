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

package dev.mars.stratus.workflow.recovery;

/**
 * Callback notified when a run suspends a step for manual intervention. The
 * handler may resolve the request immediately or later, from any thread, through
 * {@link ManualInterventionQueue#resolve}.
 */
@FunctionalInterface
public interface ManualInterventionHandler {

    void onInterventionRequested(ManualInterventionRequest request, ManualInterventionQueue queue);
}
