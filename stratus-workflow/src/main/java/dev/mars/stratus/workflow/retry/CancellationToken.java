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

package dev.mars.stratus.workflow.retry;

import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Shared flag telling in-flight steps of a run to stop.
 *
 * <p>Cancelling means "stop waiting and report": attempts that have not started
 * are not started, and delays end early. An operation already dispatched to the
 * backend is not interrupted.</p>
 */
public class CancellationToken {

    private final AtomicReference<String> reason = new AtomicReference<>();
    private final CopyOnWriteArrayList<Runnable> listeners = new CopyOnWriteArrayList<>();

    /**
     * Cancels the token. Only the first reason is kept.
     *
     * @return true if this call cancelled the token
     */
    public boolean cancel(String cancelReason) {
        if (reason.compareAndSet(null, cancelReason != null ? cancelReason : "cancelled")) {
            listeners.forEach(Runnable::run);
            return true;
        }
        return false;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public Optional<String> getReason() {
        return Optional.ofNullable(reason.get());
    }

    /**
     * Registers a callback run once on cancellation, or immediately if already cancelled.
     */
    public void onCancel(Runnable listener) {
        listeners.add(listener);
        if (isCancelled() && listeners.remove(listener)) {
            listener.run();
        }
    }
}
