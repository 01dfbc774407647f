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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Pending manual interventions of a single workflow run.
 *
 * <p>Each request is paired with a future that completes when an operator resolves
 * it. Two steps of the same batch can fail at once, so every mutation of the pending
 * map is synchronized on the queue.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public class ManualInterventionQueue {

    private static final Logger logger = Logger.getLogger(ManualInterventionQueue.class.getName());

    private final Map<String, PendingIntervention> pending = new LinkedHashMap<>();
    private int requestCount;

    /**
     * Queues a new request for the failure described by {@code context}.
     */
    public synchronized ManualInterventionRequest request(ErrorContext context, List<String> suggestedActions) {
        Objects.requireNonNull(context, "Error context cannot be null");
        String id = "intervention-" + UUID.randomUUID();
        ManualInterventionRequest request = new ManualInterventionRequest(id, context, suggestedActions,
                Instant.now());
        pending.put(id, new PendingIntervention(request, new CompletableFuture<>()));
        requestCount++;
        logger.warning("Manual intervention requested for step " + request.getStepName() + " (" + id + "): " +
                request.getErrorMessage());
        return request;
    }

    /**
     * Resolves a pending request and wakes the suspended step.
     *
     * @return the handler result; for a retry decision it carries the original step
     * @throws InterventionNotFoundException if {@code id} is not pending
     */
    public RecoveryHandlerResult resolve(String id, ErrorRecoveryStrategy strategy)
            throws InterventionNotFoundException {
        Objects.requireNonNull(strategy, "Strategy cannot be null");
        PendingIntervention entry;
        synchronized (this) {
            entry = pending.remove(id);
        }
        if (entry == null) {
            throw new InterventionNotFoundException(id);
        }

        logger.info("Manual intervention " + id + " resolved with " + strategy.type().value() + ": " +
                strategy.reason());
        entry.future.complete(strategy);

        return strategy instanceof ErrorRecoveryStrategy.Retry
                ? new RecoveryHandlerResult(strategy, entry.request.getContext().step())
                : new RecoveryHandlerResult(strategy, null);
    }

    /**
     * Pending requests, oldest first.
     */
    public synchronized List<ManualInterventionRequest> listPending() {
        List<ManualInterventionRequest> requests = new ArrayList<>();
        for (PendingIntervention entry : pending.values()) {
            requests.add(entry.request);
        }
        requests.sort(Comparator.comparing(ManualInterventionRequest::getTimestamp));
        return requests;
    }

    /**
     * Future completed with the operator's decision. With a positive timeout the
     * future fails with a {@link java.util.concurrent.TimeoutException} if nobody
     * decides in time, and the request is withdrawn.
     *
     * @throws InterventionNotFoundException if {@code id} is not pending
     */
    public CompletableFuture<ErrorRecoveryStrategy> awaitResolution(String id, Duration timeout)
            throws InterventionNotFoundException {
        PendingIntervention entry;
        synchronized (this) {
            entry = pending.get(id);
        }
        if (entry == null) {
            throw new InterventionNotFoundException(id);
        }

        CompletableFuture<ErrorRecoveryStrategy> future = entry.future;
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            future = future.copy().orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
            future.whenComplete((strategy, error) -> {
                if (error != null) {
                    withdraw(id);
                }
            });
        }
        return future;
    }

    /**
     * Removes a request without resolving it, completing its waiter with an abort.
     */
    public void withdraw(String id) {
        PendingIntervention entry;
        synchronized (this) {
            entry = pending.remove(id);
        }
        if (entry != null) {
            logger.warning("Manual intervention " + id + " withdrawn");
            entry.future.complete(ErrorRecoveryStrategy.abort("Intervention " + id + " withdrawn"));
        }
    }

    /**
     * Number of requests ever made through this queue, resolved or not.
     */
    public synchronized int getRequestCount() {
        return requestCount;
    }

    public synchronized boolean isEmpty() {
        return pending.isEmpty();
    }

    private static final class PendingIntervention {
        private final ManualInterventionRequest request;
        private final CompletableFuture<ErrorRecoveryStrategy> future;

        private PendingIntervention(ManualInterventionRequest request,
                                    CompletableFuture<ErrorRecoveryStrategy> future) {
            this.request = request;
            this.future = future;
        }
    }
}
