package io.github.goodees.aggregates.middleware;

/*-
 * #%L
 * aggregates-core
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.aggregates.dispatch.Consistency;
import io.github.goodees.aggregates.dispatch.DispatchFailure;
import io.github.goodees.aggregates.dispatch.DispatchResult;
import io.github.goodees.aggregates.dispatch.DispatchOptions;
import io.github.goodees.aggregates.instance.ExecutionResult;
import io.github.goodees.aggregates.routing.Route;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * State of single command dispatch, passed through the middleware. Not thread safe, a pipeline is only accessed by
 * the dispatching thread.
 */
public class Pipeline {
    private final Object command;
    private final Route route;
    private final String commandId = UUID.randomUUID().toString();
    private final Consistency consistency;
    private final Map<String, Object> metadata;
    private final Map<String, Object> assigns;
    private final long timeoutMillis;
    private final long startNanos = System.nanoTime();

    private String correlationId = UUID.randomUUID().toString();
    private String identity;
    private boolean halted;
    private DispatchResult response;
    private ExecutionResult executionResult;
    private DispatchFailure failure;

    public Pipeline(Object command, Route route, Consistency consistency, long timeoutMillis,
                    Map<String, Object> metadata, Map<String, Object> assigns) {
        this.command = Objects.requireNonNull(command);
        this.route = Objects.requireNonNull(route);
        this.consistency = Objects.requireNonNull(consistency);
        this.timeoutMillis = timeoutMillis;
        this.metadata = new LinkedHashMap<>(metadata);
        this.assigns = new LinkedHashMap<>(assigns);
    }

    public Object getCommand() {
        return command;
    }

    public Route getRoute() {
        return route;
    }

    /**
     * Unique id of this dispatch. It is recorded as causation id of the produced events.
     * @return command id
     */
    public String getCommandId() {
        return commandId;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public void setCorrelationId(String correlationId) {
        this.correlationId = Objects.requireNonNull(correlationId);
    }

    public Consistency getConsistency() {
        return consistency;
    }

    /**
     * Metadata to attach to produced events. Mutable, middleware may add entries before dispatch.
     * @return metadata
     */
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Map<String, Object> getAssigns() {
        return assigns;
    }

    public Pipeline assign(String key, Object value) {
        assigns.put(Objects.requireNonNull(key), Objects.requireNonNull(value));
        return this;
    }

    public Optional<String> getIdentity() {
        return Optional.ofNullable(identity);
    }

    public void setIdentity(String identity) {
        this.identity = identity;
    }

    /**
     * Identity of the aggregate's event stream, the identity prefixed with the route's identity prefix.
     * @return stream id, empty when identity was not yet extracted
     */
    public Optional<String> getStreamId() {
        return getIdentity().map(id -> route.getIdentityPrefix() + id);
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    /**
     * Milliseconds remaining until the dispatch times out.
     * @return remaining time, never negative, or {@link DispatchOptions#INFINITY}
     */
    public long remainingMillis() {
        if (timeoutMillis == DispatchOptions.INFINITY) {
            return DispatchOptions.INFINITY;
        }
        long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        return Math.max(0, timeoutMillis - elapsed);
    }

    public long elapsedMillis() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    /**
     * Stop the dispatch. Unless a response was already set, the dispatch fails with {@link DispatchFailure.Kind#HALTED}
     * and the given reason.
     * @param reason reason of halting
     * @return this
     */
    public Pipeline halt(Object reason) {
        if (response == null) {
            response = DispatchResult.failed(DispatchFailure.halted(reason));
        }
        halted = true;
        return this;
    }

    public boolean isHalted() {
        return halted;
    }

    /**
     * Set the response of the dispatch, replacing the one the dispatcher would produce.
     * @param response the response
     * @return this
     */
    public Pipeline respond(DispatchResult response) {
        this.response = Objects.requireNonNull(response);
        return this;
    }

    public Optional<DispatchResult> getResponse() {
        return Optional.ofNullable(response);
    }

    public Optional<ExecutionResult> getExecutionResult() {
        return Optional.ofNullable(executionResult);
    }

    public Optional<DispatchFailure> getFailure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Record successful execution.
     * @param executionResult the result
     */
    public void executed(ExecutionResult executionResult) {
        this.executionResult = executionResult;
    }

    /**
     * Record failed execution. Sets the response to the failure.
     * @param failure the failure
     */
    public void failed(DispatchFailure failure) {
        this.failure = failure;
        this.response = DispatchResult.failed(failure);
    }

    @Override
    public String toString() {
        return "Pipeline[" + command.getClass().getSimpleName() + ", commandId=" + commandId + "]";
    }
}
