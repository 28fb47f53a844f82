package io.github.goodees.aggregates.dispatch;

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

import io.github.goodees.aggregates.instance.ExecutionResult;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Response to a dispatched command. Either successful, optionally carrying the aggregate version, the execution
 * result or the value returned by a plain handler, or failed with a {@link DispatchFailure}.
 */
public final class DispatchResult {
    private static final DispatchResult OK = new DispatchResult(null, null, null, null);

    private final Long aggregateVersion;
    private final ExecutionResult executionResult;
    private final Object value;
    private final DispatchFailure failure;

    private DispatchResult(Long aggregateVersion, ExecutionResult executionResult, Object value,
                           DispatchFailure failure) {
        this.aggregateVersion = aggregateVersion;
        this.executionResult = executionResult;
        this.value = value;
        this.failure = failure;
    }

    public static DispatchResult ok() {
        return OK;
    }

    public static DispatchResult ok(long aggregateVersion) {
        return new DispatchResult(aggregateVersion, null, null, null);
    }

    public static DispatchResult ok(ExecutionResult executionResult) {
        return new DispatchResult(executionResult.getAggregateVersion(), executionResult, null, null);
    }

    /**
     * Successful result carrying a value of plain command handler.
     * @param value the value, {@code null} for bare success
     * @return the result
     */
    public static DispatchResult value(Object value) {
        return value == null ? OK : new DispatchResult(null, null, value, null);
    }

    public static DispatchResult failed(DispatchFailure failure) {
        return new DispatchResult(null, null, null, failure);
    }

    public boolean isOk() {
        return failure == null;
    }

    public boolean isFailure() {
        return failure != null;
    }

    public Optional<DispatchFailure> getFailure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Kind of failure, if the dispatch failed.
     * @return failure kind or empty for successful result
     */
    public Optional<DispatchFailure.Kind> getFailureKind() {
        return getFailure().map(DispatchFailure::getKind);
    }

    public OptionalLong getAggregateVersion() {
        return aggregateVersion == null ? OptionalLong.empty() : OptionalLong.of(aggregateVersion);
    }

    public Optional<ExecutionResult> getExecutionResult() {
        return Optional.ofNullable(executionResult);
    }

    public Optional<Object> getValue() {
        return Optional.ofNullable(value);
    }

    @Override
    public String toString() {
        if (failure != null) {
            return "DispatchResult[" + failure + "]";
        } else if (executionResult != null) {
            return "DispatchResult[ok, " + executionResult + "]";
        } else if (aggregateVersion != null) {
            return "DispatchResult[ok, version=" + aggregateVersion + "]";
        } else if (value != null) {
            return "DispatchResult[ok, " + value + "]";
        } else {
            return "DispatchResult[ok]";
        }
    }
}
