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
import io.github.goodees.aggregates.dispatch.DispatchOptions;
import io.github.goodees.aggregates.dispatch.DispatchResult;
import io.github.goodees.aggregates.instance.ExecutionResult;
import io.github.goodees.aggregates.subscription.ProgressTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Blocks strongly consistent dispatches until every strongly consistent event handler processed the events the command
 * produced. The handlers are polled until they reach the new aggregate version, or the dispatch times out. Timeout
 * replaces the successful response with {@link DispatchFailure.Kind#CONSISTENCY_TIMEOUT}, the events stay persisted.
 */
public class ConsistencyGuarantee implements Middleware {
    public static final long DEFAULT_POLL_INTERVAL = 10;

    private static final Logger logger = LoggerFactory.getLogger(ConsistencyGuarantee.class);

    private final ProgressTracker progressTracker;
    private final long pollIntervalMillis;

    public ConsistencyGuarantee(ProgressTracker progressTracker) {
        this(progressTracker, DEFAULT_POLL_INTERVAL);
    }

    public ConsistencyGuarantee(ProgressTracker progressTracker, long pollIntervalMillis) {
        this.progressTracker = Objects.requireNonNull(progressTracker, "Progress tracker must be specified");
        if (pollIntervalMillis <= 0) {
            throw new IllegalArgumentException("Poll interval must be positive");
        }
        this.pollIntervalMillis = pollIntervalMillis;
    }

    @Override
    public void afterDispatch(Pipeline pipeline) {
        if (pipeline.getConsistency() != Consistency.STRONG || !pipeline.getExecutionResult().isPresent()) {
            return;
        }
        ExecutionResult result = pipeline.getExecutionResult().get();
        if (result.getAggregateVersion() == result.getVersionBefore()) {
            return;
        }
        for (String handler : progressTracker.stronglyConsistentHandlers()) {
            if (!awaitHandler(pipeline, handler, result.getIdentity(), result.getAggregateVersion())) {
                logger.warn("Handler {} did not process {} up to version {} within dispatch timeout",
                        handler, result.getIdentity(), result.getAggregateVersion());
                pipeline.respond(DispatchResult.failed(DispatchFailure.consistencyTimeout(handler)));
                return;
            }
        }
    }

    private boolean awaitHandler(Pipeline pipeline, String handler, String streamId, long version) {
        while (progressTracker.processedVersion(handler, streamId) < version) {
            long remaining = pipeline.remainingMillis();
            if (remaining == 0) {
                return false;
            }
            long sleep = remaining == DispatchOptions.INFINITY ? pollIntervalMillis
                    : Math.min(pollIntervalMillis, remaining);
            try {
                Thread.sleep(sleep);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }
}
