package io.github.goodees.aggregates.subscription;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Progress tracker, where event handlers acknowledge processed events themselves.
 */
public class InMemoryProgressTracker implements ProgressTracker {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryProgressTracker.class);

    private final Set<String> stronglyConsistent = ConcurrentHashMap.newKeySet();
    private final ConcurrentMap<String, ConcurrentMap<String, Long>> progress = new ConcurrentHashMap<>();

    /**
     * Register a handler that strongly consistent dispatches will wait for.
     * @param handlerName name of the handler
     * @return this
     */
    public InMemoryProgressTracker registerStronglyConsistent(String handlerName) {
        stronglyConsistent.add(handlerName);
        return this;
    }

    /**
     * Acknowledge that the handler processed the stream up to given version. Acknowledging older version than already
     * acknowledged has no effect.
     * @param handlerName name of the handler
     * @param streamId identity of the stream
     * @param version processed version
     */
    public void ack(String handlerName, String streamId, long version) {
        progress.computeIfAbsent(handlerName, k -> new ConcurrentHashMap<>())
                .merge(streamId, version, Math::max);
        logger.trace("Handler {} processed {} up to version {}", handlerName, streamId, version);
    }

    @Override
    public Set<String> stronglyConsistentHandlers() {
        return Collections.unmodifiableSet(stronglyConsistent);
    }

    @Override
    public long processedVersion(String handlerName, String streamId) {
        ConcurrentMap<String, Long> handlerProgress = progress.get(handlerName);
        if (handlerProgress == null) {
            return 0;
        }
        return handlerProgress.getOrDefault(streamId, 0L);
    }
}
