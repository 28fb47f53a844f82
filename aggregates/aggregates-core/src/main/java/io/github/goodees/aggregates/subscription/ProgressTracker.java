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

import java.util.Collections;
import java.util.Set;

/**
 * View of event handler progress, used for waiting on strongly consistent handlers after a command was dispatched with
 * {@code STRONG} consistency.
 */
public interface ProgressTracker {

    /**
     * Tracker without any strongly consistent handler. Strongly consistent dispatches complete immediately.
     */
    ProgressTracker NONE = new ProgressTracker() {
        @Override
        public Set<String> stronglyConsistentHandlers() {
            return Collections.emptySet();
        }

        @Override
        public long processedVersion(String handlerName, String streamId) {
            return Long.MAX_VALUE;
        }
    };

    /**
     * Names of the event handlers a strongly consistent dispatch waits for.
     * @return handler names
     */
    Set<String> stronglyConsistentHandlers();

    /**
     * Highest version of a stream the handler has processed.
     * @param handlerName name of the handler
     * @param streamId identity of the stream
     * @return processed version, {@code 0} if the handler has not seen any event of the stream
     */
    long processedVersion(String handlerName, String streamId);
}
