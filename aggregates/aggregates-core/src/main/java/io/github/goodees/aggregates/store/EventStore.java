package io.github.goodees.aggregates.store;

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

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Append-only storage of aggregate events, one stream per aggregate identity.
 *
 * <p>Appending a batch of events constitutes a separate non-distributed transaction, that is atomic per stream.
 * The store needs to guarantee consistency of the stream across processes by checking the expected version of the
 * stream on every append. This check is the only protection against concurrent writers outside of this process.</p>
 */
public interface EventStore {

    /**
     * Expected version of a stream that has no events.
     */
    long NO_STREAM = 0;

    /**
     * Append events to the end of a stream.
     * @param streamId identity of the stream
     * @param expectedVersion number of events the caller believes the stream contains
     * @param events events to append, in order
     * @return the recorded events with their assigned stream versions
     * @throws EventStoreException with fault {@link EventStoreException.Fault#WRONG_EXPECTED_VERSION} when the stream
     *         does not have expected version, or any other fault when storing fails
     */
    List<RecordedEvent> appendToStream(String streamId, long expectedVersion, List<EventData> events)
            throws EventStoreException;

    /**
     * Read all events of a stream that happened after specified version.
     * @param streamId identity of the stream
     * @param afterVersion events that happened after this version. 0 stands for uninitialized, will therefore return
     *                     entire history
     * @return accessor for the events in order they appeared in history
     */
    StoredEvents readStreamForward(String streamId, long afterVersion);

    /**
     * Read entire stream, oldest event first.
     * @param streamId identity of the stream
     * @return accessor for the events in order they appeared in history
     */
    default StoredEvents readStreamForward(String streamId) {
        return readStreamForward(streamId, NO_STREAM);
    }

    /**
     * Accessor that enables single iteration over found events.
     * The underlying idea is, that the events needs not to be materialized at once, rather it could for example wrap a JDBC
     * ResultSet. This also means that only one of methods foreach and reduce may be called on single instance, and
     * only once.
     */
    interface StoredEvents extends AutoCloseable {
        /**
         * Iterate over all found events. Consumer may call {@link #stop()} to stop the iteration.
         * @param consumer consumer that will receive the events
         */
        void foreach(Consumer<? super RecordedEvent> consumer);

        /**
         * Perform a reduction over all found events. Reducer may call {@link #stop()} to stop the process.
         * @param initial Initial value for reduction
         * @param reducer the reducer function
         * @param <R> type of result
         * @return result of reduction.
         */
        <R> R reduce(R initial, BiFunction<R, ? super RecordedEvent, R> reducer);

        /**
         * Can be called from within the lambda functions to stop the iteration after current step.
         */
        void stop();

        // will not throw exception
        @Override
        void close();
    }
}
