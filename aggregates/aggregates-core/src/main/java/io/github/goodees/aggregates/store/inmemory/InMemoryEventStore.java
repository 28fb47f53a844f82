package io.github.goodees.aggregates.store.inmemory;

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

import io.github.goodees.aggregates.store.EventData;
import io.github.goodees.aggregates.store.EventStore;
import io.github.goodees.aggregates.store.EventStoreException;
import io.github.goodees.aggregates.store.RecordedEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiFunction;
import java.util.function.Consumer;

import static java.util.stream.Collectors.toList;

/**
 * Event store keeping the streams in memory. Suitable for tests and prototypes.
 */
public class InMemoryEventStore implements EventStore {
    private final ConcurrentMap<String, List<RecordedEvent>> storage = new ConcurrentHashMap<>();

    @Override
    public List<RecordedEvent> appendToStream(String streamId, long expectedVersion, List<EventData> events)
            throws EventStoreException {
        List<RecordedEvent> stream = stream(streamId);
        //ad SynchronizedList - the version check and the append need to be atomic
        synchronized (stream) {
            if (stream.size() != expectedVersion) {
                throw EventStoreException.wrongExpectedVersion(streamId, expectedVersion, stream.size());
            }
            List<RecordedEvent> recorded = new ArrayList<>(events.size());
            long version = expectedVersion;
            for (EventData event : events) {
                recorded.add(RecordedEvent.record(streamId, ++version, event));
            }
            stream.addAll(recorded);
            return Collections.unmodifiableList(recorded);
        }
    }

    /**
     * Current version of a stream.
     * @param streamId identity of the stream
     * @return number of events in the stream
     */
    public long streamVersion(String streamId) {
        return stream(streamId).size();
    }

    private List<RecordedEvent> stream(String streamId) {
        return storage.computeIfAbsent(streamId, (i) -> Collections.synchronizedList(new ArrayList<>()));
    }

    @Override
    public StoredEvents readStreamForward(String streamId, long afterVersion) {
        return new StoredEvents() {
            final List<RecordedEvent> filteredEvents;
            boolean stop = false;

            {
                List<RecordedEvent> events = stream(streamId);
                //ad SynchronizedList - It is imperative that the user manually synchronize on the returned list when iterating over it.
                synchronized (events) {
                    filteredEvents = events.stream().filter(e -> e.getStreamVersion() > afterVersion).collect(toList());
                }
            }

            @Override
            public void foreach(Consumer<? super RecordedEvent> consumer) {
                for (RecordedEvent event : filteredEvents) {
                    if (stop) {
                        break;
                    }
                    consumer.accept(event);
                }
            }

            @Override
            public <R> R reduce(R initial, BiFunction<R, ? super RecordedEvent, R> reducer) {
                R result = initial;
                for (RecordedEvent event : filteredEvents) {
                    if (stop) {
                        break;
                    }
                    result = reducer.apply(result, event);
                }
                return result;
            }

            @Override
            public void stop() {
                stop = true;
            }

            @Override
            public void close() {
            }
        };
    }
}
