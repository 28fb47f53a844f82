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

import io.github.goodees.aggregates.ImmutablesStyle;
import org.immutables.value.Value;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Event as it was durably stored in a stream.
 */
@Value.Immutable
@ImmutablesStyle
public interface RecordedEvent {

    UUID getEventId();

    String getStreamId();

    /**
     * Version of the stream after this event. The first event of a stream has version 1.
     * @return the stream version
     */
    long getStreamVersion();

    String getEventType();

    Object getData();

    Map<String, Object> getMetadata();

    Optional<String> getCausationId();

    Optional<String> getCorrelationId();

    Instant getCreatedAt();

    /**
     * Record event data at given position of a stream.
     * @param streamId stream identity
     * @param streamVersion version of the stream after this event
     * @param data the appended data
     * @return recorded event
     */
    static RecordedEvent record(String streamId, long streamVersion, EventData data) {
        return ImmutableRecordedEvent.builder()
                .eventId(UUID.randomUUID())
                .streamId(streamId)
                .streamVersion(streamVersion)
                .eventType(data.getEventType())
                .data(data.getData())
                .metadata(data.getMetadata())
                .causationId(data.getCausationId())
                .correlationId(data.getCorrelationId())
                .createdAt(Instant.now())
                .build();
    }
}
