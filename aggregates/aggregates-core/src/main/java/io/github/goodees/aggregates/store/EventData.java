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

import io.github.goodees.aggregates.EventType;
import io.github.goodees.aggregates.ImmutablesStyle;
import org.immutables.value.Value;

import java.util.Map;
import java.util.Optional;

/**
 * An event to be appended to a stream, along with metadata stored outside of the payload.
 */
@Value.Immutable
@ImmutablesStyle
public interface EventData {

    /**
     * The type of event.
     * @return textual type of the event
     * @see EventType#of(Object)
     */
    String getEventType();

    /**
     * The domain event produced by the aggregate.
     * @return event payload
     */
    Object getData();

    Map<String, Object> getMetadata();

    /**
     * Identity of the command that caused the event.
     * @return causation id
     */
    Optional<String> getCausationId();

    Optional<String> getCorrelationId();

    static EventData of(Object event) {
        return ImmutableEventData.builder().eventType(EventType.of(event)).data(event).build();
    }
}
