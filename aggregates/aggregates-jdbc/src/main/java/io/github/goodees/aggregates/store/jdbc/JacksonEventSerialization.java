package io.github.goodees.aggregates.store.jdbc;

/*-
 * #%L
 * aggregates-jdbc
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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.goodees.aggregates.EventType;
import io.github.goodees.aggregates.store.Serialization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * JSON serialization of registered event classes. Events are recognized by their {@linkplain EventType type name},
 * so an Immutables event registered by its abstract value type accepts instances of the generated implementation.
 */
public class JacksonEventSerialization implements Serialization<Object> {
    private static final Logger logger = LoggerFactory.getLogger(JacksonEventSerialization.class);
    static final int PAYLOAD_VERSION = 1;

    private final ObjectMapper mapper;
    private final Map<String, Class<?>> types = new ConcurrentHashMap<>();

    public JacksonEventSerialization() {
        this(JacksonMappers.createMapper());
    }

    public JacksonEventSerialization(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Register event classes.
     * @param eventTypes classes of events, type names of which are derived by {@link EventType#defaultTypeName(Class)}
     * @return this
     */
    public JacksonEventSerialization register(Class<?>... eventTypes) {
        for (Class<?> type : eventTypes) {
            Class<?> previous = types.putIfAbsent(EventType.defaultTypeName(type), type);
            if (previous != null && previous != type) {
                throw new IllegalArgumentException("Event type " + EventType.defaultTypeName(type)
                        + " is already registered for " + previous.getName());
            }
        }
        return this;
    }

    @Override
    public int payloadVersion(Object object) {
        return PAYLOAD_VERSION;
    }

    @Override
    public String serialize(Object object) {
        try {
            return mapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + object, e);
        }
    }

    @Override
    public Object deserialize(int payloadVersion, String payload, String type) {
        Class<?> eventClass = types.get(type);
        if (eventClass == null || payloadVersion != PAYLOAD_VERSION) {
            return null;
        }
        try {
            return mapper.readValue(payload, eventClass);
        } catch (JsonProcessingException e) {
            logger.warn("Cannot deserialize event of type {}", type, e);
            return null;
        }
    }

    @Override
    public Object toSerializable(Object o) {
        return o != null && types.containsKey(EventType.of(o)) ? o : null;
    }
}
