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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.goodees.aggregates.store.Serialization;

import java.util.Collections;
import java.util.Map;

/**
 * Event metadata as JSON object.
 */
public class JacksonMetadataSerialization implements Serialization<Map<String, Object>> {
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {
    };

    private final ObjectMapper mapper;

    public JacksonMetadataSerialization() {
        this(JacksonMappers.createMapper());
    }

    public JacksonMetadataSerialization(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public int payloadVersion(Map<String, Object> object) {
        return 1;
    }

    @Override
    public String serialize(Map<String, Object> object) {
        try {
            return mapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize metadata " + object, e);
        }
    }

    @Override
    public Map<String, Object> deserialize(int payloadVersion, String payload, String type) {
        try {
            Map<String, Object> metadata = mapper.readValue(payload, MAP_TYPE);
            return metadata == null ? Collections.emptyMap() : metadata;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot deserialize metadata " + payload, e);
        }
    }

    @Override
    public Map<String, Object> toSerializable(Object o) {
        return o instanceof Map ? (Map<String, Object>) o : null;
    }
}
