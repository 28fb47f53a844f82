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

/**
 * Common interface for serialization and deserialization into String payload. Event stores utilize this to define
 * application-specific conversions of event payloads and metadata.
 * <p>We expect that during lifetime of the project, the serialization scenarios might change. Whenever the serialized
 * object changes in incompatible manner, serialization should start using different unique payload version for it.</p>
 * <p>Payload version will be stored separately by the store, and will be provided to method {@link #deserialize(int, String, String)}</p>
 */
public interface Serialization<T> {
    /**
     * Determine version of payload to be used for serialization.
     * @param object object to be serialized
     * @return payload version.
     */
    int payloadVersion(T object);

    /**
     * Serialize the object into a String payload.
     * @param object object to serialize
     * @return String serialization of the object
     * @throws IllegalArgumentException when the object cannot be serialized
     */
    String serialize(T object);

    /**
     * Deserialize a payload given its version. As noted above, serialization must support reading all past versions
     * of payloads.
     *
     * @param payloadVersion the version of the payload as stored in the store
     * @param payload payload to deserialize
     * @param type a type discriminator if supported by underlying storage, <code>null</code> otherwise
     * @return deserialized object or null if the payload is not recognized
     */
    T deserialize(int payloadVersion, String payload, String type);

    /**
     * Return object of correct type, if its class is supported.
     *
     * @param o object to cast
     * @return casted object, or <code>null</code> if instance is of unsupported type.
     */
    T toSerializable(Object o);
}
