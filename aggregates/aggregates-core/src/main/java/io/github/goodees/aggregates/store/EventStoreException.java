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
 * Exception generated when storing of events fails.
 */
public class EventStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        WRONG_EXPECTED_VERSION, TX_ERROR, PROGRAMMATIC_ERROR
    }

    protected EventStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public boolean isWrongExpectedVersion() {
        return fault == Fault.WRONG_EXPECTED_VERSION;
    }

    public static EventStoreException wrongExpectedVersion(String streamId, long expectedVersion) {
        return new EventStoreException(Fault.WRONG_EXPECTED_VERSION, "Known stream " + streamId
                + " version differs from expected version " + expectedVersion, null);
    }

    public static EventStoreException wrongExpectedVersion(String streamId, long expectedVersion, long actualVersion) {
        return new EventStoreException(Fault.WRONG_EXPECTED_VERSION, "Stream " + streamId + " append expected version "
                + expectedVersion + " while last known version is " + actualVersion, null);
    }

    public static EventStoreException storeFailed(String streamId, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR,
            "Store of stream " + streamId + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException unsupported(EventData event) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Unsupported event type: " + event.getEventType(),
            null);
    }

    public static EventStoreException serializationFailed(String streamId, Throwable cause) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Events of stream " + streamId
                + " could not be serialized. " + cause.getMessage(), cause);
    }
}
