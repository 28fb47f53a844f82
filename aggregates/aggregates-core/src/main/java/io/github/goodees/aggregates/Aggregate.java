package io.github.goodees.aggregates;

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
 * Definition of an event sourced aggregate. The aggregate itself holds no state, it describes how state of a single
 * aggregate instance is created and how it evolves as the events are applied to it.
 *
 * <p>The state <strong>only</strong> changes as result of {@link #apply(Object, Object)}, both when past events are
 * replayed during recovery and when new events were persisted during command execution. Command handling functions
 * receive the current state and the command and return the events to persist; they must not change the state.</p>
 *
 * <p>Commands routed directly to an aggregate are handled by its public two argument methods (by default named
 * {@code execute}) taking the state as first and the command as second argument.</p>
 *
 * @param <S> type of aggregate state
 * @see io.github.goodees.aggregates.routing.Router
 */
public interface Aggregate<S> {

    /**
     * State of an aggregate that has not seen any event yet.
     * @return the initial state
     */
    S initialState();

    /**
     * Apply an event to the state. This method must be very robust - it may not throw an exception under any input
     * that was accepted by the event store, otherwise the aggregate cannot be recovered.
     * @param state current state
     * @param event persisted event
     * @return state after applying the event, may be the same (mutated) instance
     */
    S apply(S state, Object event);

    /**
     * Name of the aggregate type. Together with the stream identity it forms the key of a live instance.
     * @return type name, simple class name by default
     */
    default String aggregateType() {
        return getClass().getSimpleName();
    }
}
