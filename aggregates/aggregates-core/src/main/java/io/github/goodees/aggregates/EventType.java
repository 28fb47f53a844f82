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
 * Naming of event types as they are recorded in the event store.
 */
public final class EventType {
    private static final String IMMUTABLE_PREFIX = "Immutable";

    private EventType() {
    }

    /**
     * Type name of an event object. Events generated by Immutables are named after their abstract value type.
     * @param event the event
     * @return type name of the event
     */
    public static String of(Object event) {
        return defaultTypeName(event.getClass());
    }

    /**
     * Default type name of event class, its simple name without Immutable prefix.
     * @param eventClass the class of event
     * @return Simple name. ImmutableMoneyDeposited becomes MoneyDeposited.
     */
    public static String defaultTypeName(Class<?> eventClass) {
        String name = eventClass.getSimpleName();
        return name.startsWith(IMMUTABLE_PREFIX) && name.length() > IMMUTABLE_PREFIX.length()
                ? name.substring(IMMUTABLE_PREFIX.length())
                : name;
    }
}
