package io.github.goodees.aggregates.instance;

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
 * Decides how long an aggregate instance should stay in memory after executing a command without receiving another
 * one.
 */
@FunctionalInterface
public interface AggregateLifespan {
    long INFINITY = -1;

    /**
     * Idle timeout after successful execution of given command.
     * @param command the command that was executed
     * @return timeout in milliseconds, or {@link #INFINITY} to keep the instance running
     */
    long afterCommand(Object command);

    static AggregateLifespan stopAfter(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("Timeout must not be negative, use INFINITY instead");
        }
        return command -> millis;
    }
}
