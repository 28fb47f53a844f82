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
 * Thrown for operations, that reached an aggregate instance after it terminated. The cause, if present, is the failure
 * that terminated the instance.
 */
public class AggregateTerminatedException extends RuntimeException {
    private final AggregateKey key;

    public AggregateTerminatedException(AggregateKey key, Throwable cause) {
        super("Aggregate " + key + " is terminated", cause);
        this.key = key;
    }

    public AggregateKey getKey() {
        return key;
    }

    /**
     * Whether the instance was stopped, by idle timeout or shutdown, rather than terminated by a failure.
     * @return true if there is no failure behind the termination
     */
    public boolean isStopped() {
        return getCause() == null;
    }
}
