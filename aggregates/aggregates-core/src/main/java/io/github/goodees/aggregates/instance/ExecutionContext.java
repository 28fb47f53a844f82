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

import io.github.goodees.aggregates.ImmutablesStyle;
import org.immutables.value.Value;

import java.util.Map;
import java.util.Optional;

/**
 * Everything an aggregate instance needs to execute a single command.
 */
@Value.Immutable
@ImmutablesStyle
public interface ExecutionContext {
    Object getCommand();

    HandlerFunction getFunction();

    /**
     * Metadata attached to every produced event.
     */
    Map<String, Object> getMetadata();

    Map<String, Object> getAssigns();

    @Value.Default
    default AggregateLifespan getLifespan() {
        return DefaultLifespan.INSTANCE;
    }

    /**
     * Id of the command, recorded as causation id of produced events.
     */
    Optional<String> getCausationId();

    Optional<String> getCorrelationId();
}
