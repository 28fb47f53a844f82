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

import java.util.List;
import java.util.Map;

/**
 * Outcome of successful command execution.
 */
@Value.Immutable
@ImmutablesStyle
public interface ExecutionResult {
    String getAggregateType();

    String getIdentity();

    long getVersionBefore();

    /**
     * Version of the aggregate after the events were appended. Equal to {@link #getVersionBefore()} when the command
     * produced no events.
     */
    long getAggregateVersion();

    List<Object> getEvents();

    Map<String, Object> getMetadata();
}
