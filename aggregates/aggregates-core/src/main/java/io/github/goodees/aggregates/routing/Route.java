package io.github.goodees.aggregates.routing;

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

import io.github.goodees.aggregates.Aggregate;
import io.github.goodees.aggregates.dispatch.Consistency;
import io.github.goodees.aggregates.instance.AggregateLifespan;
import io.github.goodees.aggregates.instance.HandlerFunction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registered binding of a command type to its handler. Routes without aggregate are handled by plain handlers, their
 * function is invoked with the command and the pipeline assigns.
 */
public final class Route {
    private final Class<?> commandType;
    private final Object handler;
    private final String functionName;
    private final HandlerFunction function;
    private final Aggregate<?> aggregate;
    private final IdentityExtractor identityExtractor;
    private final String identityPrefix;
    private final Consistency consistency;
    private final long timeout;
    private final AggregateLifespan lifespan;
    private final Map<String, Object> assigns;

    Route(Class<?> commandType, Object handler, String functionName, HandlerFunction function,
          Aggregate<?> aggregate, IdentityExtractor identityExtractor, String identityPrefix,
          Consistency consistency, long timeout, AggregateLifespan lifespan, Map<String, Object> assigns) {
        this.commandType = commandType;
        this.handler = handler;
        this.functionName = functionName;
        this.function = function;
        this.aggregate = aggregate;
        this.identityExtractor = identityExtractor;
        this.identityPrefix = identityPrefix;
        this.consistency = consistency;
        this.timeout = timeout;
        this.lifespan = lifespan;
        this.assigns = Collections.unmodifiableMap(new LinkedHashMap<>(assigns));
    }

    public Class<?> getCommandType() {
        return commandType;
    }

    public Object getHandler() {
        return handler;
    }

    public String getFunctionName() {
        return functionName;
    }

    public HandlerFunction getFunction() {
        return function;
    }

    /**
     * Target aggregate of the route.
     * @return the aggregate, empty for routes to plain handlers
     */
    public Optional<Aggregate<?>> getAggregate() {
        return Optional.ofNullable(aggregate);
    }

    public IdentityExtractor getIdentityExtractor() {
        return identityExtractor;
    }

    /**
     * Prefix of the stream identity.
     * @return prefix, empty string when none was configured
     */
    public String getIdentityPrefix() {
        return identityPrefix;
    }

    public Consistency getConsistency() {
        return consistency;
    }

    public long getTimeout() {
        return timeout;
    }

    public AggregateLifespan getLifespan() {
        return lifespan;
    }

    public Map<String, Object> getAssigns() {
        return assigns;
    }

    @Override
    public String toString() {
        return "Route[" + commandType.getSimpleName() + " -> " + handler.getClass().getSimpleName() + "."
                + functionName + "]";
    }
}
