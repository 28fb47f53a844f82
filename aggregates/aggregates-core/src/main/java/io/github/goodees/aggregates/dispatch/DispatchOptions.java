package io.github.goodees.aggregates.dispatch;

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

import io.github.goodees.aggregates.instance.AggregateLifespan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Per dispatch options. Options that are not set fall back to defaults of the route.
 */
public final class DispatchOptions {
    /**
     * Timeout value for waiting indefinitely.
     */
    public static final long INFINITY = -1;

    private static final DispatchOptions DEFAULTS = builder().build();

    private final Consistency consistency;
    private final Long timeout;
    private final boolean includeAggregateVersion;
    private final boolean includeExecutionResult;
    private final Map<String, Object> metadata;
    private final Map<String, Object> assigns;
    private final AggregateLifespan lifespan;

    private DispatchOptions(Builder builder) {
        this.consistency = builder.consistency;
        this.timeout = builder.timeout;
        this.includeAggregateVersion = builder.includeAggregateVersion;
        this.includeExecutionResult = builder.includeExecutionResult;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.assigns = Collections.unmodifiableMap(new LinkedHashMap<>(builder.assigns));
        this.lifespan = builder.lifespan;
    }

    public static DispatchOptions defaults() {
        return DEFAULTS;
    }

    public static DispatchOptions timeout(long timeoutMillis) {
        return builder().timeout(timeoutMillis).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Consistency> getConsistency() {
        return Optional.ofNullable(consistency);
    }

    public OptionalLong getTimeout() {
        return timeout == null ? OptionalLong.empty() : OptionalLong.of(timeout);
    }

    public boolean isIncludeAggregateVersion() {
        return includeAggregateVersion;
    }

    public boolean isIncludeExecutionResult() {
        return includeExecutionResult;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Map<String, Object> getAssigns() {
        return assigns;
    }

    public Optional<AggregateLifespan> getLifespan() {
        return Optional.ofNullable(lifespan);
    }

    public static class Builder {
        private Consistency consistency;
        private Long timeout;
        private boolean includeAggregateVersion;
        private boolean includeExecutionResult;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private final Map<String, Object> assigns = new LinkedHashMap<>();
        private AggregateLifespan lifespan;

        private Builder() {
        }

        public Builder consistency(Consistency consistency) {
            this.consistency = Objects.requireNonNull(consistency, "Consistency must not be null");
            return this;
        }

        /**
         * Time to wait for the dispatch in milliseconds.
         * @param timeoutMillis milliseconds or {@link #INFINITY}
         * @return this
         */
        public Builder timeout(long timeoutMillis) {
            if (timeoutMillis < 0 && timeoutMillis != INFINITY) {
                throw new IllegalArgumentException("Timeout must not be negative: " + timeoutMillis);
            }
            this.timeout = timeoutMillis;
            return this;
        }

        public Builder includeAggregateVersion(boolean include) {
            this.includeAggregateVersion = include;
            return this;
        }

        /**
         * Include the execution result in the response. Takes precedence over
         * {@link #includeAggregateVersion(boolean)}.
         * @param include whether to include the result
         * @return this
         */
        public Builder includeExecutionResult(boolean include) {
            this.includeExecutionResult = include;
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(Objects.requireNonNull(key), Objects.requireNonNull(value));
            return this;
        }

        public Builder metadata(Map<String, ?> metadata) {
            metadata.forEach(this::metadata);
            return this;
        }

        public Builder assign(String key, Object value) {
            this.assigns.put(Objects.requireNonNull(key), Objects.requireNonNull(value));
            return this;
        }

        public Builder assigns(Map<String, ?> assigns) {
            assigns.forEach(this::assign);
            return this;
        }

        public Builder lifespan(AggregateLifespan lifespan) {
            this.lifespan = Objects.requireNonNull(lifespan);
            return this;
        }

        public DispatchOptions build() {
            return new DispatchOptions(this);
        }
    }
}
