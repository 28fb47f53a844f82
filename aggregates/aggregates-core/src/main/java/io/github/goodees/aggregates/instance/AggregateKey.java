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

import io.github.goodees.aggregates.Aggregate;

import java.util.Objects;

/**
 * Identity of a running aggregate instance: aggregate type together with its stream identity.
 */
public final class AggregateKey {
    private final String aggregateType;
    private final String identity;

    private AggregateKey(String aggregateType, String identity) {
        this.aggregateType = Objects.requireNonNull(aggregateType, "Aggregate type must be specified");
        this.identity = Objects.requireNonNull(identity, "Identity must be specified");
    }

    public static AggregateKey of(String aggregateType, String identity) {
        return new AggregateKey(aggregateType, identity);
    }

    public static AggregateKey of(Aggregate<?> aggregate, String identity) {
        return new AggregateKey(aggregate.aggregateType(), identity);
    }

    public String getAggregateType() {
        return aggregateType;
    }

    /**
     * Stream identity, i. e. the id of the event stream of the aggregate.
     * @return stream identity
     */
    public String getIdentity() {
        return identity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AggregateKey that = (AggregateKey) o;
        return aggregateType.equals(that.aggregateType) && identity.equals(that.identity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateType, identity);
    }

    @Override
    public String toString() {
        return aggregateType + "[" + identity + "]";
    }
}
