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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * Keeps track of live aggregate instances, at most one per aggregate type and stream identity.
 *
 * <p>An instance is created and its load is enqueued on first access. Concurrent callers for the same key obtain the
 * same instance, and as the load is the first task of its mailbox, every operation they enqueue runs after the
 * instance is recovered. Terminated instances remove themselves from the registry, next access creates new instance
 * recovered from the event store.</p>
 */
public class AggregateRegistry {
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final RuntimeConfiguration conf;
    private final ConcurrentMap<AggregateKey, AggregateInstance<?>> instances = new ConcurrentHashMap<>();

    public AggregateRegistry(RuntimeConfiguration conf) {
        this.conf = conf;
    }

    public RuntimeConfiguration getConfiguration() {
        return conf;
    }

    /**
     * Return live instance of the aggregate, or start a new one.
     * @param aggregate the aggregate definition
     * @param identity stream identity of the instance
     * @param <S> type of aggregate state
     * @return the instance, possibly still loading
     */
    public <S> AggregateInstance<S> getOrStart(Aggregate<S> aggregate, String identity) {
        AggregateKey key = AggregateKey.of(aggregate, identity);
        return (AggregateInstance<S>) instances.computeIfAbsent(key, k -> start(k, aggregate));
    }

    private <S> AggregateInstance<S> start(AggregateKey key, Aggregate<S> aggregate) {
        AggregateInstance<S> instance = new AggregateInstance<>(key, aggregate, conf, this::deregister);
        instance.start();
        logger.debug("Started aggregate instance {}", key);
        return instance;
    }

    private void deregister(AggregateInstance<?> instance) {
        if (instances.remove(instance.getKey(), instance)) {
            logger.debug("Removed aggregate instance {}", instance.getKey());
        }
    }

    /**
     * Whether there is a live instance for the aggregate.
     * @param aggregate the aggregate definition
     * @param identity stream identity
     * @return true if instance is registered
     */
    public boolean isRunning(Aggregate<?> aggregate, String identity) {
        return instances.containsKey(AggregateKey.of(aggregate, identity));
    }

    public int runningInstances() {
        return instances.size();
    }

    /**
     * Current state of aggregate, starting the instance if necessary. Blocks until the instance is loaded and all
     * operations enqueued before completed.
     * @param aggregate the aggregate definition
     * @param identity stream identity
     * @param <S> type of aggregate state
     * @return the state
     * @throws AggregateTerminatedException if a failure terminated the instance before the query
     */
    public <S> S aggregateState(Aggregate<S> aggregate, String identity) {
        return query(aggregate, identity, AggregateInstance::state);
    }

    /**
     * Current version of aggregate, starting the instance if necessary.
     * @param aggregate the aggregate definition
     * @param identity stream identity
     * @return the version
     * @throws AggregateTerminatedException if a failure terminated the instance before the query
     */
    public long aggregateVersion(Aggregate<?> aggregate, String identity) {
        return query(aggregate, identity, AggregateInstance::version);
    }

    private <S, T> T query(Aggregate<S> aggregate, String identity,
                           Function<AggregateInstance<S>, CompletableFuture<T>> operation) {
        while (true) {
            AggregateInstance<S> instance = getOrStart(aggregate, identity);
            try {
                return await(operation.apply(instance));
            } catch (AggregateTerminatedException e) {
                if (!e.isStopped()) {
                    throw e;
                }
                logger.debug("Aggregate {} stopped before the query, restarting", instance.getKey());
            }
        }
    }

    /**
     * Terminate live instance of the aggregate, if there is one, and wait until it is terminated.
     * @param aggregate the aggregate definition
     * @param identity stream identity
     */
    public void shutdown(Aggregate<?> aggregate, String identity) {
        AggregateInstance<?> instance = instances.get(AggregateKey.of(aggregate, identity));
        if (instance != null) {
            await(instance.stop());
        }
    }

    /**
     * Terminate all live instances.
     */
    public void shutdownAll() {
        List<CompletableFuture<Void>> stops = new ArrayList<>();
        instances.values().forEach(instance -> stops.add(instance.stop()));
        stops.forEach(AggregateRegistry::await);
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for aggregate", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Aggregate operation failed", cause);
        }
    }
}
