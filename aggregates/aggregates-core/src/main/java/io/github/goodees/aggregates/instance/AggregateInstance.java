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
import io.github.goodees.aggregates.EventType;
import io.github.goodees.aggregates.store.EventData;
import io.github.goodees.aggregates.store.EventStore;
import io.github.goodees.aggregates.store.EventStoreException;
import io.github.goodees.aggregates.store.ImmutableEventData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Single live instance of an aggregate. Holds the state reconstructed from the event stream of the aggregate and is the
 * only writer to that stream within the process.
 *
 * <h2>Lifecycle</h2>
 * <p>Every operation of an instance is a task in its {@link Mailbox}, so at most one of them runs at a time and they
 * run in order of submission. The first task is the load, which replays the whole stream, oldest event first, and folds
 * each event into the state with {@link Aggregate#apply(Object, Object)}.</p>
 *
 * <p>Command execution invokes the handler function with current state and the command. The produced events are
 * appended to the stream with expected version equal to current version of the instance. Only after the store accepted
 * them they are applied to the state. When the handler throws, when the store rejects the append or when the events
 * cannot be applied, the instance {@linkplain InstanceState#TERMINATED terminates}. Nothing is applied to its state and
 * the next access via {@link AggregateRegistry} recovers a fresh instance from the store.</p>
 *
 * @param <S> type of aggregate state
 */
public class AggregateInstance<S> {
    private static final Logger logger = LoggerFactory.getLogger(AggregateInstance.class);

    private final AggregateKey key;
    private final Aggregate<S> aggregate;
    private final RuntimeConfiguration conf;
    private final Mailbox mailbox;
    private final Consumer<AggregateInstance<?>> terminationListener;

    private volatile InstanceState lifecycle = InstanceState.UNSTARTED;
    // accessed only within mailbox tasks
    private S state;
    private long version;
    private Throwable terminationCause;
    private long executions;
    private ScheduledFuture<?> idleTimeout;

    AggregateInstance(AggregateKey key, Aggregate<S> aggregate, RuntimeConfiguration conf,
                      Consumer<AggregateInstance<?>> terminationListener) {
        this.key = key;
        this.aggregate = aggregate;
        this.conf = conf;
        this.terminationListener = terminationListener;
        this.mailbox = new Mailbox(conf.runtimeName() + "." + key, conf.executorService());
    }

    /**
     * Enqueue the load of the instance. Must be called exactly once, before any other operation.
     */
    void start() {
        mailbox.enqueue(this::load);
    }

    public AggregateKey getKey() {
        return key;
    }

    public InstanceState getLifecycle() {
        return lifecycle;
    }

    /**
     * Execute a command. The returned future completes with the result when the produced events were persisted, or
     * exceptionally with the failure that terminated the instance. When the instance was stopped before the execution
     * started, the future fails with {@link AggregateTerminatedException} that {@linkplain
     * AggregateTerminatedException#isStopped() is a stop}, and the command may be sent to a new instance.
     * @param context command and its handler function
     * @return future result of the execution
     */
    public CompletableFuture<ExecutionResult> execute(ExecutionContext context) {
        Objects.requireNonNull(context, "Execution context must be provided");
        return mailbox.enqueue(() -> doExecute(context));
    }

    /**
     * Current state of the aggregate, after all preceding operations completed.
     * @return future state
     */
    public CompletableFuture<S> state() {
        return mailbox.enqueue(() -> {
            ensureRunning();
            return state;
        });
    }

    /**
     * Current version of the aggregate, i. e. number of events in its stream.
     * @return future version
     */
    public CompletableFuture<Long> version() {
        return mailbox.enqueue(() -> {
            ensureRunning();
            return version;
        });
    }

    /**
     * Terminate the instance after all preceding operations completed.
     * @return future completing after termination
     */
    public CompletableFuture<Void> stop() {
        return mailbox.enqueue(() -> {
            terminate(null);
            return null;
        });
    }

    private Void load() {
        lifecycle = InstanceState.LOADING;
        long start = System.nanoTime();
        try (EventStore.StoredEvents events = conf.eventStore().readStreamForward(key.getIdentity())) {
            state = aggregate.initialState();
            events.foreach(event -> {
                state = aggregate.apply(state, event.getData());
                version++;
            });
        } catch (RuntimeException e) {
            logger.error("Aggregate {} failed to recover", key, e);
            terminate(e);
            throw e;
        }
        lifecycle = InstanceState.READY;
        logger.debug("Aggregate {} recovered at version {} in {} ms", key, version,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        return null;
    }

    private ExecutionResult doExecute(ExecutionContext context) throws Exception {
        ensureRunning();
        executions++;
        cancelIdleTimeout();
        lifecycle = InstanceState.EXECUTING;
        long versionBefore = version;

        List<Object> events;
        try {
            events = normalize(context.getFunction().invoke(state, context.getCommand()));
        } catch (Throwable t) {
            logger.info("Aggregate {} failed to execute {}", key, context.getCommand(), t);
            terminate(t);
            throw t;
        }

        if (!events.isEmpty()) {
            List<EventData> eventData = events.stream()
                    .map(event -> toEventData(event, context))
                    .collect(Collectors.toList());
            try {
                conf.eventStore().appendToStream(key.getIdentity(), versionBefore, eventData);
            } catch (EventStoreException e) {
                if (e.isWrongExpectedVersion()) {
                    logger.warn("Aggregate {} at version {} is not the only writer of its stream", key, versionBefore);
                } else {
                    logger.error("Aggregate {} failed to persist {} events", key, events.size(), e);
                }
                terminate(e);
                throw e;
            } catch (RuntimeException e) {
                logger.error("Aggregate {} failed to persist {} events", key, events.size(), e);
                terminate(e);
                throw e;
            }
            try {
                for (Object event : events) {
                    state = aggregate.apply(state, event);
                }
            } catch (RuntimeException e) {
                logger.error("Aggregate {} failed to apply persisted events", key, e);
                terminate(e);
                throw e;
            }
            version = versionBefore + events.size();
        }
        lifecycle = InstanceState.READY;
        scheduleIdleTimeout(context);
        return ImmutableExecutionResult.builder()
                .aggregateType(key.getAggregateType())
                .identity(key.getIdentity())
                .versionBefore(versionBefore)
                .aggregateVersion(version)
                .events(events)
                .metadata(context.getMetadata())
                .build();
    }

    static List<Object> normalize(Object result) {
        if (result == null) {
            return Collections.emptyList();
        }
        Collection<?> events;
        if (result instanceof Collection) {
            events = (Collection<?>) result;
        } else if (result instanceof Object[]) {
            events = Arrays.asList((Object[]) result);
        } else {
            return Collections.singletonList(result);
        }
        List<Object> normalized = new ArrayList<>(events.size());
        for (Object event : events) {
            if (event != null) {
                normalized.add(event);
            }
        }
        return normalized;
    }

    private static EventData toEventData(Object event, ExecutionContext context) {
        return ImmutableEventData.builder()
                .eventType(EventType.of(event))
                .data(event)
                .metadata(context.getMetadata())
                .causationId(context.getCausationId())
                .correlationId(context.getCorrelationId())
                .build();
    }

    private void scheduleIdleTimeout(ExecutionContext context) {
        long timeout = context.getLifespan().afterCommand(context.getCommand());
        if (timeout < 0) {
            return;
        }
        long execution = executions;
        try {
            idleTimeout = conf.schedulerService().schedule(() -> mailbox.enqueue(() -> idle(execution)),
                    timeout, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.warn("Cannot schedule idle timeout of aggregate {}, scheduler is shut down", key);
        }
    }

    private void cancelIdleTimeout() {
        if (idleTimeout != null) {
            idleTimeout.cancel(false);
            idleTimeout = null;
        }
    }

    private Void idle(long execution) {
        if (execution != executions || lifecycle != InstanceState.READY) {
            return null;
        }
        if (mailbox.backlog() > 0) {
            // not idle, check again after the queued tasks
            mailbox.enqueue(() -> idle(execution));
        } else {
            logger.debug("Aggregate {} stopping after idle timeout", key);
            terminate(null);
        }
        return null;
    }

    private void ensureRunning() {
        if (lifecycle == InstanceState.TERMINATED) {
            throw new AggregateTerminatedException(key, terminationCause);
        }
    }

    private void terminate(Throwable cause) {
        if (lifecycle == InstanceState.TERMINATED) {
            return;
        }
        lifecycle = InstanceState.TERMINATED;
        terminationCause = cause;
        state = null;
        cancelIdleTimeout();
        terminationListener.accept(this);
        logger.debug("Aggregate {} terminated at version {}", key, version);
    }

    @Override
    public String toString() {
        return "AggregateInstance[" + key + ", " + lifecycle + "]";
    }
}
