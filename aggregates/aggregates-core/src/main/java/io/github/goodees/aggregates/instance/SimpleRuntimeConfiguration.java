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

import io.github.goodees.aggregates.store.EventStore;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * General runtime configuration implementation, as alternative to defining own implementation. Its dependencies are
 * passed to constructor.
 */
public class SimpleRuntimeConfiguration implements RuntimeConfiguration {
    private final String name;
    private final ExecutorService executorService;
    private final ScheduledExecutorService schedulerService;
    private final EventStore eventStore;

    /**
     * Create runtime configuration.
     * @param name the name of the runtime
     * @param executorService executor service to use
     * @param schedulerService scheduler service to use
     * @param eventStore event store aggregates are persisted into
     */
    public SimpleRuntimeConfiguration(String name, ExecutorService executorService,
                                      ScheduledExecutorService schedulerService, EventStore eventStore) {
        this.name = Objects.requireNonNull(name, "Name must be specified");
        this.executorService = Objects.requireNonNull(executorService, "Executor service must be specified");
        this.schedulerService = Objects.requireNonNull(schedulerService, "Scheduled executor must be specified");
        this.eventStore = Objects.requireNonNull(eventStore, "Event store must be specified");
        if (executorService == schedulerService) {
            throw new IllegalArgumentException("Executor service and scheduled executor must be different");
        }
    }

    /**
     * Create runtime configuration with own thread pools. Executor has one daemon thread per available processor,
     * scheduler has a single daemon thread.
     * @param name the name of the runtime, used for naming the threads
     * @param eventStore event store aggregates are persisted into
     * @return new configuration
     */
    public static SimpleRuntimeConfiguration withDefaultExecutors(String name, EventStore eventStore) {
        return new SimpleRuntimeConfiguration(name,
                Executors.newFixedThreadPool(Runtime.getRuntime().availableProcessors(), daemonThreads(name + "-worker")),
                Executors.newSingleThreadScheduledExecutor(daemonThreads(name + "-scheduler")),
                eventStore);
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public String runtimeName() {
        return name;
    }

    @Override
    public ExecutorService executorService() {
        return executorService;
    }

    @Override
    public ScheduledExecutorService schedulerService() {
        return schedulerService;
    }

    @Override
    public EventStore eventStore() {
        return eventStore;
    }
}
