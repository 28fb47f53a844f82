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

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Dependencies of the aggregate runtime.
 */
public interface RuntimeConfiguration {
    String runtimeName();

    /**
     * The thread pool mailboxes of aggregate instances run on. Loading, command execution and queries of instances
     * are invoked within this thread pool. It must not run the submitted tasks on the submitting thread.
     * @return the executor service instance
     */
    ExecutorService executorService();

    /**
     * Thread pool for scheduling idle shutdowns of aggregate instances. <strong>Should be different from
     * executorService!</strong>
     * @return scheduled executor service instance
     */
    ScheduledExecutorService schedulerService();

    EventStore eventStore();
}
