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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Serial task queue of single aggregate instance. Tasks run one at a time, in order they were enqueued, on a shared
 * executor service. The mailbox occupies at most one of its threads at a time.
 * <p>Hand-over between enqueuing threads and the processing thread is lock free. The mailbox counts tasks that were
 * enqueued and did not finish yet. The enqueue that raises the count from zero starts the processing, and the
 * processing continues with next task as long as the count stays above zero after a task finished.</p>
 * <p>Tasks cannot be withdrawn. Once enqueued, a task runs even if the one who enqueued it stopped waiting for it.</p>
 */
class Mailbox {
    private final String name;
    private final ExecutorService executorService;
    private final Logger logger;
    private final Queue<Task<?>> tasks = new ConcurrentLinkedQueue<>();
    // enqueued and not finished, including the running one
    private final AtomicInteger unfinished = new AtomicInteger();

    Mailbox(String name, ExecutorService executorService) {
        this.name = name;
        this.executorService = executorService;
        this.logger = LoggerFactory.getLogger(Mailbox.class.getName() + "." + name);
    }

    /**
     * Add an action to the queue. The returned future completes with the outcome of the action. It is a copy of the
     * mailbox's own future, so neither completing nor cancelling it affects the action.
     * @param action action to run
     * @param <T> type of result
     * @return the promise for the result
     */
    <T> CompletableFuture<T> enqueue(Callable<T> action) {
        Task<T> task = new Task<>(action);
        tasks.add(task);
        if (unfinished.getAndIncrement() == 0) {
            logger.trace("Mailbox {} starts processing", name);
            executorService.execute(this::processNext);
        }
        return task.result.copy();
    }

    /**
     * Number of tasks waiting behind the running one. Meaningful only when called from a running task.
     * @return number of queued tasks
     */
    int backlog() {
        return Math.max(0, unfinished.get() - 1);
    }

    private void processNext() {
        // every counted task was added to the queue before it was counted
        Task<?> task = tasks.poll();
        if (task == null) {
            logger.error("Mailbox {} counts {} unfinished tasks, but its queue is empty", name, unfinished.get());
            return;
        }
        task.run();
        if (unfinished.decrementAndGet() > 0) {
            executorService.execute(this::processNext);
        } else {
            logger.trace("Mailbox {} is empty", name);
        }
    }

    private class Task<T> {
        private final Callable<T> action;
        private final CompletableFuture<T> result = new CompletableFuture<>();
        private final long enqueuedNanos = System.nanoTime();

        Task(Callable<T> action) {
            this.action = action;
        }

        void run() {
            long waited = System.nanoTime() - enqueuedNanos;
            try {
                result.complete(action.call());
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
            if (logger.isTraceEnabled()) {
                logger.trace("Task of {} waited {} ms, ran {} ms", name, TimeUnit.NANOSECONDS.toMillis(waited),
                        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - enqueuedNanos - waited));
            }
        }
    }
}
