package io.github.goodees.aggregates.middleware;

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

import io.github.goodees.aggregates.dispatch.Consistency;
import io.github.goodees.aggregates.dispatch.DispatchFailure;
import io.github.goodees.aggregates.dispatch.DispatchOptions;
import io.github.goodees.aggregates.example.bank.BankAccount;
import io.github.goodees.aggregates.example.bank.OpenAccount;
import io.github.goodees.aggregates.instance.AggregateRegistry;
import io.github.goodees.aggregates.instance.ExecutionResult;
import io.github.goodees.aggregates.instance.ImmutableExecutionResult;
import io.github.goodees.aggregates.instance.SimpleRuntimeConfiguration;
import io.github.goodees.aggregates.routing.Route;
import io.github.goodees.aggregates.routing.Router;
import io.github.goodees.aggregates.store.inmemory.InMemoryEventStore;
import io.github.goodees.aggregates.subscription.InMemoryProgressTracker;
import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.junit.Test;

import java.util.Collections;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertFalse;

public class ConsistencyGuaranteeTest {
    private static SimpleRuntimeConfiguration conf;
    private static Route route;

    private final InMemoryProgressTracker progress = new InMemoryProgressTracker()
            .registerStronglyConsistent("read-model")
            .registerStronglyConsistent("notifications");
    private final ConsistencyGuarantee guarantee = new ConsistencyGuarantee(progress, 5);

    @BeforeClass
    public static void createRoute() {
        conf = SimpleRuntimeConfiguration.withDefaultExecutors("consistency", new InMemoryEventStore());
        BankAccount account = new BankAccount();
        route = Router.builder(new AggregateRegistry(conf))
                .dispatch(OpenAccount.class, r -> r.to(account).identity("accountNumber"))
                .build()
                .route(OpenAccount.class).get();
    }

    @AfterClass
    public static void shutdown() {
        conf.executorService().shutdownNow();
        conf.schedulerService().shutdownNow();
    }

    private static Pipeline executed(Consistency consistency, long timeout, long versionBefore, long version) {
        Pipeline pipeline = new Pipeline(OpenAccount.of("ACC1", 10), route, consistency, timeout,
                Collections.emptyMap(), Collections.emptyMap());
        ExecutionResult result = ImmutableExecutionResult.builder()
                .aggregateType("BankAccount")
                .identity("ACC1")
                .versionBefore(versionBefore)
                .aggregateVersion(version)
                .build();
        pipeline.executed(result);
        return pipeline;
    }

    @Test
    public void eventual_dispatch_does_not_wait() {
        Pipeline pipeline = executed(Consistency.EVENTUAL, 50, 0, 1);
        guarantee.afterDispatch(pipeline);
        assertFalse(pipeline.getResponse().isPresent());
    }

    @Test
    public void strong_dispatch_without_events_does_not_wait() {
        Pipeline pipeline = executed(Consistency.STRONG, 50, 3, 3);
        guarantee.afterDispatch(pipeline);
        assertFalse(pipeline.getResponse().isPresent());
    }

    @Test
    public void strong_dispatch_passes_when_all_handlers_caught_up() {
        progress.ack("read-model", "ACC1", 2);
        progress.ack("notifications", "ACC1", 5);
        Pipeline pipeline = executed(Consistency.STRONG, 50, 1, 2);
        guarantee.afterDispatch(pipeline);
        assertFalse(pipeline.getResponse().isPresent());
    }

    @Test
    public void lagging_handler_fails_dispatch_after_timeout() {
        progress.ack("read-model", "ACC1", 2);
        progress.ack("notifications", "ACC1", 1);
        Pipeline pipeline = executed(Consistency.STRONG, 100, 1, 2);
        guarantee.afterDispatch(pipeline);

        DispatchFailure failure = pipeline.getResponse().get().getFailure().get();
        assertThat(failure.getKind(), is(DispatchFailure.Kind.CONSISTENCY_TIMEOUT));
        assertThat(pipeline.elapsedMillis(), greaterThanOrEqualTo(100L));
    }

    @Test
    public void progress_of_other_streams_does_not_count() {
        progress.ack("read-model", "ACC2", 10);
        progress.ack("notifications", "ACC2", 10);
        Pipeline pipeline = executed(Consistency.STRONG, 30, 0, 1);
        guarantee.afterDispatch(pipeline);
        assertThat(pipeline.getResponse().get().getFailureKind().get(), is(DispatchFailure.Kind.CONSISTENCY_TIMEOUT));
    }

    @Test
    public void infinite_timeout_waits_until_acknowledged() throws Exception {
        Pipeline pipeline = executed(Consistency.STRONG, DispatchOptions.INFINITY, 0, 1);
        CompletableFuture<Void> acks = CompletableFuture.runAsync(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            progress.ack("read-model", "ACC1", 1);
            progress.ack("notifications", "ACC1", 1);
        }, conf.executorService());
        guarantee.afterDispatch(pipeline);
        acks.get(5, TimeUnit.SECONDS);
        assertFalse(pipeline.getResponse().isPresent());
    }
}
