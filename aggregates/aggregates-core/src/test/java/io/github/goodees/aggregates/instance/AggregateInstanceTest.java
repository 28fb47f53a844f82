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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import io.github.goodees.aggregates.example.bank.AccountOpened;
import io.github.goodees.aggregates.example.bank.BankAccount;
import io.github.goodees.aggregates.example.bank.BankAccountState;
import io.github.goodees.aggregates.example.bank.CloseAccount;
import io.github.goodees.aggregates.example.bank.MoneyDeposited;
import io.github.goodees.aggregates.example.bank.MoneyWithdrawn;
import io.github.goodees.aggregates.example.bank.OpenAccount;
import io.github.goodees.aggregates.example.bank.WithdrawMoney;
import io.github.goodees.aggregates.store.EventData;
import io.github.goodees.aggregates.store.EventStore;
import io.github.goodees.aggregates.store.EventStoreException;
import io.github.goodees.aggregates.store.RecordedEvent;
import io.github.goodees.aggregates.store.inmemory.InMemoryEventStore;
import org.junit.After;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ErrorCollector;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class AggregateInstanceTest {
    static ExecutorService executor = Executors.newFixedThreadPool(4);
    static ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

    @Rule
    public ErrorCollector collector = new ErrorCollector();

    private final BankAccount account = new BankAccount();
    private InMemoryEventStore store;
    private AggregateRegistry registry;
    private AppenderBase<ILoggingEvent> errorCollector;

    @AfterClass
    public static void shutdown() {
        executor.shutdownNow();
        scheduler.shutdownNow();
    }

    private static ch.qos.logback.classic.Logger mailboxLogger() {
        return ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(Mailbox.class.getName());
    }

    @After
    public void detachCollector() {
        mailboxLogger().detachAppender(errorCollector);
    }

    @Before
    public void setUp() {
        // any errors logged by mailboxes are actually assertion errors
        errorCollector = new AppenderBase<ILoggingEvent>() {
            @Override
            protected void append(ILoggingEvent event) {
                if (event.getLevel() == Level.ERROR) {
                    collector.addError(new AssertionError(event.getFormattedMessage()));
                }
            }
        };
        errorCollector.start();
        mailboxLogger().addAppender(errorCollector);
        store = new InMemoryEventStore();
        registry = new AggregateRegistry(new SimpleRuntimeConfiguration("test", executor, scheduler, store));
    }

    static ExecutionContext context(Object command, HandlerFunction function) {
        return ImmutableExecutionContext.builder().command(command).function(function).build();
    }

    private ExecutionContext open(String accountNumber, long balance) {
        return context(OpenAccount.of(accountNumber, balance),
                (state, command) -> account.execute((BankAccountState) state, (OpenAccount) command));
    }

    private ExecutionContext withdraw(String accountNumber, long amount) {
        return context(WithdrawMoney.of(accountNumber, amount),
                (state, command) -> account.execute((BankAccountState) state, (WithdrawMoney) command));
    }

    @Test
    public void executing_command_persists_events_and_updates_state() throws Exception {
        AggregateInstance<BankAccountState> instance = registry.getOrStart(account, "ACC123");
        ExecutionResult result = instance.execute(open("ACC123", 1000)).get(5, TimeUnit.SECONDS);

        assertThat(result.getVersionBefore(), is(0L));
        assertThat(result.getAggregateVersion(), is(1L));
        assertThat(result.getEvents(), contains((Object) AccountOpened.of("ACC123", 1000)));
        assertThat(store.streamVersion("ACC123"), is(1L));

        BankAccountState state = instance.state().get(5, TimeUnit.SECONDS);
        assertThat(state.getAccountNumber(), is("ACC123"));
        assertThat(state.getBalance(), is(1000L));
        assertThat(state.getStatus(), is(BankAccountState.Status.ACTIVE));
        assertThat(instance.version().get(5, TimeUnit.SECONDS), is(1L));
    }

    @Test
    public void state_is_recovered_from_stored_events() throws Exception {
        store.appendToStream("ACC123", 0, Arrays.asList(EventData.of(AccountOpened.of("ACC123", 1000)),
                EventData.of(MoneyDeposited.of("ACC123", 500, 1500))));

        assertThat(registry.aggregateVersion(account, "ACC123"), is(2L));
        assertThat(registry.aggregateState(account, "ACC123").getBalance(), is(1500L));

        ExecutionResult result = registry.getOrStart(account, "ACC123").execute(withdraw("ACC123", 200))
                .get(5, TimeUnit.SECONDS);
        assertThat(result.getVersionBefore(), is(2L));
        assertThat(result.getAggregateVersion(), is(3L));
        assertThat(registry.aggregateState(account, "ACC123").getBalance(), is(1300L));
    }

    @Test
    public void failing_handler_persists_nothing_and_terminates_instance() throws Exception {
        AggregateInstance<BankAccountState> instance = registry.getOrStart(account, "ACC123");
        try {
            instance.execute(open("ACC123", 0)).get(5, TimeUnit.SECONDS);
            fail("Should have failed");
        } catch (ExecutionException e) {
            assertThat(e.getCause(), instanceOf(IllegalArgumentException.class));
        }
        assertThat(store.streamVersion("ACC123"), is(0L));
        assertThat(instance.getLifecycle(), is(InstanceState.TERMINATED));
        assertFalse(registry.isRunning(account, "ACC123"));
        assertThat(registry.getOrStart(account, "ACC123"), not(sameInstance(instance)));
    }

    @Test
    public void concurrent_append_by_other_writer_terminates_instance() throws Exception {
        AggregateInstance<BankAccountState> instance = registry.getOrStart(account, "ACC123");
        instance.execute(open("ACC123", 1000)).get(5, TimeUnit.SECONDS);

        // another process appends to the same stream
        store.appendToStream("ACC123", 1, Arrays.asList(EventData.of(MoneyDeposited.of("ACC123", 50, 1050))));

        try {
            instance.execute(withdraw("ACC123", 100)).get(5, TimeUnit.SECONDS);
            fail("Should have failed");
        } catch (ExecutionException e) {
            assertThat(e.getCause(), instanceOf(EventStoreException.class));
            assertTrue(((EventStoreException) e.getCause()).isWrongExpectedVersion());
        }
        assertThat(store.streamVersion("ACC123"), is(2L));
        assertFalse(registry.isRunning(account, "ACC123"));

        // fresh instance recovers the other writer's event
        assertThat(registry.aggregateVersion(account, "ACC123"), is(2L));
        assertThat(registry.aggregateState(account, "ACC123").getBalance(), is(1050L));
    }

    @Test
    public void operations_queued_after_failure_see_terminated_instance() throws Exception {
        AggregateInstance<BankAccountState> instance = registry.getOrStart(account, "ACC123");
        instance.execute(open("ACC123", 0));
        try {
            instance.state().get(5, TimeUnit.SECONDS);
            fail("Should have failed");
        } catch (ExecutionException e) {
            assertThat(e.getCause(), instanceOf(AggregateTerminatedException.class));
            assertThat(e.getCause().getCause(), instanceOf(IllegalArgumentException.class));
        }
    }

    @Test
    public void command_without_events_keeps_version() throws Exception {
        AggregateInstance<BankAccountState> instance = registry.getOrStart(account, "ACC123");
        instance.execute(open("ACC123", 1000)).get(5, TimeUnit.SECONDS);
        ExecutionResult result = instance.execute(context(CloseAccount.of("ACC123"), (state, command) -> null))
                .get(5, TimeUnit.SECONDS);
        assertThat(result.getVersionBefore(), is(1L));
        assertThat(result.getAggregateVersion(), is(1L));
        assertTrue(result.getEvents().isEmpty());
        assertThat(store.streamVersion("ACC123"), is(1L));
    }

    @Test
    public void collections_and_arrays_produce_events_in_order() throws Exception {
        AggregateInstance<BankAccountState> instance = registry.getOrStart(account, "ACC123");
        instance.execute(context(OpenAccount.of("ACC123", 100), (state, command) -> Arrays.asList(
                AccountOpened.of("ACC123", 100), MoneyDeposited.of("ACC123", 10, 110))))
                .get(5, TimeUnit.SECONDS);
        ExecutionResult result = instance.execute(context(WithdrawMoney.of("ACC123", 20), (state, command) ->
                new Object[] { MoneyWithdrawn.of("ACC123", 10, 100), MoneyWithdrawn.of("ACC123", 10, 90) }))
                .get(5, TimeUnit.SECONDS);

        assertThat(result.getVersionBefore(), is(2L));
        assertThat(result.getAggregateVersion(), is(4L));
        assertThat(instance.state().get(5, TimeUnit.SECONDS).getBalance(), is(90L));

        List<Object> types = new ArrayList<>();
        try (EventStore.StoredEvents events = store.readStreamForward("ACC123")) {
            events.foreach(e -> types.add(e.getEventType()));
        }
        assertThat(types, contains((Object) "AccountOpened", "MoneyDeposited", "MoneyWithdrawn", "MoneyWithdrawn"));
    }

    @Test
    public void produced_events_carry_metadata_and_causation() throws Exception {
        ExecutionContext context = ImmutableExecutionContext.builder()
                .from(open("ACC123", 1000))
                .putMetadata("ip_address", "127.0.0.1")
                .causationId("command-1")
                .correlationId("correlation-1")
                .build();
        ExecutionResult result = registry.getOrStart(account, "ACC123").execute(context).get(5, TimeUnit.SECONDS);
        assertThat(result.getMetadata(), hasEntry("ip_address", (Object) "127.0.0.1"));

        RecordedEvent recorded;
        try (EventStore.StoredEvents events = store.readStreamForward("ACC123")) {
            recorded = events.reduce(null, (r, e) -> e);
        }
        assertThat(recorded.getStreamVersion(), is(1L));
        assertThat(recorded.getMetadata(), hasEntry("ip_address", (Object) "127.0.0.1"));
        assertThat(recorded.getCausationId().get(), is("command-1"));
        assertThat(recorded.getCorrelationId().get(), is("correlation-1"));
    }

    @Test
    public void idle_instance_stops_after_its_lifespan() throws Exception {
        ExecutionContext context = ImmutableExecutionContext.builder()
                .from(open("ACC123", 1000))
                .lifespan(AggregateLifespan.stopAfter(50))
                .build();
        registry.getOrStart(account, "ACC123").execute(context).get(5, TimeUnit.SECONDS);

        long deadline = System.currentTimeMillis() + 5000;
        while (registry.isRunning(account, "ACC123") && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(registry.isRunning(account, "ACC123"));
        assertThat(registry.aggregateState(account, "ACC123").getBalance(), is(1000L));
    }

    @Test
    public void default_lifespan_keeps_instance_running() throws Exception {
        registry.getOrStart(account, "ACC123").execute(open("ACC123", 1000)).get(5, TimeUnit.SECONDS);
        Thread.sleep(100);
        assertTrue(registry.isRunning(account, "ACC123"));
    }

    @Test
    public void failed_recovery_fails_queued_operations() throws Exception {
        EventStore broken = new InMemoryEventStore() {
            @Override
            public StoredEvents readStreamForward(String streamId, long afterVersion) {
                throw new IllegalStateException("Cannot access storage");
            }
        };
        AggregateRegistry brokenRegistry = new AggregateRegistry(
                new SimpleRuntimeConfiguration("broken", executor, scheduler, broken));
        AggregateInstance<BankAccountState> instance = brokenRegistry.getOrStart(account, "ACC123");
        try {
            instance.execute(open("ACC123", 1000)).get(5, TimeUnit.SECONDS);
            fail("Should have failed");
        } catch (ExecutionException e) {
            assertThat(e.getCause(), instanceOf(AggregateTerminatedException.class));
            assertThat(e.getCause().getCause(), instanceOf(IllegalStateException.class));
        }
        assertFalse(brokenRegistry.isRunning(account, "ACC123"));
    }

    @Test
    public void normalization_drops_nulls() {
        assertTrue(AggregateInstance.normalize(null).isEmpty());
        assertThat(AggregateInstance.normalize(Arrays.asList("a", null, "b")), contains((Object) "a", "b"));
        assertThat(AggregateInstance.normalize("a"), contains((Object) "a"));
    }
}
