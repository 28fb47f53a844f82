package io.github.goodees.aggregates.store.jdbc;

/*-
 * #%L
 * aggregates-jdbc
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

import io.github.goodees.aggregates.store.EventData;
import io.github.goodees.aggregates.store.EventStore;
import io.github.goodees.aggregates.store.EventStoreException;
import io.github.goodees.aggregates.store.ImmutableEventData;
import io.github.goodees.aggregates.store.RecordedEvent;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ErrorCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class JdbcEventStoreTest extends JdbcTest {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventStoreTest.class);
    @Rule
    public ErrorCollector collector = new ErrorCollector();

    private static List<EventData> counted(String counterId, int... amounts) {
        List<EventData> events = new ArrayList<>();
        for (int amount : amounts) {
            events.add(EventData.of(Counted.of(counterId, amount)));
        }
        return events;
    }

    @Test
    public void events_for_new_stream_are_persisted() throws EventStoreException {
        List<RecordedEvent> recorded = eventStore.appendToStream(name(), EventStore.NO_STREAM,
                counted(name(), 100, 200));
        assertThat(recorded.get(1).getStreamVersion(), is(2L));
        assertDb(2, "select count(*) from aggregate_event where stream_id = ?", name());
        assertDb(2, "select stream_version from stream_version where stream_id = ?", name());
    }

    @Test
    public void events_for_existing_stream_are_persisted() throws EventStoreException {
        eventStore.appendToStream(name(), 0, counted(name(), 100, 200));
        eventStore.appendToStream(name(), 2, counted(name(), 300, 400));
        assertDb(4, "select count(*) from aggregate_event where stream_id = ?", name());
        assertDb(4, "select stream_version from stream_version where stream_id = ?", name());
        assertDb(1, "select count(*) from aggregate_event where stream_id = ? and stream_version = 4 "
                + "and payload like '%400%'", name());
    }

    @Test
    public void appending_nothing_does_not_touch_storage() throws EventStoreException {
        assertThat(eventStore.appendToStream(name(), 5, Collections.emptyList()).size(), is(0));
        assertDb(0, "select count(*) from stream_version where stream_id = ?", name());
    }

    @Test
    public void persisting_unsupported_events_fails() {
        try {
            eventStore.appendToStream(name(), 0, Arrays.asList(EventData.of("not an event")));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
            assertDb(0, "select count(*) from aggregate_event where stream_id = ?", name());
        }
    }

    @Test
    public void appending_to_missing_stream_with_version_fails() {
        try {
            eventStore.appendToStream(name(), 3, counted(name(), 1));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.WRONG_EXPECTED_VERSION, e.getFault());
            assertDb(0, "select count(*) from aggregate_event where stream_id = ?", name());
        }
    }

    @Test
    public void failed_rollback_does_not_hide_append_failure() {
        TxHandler failingRollback = new TxHandler() {
            @Override
            public Connection enroll(Connection connection) throws SQLException {
                return TxHandler.LOCAL.enroll(connection);
            }

            @Override
            public void commit(Connection connection) throws SQLException {
                TxHandler.LOCAL.commit(connection);
            }

            @Override
            public void rollback(Connection connection) throws SQLException {
                TxHandler.LOCAL.rollback(connection);
                throw new SQLException("Rollback failed");
            }
        };
        JdbcEventStore<Object> store = new JdbcEventStore<>(ds, schema, serialization, metadataSerialization,
                failingRollback, true);
        try {
            store.appendToStream(name(), 3, counted(name(), 1));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.WRONG_EXPECTED_VERSION, e.getFault());
            assertThat(e.getSuppressed().length, is(1));
            assertThat(e.getSuppressed()[0].getMessage(), is("Rollback failed"));
        }
    }

    @Test
    public void local_transaction_restores_auto_commit() throws SQLException {
        try (Connection connection = ds.getConnection()) {
            TxHandler.LOCAL.enroll(connection);
            assertFalse(connection.getAutoCommit());
            TxHandler.LOCAL.commit(connection);
            assertTrue(connection.getAutoCommit());

            TxHandler.LOCAL.enroll(connection);
            TxHandler.LOCAL.rollback(connection);
            assertTrue(connection.getAutoCommit());
        }
    }

    @Test
    public void appending_stale_events_throws_early() {
        try {
            template.update("insert into stream_version (stream_id, stream_version) values(?, 10)", name());
            eventStore.appendToStream(name(), 8, counted(name(), 100, 200));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.WRONG_EXPECTED_VERSION, e.getFault());
            assertDb(0, "select count(*) from aggregate_event where stream_id = ?", name());
            assertDb(10, "select stream_version from stream_version where stream_id = ?", name());
        }
    }

    @Test
    public void duplicate_event_version_is_wrong_expected_version() throws EventStoreException {
        // version table lags behind the events, primary key of events detects the conflict
        eventStore.appendToStream(name(), 0, counted(name(), 1));
        template.update("update stream_version set stream_version = 0 where stream_id = ?", name());
        try {
            eventStore.appendToStream(name(), 0, counted(name(), 2));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.WRONG_EXPECTED_VERSION, e.getFault());
        }
        assertDb(1, "select count(*) from aggregate_event where stream_id = ?", name());
        assertDb(0, "select stream_version from stream_version where stream_id = ?", name());
    }

    @Test
    public void events_are_read_with_their_metadata() throws EventStoreException {
        EventData event = ImmutableEventData.builder()
                .from(EventData.of(Counted.of(name(), 7)))
                .putMetadata("user", "alice")
                .putMetadata("attempt", 2)
                .causationId("command-1")
                .correlationId("request-1")
                .build();
        eventStore.appendToStream(name(), 0, Arrays.asList(event));

        RecordedEvent read;
        try (EventStore.StoredEvents events = eventStore.readStreamForward(name())) {
            read = events.reduce(null, (r, e) -> e);
        }
        assertThat(read.getStreamId(), is(name()));
        assertThat(read.getStreamVersion(), is(1L));
        assertThat(read.getEventType(), is("Counted"));
        assertThat(read.getData(), is((Object) Counted.of(name(), 7)));
        assertThat(read.getMetadata(), hasEntry("user", (Object) "alice"));
        assertThat(read.getMetadata(), hasEntry("attempt", (Object) 2));
        assertThat(read.getCausationId().get(), is("command-1"));
        assertThat(read.getCorrelationId().get(), is("request-1"));
        assertThat(read.getCreatedAt(), notNullValue());
    }

    @Test
    public void events_are_read_after_version_in_order() throws EventStoreException {
        eventStore.appendToStream(name(), 0, counted(name(), 1, 2, 3, 4));
        List<Integer> amounts = new ArrayList<>();
        try (EventStore.StoredEvents events = eventStore.readStreamForward(name(), 2)) {
            events.foreach(e -> amounts.add(((Counted) e.getData()).getAmount()));
        }
        assertThat(amounts, contains(3, 4));
    }

    @Test
    public void strict_store_fails_on_unknown_event() throws EventStoreException {
        eventStore.appendToStream(name(), 0, counted(name(), 1));
        insertUnknownEvent(2);
        try (EventStore.StoredEvents events = eventStore.readStreamForward(name())) {
            events.foreach(e -> { });
            fail("should have failed");
        } catch (IllegalArgumentException e) {
            logger.info("Expected failure: {}", e.getMessage());
        }
    }

    @Test
    public void lenient_store_skips_unknown_event() throws EventStoreException {
        JdbcEventStore<Object> lenient = new JdbcEventStore<>(ds, schema, serialization, metadataSerialization,
                TxHandler.LOCAL, false);
        lenient.appendToStream(name(), 0, counted(name(), 1));
        insertUnknownEvent(2);
        template.update("update stream_version set stream_version = 2 where stream_id = ?", name());
        lenient.appendToStream(name(), 2, counted(name(), 3));

        List<Long> versions = new ArrayList<>();
        try (EventStore.StoredEvents events = lenient.readStreamForward(name())) {
            events.foreach(e -> versions.add(e.getStreamVersion()));
        }
        assertThat(versions, contains(1L, 3L));
    }

    private static Object invoke(Method method, Object target, Object[] args) throws Throwable {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getCause();
        }
    }

    private void insertUnknownEvent(long version) {
        template.update("insert into aggregate_event (stream_id, stream_version, event_id, event_type, created_at, "
                + "payload_version, payload) values (?, ?, '00000000-0000-0000-0000-000000000000', 'Renamed', "
                + "current_timestamp, 1, '{}')", name(), version);
    }

    @Test
    public void appending_stale_events_fails_on_version_update() throws InterruptedException {
        /*
            THREAD 1                 THREAD 2

            checkSourceVersion
            < release "T1 has stream version" >
                                     < wait for "T1 has stream version" >
                                    checkSourceVersion
            insert "10"             insert "20"
                                    < release "T2 has inserted events" >
            < wait for "T2 has inserted events">
            updateVersion
            < release "T1 has updated version" >
                                    < wait for "T1 has updated version" >
                                    updateVersion

            Thread 1 wins, thread 2 fails.

            The collision table has no primary key, so that the conflict is detected by the conditional version
            update rather than by constraint violation.
         */
        CountDownLatch thread1hasStreamVersion = new CountDownLatch(1);
        CountDownLatch thread2hasInsertedEvents = new CountDownLatch(1);
        CountDownLatch thread1updatedStreamVersion = new CountDownLatch(1);

        JdbcSchema race1 = new DefaultJdbcSchema("aggregate_event_collision", "stream_version") {
            @Override
            protected long readStreamVersion(ResultSet rs) throws SQLException {
                try {
                    return super.readStreamVersion(rs);
                } finally {
                    logger.info("Thread 1 has read stream version");
                    thread1hasStreamVersion.countDown();
                }
            }

            @Override
            protected PreparedStatement updateStreamVersion(Connection connection, String streamId, long startVersion,
                                                            long endVersion) throws SQLException {
                PreparedStatement delegate = super.updateStreamVersion(connection, streamId, startVersion, endVersion);
                return (PreparedStatement) Proxy.newProxyInstance(delegate.getClass().getClassLoader(),
                        new Class<?>[] { PreparedStatement.class },
                        (p, m, a) -> {
                            if ("executeUpdate".equals(m.getName())) {
                                logger.info("Waiting for thread 2 to insert events");
                                thread2hasInsertedEvents.await();
                            }
                            Object result = invoke(m, delegate, a);
                            if ("executeUpdate".equals(m.getName())) {
                                logger.info("Thread 1 updated stream version");
                                thread1updatedStreamVersion.countDown();
                            }
                            return result;
                        });
            }
        };

        JdbcSchema race2 = new DefaultJdbcSchema("aggregate_event_collision", "stream_version") {
            @Override
            protected long readStreamVersion(ResultSet rs) throws SQLException {
                try {
                    logger.info("Thread 2 waits for thread 1 to read stream version");
                    thread1hasStreamVersion.await();
                } catch (InterruptedException e) {
                    collector.addError(e);
                }
                return super.readStreamVersion(rs);
            }

            @Override
            protected PreparedStatement insertEvent(Connection connection, String streamId) throws SQLException {
                PreparedStatement delegate = super.insertEvent(connection, streamId);
                return (PreparedStatement) Proxy.newProxyInstance(delegate.getClass().getClassLoader(),
                        new Class<?>[] { PreparedStatement.class },
                        (p, m, a) -> {
                            try {
                                return invoke(m, delegate, a);
                            } finally {
                                if (m.getName().equals("executeBatch")) {
                                    logger.info("Thread 2 has inserted events");
                                    thread2hasInsertedEvents.countDown();
                                }
                            }
                        });
            }

            @Override
            protected PreparedStatement updateStreamVersion(Connection connection, String streamId, long startVersion,
                                                            long endVersion) throws SQLException {
                PreparedStatement delegate = super.updateStreamVersion(connection, streamId, startVersion, endVersion);
                return (PreparedStatement) Proxy.newProxyInstance(delegate.getClass().getClassLoader(),
                        new Class<?>[] { PreparedStatement.class },
                        (p, m, a) -> {
                            if ("executeUpdate".equals(m.getName())) {
                                logger.info("Waiting for thread 1 to update stream version");
                                thread1updatedStreamVersion.await();
                            }
                            return invoke(m, delegate, a);
                        });
            }
        };

        JdbcEventStore<Object> store1 = new JdbcEventStore<>(ds, race1, serialization, metadataSerialization);
        JdbcEventStore<Object> store2 = new JdbcEventStore<>(ds, race2, serialization, metadataSerialization);

        template.update("insert into stream_version (stream_id, stream_version) values (?,1)", name());
        Thread thread1 = new Thread(() -> {
            try {
                store1.appendToStream(name(), 1, counted(name(), 10));
            } catch (Exception e) {
                logger.error("Thread 1 failed", e);
                collector.addError(e);
            } finally {
                // release all latches in case we failed
                thread1hasStreamVersion.countDown();
                thread1updatedStreamVersion.countDown();
            }
        });
        thread1.setName("Thread 1");
        thread1.start();
        try {
            store2.appendToStream(name(), 1, counted(name(), 20));
            fail("Should have failed");
        } catch (EventStoreException e) {
            logger.info("Thread 2 got (expected) event store exception", e);
            assertEquals(EventStoreException.Fault.WRONG_EXPECTED_VERSION, e.getFault());
        }
        thread1.join();
        assertDb(1, "select count(*) from aggregate_event_collision where stream_id = ?", name());
        assertDb(2, "select stream_version from stream_version where stream_id = ?", name());
        assertDb(1, "select count(*) from aggregate_event_collision where stream_id = ? and payload like '%10%'",
                name());
        assertDb(0, "select count(*) from aggregate_event_collision where stream_id = ? and payload like '%20%'",
                name());
    }
}
