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
import io.github.goodees.aggregates.store.ImmutableRecordedEvent;
import io.github.goodees.aggregates.store.RecordedEvent;
import io.github.goodees.aggregates.store.Serialization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Event store backed by schema and serialization.
 *
 * <p>Every append checks and updates the version of the stream in the version table. The update is conditional on the
 * version read at the beginning of the append, so of two concurrent appends with the same expected version only one
 * succeeds, the other fails with {@link EventStoreException.Fault#WRONG_EXPECTED_VERSION}.</p>
 *
 * <p>When the store is in strict mode, it will throw an exception when an event being read cannot be deserialized.
 * This can usually happen in two cases: Either there was an error in payload serialization, or an event could have
 * belong to a future version of the system, code was rolled back and currently running code doesn't yet know such event.
 * When not strict, such event is skipped. Aggregates are recovered from the event store, so strict mode should be
 * used in most cases.</p>
 *
 * @param <E> type of event payloads
 */
public class JdbcEventStore<E> implements EventStore {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventStore.class);

    private final DataSource dataSource;
    private final JdbcSchema schema;
    private final Serialization<E> serialization;
    private final Serialization<Map<String, Object>> metadataSerialization;
    private final TxHandler txHandler;
    private final boolean strict;

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, Serialization<E> serialization,
                          Serialization<Map<String, Object>> metadataSerialization) {
        this(dataSource, schema, serialization, metadataSerialization, TxHandler.LOCAL, true);
    }

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, Serialization<E> serialization,
                          Serialization<Map<String, Object>> metadataSerialization, TxHandler txHandler,
                          boolean strict) {
        this.dataSource = dataSource;
        this.schema = schema;
        this.serialization = serialization;
        this.metadataSerialization = metadataSerialization;
        this.txHandler = txHandler;
        this.strict = strict;
    }

    /**
     * Indicate whether failure to deserialize event causes exception to be thrown.
     * @return true if store is strict
     */
    public boolean isStrict() {
        return strict;
    }

    protected E checkCast(EventData event) throws EventStoreException {
        E cast = serialization.toSerializable(event.getData());
        if (cast == null) {
            throw EventStoreException.unsupported(event);
        } else {
            return cast;
        }
    }

    @Override
    public List<RecordedEvent> appendToStream(String streamId, long expectedVersion, List<EventData> events)
            throws EventStoreException {
        PersistTemplate template = createTemplate(streamId, expectedVersion);
        for (EventData event : events) {
            template.addEvent(event);
        }
        return template.persist();
    }

    protected PersistTemplate createTemplate(String streamId, long expectedVersion) {
        return new PersistTemplate(streamId, expectedVersion);
    }

    protected class PersistTemplate {
        private final List<RecordedEvent> events = new ArrayList<>();
        private final List<E> payloads = new ArrayList<>();
        private final String streamId;
        private final long startVersion;

        protected PersistTemplate(String streamId, long startVersion) {
            this.streamId = streamId;
            this.startVersion = startVersion;
        }

        void addEvent(EventData event) throws EventStoreException {
            payloads.add(checkCast(event));
            events.add(RecordedEvent.record(streamId, startVersion + events.size() + 1, event));
        }

        public List<RecordedEvent> persist() throws EventStoreException {
            if (events.isEmpty()) {
                return Collections.emptyList();
            }
            try (Connection connection = txHandler.enroll(dataSource.getConnection())) {
                try (PreparedStatement selectVersion = schema.selectStreamVersion(connection, streamId);
                     ResultSet rs = selectVersion.executeQuery()) {
                    checkSourceVersion(connection, rs);
                    try (PreparedStatement insertEvent = schema.insertEvent(connection, streamId);
                         PreparedStatement updateVersion = schema.updateStreamVersion(connection, streamId,
                                 startVersion, startVersion + events.size())) {
                        storeEvents(insertEvent);
                        updateVersion(updateVersion);
                        txHandler.commit(connection);
                    }
                } catch (SQLException | EventStoreException | RuntimeException e) {
                    rollback(connection, e);
                    throw e;
                }
            } catch (SQLException ex) {
                if (isConstraintViolation(ex)) {
                    logger.debug("Concurrent append to {} detected by constraint violation", streamId, ex);
                    throw EventStoreException.wrongExpectedVersion(streamId, startVersion);
                }
                throw EventStoreException.storeFailed(streamId, ex);
            }
            return Collections.unmodifiableList(events);
        }

        private void rollback(Connection connection, Exception cause) {
            try {
                txHandler.rollback(connection);
            } catch (SQLException | RuntimeException e) {
                logger.warn("Rollback of append to {} failed", streamId, e);
                cause.addSuppressed(e);
            }
        }

        private void updateVersion(PreparedStatement updateVersion) throws SQLException, EventStoreException {
            int result = updateVersion.executeUpdate();
            if (result != 1) {
                throw EventStoreException.wrongExpectedVersion(streamId, startVersion);
            }
        }

        private void storeEvents(PreparedStatement insertEvent) throws SQLException, EventStoreException {
            for (int i = 0; i < events.size(); i++) {
                RecordedEvent event = events.get(i);
                E payload = payloads.get(i);
                String serialized;
                String metadata;
                try {
                    serialized = serialization.serialize(payload);
                    metadata = metadataSerialization.serialize(event.getMetadata());
                } catch (IllegalArgumentException e) {
                    throw EventStoreException.serializationFailed(streamId, e);
                }
                schema.prepareInsert(insertEvent, event, serialization.payloadVersion(payload), serialized, metadata);
                insertEvent.addBatch();
            }
            insertEvent.executeBatch();
        }

        private void checkSourceVersion(Connection connection, ResultSet rs) throws SQLException, EventStoreException {
            if (!rs.next()) {
                if (startVersion != NO_STREAM) {
                    throw EventStoreException.wrongExpectedVersion(streamId, startVersion, NO_STREAM);
                }
                // no stream version - create a new one.
                try (PreparedStatement createVersion = schema.createStreamVersion(connection, streamId, startVersion)) {
                    createVersion.executeUpdate();
                }
            } else {
                long version = schema.readStreamVersion(rs);
                if (version != startVersion) {
                    throw EventStoreException.wrongExpectedVersion(streamId, startVersion, version);
                }
            }
        }
    }

    static boolean isConstraintViolation(SQLException e) {
        for (SQLException ex = e; ex != null; ex = ex.getNextException()) {
            if (ex instanceof SQLIntegrityConstraintViolationException
                    || (ex.getSQLState() != null && ex.getSQLState().startsWith("23"))) {
                return true;
            }
        }
        return false;
    }

    @Override
    public StoredEvents readStreamForward(String streamId, long afterVersion) {
        try {
            return new JdbcStoredEvents(streamId, afterVersion);
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access storage", e);
        }
    }

    class JdbcStoredEvents implements StoredEvents {
        private final String streamId;
        private Connection connection;
        private PreparedStatement statement;
        private ResultSet resultSet;
        private boolean iterating;
        private boolean stop;

        JdbcStoredEvents(String streamId, long afterVersion) throws SQLException {
            this.streamId = streamId;
            try {
                connection = dataSource.getConnection();
                statement = schema.selectEvents(connection, streamId, afterVersion);
                resultSet = statement.executeQuery();
            } catch (SQLException e) {
                close();
                throw e;
            }
        }

        @Override
        public void foreach(Consumer<? super RecordedEvent> consumer) {
            reduce(null, (ignored, event) -> {
                consumer.accept(event);
                return null;
            });
        }

        @Override
        public <R> R reduce(R initial, BiFunction<R, ? super RecordedEvent, R> reducer) {
            if (iterating) {
                throw new IllegalStateException("Iteration has already been done");
            }
            iterating = true;
            try {
                R result = initial;
                while (!stop && resultSet.next()) {
                    RecordedEvent event = readEvent();
                    if (event != null) {
                        result = reducer.apply(result, event);
                    }
                }
                return result;
            } catch (SQLException e) {
                throw new IllegalStateException("Cannot access datastore", e);
            }
        }

        private RecordedEvent readEvent() throws SQLException {
            long version = schema.readEventStreamVersion(resultSet);
            String type = schema.readEventType(resultSet);
            E payload = serialization.deserialize(schema.readEventPayloadVersion(resultSet),
                    schema.readEventPayload(resultSet), type);
            if (payload == null) {
                if (isStrict()) {
                    throw new IllegalArgumentException(streamId + " Could not deserialize event " + version
                            + " of type " + type);
                } else {
                    logger.error("{} Could not deserialize event {} of type {}", streamId, version, type);
                    return null;
                }
            }
            String metadata = schema.readEventMetadata(resultSet);
            return ImmutableRecordedEvent.builder()
                    .eventId(schema.readEventId(resultSet))
                    .streamId(streamId)
                    .streamVersion(version)
                    .eventType(type)
                    .data(payload)
                    .metadata(metadata == null ? Collections.emptyMap()
                            : metadataSerialization.deserialize(1, metadata, null))
                    .causationId(Optional.ofNullable(schema.readEventCausationId(resultSet)))
                    .correlationId(Optional.ofNullable(schema.readEventCorrelationId(resultSet)))
                    .createdAt(schema.readEventCreatedAt(resultSet))
                    .build();
        }

        @Override
        public void stop() {
            stop = true;
        }

        @Override
        public void close() {
            cleanup(resultSet);
            cleanup(statement);
            cleanup(connection);
        }

        protected void cleanup(AutoCloseable resource) {
            if (resource != null) {
                try {
                    resource.close();
                } catch (Exception e) {
                    logger.warn("Suppressing cleanup exception", e);
                }
            }
        }
    }
}
