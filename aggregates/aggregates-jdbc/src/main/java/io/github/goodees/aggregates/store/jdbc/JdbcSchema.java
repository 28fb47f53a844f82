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

import io.github.goodees.aggregates.store.RecordedEvent;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.UUID;

/**
 * SQL dialect and table layout of {@link JdbcEventStore}. Statements returned by the schema are closed by the store.
 */
public abstract class JdbcSchema {

    protected abstract PreparedStatement selectStreamVersion(Connection connection, String streamId)
            throws SQLException;

    protected abstract PreparedStatement createStreamVersion(Connection connection, String streamId, long version)
            throws SQLException;

    protected abstract long readStreamVersion(ResultSet rs) throws SQLException;

    /**
     * Update version of a stream, only if it still has the start version.
     */
    protected abstract PreparedStatement updateStreamVersion(Connection connection, String streamId, long startVersion,
                                                             long endVersion) throws SQLException;

    protected abstract PreparedStatement insertEvent(Connection connection, String streamId) throws SQLException;

    protected abstract void prepareInsert(PreparedStatement insertEvent, RecordedEvent event, int payloadVersion,
                                          String payload, String metadata) throws SQLException;

    protected abstract PreparedStatement selectEvents(Connection connection, String streamId, long afterVersion)
            throws SQLException;

    protected abstract UUID readEventId(ResultSet rs) throws SQLException;

    protected abstract long readEventStreamVersion(ResultSet rs) throws SQLException;

    protected abstract String readEventType(ResultSet rs) throws SQLException;

    protected abstract Instant readEventCreatedAt(ResultSet rs) throws SQLException;

    protected abstract int readEventPayloadVersion(ResultSet rs) throws SQLException;

    protected abstract String readEventPayload(ResultSet rs) throws SQLException;

    protected abstract String readEventMetadata(ResultSet rs) throws SQLException;

    protected abstract String readEventCausationId(ResultSet rs) throws SQLException;

    protected abstract String readEventCorrelationId(ResultSet rs) throws SQLException;
}
