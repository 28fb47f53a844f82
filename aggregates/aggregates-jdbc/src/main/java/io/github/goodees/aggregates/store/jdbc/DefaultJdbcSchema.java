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
import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;

/**
 * JDBC schema with one table of events and one table of stream versions. Following tables are expected to exist:
 * <ul>
 * <li><em>eventTable</em>(STREAM_ID, STREAM_VERSION, EVENT_ID, EVENT_TYPE, CREATED_AT, PAYLOAD_VERSION, PAYLOAD,
 * METADATA, CAUSATION_ID, CORRELATION_ID) primary key (STREAM_ID, STREAM_VERSION)</li>
 * <li><em>versionTable</em>(STREAM_ID, STREAM_VERSION) primary key (STREAM_ID)</li>
 * </ul>
 */
public class DefaultJdbcSchema extends JdbcSchema {
    private static final String EVENT_COLUMNS = "STREAM_ID, STREAM_VERSION, EVENT_ID, EVENT_TYPE, CREATED_AT, "
            + "PAYLOAD_VERSION, PAYLOAD, METADATA, CAUSATION_ID, CORRELATION_ID";

    private final String eventTable;
    private final String versionTable;

    public DefaultJdbcSchema(String eventTable, String versionTable) {
        this.eventTable = eventTable;
        this.versionTable = versionTable;
    }

    protected String getEventTable() {
        return eventTable;
    }

    protected String getVersionTable() {
        return versionTable;
    }

    @Override
    protected PreparedStatement selectStreamVersion(Connection connection, String streamId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT STREAM_VERSION FROM " + getVersionTable()
                + " WHERE STREAM_ID=?");
        st.setString(1, streamId);
        return st;
    }

    @Override
    protected PreparedStatement createStreamVersion(Connection connection, String streamId, long version)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getVersionTable()
                + " (STREAM_ID, STREAM_VERSION) VALUES (?, ?)");
        st.setString(1, streamId);
        st.setLong(2, version);
        return st;
    }

    @Override
    protected long readStreamVersion(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected PreparedStatement updateStreamVersion(Connection connection, String streamId, long startVersion,
                                                    long endVersion) throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getVersionTable()
                + " SET STREAM_VERSION=? WHERE STREAM_ID=? AND STREAM_VERSION=?");
        st.setLong(1, endVersion);
        st.setString(2, streamId);
        st.setLong(3, startVersion);
        return st;
    }

    @Override
    protected PreparedStatement insertEvent(Connection connection, String streamId) throws SQLException {
        return connection.prepareStatement("INSERT INTO " + getEventTable() + " (" + EVENT_COLUMNS
                + ") VALUES (?,?,?,?,?,?,?,?,?,?)");
    }

    @Override
    protected void prepareInsert(PreparedStatement insertEvent, RecordedEvent event, int payloadVersion,
                                 String payload, String metadata) throws SQLException {
        insertEvent.setString(1, event.getStreamId());
        insertEvent.setLong(2, event.getStreamVersion());
        insertEvent.setString(3, event.getEventId().toString());
        insertEvent.setString(4, event.getEventType());
        insertEvent.setTimestamp(5, Timestamp.from(event.getCreatedAt()));
        insertEvent.setInt(6, payloadVersion);
        insertEvent.setString(7, payload);
        insertEvent.setString(8, metadata);
        insertEvent.setString(9, event.getCausationId().orElse(null));
        insertEvent.setString(10, event.getCorrelationId().orElse(null));
    }

    @Override
    protected PreparedStatement selectEvents(Connection connection, String streamId, long afterVersion)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT " + EVENT_COLUMNS + " FROM " + getEventTable()
                + " WHERE STREAM_ID=? AND STREAM_VERSION > ? ORDER BY STREAM_VERSION");
        st.setString(1, streamId);
        st.setLong(2, afterVersion);
        return st;
    }

    @Override
    protected long readEventStreamVersion(ResultSet rs) throws SQLException {
        return rs.getLong(2);
    }

    @Override
    protected UUID readEventId(ResultSet rs) throws SQLException {
        return UUID.fromString(rs.getString(3));
    }

    @Override
    protected String readEventType(ResultSet rs) throws SQLException {
        return rs.getString(4);
    }

    @Override
    protected Instant readEventCreatedAt(ResultSet rs) throws SQLException {
        return rs.getTimestamp(5).toInstant();
    }

    @Override
    protected int readEventPayloadVersion(ResultSet rs) throws SQLException {
        return rs.getInt(6);
    }

    @Override
    protected String readEventPayload(ResultSet rs) throws SQLException {
        return rs.getString(7);
    }

    @Override
    protected String readEventMetadata(ResultSet rs) throws SQLException {
        return rs.getString(8);
    }

    @Override
    protected String readEventCausationId(ResultSet rs) throws SQLException {
        return rs.getString(9);
    }

    @Override
    protected String readEventCorrelationId(ResultSet rs) throws SQLException {
        return rs.getString(10);
    }
}
