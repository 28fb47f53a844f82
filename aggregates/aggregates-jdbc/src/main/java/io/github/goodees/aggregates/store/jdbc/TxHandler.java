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

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Transaction demarcation of {@link JdbcEventStore} appends.
 */
public interface TxHandler {

    Connection enroll(Connection connection) throws SQLException;

    void commit(Connection connection) throws SQLException;

    void rollback(Connection connection) throws SQLException;

    /**
     * Transactions are managed by the container, the connection is used as it is.
     */
    TxHandler CONTAINER = new TxHandler() {
        @Override
        public Connection enroll(Connection connection) {
            return connection;
        }

        @Override
        public void commit(Connection connection) {
        }

        @Override
        public void rollback(Connection connection) {
        }
    };

    /**
     * Every append runs in local transaction of its connection. Auto commit is restored when the transaction ends, so
     * that pooled connections are returned in their original mode.
     */
    TxHandler LOCAL = new TxHandler() {
        @Override
        public Connection enroll(Connection connection) throws SQLException {
            connection.setAutoCommit(false);
            return connection;
        }

        @Override
        public void commit(Connection connection) throws SQLException {
            connection.commit();
            connection.setAutoCommit(true);
        }

        @Override
        public void rollback(Connection connection) throws SQLException {
            connection.rollback();
            connection.setAutoCommit(true);
        }
    };
}
