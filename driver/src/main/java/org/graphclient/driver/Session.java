/*
 * Copyright (c) "Neo4j"
 * Neo4j Sweden AB [https://neo4j.com]
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.graphclient.driver;

import java.util.List;

/**
 * Provides a context of work against a graph database.
 * <p>
 * A session runs batches of statements and opens explicit transactions. Implementations are either bound to a
 * single server (a leaf session, provided by a {@link org.graphclient.driver.spi.Connector}) or route every
 * statement to a server of the appropriate cluster role.
 */
public interface Session {
    /**
     * Run a batch of statements.
     *
     * @param statements the statements to run
     * @return one result per statement, in the order of the given statements
     */
    List<StatementResult> run(List<Statement> statements);

    /**
     * Begin a new explicit transaction, optionally running some statements as part of it.
     *
     * @param statements statements to run right after the transaction was started, may be empty
     * @param connectionAlias alias of the connection to open the transaction on, or {@code null} to let the session
     * decide
     * @return a new transaction
     */
    Transaction openTransaction(List<Statement> statements, String connectionAlias);

    /**
     * Begin a new explicit transaction on a connection chosen by the session.
     *
     * @return a new transaction
     */
    default Transaction openTransaction() {
        return openTransaction(List.of(), null);
    }

    /**
     * Run statements in the given transaction.
     *
     * @param transaction the transaction
     * @param statements the statements to run
     * @return one result per statement, in order
     */
    List<StatementResult> runOverTransaction(Transaction transaction, List<Statement> statements);

    /**
     * Run the given statements in the transaction and commit it.
     *
     * @param transaction the transaction
     * @param statements the final statements to run before committing, may be empty
     * @return one result per statement, in order
     */
    List<StatementResult> commitTransaction(Transaction transaction, List<Statement> statements);

    /**
     * Roll back the given transaction.
     *
     * @param transaction the transaction
     */
    void rollbackTransaction(Transaction transaction);
}
