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
import java.util.Set;

/**
 * A set of named connections. Every statement batch is sent over the connection registered under the given alias,
 * or the default one when no alias is given.
 * <p>
 * A client does not know about cluster roles. Role-aware routing happens in the session registered for an alias
 * configured with {@link Config#autoRouting()}.
 *
 * @see ClientBuilder
 */
public interface Client {
    /**
     * Run statements on the connection registered under the given alias.
     *
     * @param statements the statements
     * @param connectionAlias the alias, or {@code null} for the default connection
     * @return one result per statement, in order
     * @throws org.graphclient.driver.exceptions.ClientException when the alias is unknown
     */
    List<StatementResult> runStatements(List<Statement> statements, String connectionAlias);

    /**
     * Run statements on the default connection.
     *
     * @param statements the statements
     * @return one result per statement, in order
     */
    default List<StatementResult> run(List<Statement> statements) {
        return runStatements(statements, null);
    }

    /**
     * Run a single statement on the connection registered under the given alias.
     *
     * @param statement the statement
     * @param connectionAlias the alias, or {@code null} for the default connection
     * @return the result of the statement
     */
    default StatementResult runStatement(Statement statement, String connectionAlias) {
        return runStatements(List.of(statement), connectionAlias).get(0);
    }

    /**
     * Open a transaction on the connection registered under the given alias.
     *
     * @param statements statements to run as part of opening the transaction, may be empty
     * @param connectionAlias the alias, or {@code null} for the default connection
     * @return the transaction
     */
    Transaction openTransaction(List<Statement> statements, String connectionAlias);

    /**
     * @return the session registered under the given alias, or the default one for {@code null}
     */
    Session session(String connectionAlias);

    /**
     * @return all registered aliases
     */
    Set<String> aliases();

    /**
     * @return the alias used when none is given
     */
    String defaultAlias();
}
