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
 * Logical container for an atomic unit of work, bound to the connection it was opened on.
 */
public interface Transaction {
    /**
     * Run statements inside this transaction.
     *
     * @param statements the statements
     * @return one result per statement, in order
     */
    List<StatementResult> runStatements(List<Statement> statements);

    /**
     * Run the given statements and commit this transaction.
     *
     * @param statements the final statements, may be empty
     * @return one result per statement, in order
     */
    List<StatementResult> commit(List<Statement> statements);

    /**
     * Roll back this transaction.
     */
    void rollback();
}
