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
package org.graphclient.driver.internal.cluster;

import java.util.List;
import org.graphclient.driver.Config;
import org.graphclient.driver.Logger;
import org.graphclient.driver.Session;
import org.graphclient.driver.Statement;
import org.graphclient.driver.StatementResult;
import org.graphclient.driver.Transaction;

/**
 * Session that sends reads to followers and writes to leaders of a cluster.
 * <p>
 * Reads of a batch are dispatched first, then writes, each as one call on a randomly chosen connection of the role.
 * The two dispatches are not atomic: if the write dispatch fails the reads have already run, and the whole call
 * fails without returning their results.
 * <p>
 * Transactions are opened on a leader unless a connection alias is given, statements inside a transaction are not
 * classified.
 */
public class AutoRoutedSession implements Session {
    private final TopologyManager topologyManager;
    private final ConnectionSelector connectionSelector;
    private final Logger log;

    public AutoRoutedSession(
            Session referenceSession, String seedUrl, ConnectionPoolFactory poolFactory, Config config) {
        this(
                new TopologyManager(referenceSession, new UrlRebuilder(seedUrl), poolFactory, config),
                new ConnectionSelector(),
                config);
    }

    AutoRoutedSession(TopologyManager topologyManager, ConnectionSelector connectionSelector, Config config) {
        this.topologyManager = topologyManager;
        this.connectionSelector = connectionSelector;
        this.log = config.logging().getLog(getClass());
    }

    @Override
    public List<StatementResult> run(List<Statement> statements) {
        var pool = topologyManager.ensureFresh().pool();
        var classified = StatementClassifier.classify(statements);

        // both aliases are chosen before anything is sent, a missing role fails the call without dispatching
        var readAlias = classified.reads().isEmpty() ? null : connectionSelector.pickReadAlias(pool);
        var writeAlias = classified.writes().isEmpty() ? null : connectionSelector.pickWriteAlias(pool);

        List<StatementResult> readResults = List.of();
        if (readAlias != null) {
            log.debug("Dispatching %d read statement(s) to '%s'", classified.reads().size(), readAlias);
            readResults = pool.client().runStatements(classified.readStatements(), readAlias);
        }

        List<StatementResult> writeResults = List.of();
        if (writeAlias != null) {
            log.debug("Dispatching %d write statement(s) to '%s'", classified.writes().size(), writeAlias);
            writeResults = pool.client().runStatements(classified.writeStatements(), writeAlias);
        }

        return ResultWeaver.weave(classified, readResults, writeResults);
    }

    @Override
    public Transaction openTransaction(List<Statement> statements, String connectionAlias) {
        var pool = topologyManager.ensureFresh().pool();
        var alias = connectionAlias != null ? connectionAlias : connectionSelector.pickWriteAlias(pool);
        log.debug("Opening transaction on '%s'", alias);
        return pool.client().openTransaction(statements == null ? List.of() : statements, alias);
    }

    @Override
    public List<StatementResult> runOverTransaction(Transaction transaction, List<Statement> statements) {
        return transaction.runStatements(statements);
    }

    @Override
    public List<StatementResult> commitTransaction(Transaction transaction, List<Statement> statements) {
        return transaction.commit(statements);
    }

    @Override
    public void rollbackTransaction(Transaction transaction) {
        transaction.rollback();
    }

    TopologyManager topologyManager() {
        return topologyManager;
    }
}
