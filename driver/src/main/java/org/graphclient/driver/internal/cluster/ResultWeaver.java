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

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.graphclient.driver.StatementResult;

/**
 * Puts the results of separately dispatched reads and writes back into the order of the original batch.
 */
public final class ResultWeaver {
    private ResultWeaver() {}

    /**
     * @param classified the classification the dispatched batches were taken from
     * @param readResults results of {@link ClassifiedStatements#readStatements()}, in order; empty if none were sent
     * @param writeResults results of {@link ClassifiedStatements#writeStatements()}, in order; empty if none were sent
     * @return one result per original statement, at the statement's original position
     */
    public static List<StatementResult> weave(
            ClassifiedStatements classified, List<StatementResult> readResults, List<StatementResult> writeResults) {
        var woven = new StatementResult[classified.size()];
        place(classified.reads(), readResults, woven, "read");
        place(classified.writes(), writeResults, woven, "write");
        return Collections.unmodifiableList(new ArrayList<>(Arrays.asList(woven)));
    }

    private static void place(
            List<IndexedStatement> statements, List<StatementResult> results, StatementResult[] woven, String kind) {
        if (statements.size() != results.size()) {
            throw new IllegalStateException(format(
                    "Expected %d results for %d %s statements but received %d",
                    statements.size(), statements.size(), kind, results.size()));
        }
        for (var i = 0; i < statements.size(); i++) {
            woven[statements.get(i).index()] = results.get(i);
        }
    }
}
