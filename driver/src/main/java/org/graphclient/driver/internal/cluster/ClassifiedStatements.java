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
import org.graphclient.driver.Statement;

/**
 * A batch of statements split into the ones a follower may serve and the ones that need a leader. Both lists keep
 * the relative order of the original batch.
 */
public record ClassifiedStatements(List<IndexedStatement> reads, List<IndexedStatement> writes) {
    public ClassifiedStatements {
        reads = List.copyOf(reads);
        writes = List.copyOf(writes);
    }

    public List<Statement> readStatements() {
        return statements(reads);
    }

    public List<Statement> writeStatements() {
        return statements(writes);
    }

    public int size() {
        return reads.size() + writes.size();
    }

    private static List<Statement> statements(List<IndexedStatement> indexed) {
        return indexed.stream().map(IndexedStatement::statement).toList();
    }
}
