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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.graphclient.driver.Statement;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class StatementClassifierTest {
    @ParameterizedTest
    @ValueSource(
            strings = {
                "MERGE (n:X) RETURN n",
                "CALL db.labels()",
                "CREATE (n:Person {name: $name})",
                "MATCH (n) SET n.age = 42",
                "MATCH (n) DETACH DELETE n",
                "MATCH (n)\nWITH n\nCREATE (m)-[:R]->(n)",
                "merge(u:User{email: $email}) on create set u.uuid=$uuid return u",
                "MATCH (n:RECREATED) RETURN n"
            })
    void shouldClassifyStatementsWithWriteKeywordsAsWrites(String text) {
        assertTrue(StatementClassifier.isWrite(new Statement(text)));
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "MATCH (n) RETURN n",
                "RETURN 1",
                "MATCH (a)-[:KNOWS]->(b)\nRETURN b.name ORDER BY b.name",
                "UNWIND range(1, 10) AS x RETURN x",
                ""
            })
    void shouldClassifyStatementsWithoutWriteKeywordsAsReads(String text) {
        assertFalse(StatementClassifier.isWrite(new Statement(text)));
    }

    @Test
    void shouldPartitionBatchAndKeepOriginalIndexes() {
        var readA = new Statement("MATCH (a) RETURN a");
        var writeB = new Statement("CREATE (b)", Map.of("x", 1));
        var readC = new Statement("MATCH (c) RETURN c");
        var writeD = new Statement("MERGE (d)");

        var classified = StatementClassifier.classify(List.of(readA, writeB, readC, writeD));

        assertEquals(List.of(new IndexedStatement(0, readA), new IndexedStatement(2, readC)), classified.reads());
        assertEquals(List.of(new IndexedStatement(1, writeB), new IndexedStatement(3, writeD)), classified.writes());
        assertEquals(List.of(readA, readC), classified.readStatements());
        assertEquals(List.of(writeB, writeD), classified.writeStatements());
        assertEquals(4, classified.size());
    }

    @Test
    void shouldProduceEmptyPartitionsForEmptyBatch() {
        var classified = StatementClassifier.classify(List.of());

        assertTrue(classified.reads().isEmpty());
        assertTrue(classified.writes().isEmpty());
        assertEquals(0, classified.size());
    }

    @Test
    void shouldKeepDuplicateStatementsAtTheirOwnPositions() {
        var read = new Statement("RETURN 1");

        var classified = StatementClassifier.classify(List.of(read, read, read));

        assertEquals(
                List.of(new IndexedStatement(0, read), new IndexedStatement(1, read), new IndexedStatement(2, read)),
                classified.reads());
        assertTrue(classified.writes().isEmpty());
    }
}
