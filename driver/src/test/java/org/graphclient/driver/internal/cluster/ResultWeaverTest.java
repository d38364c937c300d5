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

import static org.graphclient.driver.internal.cluster.DiscoveryRecords.resultOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.graphclient.driver.Statement;
import org.junit.jupiter.api.Test;

class ResultWeaverTest {
    private static final Statement READ_A = new Statement("MATCH (a) RETURN a");
    private static final Statement WRITE_B = new Statement("CREATE (b) RETURN b");
    private static final Statement READ_C = new Statement("MATCH (c) RETURN c");

    @Test
    void shouldRestoreOriginalOrder() {
        var classified = StatementClassifier.classify(List.of(READ_A, WRITE_B, READ_C));
        var resultA = resultOf("x", "A");
        var resultB = resultOf("x", "B");
        var resultC = resultOf("x", "C");

        var woven = ResultWeaver.weave(classified, List.of(resultA, resultC), List.of(resultB));

        assertEquals(List.of(resultA, resultB, resultC), woven);
    }

    @Test
    void shouldWeaveOnlyReads() {
        var classified = StatementClassifier.classify(List.of(READ_A, READ_C));
        var resultA = resultOf("x", "A");
        var resultC = resultOf("x", "C");

        assertEquals(List.of(resultA, resultC), ResultWeaver.weave(classified, List.of(resultA, resultC), List.of()));
    }

    @Test
    void shouldWeaveOnlyWrites() {
        var classified = StatementClassifier.classify(List.of(WRITE_B, WRITE_B));
        var first = resultOf("x", 1L);
        var second = resultOf("x", 2L);

        assertEquals(List.of(first, second), ResultWeaver.weave(classified, List.of(), List.of(first, second)));
    }

    @Test
    void shouldWeaveEmptyBatch() {
        var classified = StatementClassifier.classify(List.of());

        assertEquals(List.of(), ResultWeaver.weave(classified, List.of(), List.of()));
    }

    @Test
    void shouldFailWhenResultCountDoesNotMatch() {
        var classified = StatementClassifier.classify(List.of(READ_A, WRITE_B));

        assertThrows(
                IllegalStateException.class,
                () -> ResultWeaver.weave(classified, List.of(), List.of(resultOf("x", "B"))));
    }
}
