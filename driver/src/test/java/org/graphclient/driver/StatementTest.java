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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StatementTest {
    @Test
    void shouldCopyParameters() {
        var parameters = new HashMap<String, Object>();
        parameters.put("name", "Alice");
        var statement = new Statement("MATCH (n {name: $name}) RETURN n", parameters);

        parameters.put("name", "Bob");

        assertEquals(Map.of("name", "Alice"), statement.parameters());
    }

    @Test
    void shouldExposeUnmodifiableParameters() {
        var statement = new Statement("RETURN $x", Map.of("x", 1));

        assertThrows(UnsupportedOperationException.class, () -> statement.parameters().put("y", 2));
    }

    @Test
    void shouldAllowNullParameterValues() {
        var parameters = new HashMap<String, Object>();
        parameters.put("x", null);

        var statement = new Statement("RETURN $x", parameters);

        assertTrue(statement.parameters().containsKey("x"));
    }

    @Test
    void shouldDefaultToEmptyParameters() {
        assertEquals(Map.of(), new Statement("RETURN 1").parameters());
    }

    @Test
    void shouldRejectNullText() {
        assertThrows(IllegalArgumentException.class, () -> new Statement(null));
    }

    @Test
    void shouldCompareTextAndParameters() {
        var statement = new Statement("RETURN $x", Map.of("x", 1));

        assertEquals(new Statement("RETURN $x", Map.of("x", 1)), statement);
        assertNotEquals(statement.withParameters(Map.of("x", 2)), statement);
        assertNotEquals(statement.withText("RETURN $x + 1"), statement);
    }
}
