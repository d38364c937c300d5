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

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * The records produced by a single statement, in the order the server returned them.
 */
public final class StatementResult implements Iterable<Record> {
    private static final StatementResult EMPTY = new StatementResult(Collections.emptyList());

    private final List<Record> records;

    public StatementResult(List<Record> records) {
        this.records = List.copyOf(records);
    }

    public static StatementResult empty() {
        return EMPTY;
    }

    public List<Record> list() {
        return records;
    }

    public Optional<Record> first() {
        return records.isEmpty() ? Optional.empty() : Optional.of(records.get(0));
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    @Override
    public Iterator<Record> iterator() {
        return records.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return records.equals(((StatementResult) o).records);
    }

    @Override
    public int hashCode() {
        return records.hashCode();
    }

    @Override
    public String toString() {
        return "StatementResult" + records;
    }
}
