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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.graphclient.driver.Statement;

/**
 * Decides per statement whether it has to run on a leader.
 * <p>
 * The check is a plain substring search for write keywords anywhere in the text, ignoring case and line breaks.
 * It does not parse the query, so a keyword inside an identifier or a string literal also marks the statement as a
 * write.
 */
public final class StatementClassifier {
    private static final Pattern WRITE_KEYWORDS = Pattern.compile("CREATE|SET|MERGE|DELETE|CALL", Pattern.CASE_INSENSITIVE);

    private StatementClassifier() {}

    public static boolean isWrite(Statement statement) {
        return WRITE_KEYWORDS.matcher(statement.text()).find();
    }

    public static ClassifiedStatements classify(List<Statement> statements) {
        var reads = new ArrayList<IndexedStatement>();
        var writes = new ArrayList<IndexedStatement>();
        var index = 0;
        for (var statement : statements) {
            var indexed = new IndexedStatement(index++, statement);
            if (isWrite(statement)) {
                writes.add(indexed);
            } else {
                reads.add(indexed);
            }
        }
        return new ClassifiedStatements(reads, writes);
    }
}
