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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.graphclient.driver.Record;
import org.graphclient.driver.Session;
import org.graphclient.driver.Statement;
import org.graphclient.driver.StatementResult;
import org.graphclient.driver.exceptions.RoutingDiscoveryException;

/**
 * Runs the routing procedure {@code dbms.routing.getRoutingTable} over a session that is bound to a single cluster
 * member.
 */
public class RoutingProcedureRunner {
    static final String ROUTING_CONTEXT = "context";
    static final String DATABASE_NAME = "database";
    static final String GET_ROUTING_TABLE =
            String.format("CALL dbms.routing.getRoutingTable($%s, $%s)", ROUTING_CONTEXT, DATABASE_NAME);

    private final Statement procedure;

    public RoutingProcedureRunner(String databaseName) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put(ROUTING_CONTEXT, Map.of());
        parameters.put(DATABASE_NAME, databaseName);
        this.procedure = new Statement(GET_ROUTING_TABLE, parameters);
    }

    /**
     * @param referenceSession session to any reachable cluster member
     * @return the records of the procedure, empty when the session returned no result at all
     * @throws RoutingDiscoveryException wrapping whatever the session threw
     */
    public List<Record> run(Session referenceSession) {
        List<StatementResult> results;
        try {
            results = referenceSession.run(List.of(procedure));
        } catch (RuntimeException error) {
            throw new RoutingDiscoveryException(
                    format(
                            "Failed to run '%s' on server. Please make sure that there is a cluster member up and running.",
                            description()),
                    error);
        }
        return results == null || results.isEmpty() ? List.of() : results.get(0).list();
    }

    /**
     * @return the procedure call with its parameters, for error messages
     */
    String description() {
        return procedure.text() + " " + procedure.parameters();
    }
}
