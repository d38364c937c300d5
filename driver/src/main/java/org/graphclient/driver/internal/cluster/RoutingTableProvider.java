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

import java.time.Clock;
import org.graphclient.driver.Session;
import org.graphclient.driver.exceptions.RoutingDiscoveryException;

/**
 * Fetches a {@link RoutingTable} through the reference session and validates the response.
 */
public class RoutingTableProvider {
    private static final String PROTOCOL_ERROR_MESSAGE = "Failed to parse '%s' result received from server due to ";

    private final Clock clock;
    private final RoutingProcedureRunner procedureRunner;

    public RoutingTableProvider(Clock clock, String databaseName) {
        this(clock, new RoutingProcedureRunner(databaseName));
    }

    RoutingTableProvider(Clock clock, RoutingProcedureRunner procedureRunner) {
        this.clock = clock;
        this.procedureRunner = procedureRunner;
    }

    /**
     * @param referenceSession session to any reachable cluster member
     * @return the routing table reported by that member
     * @throws RoutingDiscoveryException when the procedure fails or returns an unusable response
     */
    public RoutingTable getRoutingTable(Session referenceSession) {
        var records = procedureRunner.run(referenceSession);
        if (records.isEmpty()) {
            throw new RoutingDiscoveryException(
                    format(PROTOCOL_ERROR_MESSAGE + "no records received.", procedureRunner.description()));
        }

        var now = clock.millis();
        try {
            return RoutingTable.parse(records.get(0), now);
        } catch (RoutingDiscoveryException e) {
            throw new RoutingDiscoveryException(
                    format(PROTOCOL_ERROR_MESSAGE + "unparsable record received.", procedureRunner.description()),
                    e);
        }
    }
}
