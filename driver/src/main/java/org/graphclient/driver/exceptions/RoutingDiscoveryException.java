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
package org.graphclient.driver.exceptions;

/**
 * Fetching the routing table from the cluster has failed. The call that required a fresh routing table is aborted
 * without dispatching any statement.
 * <p>
 * A previously fetched routing table, if any, is kept and discovery is attempted again on the next routed call.
 */
public class RoutingDiscoveryException extends DriverException {
    private static final long serialVersionUID = 6711564351333659090L;

    public static final String CODE = "Routing.DiscoveryFailed";

    public RoutingDiscoveryException(String message) {
        super(CODE, message);
    }

    public RoutingDiscoveryException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
