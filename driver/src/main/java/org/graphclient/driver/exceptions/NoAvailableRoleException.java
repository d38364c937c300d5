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

import org.graphclient.driver.internal.cluster.RoutingRole;

/**
 * The last successful discovery returned no server for the role a statement had to be routed to, e.g. a write was
 * requested while the cluster has no leader.
 */
public class NoAvailableRoleException extends DriverException {
    private static final long serialVersionUID = -3470419307930931585L;

    public static final String CODE = "Routing.NoAvailableRole";

    private final RoutingRole role;

    public NoAvailableRoleException(RoutingRole role) {
        super(CODE, "No server with role " + role + " is available in the current routing table");
        this.role = role;
    }

    public RoutingRole role() {
        return role;
    }
}
