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

import java.util.Optional;

/**
 * Cluster roles a statement can be routed to. Discovery may report further roles, those are not routed to.
 */
public enum RoutingRole {
    LEADER("leader", "LEADER", "WRITE"),
    FOLLOWER("follower", "FOLLOWER", "READ");

    private final String aliasPrefix;
    private final String[] discoveryNames;

    RoutingRole(String aliasPrefix, String... discoveryNames) {
        this.aliasPrefix = aliasPrefix;
        this.discoveryNames = discoveryNames;
    }

    /**
     * @param index zero-based index of the server in this role's list of the routing table
     * @return the name of the pool connection to that server, e.g. {@code leader-0}
     */
    public String alias(int index) {
        return aliasPrefix + "-" + index;
    }

    public static Optional<RoutingRole> fromDiscoveryName(String name) {
        for (var role : values()) {
            for (var discoveryName : role.discoveryNames) {
                if (discoveryName.equals(name)) {
                    return Optional.of(role);
                }
            }
        }
        return Optional.empty();
    }
}
