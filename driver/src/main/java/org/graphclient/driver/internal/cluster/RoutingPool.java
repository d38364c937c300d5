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

import org.graphclient.driver.Client;

/**
 * Connections built for one routing table. Aliases {@code leader-0..maxLeaderIndex} and
 * {@code follower-0..maxFollowerIndex} are registered in {@code client}; a maximum index of {@code -1} means the
 * role has no server.
 */
public record RoutingPool(Client client, int maxLeaderIndex, int maxFollowerIndex) {
    static final int NONE = -1;

    public int maxIndex(RoutingRole role) {
        return switch (role) {
            case LEADER -> maxLeaderIndex;
            case FOLLOWER -> maxFollowerIndex;
        };
    }
}
