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

/**
 * Topology held by a {@link TopologyManager}: nothing before the first successful discovery, afterwards a routing
 * table together with the pool built from it. Both are only ever replaced together.
 */
public sealed interface TopologyState permits TopologyState.Uninitialized, TopologyState.Ready {
    Uninitialized UNINITIALIZED = new Uninitialized();

    final class Uninitialized implements TopologyState {
        private Uninitialized() {}

        @Override
        public String toString() {
            return "Uninitialized";
        }
    }

    record Ready(RoutingTable table, RoutingPool pool) implements TopologyState {}
}
