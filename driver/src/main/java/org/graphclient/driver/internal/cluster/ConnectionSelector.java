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

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.IntUnaryOperator;
import org.graphclient.driver.exceptions.NoAvailableRoleException;

/**
 * Picks the pool connection a dispatch goes to, uniformly at random among the servers of the required role.
 */
public class ConnectionSelector {
    private final IntUnaryOperator randomIndex;

    public ConnectionSelector() {
        this(bound -> ThreadLocalRandom.current().nextInt(bound));
    }

    /**
     * @param randomIndex returns an index in {@code [0, bound)} for the given bound
     */
    ConnectionSelector(IntUnaryOperator randomIndex) {
        this.randomIndex = randomIndex;
    }

    public String pickWriteAlias(RoutingPool pool) {
        return pickAlias(pool, RoutingRole.LEADER);
    }

    public String pickReadAlias(RoutingPool pool) {
        return pickAlias(pool, RoutingRole.FOLLOWER);
    }

    private String pickAlias(RoutingPool pool, RoutingRole role) {
        var maxIndex = pool.maxIndex(role);
        if (maxIndex < 0) {
            throw new NoAvailableRoleException(role);
        }
        var index = maxIndex == 0 ? 0 : randomIndex.applyAsInt(maxIndex + 1);
        if (index < 0 || index > maxIndex) {
            throw new IllegalStateException("Selected index " + index + " is outside of [0, " + maxIndex + "]");
        }
        return role.alias(index);
    }
}
