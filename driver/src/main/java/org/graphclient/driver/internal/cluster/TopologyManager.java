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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.graphclient.driver.Config;
import org.graphclient.driver.Logger;
import org.graphclient.driver.Session;
import org.graphclient.driver.exceptions.ClientException;
import org.graphclient.driver.exceptions.RoutingDiscoveryException;

/**
 * Owns the routing table of one routed session and the pool built from it.
 * <p>
 * The table and the pool are published together as a single {@link TopologyState.Ready} value. Callers holding a
 * published value keep using it even if a concurrent refresh replaces it.
 */
public class TopologyManager {
    private final Session referenceSession;
    private final RoutingTableProvider routingTableProvider;
    private final UrlRebuilder urlRebuilder;
    private final ConnectionPoolFactory poolFactory;
    private final Config leafConfig;
    private final Clock clock;
    private final String databaseName;
    private final Logger log;

    private final Lock refreshLock = new ReentrantLock();
    private volatile TopologyState state = TopologyState.UNINITIALIZED;

    public TopologyManager(
            Session referenceSession, UrlRebuilder urlRebuilder, ConnectionPoolFactory poolFactory, Config config) {
        this(
                referenceSession,
                new RoutingTableProvider(config.clock(), config.database()),
                urlRebuilder,
                poolFactory,
                config);
    }

    TopologyManager(
            Session referenceSession,
            RoutingTableProvider routingTableProvider,
            UrlRebuilder urlRebuilder,
            ConnectionPoolFactory poolFactory,
            Config config) {
        this.referenceSession = referenceSession;
        this.routingTableProvider = routingTableProvider;
        this.urlRebuilder = urlRebuilder;
        this.poolFactory = poolFactory;
        this.leafConfig = config.withAutoRouting(false);
        this.clock = config.clock();
        this.databaseName = config.database();
        this.log = config.logging().getLog(getClass());
    }

    /**
     * Make sure an unexpired routing table and its pool are published, running discovery if there is none yet or
     * the current one has expired.
     *
     * @return the published topology to dispatch against
     * @throws RoutingDiscoveryException when a required refresh failed; the previously published topology is kept
     */
    public TopologyState.Ready ensureFresh() {
        var fresh = freshOrNull(state);
        if (fresh != null) {
            return fresh;
        }

        refreshLock.lock();
        try {
            // another caller may have refreshed while this one was waiting for the lock
            var current = state;
            fresh = freshOrNull(current);
            if (fresh != null) {
                return fresh;
            }
            log.debug("Routing table for database '%s' is stale or missing. Current topology: %s", databaseName, current);

            var refreshed = refresh(current);
            state = refreshed;
            log.info(
                    "Updated routing table for database '%s' with %d leader(s) and %d follower(s). %s",
                    databaseName,
                    refreshed.pool().maxLeaderIndex() + 1,
                    refreshed.pool().maxFollowerIndex() + 1,
                    refreshed.table());
            return refreshed;
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * @return the currently published topology, without refreshing it
     */
    public TopologyState state() {
        return state;
    }

    private TopologyState.Ready freshOrNull(TopologyState current) {
        if (current instanceof TopologyState.Ready ready && !ready.table().isExpired(clock.millis())) {
            return ready;
        }
        return null;
    }

    private TopologyState.Ready refresh(TopologyState current) {
        try {
            var table = routingTableProvider.getRoutingTable(referenceSession);
            return new TopologyState.Ready(table, buildPool(table));
        } catch (RuntimeException error) {
            log.error(
                    format(
                            "Failed to update routing table for database '%s'. Current topology: %s.",
                            databaseName, current),
                    error);
            throw error;
        }
    }

    private RoutingPool buildPool(RoutingTable table) {
        var urlsByAlias = new LinkedHashMap<String, String>();
        var leaders = table.serversWithRole(RoutingRole.LEADER);
        var followers = table.serversWithRole(RoutingRole.FOLLOWER);
        register(urlsByAlias, RoutingRole.LEADER, leaders);
        register(urlsByAlias, RoutingRole.FOLLOWER, followers);

        var client = poolFactory.create(urlsByAlias, leafConfig);
        return new RoutingPool(client, maxIndex(leaders), maxIndex(followers));
    }

    private void register(LinkedHashMap<String, String> urlsByAlias, RoutingRole role, List<String> servers) {
        for (var i = 0; i < servers.size(); i++) {
            var alias = role.alias(i);
            var address = ServerUrl.redact(servers.get(i));
            String url;
            try {
                url = urlRebuilder.rebuild(servers.get(i));
            } catch (ClientException e) {
                throw new RoutingDiscoveryException(
                        format("Discovered address '%s' for %s is not a valid server address", address, alias),
                        e);
            }
            log.trace("Registering connection '%s' for discovered address %s", alias, address);
            urlsByAlias.put(alias, url);
        }
    }

    private static int maxIndex(List<String> servers) {
        return servers.isEmpty() ? RoutingPool.NONE : servers.size() - 1;
    }
}
