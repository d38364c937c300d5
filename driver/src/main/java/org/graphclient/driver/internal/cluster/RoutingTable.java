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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.graphclient.driver.Record;
import org.graphclient.driver.exceptions.RoutingDiscoveryException;

/**
 * Snapshot of the cluster topology returned by one discovery call. Instances are never updated, an expired table is
 * replaced by a new one.
 */
public final class RoutingTable {
    private static final long MAX_TTL = Long.MAX_VALUE / 1000L;

    static final String SERVERS = "servers";
    static final String TTL = "ttl";
    static final String ADDRESSES = "addresses";
    static final String ROLE = "role";

    private final Map<RoutingRole, List<String>> serversByRole;
    private final long expiresAt;

    public RoutingTable(Map<RoutingRole, List<String>> serversByRole, long expiresAt) {
        var copy = new EnumMap<RoutingRole, List<String>>(RoutingRole.class);
        serversByRole.forEach((role, servers) -> copy.put(role, List.copyOf(servers)));
        this.serversByRole = Collections.unmodifiableMap(copy);
        this.expiresAt = expiresAt;
    }

    /**
     * @return the addresses of all servers with the given role, in discovery order; empty if there are none
     */
    public List<String> serversWithRole(RoutingRole role) {
        return serversByRole.getOrDefault(role, List.of());
    }

    /**
     * @return the epoch millisecond timestamp from which this table must no longer be used
     */
    public long expiresAt() {
        return expiresAt;
    }

    public boolean isExpired(long nowMillis) {
        return nowMillis >= expiresAt;
    }

    /**
     * Build a table from the first record of the routing procedure. Only leaders and followers are kept.
     *
     * @param record the record holding {@code servers} and {@code ttl}
     * @param now the current time in epoch milliseconds
     * @return the new table
     * @throws RoutingDiscoveryException when the record does not have the expected shape
     */
    public static RoutingTable parse(Record record, long now) {
        var serversByRole = new EnumMap<RoutingRole, List<String>>(RoutingRole.class);
        for (var entry : requireList(record.get(SERVERS), SERVERS)) {
            if (!(entry instanceof Map<?, ?> server)) {
                throw malformed("server entry is not a map: " + entry);
            }
            var roleName = server.get(ROLE);
            if (!(roleName instanceof String role)) {
                throw malformed("server entry has no role: " + server);
            }
            var knownRole = RoutingRole.fromDiscoveryName(role);
            if (knownRole.isEmpty()) {
                continue;
            }
            var addresses = requireList(server.get(ADDRESSES), ADDRESSES);
            var servers = serversByRole.computeIfAbsent(knownRole.get(), ignored -> new ArrayList<>());
            for (var address : addresses) {
                if (!(address instanceof String value)) {
                    throw malformed("address is not a string: " + address);
                }
                servers.add(value);
            }
        }
        return new RoutingTable(serversByRole, expirationTimestamp(now, record.get(TTL)));
    }

    private static long expirationTimestamp(long now, Object ttlValue) {
        if (!(ttlValue instanceof Long || ttlValue instanceof Integer || ttlValue instanceof Short)) {
            throw malformed("'" + TTL + "' is not an integer: " + ttlValue);
        }
        var ttl = ((Number) ttlValue).longValue();
        if (ttl < 0) {
            throw malformed("'" + TTL + "' is negative: " + ttl);
        }
        var expirationTimestamp = now + ttl * 1000;
        if (ttl >= MAX_TTL || expirationTimestamp < 0) {
            expirationTimestamp = Long.MAX_VALUE;
        }
        return expirationTimestamp;
    }

    private static List<?> requireList(Object value, String field) {
        if (value instanceof List<?> list) {
            return list;
        }
        throw malformed(format("'%s' is %s", field, value == null ? "missing" : "not a list: " + value));
    }

    private static RoutingDiscoveryException malformed(String reason) {
        return new RoutingDiscoveryException("Malformed routing table record, " + reason);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        var that = (RoutingTable) o;
        return expiresAt == that.expiresAt && serversByRole.equals(that.serversByRole);
    }

    @Override
    public int hashCode() {
        return Objects.hash(serversByRole, expiresAt);
    }

    @Override
    public String toString() {
        return format(
                "RoutingTable{expiresAt=%s, leaders=%s, followers=%s}",
                expiresAt, serversWithRole(RoutingRole.LEADER), serversWithRole(RoutingRole.FOLLOWER));
    }
}
