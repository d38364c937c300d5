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

import static org.graphclient.driver.internal.cluster.DiscoveryRecords.routingResponse;
import static org.graphclient.driver.internal.cluster.RoutingProcedureRunner.GET_ROUTING_TABLE;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import org.graphclient.driver.Session;
import org.graphclient.driver.Statement;
import org.graphclient.driver.StatementResult;
import org.graphclient.driver.exceptions.RoutingDiscoveryException;
import org.graphclient.driver.internal.InternalRecord;
import org.graphclient.driver.internal.util.FakeClock;
import org.junit.jupiter.api.Test;

class RoutingTableProviderTest {
    private final FakeClock clock = new FakeClock(10_000);
    private final Session referenceSession = mock(Session.class);
    private final RoutingTableProvider provider = new RoutingTableProvider(clock, "movies");

    @Test
    void shouldRunRoutingProcedureWithEmptyContextAndDatabase() {
        when(referenceSession.run(any())).thenReturn(routingResponse(300, List.of("a:1"), List.of("b:1")));

        provider.getRoutingTable(referenceSession);

        var expected = new Statement(GET_ROUTING_TABLE, Map.of("context", Map.of(), "database", "movies"));
        verify(referenceSession).run(List.of(expected));
    }

    @Test
    void shouldComputeExpiryFromClock() {
        when(referenceSession.run(any())).thenReturn(routingResponse(300, List.of("a:1"), List.of("b:1")));

        var table = provider.getRoutingTable(referenceSession);

        assertEquals(310_000, table.expiresAt());
        assertEquals(List.of("a:1"), table.serversWithRole(RoutingRole.LEADER));
        assertEquals(List.of("b:1"), table.serversWithRole(RoutingRole.FOLLOWER));
    }

    @Test
    void shouldWrapTransportErrors() {
        var transportError = new IllegalStateException("connection refused");
        when(referenceSession.run(any())).thenThrow(transportError);

        var error = assertThrows(RoutingDiscoveryException.class, () -> provider.getRoutingTable(referenceSession));

        assertSame(transportError, error.getCause());
        assertThat(error.getMessage(), containsString(GET_ROUTING_TABLE));
    }

    @Test
    void shouldFailWhenNoResultIsReturned() {
        when(referenceSession.run(any())).thenReturn(List.of());

        var error = assertThrows(RoutingDiscoveryException.class, () -> provider.getRoutingTable(referenceSession));

        assertThat(error.getMessage(), containsString("no records received"));
    }

    @Test
    void shouldFailWhenResultHasNoRecords() {
        when(referenceSession.run(any())).thenReturn(List.of(StatementResult.empty()));

        assertThrows(RoutingDiscoveryException.class, () -> provider.getRoutingTable(referenceSession));
    }

    @Test
    void shouldFailOnMalformedRecord() {
        var record = new InternalRecord(Map.of("ttl", 300L));
        when(referenceSession.run(any())).thenReturn(List.of(new StatementResult(List.of(record))));

        var error = assertThrows(RoutingDiscoveryException.class, () -> provider.getRoutingTable(referenceSession));

        assertThat(error.getMessage(), containsString("unparsable record received"));
        assertThat(error.getCause(), instanceOf(RoutingDiscoveryException.class));
    }

    @Test
    void shouldUseOnlyFirstRecord() {
        var first = DiscoveryRecords.routingRecord(300, List.of("a:1"), List.of());
        var second = DiscoveryRecords.routingRecord(300, List.of("z:1"), List.of());
        when(referenceSession.run(any())).thenReturn(List.of(new StatementResult(List.of(first, second))));

        var table = provider.getRoutingTable(referenceSession);

        assertEquals(List.of("a:1"), table.serversWithRole(RoutingRole.LEADER));
    }
}
