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
package org.graphclient.driver.spi;

import org.graphclient.driver.Config;
import org.graphclient.driver.Session;

/**
 * Creates sessions that talk to exactly one server. This is where the wire protocol lives; the routing layer only
 * composes the sessions returned from here.
 * <p>
 * Implementations own the lifecycle of the network resources behind the sessions they return, including their
 * release once a session is no longer referenced.
 */
@FunctionalInterface
public interface Connector {
    /**
     * Create a session for the given URL.
     *
     * @param url the server URL, including scheme and credentials where configured
     * @param config the configuration of the connection; routing is never enabled for sessions created by the routing
     * layer itself
     * @return a new session bound to the server
     */
    Session connect(String url, Config config);
}
