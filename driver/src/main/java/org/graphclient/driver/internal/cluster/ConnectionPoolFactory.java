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

import java.util.Map;
import org.graphclient.driver.Client;
import org.graphclient.driver.Config;

/**
 * Builds the role-unaware client holding one connection per discovered server.
 */
@FunctionalInterface
public interface ConnectionPoolFactory {
    /**
     * @param urlsByAlias connection URL per alias, in alias order; may be empty
     * @param config configuration of every connection, with auto-routing disabled
     * @return a client serving exactly the given aliases
     */
    Client create(Map<String, String> urlsByAlias, Config config);
}
