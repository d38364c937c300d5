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
 * Turns addresses reported by discovery into connection URLs. Scheme, credentials, path and query configured on the
 * seed URL survive into every rebuilt URL unless the discovered address carries its own.
 */
public class UrlRebuilder {
    private final ServerUrl base;

    public UrlRebuilder(ServerUrl base) {
        this.base = base;
    }

    public UrlRebuilder(String baseUrl) {
        this(ServerUrl.parse(baseUrl));
    }

    public String rebuild(String discoveredAddress) {
        return ServerUrl.parse(discoveredAddress).withDefaultsFrom(base).toUrlString();
    }
}
