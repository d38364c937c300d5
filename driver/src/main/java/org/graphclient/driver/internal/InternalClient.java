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
package org.graphclient.driver.internal;

import static java.lang.String.format;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.graphclient.driver.Client;
import org.graphclient.driver.Session;
import org.graphclient.driver.Statement;
import org.graphclient.driver.StatementResult;
import org.graphclient.driver.Transaction;
import org.graphclient.driver.exceptions.ClientException;

public class InternalClient implements Client {
    private final Map<String, Session> sessions;
    private final String defaultAlias;

    public InternalClient(Map<String, Session> sessions, String defaultAlias) {
        this.sessions = Collections.unmodifiableMap(new LinkedHashMap<>(sessions));
        if (defaultAlias != null && !this.sessions.containsKey(defaultAlias)) {
            throw new ClientException(format("Default connection '%s' is not registered", defaultAlias));
        }
        this.defaultAlias = defaultAlias;
    }

    @Override
    public List<StatementResult> runStatements(List<Statement> statements, String connectionAlias) {
        return session(connectionAlias).run(statements);
    }

    @Override
    public Transaction openTransaction(List<Statement> statements, String connectionAlias) {
        return session(connectionAlias).openTransaction(statements, null);
    }

    @Override
    public Session session(String connectionAlias) {
        var alias = connectionAlias != null ? connectionAlias : defaultAlias;
        if (alias == null) {
            throw new ClientException("No connection alias given and no default connection is configured");
        }
        var session = sessions.get(alias);
        if (session == null) {
            throw new ClientException(
                    format("The provided alias '%s' was not found in the client. Known aliases: %s", alias, aliases()));
        }
        return session;
    }

    @Override
    public Set<String> aliases() {
        return sessions.keySet();
    }

    @Override
    public String defaultAlias() {
        return defaultAlias;
    }
}
