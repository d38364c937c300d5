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
package org.graphclient.driver;

/**
 * Logs messages for client activity.
 * <p>
 * Message templates use {@link String#format(String, Object...)}-style placeholders, like "%s".
 */
public interface Logger {
    /**
     * Logs errors from this client.
     * <p>
     * Examples of errors logged using this method:
     * <ul>
     * <li>Routing table discovery failures</li>
     * <li>Connection construction failures</li>
     * </ul>
     *
     * @param message the error message.
     * @param cause the cause of the error.
     */
    void error(String message, Throwable cause);

    /**
     * Logs information from the client, like publication of a new routing table.
     *
     * @param message the information message template.
     * @param params parameters used in the information message.
     */
    void info(String message, Object... params);

    /**
     * Logs warnings that happened when using the client.
     *
     * @param message the warning message template.
     * @param params parameters used in the warning message.
     */
    void warn(String message, Object... params);

    /**
     * Logs warnings that happened when using the client.
     *
     * @param message the warning message
     * @param cause the cause of the warning
     */
    void warn(String message, Throwable cause);

    /**
     * Logs routing decisions, like stale table detection and the connection alias chosen for a dispatch.
     * Only enabled when {@link Logger#isDebugEnabled()} returns {@code true}.
     *
     * @param message the debug message template.
     * @param params parameters used in the debug message.
     */
    void debug(String message, Object... params);

    /**
     * Logs fine grained details, like the discovered address registered under every pool alias.
     * Only enabled when {@link Logger#isTraceEnabled()} returns {@code true}.
     *
     * @param message the trace message template.
     * @param params parameters used in the trace message.
     */
    void trace(String message, Object... params);

    /**
     * Return true if the trace logging level is enabled.
     *
     * @return true if the trace logging level is enabled.
     * @see Logger#trace(String, Object...)
     */
    boolean isTraceEnabled();

    /**
     * Return true if the debug level is enabled.
     *
     * @return true if the debug level is enabled.
     * @see Logger#debug(String, Object...)
     */
    boolean isDebugEnabled();
}
