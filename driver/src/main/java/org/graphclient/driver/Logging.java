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

import java.util.logging.Level;
import org.graphclient.driver.internal.logging.ConsoleLogging;
import org.graphclient.driver.internal.logging.NoOpLogging;
import org.graphclient.driver.internal.logging.Slf4jLogging;

/**
 * Accessor for {@link Logger} instances. Configured once per client via {@link Config.ConfigBuilder#withLogging(Logging)}.
 * <p>
 * Routing components request loggers by their class name, so standard logging frameworks can be configured per
 * component, e.g. to only see topology refreshes.
 *
 * @see Logger
 * @see Config
 */
public interface Logging {
    /**
     * Obtain a {@link Logger} instance by name.
     *
     * @param name name of a {@link Logger}
     * @return {@link Logger} instance
     */
    Logger getLog(String name);

    /**
     * Obtain a {@link Logger} instance by class, its name will be the fully qualified name of the class.
     *
     * @param clazz class whose name should be used as the {@link Logger} name
     * @return {@link Logger} instance
     */
    default Logger getLog(Class<?> clazz) {
        return getLog(clazz.getCanonicalName());
    }

    /**
     * Create logging implementation that uses SLF4J.
     *
     * @return new logging implementation.
     * @throws IllegalStateException if SLF4J is not available.
     */
    static Logging slf4j() {
        return Slf4jLogging.create();
    }

    /**
     * Create logging implementation that uses {@link java.util.logging} to log to {@code System.err}.
     *
     * @param level the log level.
     * @return new logging implementation.
     */
    static Logging console(Level level) {
        return new ConsoleLogging(level);
    }

    /**
     * Create logging implementation that discards all messages and logs nothing.
     *
     * @return new logging implementation.
     */
    static Logging none() {
        return NoOpLogging.INSTANCE;
    }
}
