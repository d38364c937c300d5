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
package org.graphclient.driver.internal.logging;

import org.graphclient.driver.Logger;
import org.graphclient.driver.Logging;
import org.slf4j.LoggerFactory;

/**
 * Routes client logs to SLF4J, looking loggers up by name through {@link LoggerFactory}.
 */
public final class Slf4jLogging implements Logging {
    private static final String LOGGER_FACTORY = "org.slf4j.LoggerFactory";

    private Slf4jLogging() {}

    /**
     * @return logging backed by SLF4J
     * @throws IllegalStateException when slf4j-api is not on the class path
     */
    public static Slf4jLogging create() {
        try {
            Class.forName(LOGGER_FACTORY, false, Slf4jLogging.class.getClassLoader());
        } catch (ClassNotFoundException | LinkageError e) {
            throw new IllegalStateException(
                    "SLF4J logging was requested but " + LOGGER_FACTORY
                            + " is not on the class path. Add slf4j-api and a binding such as Logback.",
                    e);
        }
        return new Slf4jLogging();
    }

    @Override
    public Logger getLog(String name) {
        return new Slf4jLogger(LoggerFactory.getLogger(name));
    }
}
