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

import java.time.Clock;
import java.util.Objects;
import org.graphclient.driver.internal.logging.NoOpLogging;

/**
 * A configuration class to config connection properties.
 * <p>
 * To build a config for a connection that routes statements across a cluster:
 * <pre>
 * {@code
 * Config config = Config.builder()
 *                       .withLogging(Logging.slf4j())
 *                       .withDatabase("movies")
 *                       .withAutoRouting(true)
 *                       .build();
 * }
 * </pre>
 */
public final class Config {
    public static final String DEFAULT_DATABASE = "neo4j";

    private static final Config EMPTY = builder().build();

    /**
     * User defined logging
     */
    private final Logging logging;

    /**
     * The database whose routing table is discovered.
     */
    private final String database;

    /**
     * The flag indicating if statements are routed to cluster members by role.
     */
    private final boolean autoRouting;

    /**
     * The clock used to expire routing tables.
     */
    private final Clock clock;

    private Config(ConfigBuilder builder) {
        this.logging = builder.logging;
        this.database = builder.database;
        this.autoRouting = builder.autoRouting;
        this.clock = builder.clock;
    }

    /**
     * Logging provider
     *
     * @return the Logging provider to use
     */
    public Logging logging() {
        return logging;
    }

    /**
     * @return the name of the database to discover the routing table for
     */
    public String database() {
        return database;
    }

    /**
     * @return {@code true} if statements sent over this connection are routed to leaders and followers
     */
    public boolean autoRouting() {
        return autoRouting;
    }

    /**
     * @return the clock routing table expiry is measured with
     */
    public Clock clock() {
        return clock;
    }

    /**
     * Return a copy of this config with a different auto-routing flag.
     *
     * @param autoRouting the new flag
     * @return a new config, or this one when the flag is unchanged
     */
    public Config withAutoRouting(boolean autoRouting) {
        if (this.autoRouting == autoRouting) {
            return this;
        }
        return toBuilder().withAutoRouting(autoRouting).build();
    }

    /**
     * @return a builder initialized with the values of this config
     */
    public ConfigBuilder toBuilder() {
        return builder()
                .withLogging(logging)
                .withDatabase(database)
                .withAutoRouting(autoRouting)
                .withClock(clock);
    }

    /**
     * Return a {@link ConfigBuilder} instance
     *
     * @return a {@link ConfigBuilder} instance
     */
    public static ConfigBuilder builder() {
        return new ConfigBuilder();
    }

    /**
     * @return A config with all default settings
     */
    public static Config defaultConfig() {
        return EMPTY;
    }

    @Override
    public String toString() {
        return "Config{database='" + database + "', autoRouting=" + autoRouting + '}';
    }

    /**
     * Used to build new config instances
     */
    public static final class ConfigBuilder {
        private Logging logging = NoOpLogging.INSTANCE;
        private String database = DEFAULT_DATABASE;
        private boolean autoRouting;
        private Clock clock = Clock.systemUTC();

        private ConfigBuilder() {}

        /**
         * Provide a logging implementation for the client to use. The default discards all messages.
         *
         * @param logging the logging instance to use
         * @return this builder
         */
        public ConfigBuilder withLogging(Logging logging) {
            this.logging = Objects.requireNonNull(logging, "logging");
            return this;
        }

        /**
         * Set the database whose routing table is requested during discovery.
         *
         * @param database the database name, must not be blank
         * @return this builder
         */
        public ConfigBuilder withDatabase(String database) {
            if (database == null || database.isBlank()) {
                throw new IllegalArgumentException("Database name must not be blank, given: '" + database + "'");
            }
            this.database = database;
            return this;
        }

        /**
         * Enable or disable routing of statements to cluster members by role. Disabled by default.
         *
         * @param autoRouting the flag
         * @return this builder
         */
        public ConfigBuilder withAutoRouting(boolean autoRouting) {
            this.autoRouting = autoRouting;
            return this;
        }

        /**
         * Set the clock used to decide when a routing table has expired.
         *
         * @param clock the clock
         * @return this builder
         */
        public ConfigBuilder withClock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Create a config instance from this builder.
         *
         * @return a new {@link Config} instance.
         */
        public Config build() {
            return new Config(this);
        }
    }
}
