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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import org.graphclient.driver.internal.logging.NoOpLogging;
import org.graphclient.driver.internal.util.FakeClock;
import org.junit.jupiter.api.Test;

class ConfigTest {
    @Test
    void shouldDefaultToNoRoutingAndDefaultDatabase() {
        var config = Config.defaultConfig();

        assertFalse(config.autoRouting());
        assertEquals(Config.DEFAULT_DATABASE, config.database());
        assertSame(NoOpLogging.INSTANCE, config.logging());
        assertEquals(Clock.systemUTC(), config.clock());
    }

    @Test
    void shouldCopyWithDifferentAutoRouting() {
        var clock = new FakeClock();
        var logging = Logging.none();
        var config = Config.builder()
                .withAutoRouting(true)
                .withDatabase("movies")
                .withClock(clock)
                .withLogging(logging)
                .build();

        var leaf = config.withAutoRouting(false);

        assertFalse(leaf.autoRouting());
        assertTrue(config.autoRouting());
        assertEquals("movies", leaf.database());
        assertSame(clock, leaf.clock());
        assertSame(logging, leaf.logging());
    }

    @Test
    void shouldReturnSameConfigWhenAutoRoutingIsUnchanged() {
        var config = Config.builder().withAutoRouting(true).build();

        assertSame(config, config.withAutoRouting(true));
    }

    @Test
    void shouldRejectBlankDatabase() {
        var builder = Config.builder();

        assertThrows(IllegalArgumentException.class, () -> builder.withDatabase(" "));
        assertThrows(IllegalArgumentException.class, () -> builder.withDatabase(null));
    }

    @Test
    void shouldRejectNullLogging() {
        assertThrows(NullPointerException.class, () -> Config.builder().withLogging(null));
    }
}
