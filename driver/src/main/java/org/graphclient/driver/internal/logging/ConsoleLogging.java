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

import static java.time.format.DateTimeFormatter.ISO_LOCAL_DATE_TIME;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Objects;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.StreamHandler;
import org.graphclient.driver.Logger;
import org.graphclient.driver.Logging;

/**
 * Writes client logs to {@code System.err} through {@link java.util.logging}, one line per message followed by the
 * stack trace of a logged cause.
 * <p>
 * Every {@link #getLog(String)} call reconfigures the named {@link java.util.logging.Logger}: it stops forwarding to
 * parent handlers and keeps a single standard error handler at the configured level.
 */
public final class ConsoleLogging implements Logging {
    private final Level level;

    public ConsoleLogging(Level level) {
        this.level = Objects.requireNonNull(level, "level");
    }

    @Override
    public Logger getLog(String name) {
        var julLogger = java.util.logging.Logger.getLogger(name);
        julLogger.setUseParentHandlers(false);
        for (var handler : julLogger.getHandlers()) {
            if (handler instanceof StandardErrorHandler) {
                julLogger.removeHandler(handler);
            }
        }
        var handler = new StandardErrorHandler();
        handler.setLevel(level);
        julLogger.addHandler(handler);
        julLogger.setLevel(level);
        return new ConsoleLogger(julLogger);
    }

    static final class ConsoleLogger implements Logger {
        private final java.util.logging.Logger delegate;

        ConsoleLogger(java.util.logging.Logger delegate) {
            this.delegate = delegate;
        }

        @Override
        public void error(String message, Throwable cause) {
            log(Level.SEVERE, cause, message);
        }

        @Override
        public void info(String message, Object... params) {
            log(Level.INFO, null, message, params);
        }

        @Override
        public void warn(String message, Object... params) {
            log(Level.WARNING, null, message, params);
        }

        @Override
        public void warn(String message, Throwable cause) {
            log(Level.WARNING, cause, message);
        }

        @Override
        public void debug(String message, Object... params) {
            log(Level.FINE, null, message, params);
        }

        @Override
        public void trace(String message, Object... params) {
            log(Level.FINEST, null, message, params);
        }

        @Override
        public boolean isTraceEnabled() {
            return delegate.isLoggable(Level.FINEST);
        }

        @Override
        public boolean isDebugEnabled() {
            return delegate.isLoggable(Level.FINE);
        }

        private void log(Level level, Throwable cause, String template, Object... params) {
            if (delegate.isLoggable(level)) {
                delegate.log(level, MessageTemplates.render(template, params), cause);
            }
        }
    }

    private static final class StandardErrorHandler extends StreamHandler {
        StandardErrorHandler() {
            super(System.err, new LineFormatter());
        }

        @Override
        public synchronized void publish(LogRecord record) {
            super.publish(record);
            flush();
        }

        // System.err stays open
        @Override
        public synchronized void close() {
            flush();
        }
    }

    static final class LineFormatter extends Formatter {
        @Override
        public String format(LogRecord record) {
            var line = new StringBuilder()
                    .append(LocalDateTime.ofInstant(record.getInstant(), ZoneId.systemDefault())
                            .format(ISO_LOCAL_DATE_TIME))
                    .append(' ')
                    .append(record.getLevel().getName())
                    .append(" [")
                    .append(record.getLoggerName())
                    .append("] ")
                    .append(record.getMessage())
                    .append(System.lineSeparator());
            var thrown = record.getThrown();
            if (thrown != null) {
                var stackTrace = new StringWriter();
                thrown.printStackTrace(new PrintWriter(stackTrace));
                line.append(stackTrace);
            }
            return line.toString();
        }
    }
}
