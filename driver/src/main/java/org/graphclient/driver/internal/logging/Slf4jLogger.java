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

import java.util.Objects;
import org.graphclient.driver.Logger;
import org.slf4j.event.Level;

/**
 * Renders {@code %s} templates itself and hands finished messages to SLF4J, whose own placeholder is {@code {}}.
 */
final class Slf4jLogger implements Logger {
    private final org.slf4j.Logger delegate;

    Slf4jLogger(org.slf4j.Logger delegate) {
        this.delegate = Objects.requireNonNull(delegate);
    }

    @Override
    public void error(String message, Throwable cause) {
        log(Level.ERROR, cause, message);
    }

    @Override
    public void info(String message, Object... params) {
        log(Level.INFO, null, message, params);
    }

    @Override
    public void warn(String message, Object... params) {
        log(Level.WARN, null, message, params);
    }

    @Override
    public void warn(String message, Throwable cause) {
        log(Level.WARN, cause, message);
    }

    @Override
    public void debug(String message, Object... params) {
        log(Level.DEBUG, null, message, params);
    }

    @Override
    public void trace(String message, Object... params) {
        log(Level.TRACE, null, message, params);
    }

    @Override
    public boolean isTraceEnabled() {
        return isEnabled(Level.TRACE);
    }

    @Override
    public boolean isDebugEnabled() {
        return isEnabled(Level.DEBUG);
    }

    private void log(Level level, Throwable cause, String template, Object... params) {
        if (!isEnabled(level)) {
            return;
        }
        var message = MessageTemplates.render(template, params);
        switch (level) {
            case ERROR -> delegate.error(message, cause);
            case WARN -> {
                if (cause == null) {
                    delegate.warn(message);
                } else {
                    delegate.warn(message, cause);
                }
            }
            case INFO -> delegate.info(message);
            case DEBUG -> delegate.debug(message);
            case TRACE -> delegate.trace(message);
        }
    }

    private boolean isEnabled(Level level) {
        return switch (level) {
            case ERROR -> delegate.isErrorEnabled();
            case WARN -> delegate.isWarnEnabled();
            case INFO -> delegate.isInfoEnabled();
            case DEBUG -> delegate.isDebugEnabled();
            case TRACE -> delegate.isTraceEnabled();
        };
    }
}
