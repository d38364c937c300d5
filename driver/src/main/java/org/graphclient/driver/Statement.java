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

import static java.lang.String.format;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The components of a query statement, containing the query text and parameter map.
 * <p>
 * Instances are immutable. Parameters are copied at construction and exposed as an unmodifiable map.
 *
 * @see Session
 * @see Transaction
 */
public final class Statement {
    private final String text;
    private final Map<String, Object> parameters;

    /**
     * Create a new statement.
     *
     * @param text the query text
     * @param parameters the parameter map
     */
    public Statement(String text, Map<String, Object> parameters) {
        this.text = validateQueryText(text);
        this.parameters = parameters == null || parameters.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * Create a new statement without parameters.
     *
     * @param text the query text
     */
    public Statement(String text) {
        this(text, null);
    }

    /**
     * @return the query text
     */
    public String text() {
        return text;
    }

    /**
     * @return the parameter map
     */
    public Map<String, Object> parameters() {
        return parameters;
    }

    /**
     * @param newText the new query text
     * @return a new statement with updated text
     */
    public Statement withText(String newText) {
        return new Statement(newText, parameters);
    }

    /**
     * @param newParameters the new parameter map
     * @return a new statement with updated parameters
     */
    public Statement withParameters(Map<String, Object> newParameters) {
        return new Statement(text, newParameters);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        var statement = (Statement) o;
        return text.equals(statement.text) && parameters.equals(statement.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, parameters);
    }

    @Override
    public String toString() {
        return format("Statement{text='%s', parameters=%s}", text, parameters);
    }

    private static String validateQueryText(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Statement text should not be null");
        }
        return text;
    }
}
