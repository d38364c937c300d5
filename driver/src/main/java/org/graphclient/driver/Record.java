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

import java.util.List;
import java.util.Map;

/**
 * Container for keyed values returned by a statement, comparable to a row of a table.
 * <p>
 * Values are plain Java objects as decoded by the connection collaborator: strings, numbers, booleans,
 * {@link List lists}, {@link Map maps} and {@code null}.
 */
public interface Record {
    /**
     * Retrieve the keys of the underlying map, in their original order.
     *
     * @return all field keys in order
     */
    List<String> keys();

    /**
     * Check if the record contains a given key.
     *
     * @param key the key
     * @return {@code true} if this record contains the key
     */
    boolean containsKey(String key);

    /**
     * Retrieve the value of the property with the given key.
     *
     * @param key the key of the property
     * @return the property's value or {@code null} if no such key exists
     */
    Object get(String key);

    /**
     * @return the number of fields in this record
     */
    int size();

    /**
     * @return an unmodifiable view of the fields of this record
     */
    Map<String, Object> asMap();
}
