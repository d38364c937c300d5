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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.graphclient.driver.Record;

public class InternalRecord implements Record {
    private final List<String> keys;
    private final Map<String, Object> fields;

    public InternalRecord(Map<String, Object> fields) {
        // LinkedHashMap keeps the column order and tolerates null values
        var copy = new LinkedHashMap<>(fields);
        this.keys = Collections.unmodifiableList(new ArrayList<>(copy.keySet()));
        this.fields = Collections.unmodifiableMap(copy);
    }

    public InternalRecord(List<String> keys, List<Object> values) {
        this(zip(keys, values));
    }

    @Override
    public List<String> keys() {
        return keys;
    }

    @Override
    public boolean containsKey(String key) {
        return fields.containsKey(key);
    }

    @Override
    public Object get(String key) {
        return fields.get(key);
    }

    @Override
    public int size() {
        return keys.size();
    }

    @Override
    public Map<String, Object> asMap() {
        return fields;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Record otherRecord)) {
            return false;
        }
        return keys.equals(otherRecord.keys()) && fields.equals(otherRecord.asMap());
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return format("Record<%s>", fields);
    }

    private static Map<String, Object> zip(List<String> keys, List<Object> values) {
        if (keys.size() != values.size()) {
            throw new IllegalArgumentException(
                    format("Record has %d keys but %d values", keys.size(), values.size()));
        }
        var result = new LinkedHashMap<String, Object>();
        for (var i = 0; i < keys.size(); i++) {
            result.put(keys.get(i), values.get(i));
        }
        return result;
    }
}
