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

final class MessageTemplates {
    private MessageTemplates() {}

    /**
     * Apply {@link String#format(String, Object...)} to a template. A template without parameters is returned as is,
     * so a literal {@code %} in a plain message is kept.
     */
    static String render(String template, Object... params) {
        if (params == null || params.length == 0) {
            return template;
        }
        return String.format(template, params);
    }
}
