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
package org.graphclient.driver.exceptions;

/**
 * This is the base class for all exceptions raised by the client itself.
 * <p>
 * Exceptions raised by the wire-level session and transaction collaborators are not wrapped and do not extend
 * this class.
 */
public abstract class DriverException extends RuntimeException {
    private static final long serialVersionUID = -80579062276712566L;

    private final String code;

    protected DriverException(String message) {
        this("N/A", message);
    }

    protected DriverException(String message, Throwable cause) {
        this("N/A", message, cause);
    }

    protected DriverException(String code, String message) {
        this(code, message, null);
    }

    protected DriverException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * Access the error code for this exception.
     *
     * @return the error code for this exception, or 'N/A' if none is available
     */
    public String code() {
        return code;
    }
}
