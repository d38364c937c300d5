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
package org.graphclient.driver.internal.cluster;

import java.net.URI;
import java.net.URISyntaxException;
import org.graphclient.driver.exceptions.ClientException;

/**
 * The components of a server URL. Components missing from the parsed text are {@code null}, the port is {@code -1}
 * when absent.
 * <p>
 * {@link #toString()} and parse errors never show the password, only {@link #toUrlString()} does.
 */
public record ServerUrl(
        String scheme,
        String user,
        String password,
        String host,
        int port,
        String path,
        String query,
        String fragment) {
    private static final String MASKED_PASSWORD = "****";

    public static ServerUrl parse(String url) {
        if (url == null || url.isBlank()) {
            throw invalidUrl(url, null);
        }
        var text = url.strip();
        URI uri;
        try {
            uri = new URI(text.contains("://") || text.startsWith("//") ? text : "//" + authorityWithBrackets(text));
        } catch (URISyntaxException e) {
            throw invalidUrl(url, e.getReason());
        }
        if (uri.getRawAuthority() != null && uri.getHost() == null) {
            // registry based authority, e.g. a host name with an underscore
            throw invalidUrl(url, null);
        }

        String user = null;
        String password = null;
        var userInfo = uri.getRawUserInfo();
        if (userInfo != null) {
            var separator = userInfo.indexOf(':');
            user = separator == -1 ? userInfo : userInfo.substring(0, separator);
            password = separator == -1 ? null : userInfo.substring(separator + 1);
        }
        return new ServerUrl(
                uri.getScheme(),
                user,
                password,
                uri.getHost(),
                uri.getPort(),
                emptyToNull(uri.getRawPath()),
                uri.getRawQuery(),
                uri.getRawFragment());
    }

    /**
     * Fill every component this URL lacks with the one of the given base.
     *
     * @param base the URL to take missing components from
     * @return the merged URL
     */
    public ServerUrl withDefaultsFrom(ServerUrl base) {
        return new ServerUrl(
                scheme != null ? scheme : base.scheme,
                user != null ? user : base.user,
                password != null ? password : base.password,
                host != null ? host : base.host,
                port != -1 ? port : base.port,
                path != null ? path : base.path,
                query != null ? query : base.query,
                fragment != null ? fragment : base.fragment);
    }

    public String toUrlString() {
        return render(password);
    }

    @Override
    public String toString() {
        return render(password == null ? null : MASKED_PASSWORD);
    }

    private String render(String shownPassword) {
        var builder = new StringBuilder();
        if (scheme != null) {
            builder.append(scheme).append(':');
        }
        if (host != null || user != null) {
            builder.append("//");
        }
        if (user != null) {
            builder.append(user);
            if (shownPassword != null) {
                builder.append(':').append(shownPassword);
            }
            builder.append('@');
        }
        if (host != null) {
            builder.append(host);
        }
        if (port != -1) {
            builder.append(':').append(port);
        }
        if (path != null) {
            builder.append(path);
        }
        if (query != null) {
            builder.append('?').append(query);
        }
        if (fragment != null) {
            builder.append('#').append(fragment);
        }
        return builder.toString();
    }

    private static String authorityWithBrackets(String address) {
        var end = address.length();
        for (var i = 0; i < address.length(); i++) {
            var c = address.charAt(i);
            if (c == '/' || c == '?' || c == '#') {
                end = i;
                break;
            }
        }
        var authority = address.substring(0, end);
        if (authority.startsWith("[") || authority.contains("@") || authority.indexOf(':') == authority.lastIndexOf(':')) {
            return address;
        }
        // multiple colons without brackets, expected to be an IPv6 address without port
        return "[" + authority + "]" + address.substring(end);
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static ClientException invalidUrl(String url, String reason) {
        var message = "Invalid URL format `" + redact(url) + "`";
        // the syntax error itself is not kept as cause, its message repeats the raw input
        return new ClientException(reason == null ? message : message + ": " + reason);
    }

    /**
     * Mask the password of a URL that could not be parsed.
     */
    static String redact(String url) {
        if (url == null) {
            return null;
        }
        var schemeEnd = url.indexOf("://");
        var authorityStart = schemeEnd == -1 ? (url.startsWith("//") ? 2 : 0) : schemeEnd + 3;
        var authorityEnd = url.length();
        for (var i = authorityStart; i < url.length(); i++) {
            var c = url.charAt(i);
            if (c == '/' || c == '?' || c == '#') {
                authorityEnd = i;
                break;
            }
        }
        var at = url.lastIndexOf('@', authorityEnd - 1);
        if (at < authorityStart) {
            return url;
        }
        var separator = url.indexOf(':', authorityStart);
        if (separator == -1 || separator > at) {
            return url;
        }
        return url.substring(0, separator + 1) + MASKED_PASSWORD + url.substring(at);
    }
}
