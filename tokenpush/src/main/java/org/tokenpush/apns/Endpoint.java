/*
 * Copyright (c) 2020 Jon Chambers
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package org.tokenpush.apns;

import java.util.Objects;

/**
 * The host and port of an APNs server. Apple operates a production and a development environment, each reachable on
 * the standard HTTPS port and on an alternate port for networks that block outbound traffic on 443.
 */
public final class Endpoint {

    /**
     * The hostname of the production APNs environment.
     */
    public static final String PRODUCTION_APNS_HOST = "api.push.apple.com";

    /**
     * The hostname of the development APNs environment.
     */
    public static final String DEVELOPMENT_APNS_HOST = "api.sandbox.push.apple.com";

    /**
     * The default (HTTPS) port for communication with the APNs server.
     */
    public static final int DEFAULT_APNS_PORT = 443;

    /**
     * The alternate port for communication with the APNs server.
     */
    public static final int ALTERNATE_APNS_PORT = 2197;

    public static final Endpoint PRODUCTION = new Endpoint(PRODUCTION_APNS_HOST, DEFAULT_APNS_PORT);
    public static final Endpoint PRODUCTION_ALTERNATE_PORT = new Endpoint(PRODUCTION_APNS_HOST, ALTERNATE_APNS_PORT);
    public static final Endpoint DEVELOPMENT = new Endpoint(DEVELOPMENT_APNS_HOST, DEFAULT_APNS_PORT);
    public static final Endpoint DEVELOPMENT_ALTERNATE_PORT = new Endpoint(DEVELOPMENT_APNS_HOST, ALTERNATE_APNS_PORT);

    private final String host;
    private final int port;

    /**
     * Constructs an endpoint for an arbitrary APNs-compatible server.
     *
     * @throws IllegalArgumentException if the host is blank or the port is outside the range [1, 65535]
     */
    public Endpoint(final String host, final int port) {
        Objects.requireNonNull(host, "Host must not be null.");

        if (host.trim().isEmpty()) {
            throw new IllegalArgumentException("Host must not be blank.");
        }

        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Port must be between 1 and 65535, but was " + port);
        }

        this.host = host;
        this.port = port;
    }

    /**
     * Parses an endpoint from its canonical {@code host:port} form, as produced by {@link #toString()}.
     *
     * @throws IllegalArgumentException if the given string is not of the form {@code host:port}
     */
    public static Endpoint parse(final String hostAndPort) {
        Objects.requireNonNull(hostAndPort, "Endpoint string must not be null.");

        final int separatorIndex = hostAndPort.lastIndexOf(':');

        if (separatorIndex <= 0 || separatorIndex == hostAndPort.length() - 1) {
            throw new IllegalArgumentException("Endpoint must be of the form host:port, but was \"" + hostAndPort + "\"");
        }

        final int port;

        try {
            port = Integer.parseInt(hostAndPort.substring(separatorIndex + 1));
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Could not parse port from \"" + hostAndPort + "\"", e);
        }

        return new Endpoint(hostAndPort.substring(0, separatorIndex), port);
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    /**
     * Returns the base URI of this endpoint, e.g. {@code https://api.push.apple.com:443}.
     */
    public String getBaseUri() {
        return "https://" + this;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final Endpoint endpoint = (Endpoint) o;
        return port == endpoint.port && host.equals(endpoint.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port);
    }

    /**
     * Returns the canonical {@code host:port} form of this endpoint.
     */
    @Override
    public String toString() {
        return host + ":" + port;
    }
}
