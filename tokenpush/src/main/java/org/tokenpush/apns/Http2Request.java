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

import io.netty.handler.codec.http2.Http2Headers;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A {@code POST} request to be sent to an APNs server, together with the future that receives its response. Headers
 * hold only the regular request headers; transports add the pseudo-headers for the method, scheme, authority and path.
 */
class Http2Request {

    private final String path;
    private final Http2Headers headers;
    private final byte[] payload;

    private final CompletableFuture<Http2Response> responseFuture = new CompletableFuture<>();

    Http2Request(final String path, final Http2Headers headers, final byte[] payload) {
        this.path = Objects.requireNonNull(path);
        this.headers = Objects.requireNonNull(headers);
        this.payload = Objects.requireNonNull(payload);
    }

    String getPath() {
        return path;
    }

    Http2Headers getHeaders() {
        return headers;
    }

    byte[] getPayload() {
        return payload;
    }

    CompletableFuture<Http2Response> getResponseFuture() {
        return responseFuture;
    }
}
