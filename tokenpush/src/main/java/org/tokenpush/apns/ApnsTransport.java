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

import java.util.concurrent.CompletableFuture;

/**
 * Exchanges requests with an APNs server. Transports are responsible for connection management and for reporting
 * every connection, TLS or stream failure through the returned future; they do not interpret responses.
 */
interface ApnsTransport {

    /**
     * Sends the given request and returns a future that completes with the server's response, or exceptionally if the
     * request could not be exchanged with the server. The returned future is the request's own response future.
     */
    CompletableFuture<Http2Response> send(Http2Request request);

    /**
     * Closes all connections and releases all resources held by this transport.
     */
    CompletableFuture<Void> close();
}
