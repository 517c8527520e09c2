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

import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http2.DefaultHttp2Headers;
import io.netty.handler.codec.http2.Http2Headers;
import io.netty.util.AsciiString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tokenpush.apns.auth.AuthenticationToken;
import org.tokenpush.apns.auth.AuthenticationTokenSigner;
import org.tokenpush.apns.payload.Payload;
import org.tokenpush.apns.payload.PayloadSerializer;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * <p>An APNs client sends push notifications to the APNs gateway using token-based authentication. Clients are
 * constructed using an {@link ApnsClientBuilder}. Each client holds a single signing key and signs a new
 * authentication token whenever its current token is twenty minutes old; between refreshes, every notification carries
 * the same token.</p>
 *
 * <p>Sending a notification is asynchronous: {@link #push(Payload, String, PushOptions)} returns a future that
 * completes with a {@link PushReceipt} when the server accepts the notification, or exceptionally with an
 * {@link ApnsClientException} describing why the notification could not be sent or was rejected. Rejections reported by
 * the server arrive as {@link ApnsServiceException}. Clients never retry.</p>
 *
 * <p>APNs clients are <em>not</em> thread-safe: sending a notification may replace the client's cached authentication
 * token without synchronization. Callers that share a client between threads must synchronize calls to
 * {@link #push(Payload, String, PushOptions)}, or give each thread its own client.</p>
 *
 * <p>Callers must call {@link #close()} when they are done with a client to release its connection and, if the client
 * created its own event loop group, its I/O threads.</p>
 *
 * @see ApnsClientBuilder
 */
public class ApnsClient {

    private final Endpoint endpoint;
    private final AuthenticationTokenSigner tokenSigner;
    private final ApnsTransport transport;
    private final PayloadSerializer payloadSerializer;

    private final AtomicBoolean isClosed = new AtomicBoolean(false);

    static final String DEVICE_PATH_PREFIX = "/3/device/";

    static final AsciiString APNS_AUTHORIZATION_HEADER = new AsciiString("authorization");
    static final AsciiString APNS_PUSH_TYPE_HEADER = new AsciiString("apns-push-type");
    static final AsciiString APNS_ID_HEADER = new AsciiString("apns-id");
    static final AsciiString APNS_EXPIRATION_HEADER = new AsciiString("apns-expiration");
    static final AsciiString APNS_PRIORITY_HEADER = new AsciiString("apns-priority");
    static final AsciiString APNS_COLLAPSE_ID_HEADER = new AsciiString("apns-collapse-id");
    static final AsciiString APNS_TOPIC_HEADER = new AsciiString("apns-topic");
    static final AsciiString APNS_UNIQUE_ID_HEADER = new AsciiString("apns-unique-id");

    private static final IllegalStateException CLIENT_CLOSED_EXCEPTION =
            new IllegalStateException("Client has been closed and can no longer send push notifications.");

    private static final Logger log = LoggerFactory.getLogger(ApnsClient.class);

    ApnsClient(final Endpoint endpoint, final AuthenticationTokenSigner tokenSigner, final ApnsTransport transport) {
        this(endpoint, tokenSigner, transport, new PayloadSerializer());
    }

    ApnsClient(final Endpoint endpoint, final AuthenticationTokenSigner tokenSigner, final ApnsTransport transport, final PayloadSerializer payloadSerializer) {
        this.endpoint = Objects.requireNonNull(endpoint);
        this.tokenSigner = Objects.requireNonNull(tokenSigner);
        this.transport = Objects.requireNonNull(transport);
        this.payloadSerializer = Objects.requireNonNull(payloadSerializer);
    }

    /**
     * Returns the server to which this client sends notifications.
     */
    public Endpoint getEndpoint() {
        return endpoint;
    }

    /**
     * <p>Sends a push notification to the APNs gateway.</p>
     *
     * <p>The authentication token, request headers and serialized payload are prepared before this method returns; if
     * any of them cannot be prepared, the returned future has already failed and nothing is sent. Otherwise the future
     * completes when the server replies or the exchange fails.</p>
     *
     * <p>The returned future fails with:</p>
     *
     * <ul>
     *     <li>{@link TokenSigningException} or {@link ClockException} if no authentication token could be issued</li>
     *     <li>{@link InvalidHeaderException} if the device token or an option contains characters that may not be sent
     *     in a header</li>
     *     <li>{@link TransportException} if the request could not be exchanged with the server</li>
     *     <li>{@link InvalidResponseException} or {@link HeaderDecodeException} if the server's reply was malformed</li>
     *     <li>{@link ApnsServiceException} if the server rejected the notification</li>
     *     <li>{@link IllegalStateException} if this client has been closed</li>
     * </ul>
     *
     * @param payload the payload to send
     * @param deviceToken the hex-encoded token of the device to which to send the notification
     * @param options the request options, including the notification's topic
     *
     * @return a future that completes with the server's receipt for the notification
     */
    public CompletableFuture<PushReceipt> push(final Payload payload, final String deviceToken, final PushOptions options) {
        Objects.requireNonNull(payload, "Payload must not be null.");
        Objects.requireNonNull(deviceToken, "Device token must not be null.");
        Objects.requireNonNull(options, "Options must not be null.");

        final CompletableFuture<PushReceipt> receiptFuture = new CompletableFuture<>();

        if (this.isClosed.get()) {
            receiptFuture.completeExceptionally(CLIENT_CLOSED_EXCEPTION);
            return receiptFuture;
        }

        final Http2Request request;

        try {
            request = this.buildRequest(payload, deviceToken, options);
        } catch (final ApnsClientException e) {
            receiptFuture.completeExceptionally(e);
            return receiptFuture;
        }

        this.transport.send(request).whenComplete((response, cause) -> {
            if (cause != null) {
                receiptFuture.completeExceptionally(new TransportException("Failed to exchange request with APNs server.",
                        unwrapCompletionCause(cause)));
            } else {
                try {
                    receiptFuture.complete(handleResponse(response));
                } catch (final ApnsClientException e) {
                    receiptFuture.completeExceptionally(e);
                }
            }
        });

        return receiptFuture;
    }

    private Http2Request buildRequest(final Payload payload, final String deviceToken, final PushOptions options) throws ApnsClientException {
        final AuthenticationToken token = this.tokenSigner.getAuthenticationToken();

        final Http2Headers headers = new DefaultHttp2Headers();
        headers.add(APNS_AUTHORIZATION_HEADER, token.getAuthorizationHeader());

        if (options.getPushType().isPresent()) {
            headers.add(APNS_PUSH_TYPE_HEADER, options.getPushType().get().getHeaderValue());
        }

        if (options.getApnsId().isPresent()) {
            headers.add(APNS_ID_HEADER, HeaderValues.requireValidRequestValue("apns-id", options.getApnsId().get()));
        }

        if (options.getExpiration().isPresent()) {
            headers.addLong(APNS_EXPIRATION_HEADER, options.getExpiration().get().getEpochSecond());
        }

        if (options.getPriority().isPresent()) {
            headers.addInt(APNS_PRIORITY_HEADER, options.getPriority().get().getCode());
        }

        if (options.getCollapseId().isPresent()) {
            headers.add(APNS_COLLAPSE_ID_HEADER, HeaderValues.requireValidRequestValue("apns-collapse-id", options.getCollapseId().get()));
        }

        headers.add(APNS_TOPIC_HEADER, HeaderValues.requireValidRequestValue("apns-topic", options.getTopic()));

        final String path = DEVICE_PATH_PREFIX + HeaderValues.requireValidRequestValue("device token", deviceToken);
        final byte[] payloadBytes = this.payloadSerializer.serialize(payload).getBytes(StandardCharsets.UTF_8);

        log.trace("Prepared request for {}{} with {} payload bytes", this.endpoint.getBaseUri(), path, payloadBytes.length);

        return new Http2Request(path, headers, payloadBytes);
    }

    static PushReceipt handleResponse(final Http2Response response) throws ApnsClientException {
        final Http2Headers headers = response.getHeaders();

        final CharSequence apnsIdValue = headers.get(APNS_ID_HEADER);

        if (apnsIdValue == null) {
            throw new InvalidResponseException("Response did not include an apns-id header.");
        }

        final String apnsId = HeaderValues.requireVisibleAscii(APNS_ID_HEADER.toString(), apnsIdValue);

        final CharSequence apnsUniqueIdValue = headers.get(APNS_UNIQUE_ID_HEADER);
        final String apnsUniqueId = apnsUniqueIdValue != null ?
                HeaderValues.requireVisibleAscii(APNS_UNIQUE_ID_HEADER.toString(), apnsUniqueIdValue) : null;

        final PushReceipt receipt = new PushReceipt(apnsId, apnsUniqueId);

        final CharSequence statusValue = headers.status();

        if (statusValue == null) {
            throw new InvalidResponseException("Response did not include a :status pseudo-header.");
        }

        final HttpResponseStatus status;

        try {
            status = HttpResponseStatus.parseLine(statusValue);
        } catch (final IllegalArgumentException e) {
            throw new InvalidResponseException("Could not parse response status: " + statusValue, e);
        }

        if (HttpResponseStatus.OK.code() == status.code()) {
            return receipt;
        }

        final ErrorResponse errorResponse = ErrorResponse.fromJson(new String(response.getData(), StandardCharsets.UTF_8));

        throw new ApnsServiceException(status.code(), errorResponse.getReason(), errorResponse.getTimestamp(), receipt);
    }

    private static Throwable unwrapCompletionCause(final Throwable cause) {
        if ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            return cause.getCause();
        }

        return cause;
    }

    /**
     * <p>Shuts down the client, closing its connection and releasing its resources. Notifications whose replies have
     * not yet arrived fail with a {@link TransportException}.</p>
     *
     * <p>The returned future completes when the connection has closed and, if the client created its own event loop
     * group, that group has shut down. Clients may not be reused once they have been closed.</p>
     *
     * @return a future that completes when the client has finished shutting down
     */
    public CompletableFuture<Void> close() {
        log.info("Shutting down.");

        if (this.isClosed.compareAndSet(false, true)) {
            return this.transport.close();
        }

        return CompletableFuture.completedFuture(null);
    }
}
