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

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.CompositeByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpScheme;
import io.netty.handler.codec.http2.AbstractHttp2ConnectionHandlerBuilder;
import io.netty.handler.codec.http2.DefaultHttp2Headers;
import io.netty.handler.codec.http2.Http2CodecUtil;
import io.netty.handler.codec.http2.Http2Connection;
import io.netty.handler.codec.http2.Http2ConnectionDecoder;
import io.netty.handler.codec.http2.Http2ConnectionEncoder;
import io.netty.handler.codec.http2.Http2ConnectionHandler;
import io.netty.handler.codec.http2.Http2Exception;
import io.netty.handler.codec.http2.Http2Flags;
import io.netty.handler.codec.http2.Http2FrameListener;
import io.netty.handler.codec.http2.Http2FrameLogger;
import io.netty.handler.codec.http2.Http2Headers;
import io.netty.handler.codec.http2.Http2Settings;
import io.netty.handler.codec.http2.Http2Stream;
import io.netty.util.collection.IntObjectHashMap;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.PromiseCombiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * An HTTP/2 connection handler that writes {@link Http2Request Http2Requests} as {@code POST} streams and completes
 * each request's response future when the server finishes its reply, or exceptionally when the stream or connection
 * fails first.
 */
class ApnsTransportHandler extends Http2ConnectionHandler implements Http2FrameListener, Http2Connection.Listener {

    private final Map<Integer, Http2Request> unattachedRequestsByStreamId = new IntObjectHashMap<>();

    private final Http2Connection.PropertyKey responseHeadersPropertyKey;
    private final Http2Connection.PropertyKey responseDataPropertyKey;
    private final Http2Connection.PropertyKey requestPropertyKey;
    private final Http2Connection.PropertyKey streamErrorCausePropertyKey;

    private final String authority;

    private Throwable connectionErrorCause;

    private static final IOException STREAMS_EXHAUSTED_EXCEPTION =
            new IOException("HTTP/2 streams exhausted; closing connection.");

    private static final IOException STREAM_CLOSED_BEFORE_REPLY_EXCEPTION =
            new IOException("Stream closed before a reply was received");

    private static final Logger log = LoggerFactory.getLogger(ApnsTransportHandler.class);

    static class ApnsTransportHandlerBuilder extends AbstractHttp2ConnectionHandlerBuilder<ApnsTransportHandler, ApnsTransportHandlerBuilder> {

        private String authority;

        ApnsTransportHandlerBuilder authority(final String authority) {
            this.authority = authority;
            return this;
        }

        String authority() {
            return this.authority;
        }

        @Override
        public ApnsTransportHandlerBuilder frameLogger(final Http2FrameLogger frameLogger) {
            return super.frameLogger(frameLogger);
        }

        @Override
        public Http2FrameLogger frameLogger() {
            return super.frameLogger();
        }

        @Override
        protected final boolean isServer() {
            return false;
        }

        @Override
        protected boolean encoderEnforceMaxConcurrentStreams() {
            return true;
        }

        @Override
        public ApnsTransportHandler build(final Http2ConnectionDecoder decoder, final Http2ConnectionEncoder encoder, final Http2Settings initialSettings) {
            Objects.requireNonNull(this.authority(), "Authority must be set before building an ApnsTransportHandler.");

            final ApnsTransportHandler handler = new ApnsTransportHandler(decoder, encoder, initialSettings, this.authority());
            this.frameListener(handler);
            return handler;
        }

        @Override
        public ApnsTransportHandler build() {
            return super.build();
        }
    }

    ApnsTransportHandler(final Http2ConnectionDecoder decoder, final Http2ConnectionEncoder encoder, final Http2Settings initialSettings, final String authority) {
        super(decoder, encoder, initialSettings);

        this.authority = authority;

        this.responseHeadersPropertyKey = this.connection().newKey();
        this.responseDataPropertyKey = this.connection().newKey();
        this.requestPropertyKey = this.connection().newKey();
        this.streamErrorCausePropertyKey = this.connection().newKey();

        this.connection().addListener(this);
    }

    @Override
    public void write(final ChannelHandlerContext context, final Object message, final ChannelPromise writePromise) {
        if (message instanceof Http2Request) {
            final Http2Request request = (Http2Request) message;

            writePromise.addListener(future -> {
                if (!future.isSuccess()) {
                    log.trace("Failed to write request.", future.cause());
                    request.getResponseFuture().completeExceptionally(future.cause());
                }
            });

            this.writeRequest(context, request, writePromise);
        } else {
            // This should never happen, but in case some foreign debris winds up in the pipeline, just pass it through.
            log.error("Unexpected object in pipeline: {}", message);
            context.write(message, writePromise);
        }
    }

    private void writeRequest(final ChannelHandlerContext context, final Http2Request request, final ChannelPromise writePromise) {
        if (context.channel().isActive()) {
            final int streamId = this.connection().local().incrementAndGetNextStreamId();

            if (streamId > 0) {
                // Streams may be buffered by the encoder, so requests are attached in onStreamAdded once the stream
                // actually exists.
                this.unattachedRequestsByStreamId.put(streamId, request);

                // A write that fails before the stream exists never reaches onStreamAdded.
                writePromise.addListener(future -> {
                    if (!future.isSuccess()) {
                        this.unattachedRequestsByStreamId.remove(streamId);
                    }
                });

                final Http2Headers headers = new DefaultHttp2Headers()
                        .method(HttpMethod.POST.asciiName())
                        .scheme(HttpScheme.HTTPS.name())
                        .authority(this.authority)
                        .path(request.getPath())
                        .add(request.getHeaders());

                final ChannelPromise headersPromise = context.newPromise();
                this.encoder().writeHeaders(context, streamId, headers, 0, false, headersPromise);
                log.trace("Wrote headers on stream {}: {}", streamId, headers);

                final ChannelPromise dataPromise = context.newPromise();
                this.encoder().writeData(context, streamId, Unpooled.wrappedBuffer(request.getPayload()), 0, true, dataPromise);
                log.trace("Wrote {} payload bytes on stream {}", request.getPayload().length, streamId);

                final PromiseCombiner promiseCombiner = new PromiseCombiner(context.executor());
                promiseCombiner.addAll((ChannelFuture) headersPromise, dataPromise);
                promiseCombiner.finish(writePromise);
            } else {
                // Closing the channel makes the transport open a fresh connection for the next request.
                writePromise.tryFailure(STREAMS_EXHAUSTED_EXCEPTION);
                context.channel().close();
            }
        } else {
            writePromise.tryFailure(STREAM_CLOSED_BEFORE_REPLY_EXCEPTION);
        }
    }

    @Override
    public int onDataRead(final ChannelHandlerContext context, final int streamId, final ByteBuf data, final int padding, final boolean endOfStream) {
        final int bytesProcessed = data.readableBytes() + padding;

        final Http2Stream stream = this.connection().stream(streamId);
        ((CompositeByteBuf) stream.getProperty(this.responseDataPropertyKey)).addComponent(true, data.retain());

        if (endOfStream) {
            this.handleEndOfStream(stream);
        }

        return bytesProcessed;
    }

    @Override
    public void onHeadersRead(final ChannelHandlerContext context, final int streamId, final Http2Headers headers, final int streamDependency, final short weight, final boolean exclusive, final int padding, final boolean endOfStream) {
        this.onHeadersRead(context, streamId, headers, padding, endOfStream);
    }

    @Override
    public void onHeadersRead(final ChannelHandlerContext context, final int streamId, final Http2Headers headers, final int padding, final boolean endOfStream) {
        final Http2Stream stream = this.connection().stream(streamId);
        stream.setProperty(this.responseHeadersPropertyKey, headers);

        if (endOfStream) {
            this.handleEndOfStream(stream);
        }
    }

    private void handleEndOfStream(final Http2Stream stream) {
        final Http2Request request = stream.getProperty(this.requestPropertyKey);

        if (request != null) {
            final CompositeByteBuf responseData = stream.getProperty(this.responseDataPropertyKey);

            request.getResponseFuture().complete(new Http2Response(stream.getProperty(this.responseHeadersPropertyKey),
                    ByteBufUtil.getBytes(responseData)));
        } else {
            log.warn("Received a complete response on stream {}, but no request was attached to it", stream.id());
        }
    }

    @Override
    public void onPriorityRead(final ChannelHandlerContext ctx, final int streamId, final int streamDependency, final short weight, final boolean exclusive) {
    }

    @Override
    public void onRstStreamRead(final ChannelHandlerContext context, final int streamId, final long errorCode) {
        log.debug("Server reset stream {} with error code {}", streamId, errorCode);
    }

    @Override
    public void onSettingsAckRead(final ChannelHandlerContext ctx) {
    }

    @Override
    public void onSettingsRead(final ChannelHandlerContext context, final Http2Settings settings) {
        log.debug("Received settings from APNs server: {}", settings);

        // The first SETTINGS frame marks the end of connection setup; later ones have no effect on the promise.
        getChannelReadyPromise(context.channel()).trySuccess(context.channel());
    }

    @Override
    public void onPingRead(final ChannelHandlerContext ctx, final long pingData) {
    }

    @Override
    public void onPingAckRead(final ChannelHandlerContext context, final long pingData) {
    }

    @Override
    public void onPushPromiseRead(final ChannelHandlerContext ctx, final int streamId, final int promisedStreamId, final Http2Headers headers, final int padding) {
    }

    @Override
    public void onGoAwayRead(final ChannelHandlerContext context, final int lastStreamId, final long errorCode, final ByteBuf debugData) {
        log.info("Received GOAWAY from APNs server: {}", debugData.toString(StandardCharsets.UTF_8));
        context.close();
    }

    @Override
    public void onWindowUpdateRead(final ChannelHandlerContext ctx, final int streamId, final int windowSizeIncrement) {
    }

    @Override
    public void onUnknownFrame(final ChannelHandlerContext ctx, final byte frameType, final int streamId, final Http2Flags flags, final ByteBuf payload) {
    }

    @Override
    public void onStreamAdded(final Http2Stream stream) {
        stream.setProperty(this.requestPropertyKey, this.unattachedRequestsByStreamId.remove(stream.id()));
        stream.setProperty(this.responseDataPropertyKey, Unpooled.compositeBuffer());
    }

    @Override
    public void onStreamActive(final Http2Stream stream) {
    }

    @Override
    public void onStreamHalfClosed(final Http2Stream stream) {
    }

    @Override
    public void onStreamClosed(final Http2Stream stream) {
        // Completed requests ignore this; requests whose streams closed without a full reply fail here.
        final Http2Request request = stream.getProperty(this.requestPropertyKey);

        if (request != null) {
            final Throwable cause;

            if (stream.getProperty(this.streamErrorCausePropertyKey) != null) {
                cause = stream.getProperty(this.streamErrorCausePropertyKey);
            } else if (this.connectionErrorCause != null) {
                cause = this.connectionErrorCause;
            } else {
                cause = STREAM_CLOSED_BEFORE_REPLY_EXCEPTION;
            }

            request.getResponseFuture().completeExceptionally(cause);
        }
    }

    @Override
    public void onStreamRemoved(final Http2Stream stream) {
        stream.removeProperty(this.responseHeadersPropertyKey);
        stream.removeProperty(this.requestPropertyKey);
        stream.removeProperty(this.streamErrorCausePropertyKey);

        final CompositeByteBuf responseData = stream.removeProperty(this.responseDataPropertyKey);

        if (responseData != null) {
            responseData.release();
        }
    }

    @Override
    public void onGoAwaySent(final int lastStreamId, final long errorCode, final ByteBuf debugData) {
    }

    @Override
    public void onGoAwayReceived(final int lastStreamId, final long errorCode, final ByteBuf debugData) {
    }

    @Override
    protected void onStreamError(final ChannelHandlerContext context, final boolean isOutbound, final Throwable cause, final Http2Exception.StreamException streamException) {
        final Http2Stream stream = this.connection().stream(streamException.streamId());

        // The affected stream may already be closed (or was never open in the first place)
        if (stream != null) {
            stream.setProperty(this.streamErrorCausePropertyKey, streamException);
        }

        super.onStreamError(context, isOutbound, cause, streamException);
    }

    @Override
    protected void onConnectionError(final ChannelHandlerContext context, final boolean isOutbound, final Throwable cause, final Http2Exception http2Exception) {
        this.connectionErrorCause = http2Exception != null ? http2Exception : cause;

        super.onConnectionError(context, isOutbound, cause, http2Exception);
    }

    @Override
    public void channelInactive(final ChannelHandlerContext context) throws Exception {
        final Throwable cause = this.connectionErrorCause != null ? this.connectionErrorCause : STREAM_CLOSED_BEFORE_REPLY_EXCEPTION;

        for (final Http2Request request : this.unattachedRequestsByStreamId.values()) {
            request.getResponseFuture().completeExceptionally(cause);
        }

        this.unattachedRequestsByStreamId.clear();

        if (getChannelReadyPromise(context.channel()).tryFailure(cause)) {
            log.debug("Channel became inactive before SETTINGS frame received");
        }

        super.channelInactive(context);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext context, final Throwable cause) throws Exception {
        // Fails connection setup if the channel never became ready; no effect otherwise.
        getChannelReadyPromise(context.channel()).tryFailure(cause);

        if (Http2CodecUtil.getEmbeddedHttp2Exception(cause) != null) {
            super.exceptionCaught(context, cause);
        } else {
            log.debug("Closing channel {} after unexpected exception", context.channel(), cause);

            this.connectionErrorCause = cause;
            context.close();
        }
    }

    int getUnattachedRequestCount() {
        return this.unattachedRequestsByStreamId.size();
    }

    private Promise<Channel> getChannelReadyPromise(final Channel channel) {
        return channel.attr(NettyApnsTransport.CHANNEL_READY_PROMISE_ATTRIBUTE_KEY).get();
    }
}
