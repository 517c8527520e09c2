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

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http2.Http2FrameLogger;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslHandler;
import io.netty.util.AttributeKey;
import io.netty.util.ReferenceCounted;
import io.netty.util.concurrent.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLParameters;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An APNs transport that maintains a single HTTP/2-over-TLS connection to an APNs server. The connection is opened
 * when the first request is sent and reopened for the next request after it closes for any reason. Requests are never
 * retried.
 */
class NettyApnsTransport implements ApnsTransport {

    private final Endpoint endpoint;
    private final SslContext sslContext;

    private final EventLoopGroup eventLoopGroup;
    private final boolean shouldShutDownEventLoopGroup;

    private final Bootstrap bootstrapTemplate;

    private Channel channel;
    private Promise<Channel> channelReadyPromise;

    private final AtomicBoolean isClosed = new AtomicBoolean(false);

    static final AttributeKey<Promise<Channel>> CHANNEL_READY_PROMISE_ATTRIBUTE_KEY =
            AttributeKey.valueOf(NettyApnsTransport.class, "channelReadyPromise");

    private static final IllegalStateException TRANSPORT_CLOSED_EXCEPTION =
            new IllegalStateException("Transport has been closed and can no longer send requests.");

    private static final Logger log = LoggerFactory.getLogger(NettyApnsTransport.class);

    /**
     * Constructs a new transport.
     *
     * @param endpoint the server to which to connect
     * @param sslContext the TLS context with which to secure connections; must negotiate HTTP/2 via ALPN
     * @param hostnameVerificationEnabled whether to check the server's certificate against the endpoint's host name
     * @param connectionTimeout the maximum time to wait for a TCP connection to be established; may be {@code null}
     * @param eventLoopGroup the event loop group on which to perform I/O; if {@code null}, the transport creates a
     * single-threaded group of its own and shuts it down when closed
     * @param frameLogger a logger for all inbound and outbound HTTP/2 frames; may be {@code null}
     */
    NettyApnsTransport(final Endpoint endpoint,
                       final SslContext sslContext,
                       final boolean hostnameVerificationEnabled,
                       final Duration connectionTimeout,
                       final EventLoopGroup eventLoopGroup,
                       final Http2FrameLogger frameLogger) {

        this.endpoint = endpoint;
        this.sslContext = sslContext;

        if (this.sslContext instanceof ReferenceCounted) {
            ((ReferenceCounted) this.sslContext).retain();
        }

        if (eventLoopGroup != null) {
            this.eventLoopGroup = eventLoopGroup;
            this.shouldShutDownEventLoopGroup = false;
        } else {
            this.eventLoopGroup = new NioEventLoopGroup(1);
            this.shouldShutDownEventLoopGroup = true;
        }

        this.bootstrapTemplate = new Bootstrap();
        this.bootstrapTemplate.group(this.eventLoopGroup);
        this.bootstrapTemplate.channel(SocketChannelClassUtil.getSocketChannelClass(this.eventLoopGroup));
        this.bootstrapTemplate.option(ChannelOption.TCP_NODELAY, true);
        this.bootstrapTemplate.remoteAddress(endpoint.getHost(), endpoint.getPort());

        if (connectionTimeout != null) {
            this.bootstrapTemplate.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectionTimeout.toMillis());
        }

        this.bootstrapTemplate.handler(new ChannelInitializer<SocketChannel>() {

            @Override
            protected void initChannel(final SocketChannel channel) {
                final SslHandler sslHandler = sslContext.newHandler(channel.alloc(), endpoint.getHost(), endpoint.getPort());

                if (hostnameVerificationEnabled) {
                    final SSLEngine sslEngine = sslHandler.engine();
                    final SSLParameters sslParameters = sslEngine.getSSLParameters();
                    sslParameters.setEndpointIdentificationAlgorithm("HTTPS");
                    sslEngine.setSSLParameters(sslParameters);
                }

                final ApnsTransportHandler.ApnsTransportHandlerBuilder handlerBuilder =
                        new ApnsTransportHandler.ApnsTransportHandlerBuilder()
                                .authority(endpoint.getHost());

                if (frameLogger != null) {
                    handlerBuilder.frameLogger(frameLogger);
                }

                channel.pipeline().addLast(sslHandler);
                channel.pipeline().addLast(handlerBuilder.build());
            }
        });
    }

    @Override
    public CompletableFuture<Http2Response> send(final Http2Request request) {
        if (this.isClosed.get()) {
            request.getResponseFuture().completeExceptionally(TRANSPORT_CLOSED_EXCEPTION);
            return request.getResponseFuture();
        }

        final Promise<Channel> readyPromise = this.getReadyChannel();

        readyPromise.addListener(future -> {
            if (future.isSuccess()) {
                readyPromise.getNow().writeAndFlush(request).addListener(writeFuture -> {
                    if (!writeFuture.isSuccess()) {
                        request.getResponseFuture().completeExceptionally(writeFuture.cause());
                    }
                });
            } else {
                request.getResponseFuture().completeExceptionally(future.cause());
            }
        });

        return request.getResponseFuture();
    }

    private synchronized Promise<Channel> getReadyChannel() {
        final boolean needsNewConnection = this.channelReadyPromise == null ||
                (this.channelReadyPromise.isDone() && !(this.channelReadyPromise.isSuccess() && this.channel.isActive()));

        if (needsNewConnection) {
            this.connect();
        }

        return this.channelReadyPromise;
    }

    private void connect() {
        final Bootstrap bootstrap = this.bootstrapTemplate.clone();
        final Promise<Channel> readyPromise = bootstrap.config().group().next().newPromise();

        bootstrap.attr(CHANNEL_READY_PROMISE_ATTRIBUTE_KEY, readyPromise);

        log.debug("Connecting to {}", this.endpoint);

        final ChannelFuture connectFuture = bootstrap.connect();

        connectFuture.addListener(future -> {
            if (!future.isSuccess()) {
                log.debug("Failed to connect to {}", this.endpoint, future.cause());
                readyPromise.tryFailure(future.cause());
            }
        });

        connectFuture.channel().closeFuture().addListener(future -> log.debug("Connection to {} closed", this.endpoint));

        this.channel = connectFuture.channel();
        this.channelReadyPromise = readyPromise;
    }

    @Override
    public CompletableFuture<Void> close() {
        final CompletableFuture<Void> closeFuture = new CompletableFuture<>();

        if (this.isClosed.compareAndSet(false, true)) {
            final Channel channelToClose;

            synchronized (this) {
                channelToClose = this.channel;

                this.channel = null;
                this.channelReadyPromise = null;
            }

            final CompletableFuture<Void> channelClosedFuture = new CompletableFuture<>();

            if (channelToClose != null) {
                channelToClose.close().addListener(future -> channelClosedFuture.complete(null));
            } else {
                channelClosedFuture.complete(null);
            }

            channelClosedFuture.thenRun(() -> {
                if (this.sslContext instanceof ReferenceCounted) {
                    ((ReferenceCounted) this.sslContext).release();
                }

                if (this.shouldShutDownEventLoopGroup) {
                    this.eventLoopGroup.shutdownGracefully().addListener(future -> closeFuture.complete(null));
                } else {
                    closeFuture.complete(null);
                }
            });
        } else {
            closeFuture.complete(null);
        }

        return closeFuture;
    }
}
