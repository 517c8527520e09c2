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

package org.tokenpush.apns.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http2.Http2SecurityUtil;
import io.netty.handler.ssl.ApplicationProtocolConfig;
import io.netty.handler.ssl.ApplicationProtocolNames;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.ssl.SslProvider;
import io.netty.handler.ssl.SupportedCipherSuiteFilter;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.security.interfaces.ECPublicKey;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * <p>A TLS-secured HTTP/2 server that imitates the APNs device endpoint closely enough to exercise a real client
 * connection. Bearer tokens are verified against a single public key; device tokens must be registered before
 * notifications addressed to them are accepted.</p>
 *
 * <p>Mock servers are intended for tests only and keep every authenticated request they receive in memory.</p>
 */
public class MockApnsServer {

    private final SslContext sslContext;

    private final ECPublicKey verificationKey;
    private final String teamId;
    private final String keyId;

    private final ServerBootstrap bootstrap;
    private final ChannelGroup connections;
    private Channel serverChannel;
    private CompletableFuture<Void> shutdownFuture;

    private final Set<String> registeredDeviceTokens = ConcurrentHashMap.newKeySet();
    private final Map<String, Instant> unregisteredDeviceTokens = new ConcurrentHashMap<>();
    private final Set<String> resetDeviceTokens = ConcurrentHashMap.newKeySet();
    private volatile boolean uniqueIdEnabled = false;

    private final List<ReceivedRequest> receivedRequests = new CopyOnWriteArrayList<>();

    private static final Logger log = LoggerFactory.getLogger(MockApnsServer.class);

    @ChannelHandler.Sharable
    private static class ConnectionNegotiationErrorHandler extends ChannelInboundHandlerAdapter {

        static final ConnectionNegotiationErrorHandler INSTANCE = new ConnectionNegotiationErrorHandler();

        @Override
        public void exceptionCaught(final ChannelHandlerContext context, final Throwable cause) {
            log.debug("Server caught an exception before establishing an HTTP/2 connection.", cause);
        }
    }

    /**
     * Constructs a new mock server with its own single-threaded event loop group.
     *
     * @param sslContext the server-side TLS context; must advertise HTTP/2 via ALPN
     * @param verificationKey the public key against which bearer token signatures are checked
     * @param teamId the team identifier every bearer token must name
     * @param keyId the key identifier every bearer token must name
     */
    public MockApnsServer(final SslContext sslContext, final ECPublicKey verificationKey, final String teamId, final String keyId) {
        this.sslContext = sslContext;
        this.verificationKey = verificationKey;
        this.teamId = teamId;
        this.keyId = keyId;

        this.bootstrap = new ServerBootstrap();
        this.bootstrap.group(new NioEventLoopGroup(1));
        this.bootstrap.channel(NioServerSocketChannel.class);

        this.connections = new DefaultChannelGroup(this.bootstrap.config().group().next());

        this.bootstrap.childHandler(new ChannelInitializer<SocketChannel>() {

            @Override
            protected void initChannel(final SocketChannel channel) {
                final SslHandler sslHandler = sslContext.newHandler(channel.alloc());
                channel.pipeline().addLast(sslHandler);
                channel.pipeline().addLast(ConnectionNegotiationErrorHandler.INSTANCE);

                sslHandler.handshakeFuture().addListener(handshakeFuture -> {
                    if (handshakeFuture.isSuccess()) {
                        channel.pipeline().addLast(new MockApnsServerHandler.MockApnsServerHandlerBuilder()
                                .server(MockApnsServer.this)
                                .build());

                        channel.pipeline().remove(ConnectionNegotiationErrorHandler.INSTANCE);

                        MockApnsServer.this.connections.add(channel);
                    } else {
                        log.debug("TLS handshake failed.", handshakeFuture.cause());
                    }
                });
            }
        });
    }

    /**
     * Builds a server-side TLS context from PEM-encoded certificates and a PKCS#8 private key.
     *
     * @param certificateChain the server's certificate chain
     * @param privateKey the server's private key
     *
     * @return a TLS context that negotiates HTTP/2
     *
     * @throws SSLException if the context could not be constructed
     */
    public static SslContext buildSslContext(final InputStream certificateChain, final InputStream privateKey) throws SSLException {
        return SslContextBuilder.forServer(certificateChain, privateKey)
                .sslProvider(SslProvider.JDK)
                .ciphers(Http2SecurityUtil.CIPHERS, SupportedCipherSuiteFilter.INSTANCE)
                .applicationProtocolConfig(new ApplicationProtocolConfig(
                        ApplicationProtocolConfig.Protocol.ALPN,
                        ApplicationProtocolConfig.SelectorFailureBehavior.NO_ADVERTISE,
                        ApplicationProtocolConfig.SelectedListenerFailureBehavior.ACCEPT,
                        ApplicationProtocolNames.HTTP_2))
                .build();
    }

    /**
     * Starts this server on the given port.
     *
     * @param port the port to which to bind, or 0 for any free port
     *
     * @return a future that completes with the bound port once the server is accepting connections
     */
    public CompletableFuture<Integer> start(final int port) {
        final ChannelFuture channelFuture = this.bootstrap.bind(port);
        final CompletableFuture<Integer> startFuture = new CompletableFuture<>();

        channelFuture.addListener(future -> {
            if (future.isSuccess()) {
                this.serverChannel = channelFuture.channel();
                startFuture.complete(((InetSocketAddress) channelFuture.channel().localAddress()).getPort());
            } else {
                startFuture.completeExceptionally(future.cause());
            }
        });

        return startFuture;
    }

    /**
     * Closes every open client connection while continuing to accept new ones.
     *
     * @return a future that completes once all connections have closed
     */
    public CompletableFuture<Void> closeConnections() {
        return toCompletableFuture(this.connections.close());
    }

    /**
     * Unbinds this server, closes all connections and shuts down its event loop group. Servers may not be restarted
     * after shutting down; repeated calls return the same future.
     *
     * @return a future that completes once the event loop group has terminated
     */
    public synchronized CompletableFuture<Void> shutdown() {
        if (this.shutdownFuture != null) {
            return this.shutdownFuture;
        }

        final List<Future<?>> closeFutures = new ArrayList<>();
        closeFutures.add(this.connections.close());

        if (this.serverChannel != null) {
            closeFutures.add(this.serverChannel.close());
        }

        final CompletableFuture<?>[] closed = closeFutures.stream()
                .map(MockApnsServer::toCompletableFuture)
                .toArray(CompletableFuture[]::new);

        this.shutdownFuture = CompletableFuture.allOf(closed)
                .thenCompose(ignored -> toCompletableFuture(this.bootstrap.config().group().shutdownGracefully()))
                .thenRun(() -> ReferenceCountUtil.release(this.sslContext));

        return this.shutdownFuture;
    }

    private static <T> CompletableFuture<Void> toCompletableFuture(final Future<T> nettyFuture) {
        final CompletableFuture<Void> completableFuture = new CompletableFuture<>();

        nettyFuture.addListener(future -> {
            if (future.isSuccess()) {
                completableFuture.complete(null);
            } else {
                completableFuture.completeExceptionally(future.cause());
            }
        });

        return completableFuture;
    }

    public void registerDeviceToken(final String deviceToken) {
        this.registeredDeviceTokens.add(deviceToken);
    }

    /**
     * Marks a device token as no longer active; notifications sent to it are rejected with status 410.
     *
     * @param deviceToken the device token to unregister
     * @param timestamp the time at which the token became inactive
     */
    public void unregisterDeviceToken(final String deviceToken, final Instant timestamp) {
        this.registeredDeviceTokens.remove(deviceToken);
        this.unregisteredDeviceTokens.put(deviceToken, timestamp);
    }

    /**
     * Causes the server to reset, rather than answer, streams carrying notifications for the given device token.
     *
     * @param deviceToken the device token whose streams should be reset
     */
    public void resetStreamsForDeviceToken(final String deviceToken) {
        this.resetDeviceTokens.add(deviceToken);
    }

    public void setUniqueIdEnabled(final boolean uniqueIdEnabled) {
        this.uniqueIdEnabled = uniqueIdEnabled;
    }

    public List<ReceivedRequest> getReceivedRequests() {
        return new ArrayList<>(this.receivedRequests);
    }

    void recordRequest(final ReceivedRequest request) {
        this.receivedRequests.add(request);
    }

    boolean isRegistered(final String deviceToken) {
        return this.registeredDeviceTokens.contains(deviceToken);
    }

    Instant getUnregistrationTimestamp(final String deviceToken) {
        return this.unregisteredDeviceTokens.get(deviceToken);
    }

    boolean shouldResetStream(final String deviceToken) {
        return this.resetDeviceTokens.contains(deviceToken);
    }

    boolean isUniqueIdEnabled() {
        return this.uniqueIdEnabled;
    }

    ECPublicKey getVerificationKey() {
        return this.verificationKey;
    }

    String getTeamId() {
        return this.teamId;
    }

    String getKeyId() {
        return this.keyId;
    }
}
