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

import io.netty.channel.EventLoopGroup;
import io.netty.handler.codec.http2.Http2FrameLogger;
import io.netty.handler.codec.http2.Http2SecurityUtil;
import io.netty.handler.ssl.ApplicationProtocolConfig;
import io.netty.handler.ssl.ApplicationProtocolConfig.Protocol;
import io.netty.handler.ssl.ApplicationProtocolConfig.SelectedListenerFailureBehavior;
import io.netty.handler.ssl.ApplicationProtocolConfig.SelectorFailureBehavior;
import io.netty.handler.ssl.ApplicationProtocolNames;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SupportedCipherSuiteFilter;
import io.netty.util.ReferenceCounted;
import org.tokenpush.apns.auth.ApnsSigningKey;
import org.tokenpush.apns.auth.AuthenticationTokenSigner;

import javax.net.ssl.SSLException;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Objects;

/**
 * <p>An {@code ApnsClientBuilder} constructs new {@link ApnsClient} instances. Callers must supply a signing key,
 * either as an {@link ApnsSigningKey} or as the PEM-armored contents of a PKCS#8 file with its team and key
 * identifiers; every other setting has a default. Clients connect to the production APNs environment unless another
 * {@link Endpoint} is set.</p>
 *
 * <p>Builders may be reused to construct multiple clients. Builders are not thread-safe.</p>
 */
public class ApnsClientBuilder {

    private Endpoint endpoint = Endpoint.PRODUCTION;

    private ApnsSigningKey signingKey;

    private String teamId;
    private String keyId;
    private String pkcs8Pem;

    private File trustedServerCertificatePemFile;
    private InputStream trustedServerCertificateInputStream;
    private X509Certificate[] trustedServerCertificates;

    private boolean hostnameVerificationEnabled = true;

    private EventLoopGroup eventLoopGroup;

    private Duration connectionTimeout;

    private Http2FrameLogger frameLogger;

    /**
     * Sets the APNs server to which clients connect. By default, clients connect to {@link Endpoint#PRODUCTION}.
     *
     * @param endpoint the server to which clients connect
     *
     * @return a reference to this builder
     */
    public ApnsClientBuilder setEndpoint(final Endpoint endpoint) {
        this.endpoint = Objects.requireNonNull(endpoint, "Endpoint must not be null.");
        return this;
    }

    /**
     * Sets the host and port of the APNs server to which clients connect.
     *
     * @see #setEndpoint(Endpoint)
     */
    public ApnsClientBuilder setApnsServer(final String host, final int port) {
        return this.setEndpoint(new Endpoint(host, port));
    }

    /**
     * Sets the key with which clients sign authentication tokens. Replaces any key material set with
     * {@link #setSigningKey(String, String, String)}.
     *
     * @param signingKey the key with which to sign authentication tokens
     *
     * @return a reference to this builder
     */
    public ApnsClientBuilder setSigningKey(final ApnsSigningKey signingKey) {
        this.signingKey = signingKey;

        this.teamId = null;
        this.keyId = null;
        this.pkcs8Pem = null;

        return this;
    }

    /**
     * Sets the key material with which clients sign authentication tokens. The key is parsed when a client is built, so
     * a malformed key causes {@link #build()} to fail with a {@link ClientInitializationException}. Replaces any key set
     * with {@link #setSigningKey(ApnsSigningKey)}.
     *
     * @param teamId the Apple-issued identifier of the team to which the key belongs
     * @param keyId the Apple-issued identifier of the key
     * @param pkcs8Pem the PEM-armored contents of the key's PKCS#8 file
     *
     * @return a reference to this builder
     */
    public ApnsClientBuilder setSigningKey(final String teamId, final String keyId, final String pkcs8Pem) {
        this.signingKey = null;

        this.teamId = Objects.requireNonNull(teamId, "Team identifier must not be null.");
        this.keyId = Objects.requireNonNull(keyId, "Key identifier must not be null.");
        this.pkcs8Pem = Objects.requireNonNull(pkcs8Pem, "Key material must not be null.");

        return this;
    }

    /**
     * <p>Sets the trusted certificate chain for clients using the contents of the given PEM file. If not set (or
     * {@code null}), clients use the JVM's default trust manager.</p>
     *
     * <p>Callers will generally not need to set a trusted server certificate chain in normal operation, but may wish to
     * do so for certificate pinning or connecting to a mock server for integration testing.</p>
     *
     * @param certificatePemFile a PEM file containing one or more trusted certificates
     *
     * @return a reference to this builder
     */
    public ApnsClientBuilder setTrustedServerCertificateChain(final File certificatePemFile) {
        this.trustedServerCertificatePemFile = certificatePemFile;
        this.trustedServerCertificateInputStream = null;
        this.trustedServerCertificates = null;

        return this;
    }

    /**
     * Sets the trusted certificate chain for clients using the contents of the given PEM input stream.
     *
     * @see #setTrustedServerCertificateChain(File)
     */
    public ApnsClientBuilder setTrustedServerCertificateChain(final InputStream certificateInputStream) {
        this.trustedServerCertificatePemFile = null;
        this.trustedServerCertificateInputStream = certificateInputStream;
        this.trustedServerCertificates = null;

        return this;
    }

    /**
     * Sets the trusted certificate chain for clients.
     *
     * @see #setTrustedServerCertificateChain(File)
     */
    public ApnsClientBuilder setTrustedServerCertificateChain(final X509Certificate... certificates) {
        this.trustedServerCertificatePemFile = null;
        this.trustedServerCertificateInputStream = null;
        this.trustedServerCertificates = certificates;

        return this;
    }

    /**
     * Sets whether clients verify that the server's certificate matches the endpoint's host name. Verification is
     * enabled by default and should only be disabled in tests.
     *
     * @return a reference to this builder
     */
    public ApnsClientBuilder setHostnameVerificationEnabled(final boolean hostnameVerificationEnabled) {
        this.hostnameVerificationEnabled = hostnameVerificationEnabled;
        return this;
    }

    /**
     * <p>Sets the event loop group clients use for I/O. If not set (or if {@code null}), each client creates and
     * manages its own single-threaded event loop group.</p>
     *
     * <p>Callers that create many clients may wish to share one event loop group between them. Callers that provide
     * an event loop group are responsible for shutting it down after all clients using it have been closed.</p>
     *
     * @param eventLoopGroup the event loop group clients use for I/O
     *
     * @return a reference to this builder
     */
    public ApnsClientBuilder setEventLoopGroup(final EventLoopGroup eventLoopGroup) {
        this.eventLoopGroup = eventLoopGroup;
        return this;
    }

    /**
     * Sets the maximum time clients wait for a connection to the APNs server to be established. If not set, Netty's
     * default connection timeout applies.
     *
     * @return a reference to this builder
     */
    public ApnsClientBuilder setConnectionTimeout(final Duration connectionTimeout) {
        this.connectionTimeout = connectionTimeout;
        return this;
    }

    /**
     * Sets a logger for all HTTP/2 frames clients send and receive. Useful for debugging.
     *
     * @return a reference to this builder
     */
    public ApnsClientBuilder setFrameLogger(final Http2FrameLogger frameLogger) {
        this.frameLogger = frameLogger;
        return this;
    }

    /**
     * Constructs a new {@link ApnsClient} with the previously-set configuration.
     *
     * @return a new client
     *
     * @throws ClientInitializationException if the signing key could not be parsed or the TLS context could not be
     * created
     * @throws IllegalStateException if no signing key has been set
     */
    public ApnsClient build() throws ClientInitializationException {
        final ApnsSigningKey clientSigningKey;

        if (this.signingKey != null) {
            clientSigningKey = this.signingKey;
        } else if (this.pkcs8Pem != null) {
            try {
                clientSigningKey = ApnsSigningKey.loadFromPkcs8String(this.pkcs8Pem, this.teamId, this.keyId);
            } catch (final IOException | GeneralSecurityException e) {
                throw new ClientInitializationException("Could not load signing key.", e);
            }
        } else {
            throw new IllegalStateException("No signing key specified; a signing key must be provided before building a client.");
        }

        final SslContext sslContext;
        {
            final SslContextBuilder sslContextBuilder = SslContextBuilder.forClient()
                    .sslProvider(SslUtil.getSslProvider())
                    .ciphers(Http2SecurityUtil.CIPHERS, SupportedCipherSuiteFilter.INSTANCE)
                    .applicationProtocolConfig(
                            new ApplicationProtocolConfig(Protocol.ALPN,
                                    SelectorFailureBehavior.NO_ADVERTISE,
                                    SelectedListenerFailureBehavior.ACCEPT,
                                    ApplicationProtocolNames.HTTP_2));

            try {
                if (this.trustedServerCertificatePemFile != null) {
                    sslContextBuilder.trustManager(this.trustedServerCertificatePemFile);
                } else if (this.trustedServerCertificateInputStream != null) {
                    sslContextBuilder.trustManager(this.trustedServerCertificateInputStream);
                } else if (this.trustedServerCertificates != null) {
                    sslContextBuilder.trustManager(this.trustedServerCertificates);
                }

                sslContext = sslContextBuilder.build();
            } catch (final SSLException | IllegalArgumentException e) {
                throw new ClientInitializationException("Could not create TLS context.", e);
            }
        }

        try {
            final NettyApnsTransport transport = new NettyApnsTransport(this.endpoint, sslContext,
                    this.hostnameVerificationEnabled, this.connectionTimeout, this.eventLoopGroup, this.frameLogger);

            return new ApnsClient(this.endpoint, new AuthenticationTokenSigner(clientSigningKey), transport);
        } finally {
            // The transport holds its own reference to the context.
            if (sslContext instanceof ReferenceCounted) {
                ((ReferenceCounted) sslContext).release();
            }
        }
    }
}
