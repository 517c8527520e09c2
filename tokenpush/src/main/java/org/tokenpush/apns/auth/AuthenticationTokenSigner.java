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

package org.tokenpush.apns.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tokenpush.apns.ClockException;
import org.tokenpush.apns.TokenSigningException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * An authentication token signer issues authentication tokens on demand and reuses each token until it is
 * {@link #TOKEN_REFRESH_INTERVAL} old, at which point the next request signs a replacement. APNs rejects tokens older
 * than an hour and throttles clients that replace tokens more often than every twenty minutes.
 *
 * <p>Token signers are <em>not</em> thread-safe. Each signer belongs to exactly one client, and callers that share a
 * client between threads must synchronize access to it.</p>
 */
public class AuthenticationTokenSigner {

    /**
     * The age at which a cached token is replaced.
     */
    public static final Duration TOKEN_REFRESH_INTERVAL = Duration.ofMinutes(20);

    private final ApnsSigningKey signingKey;
    private final Clock clock;

    private AuthenticationToken token;

    private static final Logger log = LoggerFactory.getLogger(AuthenticationTokenSigner.class);

    /**
     * Constructs a new token signer that signs tokens with the given key. No token is signed until one is first
     * requested.
     *
     * @param signingKey the key with which to sign tokens
     */
    public AuthenticationTokenSigner(final ApnsSigningKey signingKey) {
        this(signingKey, Clock.systemUTC());
    }

    AuthenticationTokenSigner(final ApnsSigningKey signingKey, final Clock clock) {
        this.signingKey = Objects.requireNonNull(signingKey, "Signing key must not be null.");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null.");
    }

    /**
     * Returns a current authentication token. If a token was issued less than {@link #TOKEN_REFRESH_INTERVAL} ago, the
     * same instance is returned again; otherwise a new token is signed, cached and returned.
     *
     * @return a current authentication token
     *
     * @throws TokenSigningException if a new token was needed but could not be signed
     * @throws ClockException if the clock reads earlier than the Unix epoch or earlier than the issue time of the
     * cached token
     */
    public AuthenticationToken getAuthenticationToken() throws TokenSigningException, ClockException {
        final Instant now = clock.instant();

        if (now.isBefore(Instant.EPOCH)) {
            throw new ClockException("Clock reads earlier than the Unix epoch.", now);
        }

        final AuthenticationToken cachedToken = this.token;

        if (cachedToken != null) {
            if (now.isBefore(cachedToken.getIssuedAt())) {
                throw new ClockException("Clock reads earlier than the issue time of the current token (" +
                        cachedToken.getIssuedAt() + ").", now);
            }

            if (Duration.between(cachedToken.getIssuedAt(), now).compareTo(TOKEN_REFRESH_INTERVAL) < 0) {
                return cachedToken;
            }
        }

        final AuthenticationToken refreshedToken = new AuthenticationToken(signingKey, now);
        this.token = refreshedToken;

        log.debug("Signed new authentication token for key {} issued at {}", signingKey.getKeyId(), refreshedToken.getIssuedAt());

        return refreshedToken;
    }
}
