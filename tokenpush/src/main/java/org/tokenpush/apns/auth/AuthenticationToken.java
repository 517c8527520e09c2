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

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.base64.Base64;
import io.netty.handler.codec.base64.Base64Dialect;
import org.tokenpush.apns.TokenSigningException;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.security.Signature;
import java.security.SignatureException;
import java.security.interfaces.ECPublicKey;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <p>An authentication token ("provider token" in Apple's terminology) is a JSON Web Token (JWT) signed with ES256
 * that identifies the team sending push notifications and the key that signed the token. Clients send the token as a
 * bearer credential with every notification in lieu of TLS client authentication.</p>
 *
 * <p>The token's header carries the algorithm and key identifier ({@code {"alg":"ES256","kid":"..."}}) and its claims
 * carry the team identifier and the issue time in seconds since the epoch ({@code {"iss":"...","iat":...}}).</p>
 *
 * <p>Tokens may be constructed from an {@link ApnsSigningKey} (for clients sending notifications) or parsed from their
 * encoded form (for servers verifying a client's token). Callers generally do not need to create tokens themselves;
 * {@link AuthenticationTokenSigner} manages them for each client.</p>
 *
 * <p>Authentication tokens are immutable and thread-safe.</p>
 *
 * @see <a href="https://developer.apple.com/documentation/usernotifications/establishing-a-token-based-connection-to-apns">Establishing
 * a token-based connection to APNs</a>
 * @see <a href="https://tools.ietf.org/html/rfc7519">RFC 7519 - JSON Web Token (JWT)</a>
 */
public class AuthenticationToken {

    private static final Gson GSON = new Gson();

    private static final String AUTHORIZATION_SCHEME = "Bearer ";

    private final String keyId;
    private final String teamId;
    private final Instant issuedAt;

    private final String encodedHeaderAndClaims;
    private final byte[] signatureBytes;

    private final String encodedToken;

    /**
     * Constructs and signs a new authentication token.
     *
     * @param signingKey the key with which to sign the token and from which to take the key and team identifiers
     * @param issuedAt the time at which the token was issued; truncated to whole seconds
     *
     * @throws TokenSigningException if the token could not be signed
     */
    public AuthenticationToken(final ApnsSigningKey signingKey, final Instant issuedAt) throws TokenSigningException {
        Objects.requireNonNull(signingKey, "Signing key must not be null.");
        Objects.requireNonNull(issuedAt, "Issue time must not be null.");

        this.keyId = signingKey.getKeyId();
        this.teamId = signingKey.getTeamId();
        this.issuedAt = Instant.ofEpochSecond(issuedAt.getEpochSecond());

        this.encodedHeaderAndClaims = encodeHeaderAndClaims(this.keyId, this.teamId, this.issuedAt);

        try {
            final Signature signature = Signature.getInstance(ApnsSigningKey.APNS_SIGNATURE_ALGORITHM);
            signature.initSign(signingKey.getKey());
            signature.update(this.encodedHeaderAndClaims.getBytes(StandardCharsets.US_ASCII));

            this.signatureBytes = signature.sign();
        } catch (final GeneralSecurityException e) {
            throw new TokenSigningException("Failed to sign authentication token.", e);
        }

        this.encodedToken = this.encodedHeaderAndClaims + '.' + encodeUnpaddedBase64UrlString(this.signatureBytes);
    }

    /**
     * Parses an authentication token from its encoded {@code header.claims.signature} form. Successfully parsing a
     * token does <em>not</em> imply that its signature is valid; see {@link #verifySignature(ECPublicKey)}.
     *
     * @param encodedToken an encoded JWT string
     *
     * @throws IllegalArgumentException if the string is not a well-formed token
     */
    public AuthenticationToken(final String encodedToken) {
        Objects.requireNonNull(encodedToken, "Encoded token must not be null.");

        final String[] jwtSegments = encodedToken.split("\\.", -1);

        if (jwtSegments.length != 3) {
            throw new IllegalArgumentException("Token must have exactly three segments.");
        }

        final JsonObject header = parseJsonObject(jwtSegments[0], "header");
        final JsonObject claims = parseJsonObject(jwtSegments[1], "claims");

        this.keyId = requireString(header, "kid");
        this.teamId = requireString(claims, "iss");

        try {
            this.issuedAt = Instant.ofEpochSecond(claims.getAsJsonPrimitive("iat").getAsLong());
        } catch (final RuntimeException e) {
            throw new IllegalArgumentException("Claims must map a numeric value to the \"iat\" key.", e);
        }

        this.encodedHeaderAndClaims = jwtSegments[0] + '.' + jwtSegments[1];
        this.signatureBytes = decodeBase64UrlEncodedString(jwtSegments[2]);
        this.encodedToken = encodedToken;
    }

    /**
     * Returns the time at which this token was issued.
     */
    public Instant getIssuedAt() {
        return this.issuedAt;
    }

    /**
     * Returns the Apple-issued ID of the key used to sign this token.
     */
    public String getKeyId() {
        return this.keyId;
    }

    /**
     * Returns the Apple-issued ID of the team to which this token's key belongs.
     */
    public String getTeamId() {
        return this.teamId;
    }

    /**
     * Verifies this token's signature against the given public key.
     *
     * @param publicKey the public half of the key that should have signed this token
     *
     * @return {@code true} if the signature was produced by the corresponding private key or {@code false} otherwise
     */
    public boolean verifySignature(final ECPublicKey publicKey) {
        try {
            final Signature signature = Signature.getInstance(ApnsSigningKey.APNS_SIGNATURE_ALGORITHM);
            signature.initVerify(publicKey);
            signature.update(this.encodedHeaderAndClaims.getBytes(StandardCharsets.US_ASCII));

            return signature.verify(this.signatureBytes);
        } catch (final NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalArgumentException("Key cannot verify ES256 signatures.", e);
        } catch (final SignatureException e) {
            // A malformed signature can never verify.
            return false;
        }
    }

    /**
     * Returns a complete authorization header value (i.e. "Bearer [token]") for this token.
     */
    public String getAuthorizationHeader() {
        return AUTHORIZATION_SCHEME + this.encodedToken;
    }

    /**
     * Returns the encoded JWT form of this token.
     */
    @Override
    public String toString() {
        return this.encodedToken;
    }

    @Override
    public int hashCode() {
        return this.encodedToken.hashCode();
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }

        if (!(obj instanceof AuthenticationToken)) {
            return false;
        }

        return this.encodedToken.equals(((AuthenticationToken) obj).encodedToken);
    }

    private static String encodeHeaderAndClaims(final String keyId, final String teamId, final Instant issuedAt) {
        final Map<String, Object> header = new LinkedHashMap<>(2, 1);
        header.put("alg", "ES256");
        header.put("kid", keyId);

        final Map<String, Object> claims = new LinkedHashMap<>(2, 1);
        claims.put("iss", teamId);
        claims.put("iat", issuedAt.getEpochSecond());

        return encodeUnpaddedBase64UrlString(GSON.toJson(header).getBytes(StandardCharsets.UTF_8)) + '.' +
                encodeUnpaddedBase64UrlString(GSON.toJson(claims).getBytes(StandardCharsets.UTF_8));
    }

    private static JsonObject parseJsonObject(final String encodedSegment, final String segmentName) {
        final String json = new String(decodeBase64UrlEncodedString(encodedSegment), StandardCharsets.UTF_8);

        final JsonElement element;

        try {
            element = JsonParser.parseString(json);
        } catch (final JsonParseException e) {
            throw new IllegalArgumentException("Could not parse " + segmentName + " as JSON: " + json, e);
        }

        if (!element.isJsonObject()) {
            throw new IllegalArgumentException("Token " + segmentName + " must be a JSON object: " + json);
        }

        return element.getAsJsonObject();
    }

    private static String requireString(final JsonObject object, final String key) {
        final JsonElement element = object.get(key);

        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new IllegalArgumentException("Token must map a string value to the \"" + key + "\" key.");
        }

        return element.getAsString();
    }

    static String encodeUnpaddedBase64UrlString(final byte[] data) {
        final ByteBuf wrappedString = Unpooled.wrappedBuffer(data);
        final ByteBuf encodedString = Base64.encode(wrappedString, Base64Dialect.URL_SAFE);

        final String encodedUnpaddedString = encodedString.toString(StandardCharsets.US_ASCII).replace("=", "");

        wrappedString.release();
        encodedString.release();

        return encodedUnpaddedString;
    }

    static byte[] decodeBase64UrlEncodedString(final String base64UrlEncodedString) {
        final String paddedBase64UrlEncodedString;

        switch (base64UrlEncodedString.length() % 4) {
            case 2: {
                paddedBase64UrlEncodedString = base64UrlEncodedString + "==";
                break;
            }

            case 3: {
                paddedBase64UrlEncodedString = base64UrlEncodedString + "=";
                break;
            }

            default: {
                paddedBase64UrlEncodedString = base64UrlEncodedString;
            }
        }

        final ByteBuf base64EncodedByteBuf =
                Unpooled.wrappedBuffer(paddedBase64UrlEncodedString.getBytes(StandardCharsets.US_ASCII));

        try {
            final ByteBuf decodedByteBuf = Base64.decode(base64EncodedByteBuf, Base64Dialect.URL_SAFE);

            try {
                final byte[] decodedBytes = new byte[decodedByteBuf.readableBytes()];
                decodedByteBuf.readBytes(decodedBytes);

                return decodedBytes;
            } finally {
                decodedByteBuf.release();
            }
        } finally {
            base64EncodedByteBuf.release();
        }
    }
}
