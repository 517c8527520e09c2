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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.time.Instant;
import java.util.Base64;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

public class AuthenticationTokenTest {

    private ApnsSigningKey signingKey;
    private ECPublicKey publicKey;

    private static final String KEY_ID = "TESTKEY123";
    private static final String TEAM_ID = "TEAMID0987";

    private static final Instant ISSUED_AT = Instant.ofEpochSecond(1_700_000_000);

    @BeforeEach
    public void setUp() throws Exception {
        final KeyPair keyPair = KeyPairUtil.generateKeyPair();

        this.signingKey = new ApnsSigningKey(KEY_ID, TEAM_ID, (ECPrivateKey) keyPair.getPrivate());
        this.publicKey = (ECPublicKey) keyPair.getPublic();
    }

    @Test
    void testEncodedSegments() throws Exception {
        final AuthenticationToken token = new AuthenticationToken(signingKey, ISSUED_AT.plusMillis(750));

        final String[] segments = token.toString().split("\\.");
        assertEquals(3, segments.length);

        for (final String segment : segments) {
            assertTrue(Pattern.matches("[A-Za-z0-9_-]+", segment), "Segments must be unpadded base64url");
        }

        assertEquals("{\"alg\":\"ES256\",\"kid\":\"TESTKEY123\"}", decodeSegment(segments[0]));
        assertEquals("{\"iss\":\"TEAMID0987\",\"iat\":1700000000}", decodeSegment(segments[1]));

        // ES256 signatures are the 32-byte r and s values concatenated.
        assertEquals(64, Base64.getUrlDecoder().decode(segments[2]).length);
    }

    @Test
    void testGetters() throws Exception {
        final AuthenticationToken token = new AuthenticationToken(signingKey, ISSUED_AT.plusMillis(750));

        assertEquals(KEY_ID, token.getKeyId());
        assertEquals(TEAM_ID, token.getTeamId());
        assertEquals(ISSUED_AT, token.getIssuedAt());
    }

    @Test
    void testGetAuthorizationHeader() throws Exception {
        final AuthenticationToken token = new AuthenticationToken(signingKey, ISSUED_AT);

        assertEquals("Bearer " + token, token.getAuthorizationHeader());
    }

    @Test
    void testVerifySignature() throws Exception {
        final AuthenticationToken token = new AuthenticationToken(signingKey, ISSUED_AT);

        assertTrue(token.verifySignature(publicKey));
        assertFalse(token.verifySignature((ECPublicKey) KeyPairUtil.generateKeyPair().getPublic()));
    }

    @Test
    void testParseEncodedToken() throws Exception {
        final AuthenticationToken token = new AuthenticationToken(signingKey, ISSUED_AT);
        final AuthenticationToken parsedToken = new AuthenticationToken(token.toString());

        assertEquals(token, parsedToken);
        assertEquals(token.hashCode(), parsedToken.hashCode());
        assertEquals(KEY_ID, parsedToken.getKeyId());
        assertEquals(TEAM_ID, parsedToken.getTeamId());
        assertEquals(ISSUED_AT, parsedToken.getIssuedAt());
        assertTrue(parsedToken.verifySignature(publicKey));
    }

    @Test
    void testParseTamperedToken() throws Exception {
        final AuthenticationToken token = new AuthenticationToken(signingKey, ISSUED_AT);
        final String[] segments = token.toString().split("\\.");

        final String forgedClaims = Base64.getUrlEncoder().withoutPadding()
                .encodeToString("{\"iss\":\"OTHERTEAM1\",\"iat\":1700000000}".getBytes(StandardCharsets.UTF_8));

        final AuthenticationToken forgedToken =
                new AuthenticationToken(segments[0] + "." + forgedClaims + "." + segments[2]);

        assertEquals("OTHERTEAM1", forgedToken.getTeamId());
        assertFalse(forgedToken.verifySignature(publicKey));
    }

    @Test
    void testParseMalformedToken() {
        final String header = encodeSegment("{\"alg\":\"ES256\",\"kid\":\"TESTKEY123\"}");
        final String claims = encodeSegment("{\"iss\":\"TEAMID0987\",\"iat\":1700000000}");

        assertThrows(IllegalArgumentException.class, () -> new AuthenticationToken("not-a-token"));
        assertThrows(IllegalArgumentException.class, () -> new AuthenticationToken(header + "." + claims));
        assertThrows(IllegalArgumentException.class,
                () -> new AuthenticationToken(encodeSegment("[]") + "." + claims + ".AAAA"));
        assertThrows(IllegalArgumentException.class,
                () -> new AuthenticationToken(encodeSegment("{\"alg\":\"ES256\"}") + "." + claims + ".AAAA"));
        assertThrows(IllegalArgumentException.class,
                () -> new AuthenticationToken(header + "." + encodeSegment("{\"iss\":\"TEAMID0987\",\"iat\":\"soon\"}") + ".AAAA"));
    }

    @Test
    void testSignWithLoadedKey() throws Exception {
        final ApnsSigningKey loadedSigningKey;

        try (final InputStream inputStream = getClass().getResourceAsStream("/token-auth-private-key.p8")) {
            loadedSigningKey = ApnsSigningKey.loadFromInputStream(inputStream, TEAM_ID, KEY_ID);
        }

        final AuthenticationToken token = new AuthenticationToken(loadedSigningKey, ISSUED_AT);

        assertTrue(token.verifySignature(loadPublicKey("/token-auth-public-key.pem")));
    }

    private static String decodeSegment(final String segment) {
        return new String(Base64.getUrlDecoder().decode(segment), StandardCharsets.UTF_8);
    }

    private static String encodeSegment(final String json) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }

    private ECPublicKey loadPublicKey(final String resourceName) throws Exception {
        final String pem;

        try (final InputStream inputStream = getClass().getResourceAsStream(resourceName)) {
            pem = new String(inputStream.readAllBytes(), StandardCharsets.US_ASCII);
        }

        final String base64 = pem
                .replace("-----BEGIN PUBLIC KEY-----", "")
                .replace("-----END PUBLIC KEY-----", "")
                .replaceAll("\\s", "");

        return (ECPublicKey) KeyFactory.getInstance("EC")
                .generatePublic(new X509EncodedKeySpec(Base64.getDecoder().decode(base64)));
    }
}
