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

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.base64.Base64;
import io.netty.handler.codec.base64.Base64Dialect;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.security.AlgorithmParameters;
import java.security.InvalidKeyException;
import java.security.KeyFactory;
import java.security.NoSuchAlgorithmException;
import java.security.Signature;
import java.security.interfaces.ECPrivateKey;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.ECParameterSpec;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.InvalidParameterSpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.Objects;

/**
 * A private key used to sign authentication tokens, together with the Apple-issued identifiers of the key and of the
 * team that owns it. Signing keys are downloaded from Apple's developer portal as PKCS#8 files ({@code .p8}) and are
 * elliptic curve keys on the P-256 curve.
 *
 * <p>Signing keys are immutable and thread-safe.</p>
 */
public class ApnsSigningKey {

    /**
     * The JCA name of the signature algorithm used to sign tokens. Signatures are produced in the fixed-length
     * {@code r || s} form JSON Web Signatures require rather than in DER form.
     */
    public static final String APNS_SIGNATURE_ALGORITHM = "SHA256withECDSAinP1363Format";

    private static final String P256_CURVE_NAME = "secp256r1";

    private final String keyId;
    private final String teamId;
    private final ECPrivateKey key;

    /**
     * Constructs a new signing key.
     *
     * @param keyId the Apple-issued, ten-character identifier of the key
     * @param teamId the Apple-issued, ten-character identifier of the team to which the key belongs
     * @param key the elliptic curve private key
     *
     * @throws NoSuchAlgorithmException if the JVM does not support ECDSA signatures
     * @throws InvalidKeyException if the key is not a P-256 key or cannot be used to produce signatures
     */
    public ApnsSigningKey(final String keyId, final String teamId, final ECPrivateKey key) throws NoSuchAlgorithmException, InvalidKeyException {
        this.keyId = Objects.requireNonNull(keyId, "Key identifier must not be null.");
        this.teamId = Objects.requireNonNull(teamId, "Team identifier must not be null.");
        this.key = Objects.requireNonNull(key, "Key must not be null.");

        if (!isP256(key.getParams())) {
            throw new InvalidKeyException("Signing keys must be P-256 elliptic curve keys.");
        }

        // Fail early on missing algorithms or unusable keys.
        final Signature signature = Signature.getInstance(APNS_SIGNATURE_ALGORITHM);
        signature.initSign(key);
    }

    private static boolean isP256(final ECParameterSpec parameterSpec) throws NoSuchAlgorithmException {
        if (parameterSpec == null) {
            return false;
        }

        final ECParameterSpec p256;

        try {
            final AlgorithmParameters algorithmParameters = AlgorithmParameters.getInstance("EC");
            algorithmParameters.init(new ECGenParameterSpec(P256_CURVE_NAME));

            p256 = algorithmParameters.getParameterSpec(ECParameterSpec.class);
        } catch (final InvalidParameterSpecException e) {
            throw new NoSuchAlgorithmException("JVM does not support the " + P256_CURVE_NAME + " curve.", e);
        }

        return p256.getCurve().equals(parameterSpec.getCurve()) &&
                p256.getGenerator().equals(parameterSpec.getGenerator()) &&
                p256.getOrder().equals(parameterSpec.getOrder()) &&
                p256.getCofactor() == parameterSpec.getCofactor();
    }

    public String getKeyId() {
        return this.keyId;
    }

    public String getTeamId() {
        return this.teamId;
    }

    ECPrivateKey getKey() {
        return this.key;
    }

    /**
     * Loads a signing key from a PKCS#8 file.
     *
     * @param pkcs8File the file from which to load the key
     * @param teamId the Apple-issued identifier of the team to which the key belongs
     * @param keyId the Apple-issued identifier of the key
     *
     * @return the loaded signing key
     *
     * @throws IOException if the file could not be read or did not contain a PEM-armored private key
     * @throws NoSuchAlgorithmException if the JVM does not support elliptic curve keys
     * @throws InvalidKeyException if the file contained a key that is not a usable P-256 private key
     */
    public static ApnsSigningKey loadFromPkcs8File(final File pkcs8File, final String teamId, final String keyId) throws IOException, NoSuchAlgorithmException, InvalidKeyException {
        try (final FileInputStream fileInputStream = new FileInputStream(pkcs8File)) {
            return ApnsSigningKey.loadFromInputStream(fileInputStream, teamId, keyId);
        }
    }

    /**
     * Loads a signing key from the PEM-armored contents of a PKCS#8 file.
     *
     * @see #loadFromPkcs8File(File, String, String)
     */
    public static ApnsSigningKey loadFromPkcs8String(final String pkcs8Pem, final String teamId, final String keyId) throws IOException, NoSuchAlgorithmException, InvalidKeyException {
        return ApnsSigningKey.loadFromInputStream(
                new ByteArrayInputStream(pkcs8Pem.getBytes(StandardCharsets.US_ASCII)), teamId, keyId);
    }

    /**
     * Loads a signing key from an input stream that yields the PEM-armored contents of a PKCS#8 file. The caller is
     * responsible for closing the stream.
     *
     * @see #loadFromPkcs8File(File, String, String)
     */
    public static ApnsSigningKey loadFromInputStream(final InputStream inputStream, final String teamId, final String keyId) throws IOException, NoSuchAlgorithmException, InvalidKeyException {
        final String base64EncodedPrivateKey;
        {
            final StringBuilder privateKeyBuilder = new StringBuilder();

            final BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.US_ASCII));
            boolean haveReadHeader = false;
            boolean haveReadFooter = false;

            for (String line; (line = reader.readLine()) != null; ) {
                if (!haveReadHeader) {
                    if (line.contains("BEGIN PRIVATE KEY")) {
                        haveReadHeader = true;
                    }
                } else {
                    if (line.contains("END PRIVATE KEY")) {
                        haveReadFooter = true;
                        break;
                    } else {
                        privateKeyBuilder.append(line.trim());
                    }
                }
            }

            if (!(haveReadHeader && haveReadFooter)) {
                throw new IOException("Could not find private key header/footer");
            }

            base64EncodedPrivateKey = privateKeyBuilder.toString();
        }

        final PKCS8EncodedKeySpec keySpec = new PKCS8EncodedKeySpec(decodeBase64(base64EncodedPrivateKey));
        final KeyFactory keyFactory = KeyFactory.getInstance("EC");

        final ECPrivateKey signingKey;

        try {
            signingKey = (ECPrivateKey) keyFactory.generatePrivate(keySpec);
        } catch (final InvalidKeySpecException e) {
            throw new InvalidKeyException(e);
        }

        return new ApnsSigningKey(keyId, teamId, signingKey);
    }

    private static byte[] decodeBase64(final String base64EncodedString) throws InvalidKeyException {
        final ByteBuf encodedByteBuf = Unpooled.wrappedBuffer(base64EncodedString.getBytes(StandardCharsets.US_ASCII));

        try {
            final ByteBuf decodedByteBuf = Base64.decode(encodedByteBuf, Base64Dialect.STANDARD);

            try {
                final byte[] decodedBytes = new byte[decodedByteBuf.readableBytes()];
                decodedByteBuf.readBytes(decodedBytes);

                return decodedBytes;
            } finally {
                decodedByteBuf.release();
            }
        } catch (final IllegalArgumentException e) {
            throw new InvalidKeyException("Private key was not valid Base64", e);
        } finally {
            encodedByteBuf.release();
        }
    }
}
