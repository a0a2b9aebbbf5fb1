/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.cryptography;

import org.bouncycastle.util.Arrays;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.SecureRandom;
import java.security.Signature;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.MGF1ParameterSpec;
import java.security.spec.PSSParameterSpec;

import static org.junit.jupiter.api.Assertions.*;

public class SignatureSchemeTest {
    private static final byte[] MESSAGE = "to be signed".getBytes(StandardCharsets.UTF_8);
    private static final int    SLOT    = 0x84;

    private static KeyPair      p256;
    private static KeyPair      p384;
    private static KeyPair      p521;
    private static KeyPair      rsa;
    private static SecureRandom entropy;

    @BeforeAll
    public static void keys() throws Exception {
        entropy = new SecureRandom();
        KeyPairGenerator rsaGen = KeyPairGenerator.getInstance("RSA");
        rsaGen.initialize(2048, entropy);
        rsa = rsaGen.generateKeyPair();
        KeyPairGenerator ecGen = KeyPairGenerator.getInstance("EC");
        ecGen.initialize(new ECGenParameterSpec("secp256r1"), entropy);
        p256 = ecGen.generateKeyPair();
        ecGen.initialize(new ECGenParameterSpec("secp384r1"), entropy);
        p384 = ecGen.generateKeyPair();
        ecGen.initialize(new ECGenParameterSpec("secp521r1"), entropy);
        p521 = ecGen.generateKeyPair();
    }

    @Test
    public void ecdsaHashOfCoordinateSizeIsUnchanged() throws Exception {
        var key = new SigningKeyHandle(KeyAlgorithm.ECDSA, 256, SLOT);
        byte[] formatted = SignatureScheme.ECDSA.format(MESSAGE, DigestAlgorithm.SHA2_256, key,
                                                        SignatureScheme.DIGEST_LENGTH_SALT, entropy);
        assertArrayEquals(DigestAlgorithm.SHA2_256.hashOf(MESSAGE), formatted);
    }

    @Test
    public void ecdsaShortHashIsLeftPadded() throws Exception {
        var key = new SigningKeyHandle(KeyAlgorithm.ECDSA, 384, SLOT);
        byte[] formatted = SignatureScheme.ECDSA.format(MESSAGE, DigestAlgorithm.SHA2_256, key,
                                                        SignatureScheme.DIGEST_LENGTH_SALT, entropy);
        assertEquals(48, formatted.length);
        assertArrayEquals(new byte[16], Arrays.copyOfRange(formatted, 0, 16));
        assertArrayEquals(DigestAlgorithm.SHA2_256.hashOf(MESSAGE), Arrays.copyOfRange(formatted, 16, 48));
    }

    @Test
    public void ecdsaHashWiderThanCurveIsRejected() {
        var key = new SigningKeyHandle(KeyAlgorithm.ECDSA, 256, SLOT);
        assertThrows(UnsupportedKeySizeException.class,
                     () -> SignatureScheme.ECDSA.format(MESSAGE, DigestAlgorithm.SHA2_384, key,
                                                        SignatureScheme.DIGEST_LENGTH_SALT, entropy));
    }

    @Test
    public void ecdsaSignaturesVerify() throws Exception {
        verifyEcdsa(p256, 256, DigestAlgorithm.SHA2_256, "SHA256withECDSA");
        verifyEcdsa(p384, 384, DigestAlgorithm.SHA2_256, "SHA256withECDSA");
        verifyEcdsa(p384, 384, DigestAlgorithm.SHA2_384, "SHA384withECDSA");
        verifyEcdsa(p521, 521, DigestAlgorithm.SHA2_256, "SHA256withECDSA");
        verifyEcdsa(p521, 521, DigestAlgorithm.SHA2_512, "SHA512withECDSA");
    }

    @Test
    public void p521HashFitsTheOrder() throws Exception {
        var key = new SigningKeyHandle(KeyAlgorithm.ECDSA, 521, SLOT);
        byte[] formatted = SignatureScheme.ECDSA.format(MESSAGE, DigestAlgorithm.SHA2_512, key,
                                                        SignatureScheme.DIGEST_LENGTH_SALT, entropy);
        assertEquals(65, formatted.length);
        assertEquals(0, formatted[0]);
        assertArrayEquals(DigestAlgorithm.SHA2_512.hashOf(MESSAGE), Arrays.copyOfRange(formatted, 1, 65));
    }

    @Test
    public void mismatchedKeyIsRejected() {
        var ecKey = new SigningKeyHandle(KeyAlgorithm.ECDSA, 256, SLOT);
        var rsaKey = new SigningKeyHandle(KeyAlgorithm.RSA, 2048, SLOT);
        assertThrows(UnsupportedAlgorithmException.class,
                     () -> SignatureScheme.RSA_PSS.format(MESSAGE, DigestAlgorithm.SHA2_256, ecKey,
                                                          SignatureScheme.DIGEST_LENGTH_SALT, entropy));
        assertThrows(UnsupportedAlgorithmException.class,
                     () -> SignatureScheme.ECDSA.format(MESSAGE, DigestAlgorithm.SHA2_256, rsaKey,
                                                        SignatureScheme.DIGEST_LENGTH_SALT, entropy));
        assertThrows(UnsupportedAlgorithmException.class,
                     () -> SignatureScheme.forKey(KeyAlgorithm.RSA, SignatureScheme.ECDSA));
        assertThrows(UnsupportedAlgorithmException.class,
                     () -> new SignatureFormatter(SignatureScheme.ECDSA, DigestAlgorithm.SHA2_256, rsaKey,
                                                  SignatureScheme.DIGEST_LENGTH_SALT, entropy));
    }

    @Test
    public void pkcs1KnownAnswer() throws Exception {
        // RFC 8017 section 9.2, note 1: DigestInfo prefix of SHA-256
        String digestInfoPrefix = "3031300d060960864801650304020105000420";
        String hash = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";
        String expected = "0001" + "ff".repeat(128 - 3 - 51) + "00" + digestInfoPrefix + hash;

        var key = new SigningKeyHandle(KeyAlgorithm.RSA, 1024, SLOT);
        byte[] formatted = SignatureScheme.RSA_PKCS1.format("abc".getBytes(StandardCharsets.UTF_8),
                                                            DigestAlgorithm.SHA2_256, key,
                                                            SignatureScheme.DIGEST_LENGTH_SALT, entropy);
        assertEquals(expected, Hex.toHexString(formatted));
    }

    @Test
    public void pkcs1IsDeterministic() throws Exception {
        var key = new SigningKeyHandle(KeyAlgorithm.RSA, 2048, SLOT);
        byte[] first = SignatureScheme.RSA_PKCS1.format(MESSAGE, DigestAlgorithm.SHA2_256, key,
                                                        SignatureScheme.DIGEST_LENGTH_SALT, entropy);
        byte[] second = SignatureScheme.RSA_PKCS1.format(MESSAGE, DigestAlgorithm.SHA2_256, key,
                                                         SignatureScheme.DIGEST_LENGTH_SALT, entropy);
        assertArrayEquals(first, second);
        assertEquals(256, first.length);
    }

    @Test
    public void pkcs1SignatureVerifies() throws Exception {
        var key = new SigningKeyHandle(KeyAlgorithm.RSA, 2048, SLOT);
        var formatter = new SignatureFormatter(SignatureScheme.RSA_PKCS1, DigestAlgorithm.SHA2_384, key,
                                               SignatureScheme.DIGEST_LENGTH_SALT, entropy);
        byte[] signature = formatter.sign(MESSAGE, KeyPairRawSigner.of(SLOT, rsa.getPrivate()));

        Signature verifier = Signature.getInstance("SHA384withRSA");
        verifier.initVerify(rsa.getPublic());
        verifier.update(MESSAGE);
        assertTrue(verifier.verify(signature));
    }

    @Test
    public void pssIsRandomizedAndVerifies() throws Exception {
        var key = new SigningKeyHandle(KeyAlgorithm.RSA, 2048, SLOT);
        var formatter = new SignatureFormatter(SignatureScheme.RSA_PSS, DigestAlgorithm.SHA2_256, key,
                                               SignatureScheme.DIGEST_LENGTH_SALT, entropy);
        byte[] first = formatter.format(MESSAGE);
        byte[] second = formatter.format(MESSAGE);
        assertEquals(256, first.length);
        assertEquals((byte) 0xBC, first[first.length - 1]);
        assertEquals(0, first[0] & 0x80, "leftmost bit must be cleared");
        assertFalse(Arrays.areEqual(first, second));

        var signer = KeyPairRawSigner.of(SLOT, rsa.getPrivate());
        byte[] signature1 = signer.sign(key, first);
        byte[] signature2 = signer.sign(key, second);
        assertFalse(Arrays.areEqual(signature1, signature2));

        PSSParameterSpec spec = new PSSParameterSpec("SHA-256", "MGF1", MGF1ParameterSpec.SHA256, 32, 1);
        for (byte[] signature : new byte[][] { signature1, signature2 }) {
            Signature verifier = Signature.getInstance("RSASSA-PSS");
            verifier.setParameter(spec);
            verifier.initVerify(rsa.getPublic());
            verifier.update(MESSAGE);
            assertTrue(verifier.verify(signature));
        }
    }

    @Test
    public void pssWithExplicitSaltLength() throws Exception {
        var key = new SigningKeyHandle(KeyAlgorithm.RSA, 2048, SLOT);
        var formatter = new SignatureFormatter(SignatureScheme.RSA_PSS, DigestAlgorithm.SHA2_256, key, 0, entropy);
        byte[] formatted = formatter.format(MESSAGE);
        assertArrayEquals(formatted, formatter.format(MESSAGE), "an empty salt is deterministic");

        byte[] signature = KeyPairRawSigner.of(SLOT, rsa.getPrivate()).sign(key, formatted);
        Signature verifier = Signature.getInstance("RSASSA-PSS");
        verifier.setParameter(new PSSParameterSpec("SHA-256", "MGF1", MGF1ParameterSpec.SHA256, 0, 1));
        verifier.initVerify(rsa.getPublic());
        verifier.update(MESSAGE);
        assertTrue(verifier.verify(signature));
    }

    @Test
    public void rsaKeyTooSmallForEnvelope() {
        var key = new SigningKeyHandle(KeyAlgorithm.RSA, 512, SLOT);
        assertThrows(UnsupportedKeySizeException.class,
                     () -> SignatureScheme.RSA_PKCS1.format(MESSAGE, DigestAlgorithm.SHA2_512, key,
                                                            SignatureScheme.DIGEST_LENGTH_SALT, entropy));
        assertThrows(UnsupportedKeySizeException.class,
                     () -> SignatureScheme.RSA_PSS.format(MESSAGE, DigestAlgorithm.SHA2_512, key,
                                                          SignatureScheme.DIGEST_LENGTH_SALT, entropy));
    }

    @Test
    public void signerFaultIsDeviceError() throws Exception {
        var key = new SigningKeyHandle(KeyAlgorithm.ECDSA, 256, SLOT);
        var formatter = SignatureFormatter.forKey(key, DigestAlgorithm.SHA2_256, SignatureScheme.RSA_PSS,
                                                  SignatureScheme.DIGEST_LENGTH_SALT, entropy);
        RawSigner faulty = (handle, formatted) -> {
            throw new IllegalStateException("card removed");
        };
        var e = assertThrows(SignerException.class, () -> formatter.sign(MESSAGE, faulty));
        assertEquals(SignerException.Failure.DEVICE_ERROR, e.getFailure());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    private void verifyEcdsa(KeyPair pair, int bits, DigestAlgorithm digest, String jcaName) throws Exception {
        var key = new SigningKeyHandle(KeyAlgorithm.ECDSA, bits, SLOT);
        var formatter = SignatureFormatter.forKey(key, digest, SignatureScheme.RSA_PSS,
                                                  SignatureScheme.DIGEST_LENGTH_SALT, entropy);
        assertEquals(SignatureScheme.ECDSA, formatter.getScheme());
        byte[] signature = formatter.sign(MESSAGE, KeyPairRawSigner.of(SLOT, pair.getPrivate()));

        Signature verifier = Signature.getInstance(jcaName);
        verifier.initVerify(pair.getPublic());
        verifier.update(MESSAGE);
        assertTrue(verifier.verify(signature), jcaName + " on " + bits);
    }
}
