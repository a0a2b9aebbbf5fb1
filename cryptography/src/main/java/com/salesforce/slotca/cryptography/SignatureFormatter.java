/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.cryptography;

import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;

/**
 * Binds a {@link SignatureScheme} to a hash algorithm and a signing key, yielding the buffer handed to a
 * {@link RawSigner} and the algorithm identifier that describes the resulting signature.
 */
public class SignatureFormatter {
    private static final Logger log = LoggerFactory.getLogger(SignatureFormatter.class);

    private final DigestAlgorithm  digest;
    private final SecureRandom     entropy;
    private final SigningKeyHandle key;
    private final int              saltLength;
    private final SignatureScheme  scheme;

    public SignatureFormatter(SignatureScheme scheme, DigestAlgorithm digest, SigningKeyHandle key, int saltLength,
                              SecureRandom entropy) throws UnsupportedAlgorithmException {
        if (scheme.keyAlgorithm() != key.algorithm()) {
            throw new UnsupportedAlgorithmException("Cannot sign with " + scheme + " using key: " + key);
        }
        this.scheme = scheme;
        this.digest = digest;
        this.key = key;
        this.saltLength = saltLength;
        this.entropy = entropy;
    }

    /**
     * Select the scheme for the key's algorithm.
     *
     * @param rsaPadding the padding used should the key be RSA
     */
    public static SignatureFormatter forKey(SigningKeyHandle key, DigestAlgorithm digest, SignatureScheme rsaPadding,
                                            int saltLength, SecureRandom entropy)
    throws UnsupportedAlgorithmException {
        return new SignatureFormatter(SignatureScheme.forKey(key.algorithm(), rsaPadding), digest, key, saltLength,
                                      entropy);
    }

    /**
     * @param toBeSigned the canonical unsigned encoding
     * @return the buffer for the key's raw operation
     */
    public byte[] format(byte[] toBeSigned) throws SignatureFormatException {
        byte[] formatted = scheme.format(toBeSigned, digest, key, saltLength, entropy);
        if (log.isTraceEnabled()) {
            log.trace("Formatted {} bytes for {} {} on: {}: {}", toBeSigned.length, scheme, digest, key,
                      Hex.toHexString(formatted));
        }
        return formatted;
    }

    public AlgorithmIdentifier getAlgorithmIdentifier() {
        return scheme.algorithmIdentifier(digest, saltLength);
    }

    public DigestAlgorithm getDigest() {
        return digest;
    }

    public SigningKeyHandle getKey() {
        return key;
    }

    public SignatureScheme getScheme() {
        return scheme;
    }

    /**
     * Format the message and have the signer apply the key.
     *
     * @return the raw signature, exactly as the signer returned it
     */
    public byte[] sign(byte[] toBeSigned, RawSigner signer) throws SignatureFormatException, SignerException {
        byte[] formatted = format(toBeSigned);
        log.debug("Requesting {} signature from slot: {}", scheme, key);
        try {
            return signer.sign(key, formatted);
        } catch (RuntimeException e) {
            throw new SignerException(SignerException.Failure.DEVICE_ERROR,
                                      "Signer failed for slot: " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "SignatureFormatter[" + scheme + ", " + digest + ", " + key + "]";
    }
}
