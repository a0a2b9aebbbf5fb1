/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.issuer;

import com.salesforce.slotca.cryptography.DigestAlgorithm;
import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.util.encoders.Base64;
import org.bouncycastle.util.encoders.Hex;

import java.io.IOException;
import java.util.Locale;

/**
 * Hashes for display and audit.
 */
public final class Fingerprints {

    /**
     * @return the lower case hex SHA-256 of the encoding
     */
    public static String fingerprint(byte[] encoded) {
        return Hex.toHexString(DigestAlgorithm.SHA2_256.hashOf(encoded));
    }

    /**
     * @return base 64 of the SHA-256 of the DER encoded key info
     */
    public static String publicKeyHash(SubjectPublicKeyInfo publicKey) {
        try {
            return Base64.toBase64String(DigestAlgorithm.SHA2_256.hashOf(publicKey.getEncoded(ASN1Encoding.DER)));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to encode public key", e);
        }
    }

    /**
     * @return the upper case hex SHA-1 of the encoding, as certificate stores display it
     */
    public static String thumbprint(byte[] encoded) {
        return Hex.toHexString(DigestAlgorithm.SHA1.hashOf(encoded)).toUpperCase(Locale.ROOT);
    }

    private Fingerprints() {
    }
}
