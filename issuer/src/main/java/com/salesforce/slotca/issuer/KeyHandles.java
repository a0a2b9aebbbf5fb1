/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.issuer;

import com.salesforce.slotca.cryptography.KeyAlgorithm;
import com.salesforce.slotca.cryptography.SigningKeyHandle;
import com.salesforce.slotca.issuer.CaException.Reason;
import com.salesforce.slotca.issuer.CertificateDraft.State;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.pkcs.RSAPublicKey;
import org.bouncycastle.asn1.sec.SECObjectIdentifiers;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.asn1.x9.X9ObjectIdentifiers;

import java.io.IOException;
import java.util.Map;

/**
 * Derives {@link SigningKeyHandle}s from the public half of a slot's key.
 */
public final class KeyHandles {
    /** The PIV retired key management slot conventionally holding the CA key */
    public static final int CA_SLOT = 0x84;

    private static final Map<ASN1ObjectIdentifier, Integer> CURVES = Map.of(SECObjectIdentifiers.secp256r1, 256,
                                                                            SECObjectIdentifiers.secp384r1, 384,
                                                                            SECObjectIdentifiers.secp521r1, 521);

    /**
     * @param publicKey the public key of the key in the slot
     * @param slot      the slot holding the private key
     * @throws CaException if the key is neither RSA nor on a supported named curve
     */
    public static SigningKeyHandle forPublicKey(SubjectPublicKeyInfo publicKey, int slot) {
        ASN1ObjectIdentifier algorithm = publicKey.getAlgorithm().getAlgorithm();
        if (PKCSObjectIdentifiers.rsaEncryption.equals(algorithm) || PKCSObjectIdentifiers.id_RSASSA_PSS.equals(
        algorithm)) {
            try {
                RSAPublicKey rsa = RSAPublicKey.getInstance(publicKey.parsePublicKey());
                return new SigningKeyHandle(KeyAlgorithm.RSA, rsa.getModulus().bitLength(), slot);
            } catch (IOException | IllegalArgumentException e) {
                throw new CaException(Reason.INVALID_REQUEST, State.DRAFT, "Malformed RSA public key", e);
            }
        }
        if (X9ObjectIdentifiers.id_ecPublicKey.equals(algorithm)) {
            var parameters = publicKey.getAlgorithm().getParameters();
            Integer size = parameters instanceof ASN1ObjectIdentifier curve ? CURVES.get(curve) : null;
            if (size == null) {
                throw new CaException(Reason.UNSUPPORTED_ALGORITHM, State.DRAFT, "Unsupported curve: " + parameters);
            }
            return new SigningKeyHandle(KeyAlgorithm.ECDSA, size, slot);
        }
        throw new CaException(Reason.UNSUPPORTED_ALGORITHM, State.DRAFT,
                              "Unsupported public key algorithm: " + algorithm);
    }

    private KeyHandles() {
    }
}
