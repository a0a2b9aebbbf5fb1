/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.cryptography;

import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.DERSequence;
import org.bouncycastle.crypto.DataLengthException;
import org.bouncycastle.crypto.engines.RSAEngine;
import org.bouncycastle.crypto.params.AsymmetricKeyParameter;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ParametersWithRandom;
import org.bouncycastle.crypto.params.RSAKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.util.PrivateKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigInteger;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A {@link RawSigner} over private keys held in memory, one per slot. It performs the same raw operations a PIV
 * device does: textbook RSA on the formatted block, and ECDSA over the fixed width buffer returning a DER
 * {@code SEQUENCE { r, s }}.
 */
public class KeyPairRawSigner implements RawSigner {
    private static final Logger log = LoggerFactory.getLogger(KeyPairRawSigner.class);

    private final SecureRandom                         entropy;
    private final Map<Integer, AsymmetricKeyParameter> slots;

    public KeyPairRawSigner(Map<Integer, PrivateKey> keys) {
        this(keys, new SecureRandom());
    }

    public KeyPairRawSigner(Map<Integer, PrivateKey> keys, SecureRandom entropy) {
        this.entropy = entropy;
        Map<Integer, AsymmetricKeyParameter> converted = new HashMap<>();
        keys.forEach((slot, key) -> converted.put(slot, convert(key)));
        this.slots = Collections.unmodifiableMap(converted);
    }

    /**
     * A signer holding a single key.
     */
    public static KeyPairRawSigner of(int slot, PrivateKey key) {
        return new KeyPairRawSigner(Map.of(slot, key));
    }

    private static AsymmetricKeyParameter convert(PrivateKey key) {
        try {
            return PrivateKeyFactory.createKey(key.getEncoded());
        } catch (IOException e) {
            throw new IllegalArgumentException("Unable to convert private key: " + key.getAlgorithm(), e);
        }
    }

    @Override
    public byte[] sign(SigningKeyHandle handle, byte[] formatted) throws SignerException {
        AsymmetricKeyParameter key = slots.get(handle.slot());
        if (key == null) {
            throw new SignerException(SignerException.Failure.DEVICE_UNAVAILABLE,
                                      String.format("No key in slot: %02x", handle.slot()));
        }
        log.trace("Raw {} signature in slot: {}", handle.algorithm(), handle);
        return switch (handle.algorithm()) {
            case RSA -> rsa(key, formatted);
            case ECDSA -> ecdsa(key, formatted);
        };
    }

    private byte[] ecdsa(AsymmetricKeyParameter key, byte[] formatted) throws SignerException {
        if (!(key instanceof ECPrivateKeyParameters)) {
            throw new SignerException(SignerException.Failure.DEVICE_ERROR, "Slot does not hold an EC key");
        }
        ECDSASigner signer = new ECDSASigner();
        signer.init(true, new ParametersWithRandom(key, entropy));
        BigInteger[] rs = signer.generateSignature(formatted);
        try {
            return new DERSequence(new ASN1Encodable[] { new ASN1Integer(rs[0]), new ASN1Integer(rs[1]) }).getEncoded(
            ASN1Encoding.DER);
        } catch (IOException e) {
            throw new SignerException(SignerException.Failure.DEVICE_ERROR, "Unable to encode ECDSA signature", e);
        }
    }

    private byte[] rsa(AsymmetricKeyParameter key, byte[] formatted) throws SignerException {
        if (!(key instanceof RSAKeyParameters)) {
            throw new SignerException(SignerException.Failure.DEVICE_ERROR, "Slot does not hold an RSA key");
        }
        RSAEngine engine = new RSAEngine();
        engine.init(true, key);
        try {
            return engine.processBlock(formatted, 0, formatted.length);
        } catch (DataLengthException e) {
            throw new SignerException(SignerException.Failure.DEVICE_ERROR, "Formatted block does not fit the key", e);
        }
    }
}
