/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.cryptography;

import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.DERNull;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.pkcs.RSASSAPSSparams;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.asn1.x9.X9ObjectIdentifiers;

import java.security.SecureRandom;

/**
 * The closed set of ways a to-be-signed message is laid out for a raw private key operation. Each scheme hashes the
 * message and then applies its own encoding; the signer applies the key to the result and nothing else.
 */
public enum SignatureScheme {

    RSA_PKCS1 {
        @Override
        public AlgorithmIdentifier algorithmIdentifier(DigestAlgorithm digest, int saltLength) {
            ASN1ObjectIdentifier oid = switch (digest) {
                case SHA1 -> PKCSObjectIdentifiers.sha1WithRSAEncryption;
                case SHA2_256 -> PKCSObjectIdentifiers.sha256WithRSAEncryption;
                case SHA2_384 -> PKCSObjectIdentifiers.sha384WithRSAEncryption;
                case SHA2_512 -> PKCSObjectIdentifiers.sha512WithRSAEncryption;
            };
            return new AlgorithmIdentifier(oid, DERNull.INSTANCE);
        }

        @Override
        public KeyAlgorithm keyAlgorithm() {
            return KeyAlgorithm.RSA;
        }

        @Override
        protected byte[] encode(byte[] hash, DigestAlgorithm digest, SigningKeyHandle key, int saltLength,
                                SecureRandom entropy) throws SignatureFormatException {
            return RsaPadding.pkcs1(hash, digest, key.keySizeBytes());
        }
    },

    RSA_PSS {
        @Override
        public AlgorithmIdentifier algorithmIdentifier(DigestAlgorithm digest, int saltLength) {
            AlgorithmIdentifier hashId = new AlgorithmIdentifier(digest.oid(), DERNull.INSTANCE);
            RSASSAPSSparams params = new RSASSAPSSparams(hashId,
                                                         new AlgorithmIdentifier(PKCSObjectIdentifiers.id_mgf1,
                                                                                 hashId),
                                                         new ASN1Integer(saltLength(digest, saltLength)),
                                                         new ASN1Integer(1));
            return new AlgorithmIdentifier(PKCSObjectIdentifiers.id_RSASSA_PSS, params);
        }

        @Override
        public KeyAlgorithm keyAlgorithm() {
            return KeyAlgorithm.RSA;
        }

        @Override
        protected byte[] encode(byte[] hash, DigestAlgorithm digest, SigningKeyHandle key, int saltLength,
                                SecureRandom entropy) throws SignatureFormatException {
            byte[] salt = new byte[saltLength(digest, saltLength)];
            entropy.nextBytes(salt);
            return RsaPadding.pss(hash, digest, key.keySizeBits(), salt);
        }
    },

    ECDSA {
        @Override
        public AlgorithmIdentifier algorithmIdentifier(DigestAlgorithm digest, int saltLength) {
            return new AlgorithmIdentifier(switch (digest) {
                case SHA1 -> X9ObjectIdentifiers.ecdsa_with_SHA1;
                case SHA2_256 -> X9ObjectIdentifiers.ecdsa_with_SHA256;
                case SHA2_384 -> X9ObjectIdentifiers.ecdsa_with_SHA384;
                case SHA2_512 -> X9ObjectIdentifiers.ecdsa_with_SHA512;
            });
        }

        @Override
        public KeyAlgorithm keyAlgorithm() {
            return KeyAlgorithm.ECDSA;
        }

        /**
         * The hash, left padded with zeros to the whole bytes of the curve order. For P-521 that is 65 bytes, so the
         * padded value never exceeds the order's bit length and is not truncated by the signer.
         */
        @Override
        protected byte[] encode(byte[] hash, DigestAlgorithm digest, SigningKeyHandle key, int saltLength,
                                SecureRandom entropy) throws SignatureFormatException {
            final int size = key.keySizeBits() / 8;
            if (hash.length > size) {
                throw new UnsupportedKeySizeException(
                digest.algorithmName() + " hash of " + hash.length + " bytes exceeds the " + key.keySizeBits()
                + " bit curve");
            }
            byte[] formatted = new byte[size];
            System.arraycopy(hash, 0, formatted, size - hash.length, hash.length);
            return formatted;
        }
    };

    /**
     * Salt length meaning "as long as the digest"
     */
    public static final int DIGEST_LENGTH_SALT = -1;

    /**
     * @param key        the algorithm of the signing key
     * @param rsaPadding the scheme to use should the key be RSA
     * @return the scheme that signs with a key of the given algorithm
     * @throws UnsupportedAlgorithmException if the RSA preference is not an RSA scheme
     */
    public static SignatureScheme forKey(KeyAlgorithm key, SignatureScheme rsaPadding)
    throws UnsupportedAlgorithmException {
        return switch (key) {
            case ECDSA -> ECDSA;
            case RSA -> {
                if (rsaPadding == null || rsaPadding.keyAlgorithm() != KeyAlgorithm.RSA) {
                    throw new UnsupportedAlgorithmException("Not an RSA padding scheme: " + rsaPadding);
                }
                yield rsaPadding;
            }
        };
    }

    private static int saltLength(DigestAlgorithm digest, int saltLength) {
        return saltLength == DIGEST_LENGTH_SALT ? digest.digestLength() : saltLength;
    }

    /**
     * @return the signature algorithm identifier a certificate signed under this scheme carries
     */
    abstract public AlgorithmIdentifier algorithmIdentifier(DigestAlgorithm digest, int saltLength);

    /**
     * Produce the exact buffer the raw private key operation of the key must process.
     *
     * @param message    the to-be-signed bytes
     * @param digest     the hash algorithm of the signature
     * @param key        the signing key
     * @param saltLength PSS salt length in bytes, or {@link #DIGEST_LENGTH_SALT}. Ignored by other schemes
     * @param entropy    source of the PSS salt
     * @throws UnsupportedAlgorithmException if the key is not of this scheme's algorithm
     * @throws UnsupportedKeySizeException   if the encoded hash does not fit the key
     */
    public byte[] format(byte[] message, DigestAlgorithm digest, SigningKeyHandle key, int saltLength,
                         SecureRandom entropy) throws SignatureFormatException {
        if (key.algorithm() != keyAlgorithm()) {
            throw new UnsupportedAlgorithmException(
            "Cannot sign with " + this + " using a " + key.algorithm() + " key");
        }
        if (saltLength < DIGEST_LENGTH_SALT) {
            throw new IllegalArgumentException("Invalid salt length: " + saltLength);
        }
        return encode(digest.hashOf(message), digest, key, saltLength, entropy);
    }

    abstract public KeyAlgorithm keyAlgorithm();

    abstract protected byte[] encode(byte[] hash, DigestAlgorithm digest, SigningKeyHandle key, int saltLength,
                                     SecureRandom entropy) throws SignatureFormatException;
}
