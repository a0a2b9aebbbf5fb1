/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.cryptography;

import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.nist.NISTObjectIdentifiers;
import org.bouncycastle.asn1.x509.X509ObjectIdentifiers;
import org.bouncycastle.crypto.Digest;
import org.bouncycastle.crypto.util.DigestFactory;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * The hash algorithms a certificate signature may be computed over.
 */
public enum DigestAlgorithm {

    SHA1 {
        @Override
        public String algorithmName() {
            return "SHA-1";
        }

        @Override
        public Digest bcDigest() {
            return DigestFactory.createSHA1();
        }

        @Override
        public int digestLength() {
            return 20;
        }

        @Override
        public ASN1ObjectIdentifier oid() {
            return X509ObjectIdentifiers.id_SHA1;
        }
    },

    SHA2_256 {
        @Override
        public String algorithmName() {
            return "SHA-256";
        }

        @Override
        public Digest bcDigest() {
            return DigestFactory.createSHA256();
        }

        @Override
        public int digestLength() {
            return 32;
        }

        @Override
        public ASN1ObjectIdentifier oid() {
            return NISTObjectIdentifiers.id_sha256;
        }
    },

    SHA2_384 {
        @Override
        public String algorithmName() {
            return "SHA-384";
        }

        @Override
        public Digest bcDigest() {
            return DigestFactory.createSHA384();
        }

        @Override
        public int digestLength() {
            return 48;
        }

        @Override
        public ASN1ObjectIdentifier oid() {
            return NISTObjectIdentifiers.id_sha384;
        }
    },

    SHA2_512 {
        @Override
        public String algorithmName() {
            return "SHA-512";
        }

        @Override
        public Digest bcDigest() {
            return DigestFactory.createSHA512();
        }

        @Override
        public int digestLength() {
            return 64;
        }

        @Override
        public ASN1ObjectIdentifier oid() {
            return NISTObjectIdentifiers.id_sha512;
        }
    };

    public static final  DigestAlgorithm          DEFAULT        = SHA2_256;
    private static final ThreadLocal<DigestCache> MESSAGE_DIGEST = ThreadLocal.withInitial(() -> new DigestCache());

    /**
     * Resolve a hash algorithm by name. Accepts the JCA spelling ("SHA-256"), the compact spelling ("SHA256") and
     * the enum name ("SHA2_256"), case insensitively.
     *
     * @throws UnsupportedDigestException if the name does not denote a supported algorithm. No default is ever
     *                                    substituted.
     */
    public static DigestAlgorithm lookup(String name) throws UnsupportedDigestException {
        if (name == null) {
            throw new UnsupportedDigestException("No digest algorithm named");
        }
        return switch (name.trim().toUpperCase(Locale.ROOT).replace("-", "").replace("_", "")) {
            case "SHA1" -> SHA1;
            case "SHA256", "SHA2256" -> SHA2_256;
            case "SHA384", "SHA2384" -> SHA2_384;
            case "SHA512", "SHA2512" -> SHA2_512;
            default -> throw new UnsupportedDigestException("Unsupported digest algorithm: " + name);
        };
    }

    /**
     * @return the JCA standard name of the algorithm
     */
    abstract public String algorithmName();

    /**
     * @return a fresh Bouncy Castle lightweight digest of this algorithm
     */
    abstract public Digest bcDigest();

    abstract public int digestLength();

    public byte[] hashOf(byte[] bytes) {
        return hashOf(bytes, bytes.length);
    }

    public byte[] hashOf(byte[] bytes, int len) {
        MessageDigest md = lookupJCA();
        md.reset();
        md.update(bytes, 0, len);
        return md.digest();
    }

    /**
     * @return the object identifier of the hash, as carried in a DigestInfo or PSS parameters
     */
    abstract public ASN1ObjectIdentifier oid();

    protected MessageDigest createJCA() {
        try {
            return MessageDigest.getInstance(algorithmName());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to retrieve " + algorithmName() + " Message Digest instance", e);
        }
    }

    private MessageDigest lookupJCA() {
        return MESSAGE_DIGEST.get().lookup(this);
    }

    private static class DigestCache {
        private final Map<DigestAlgorithm, MessageDigest> cache = new HashMap<>();

        public MessageDigest lookup(DigestAlgorithm da) {
            return cache.computeIfAbsent(da, k -> k.createJCA());
        }
    }
}
