/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.cryptography;

import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.DERNull;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.asn1.x509.DigestInfo;
import org.bouncycastle.crypto.generators.MGF1BytesGenerator;
import org.bouncycastle.crypto.params.MGFParameters;

import java.io.IOException;
import java.util.Arrays;

/**
 * EMSA encodings of RFC 8017 for signing with a raw RSA private key operation.
 */
final class RsaPadding {

    private static final byte PSS_TRAILER = (byte) 0xBC;

    /**
     * The deterministic PKCS #1 v1.5 envelope {@code 00 01 FF..FF 00 DigestInfo}.
     *
     * @param hash         the message hash
     * @param digest       the algorithm that produced the hash
     * @param keySizeBytes the modulus length in bytes, which is also the length of the result
     */
    static byte[] pkcs1(byte[] hash, DigestAlgorithm digest, int keySizeBytes) throws SignatureFormatException {
        byte[] t = digestInfo(hash, digest);
        if (keySizeBytes < t.length + 11) {
            throw new UnsupportedKeySizeException(
            "RSA key of " + keySizeBytes + " bytes is too short for a " + digest.algorithmName() + " DigestInfo");
        }
        byte[] em = new byte[keySizeBytes];
        em[1] = 0x01;
        Arrays.fill(em, 2, keySizeBytes - t.length - 1, (byte) 0xFF);
        System.arraycopy(t, 0, em, keySizeBytes - t.length, t.length);
        return em;
    }

    /**
     * EMSA-PSS with MGF1 over the same hash. The result is left padded to the key length, so moduli whose bit length
     * is one more than a multiple of eight still yield a key sized buffer.
     *
     * @param mHash       the message hash
     * @param digest      the algorithm that produced the hash, used again for H and the mask generation
     * @param keySizeBits the modulus length in bits
     * @param salt        the salt, drawn fresh for every signature
     */
    static byte[] pss(byte[] mHash, DigestAlgorithm digest, int keySizeBits, byte[] salt)
    throws SignatureFormatException {
        final int hLen = digest.digestLength();
        final int sLen = salt.length;
        final int emBits = keySizeBits - 1;
        final int emLen = (emBits + 7) / 8;
        if (emLen < hLen + sLen + 2) {
            throw new UnsupportedKeySizeException(
            "RSA key of " + keySizeBits + " bits is too short for PSS with " + digest.algorithmName() + " and a "
            + sLen + " byte salt");
        }

        byte[] mPrime = new byte[8 + hLen + sLen];
        System.arraycopy(mHash, 0, mPrime, 8, hLen);
        System.arraycopy(salt, 0, mPrime, 8 + hLen, sLen);
        byte[] h = digest.hashOf(mPrime);

        final int dbLen = emLen - hLen - 1;
        byte[] db = new byte[dbLen];
        db[dbLen - sLen - 1] = 0x01;
        System.arraycopy(salt, 0, db, dbLen - sLen, sLen);

        byte[] dbMask = new byte[dbLen];
        MGF1BytesGenerator mgf = new MGF1BytesGenerator(digest.bcDigest());
        mgf.init(new MGFParameters(h));
        mgf.generateBytes(dbMask, 0, dbLen);
        for (int i = 0; i < dbLen; i++) {
            db[i] ^= dbMask[i];
        }
        db[0] &= (byte) (0xFF >>> (8 * emLen - emBits));

        final int keySizeBytes = (keySizeBits + 7) / 8;
        byte[] em = new byte[keySizeBytes];
        int offset = keySizeBytes - emLen;
        System.arraycopy(db, 0, em, offset, dbLen);
        System.arraycopy(h, 0, em, offset + dbLen, hLen);
        em[keySizeBytes - 1] = PSS_TRAILER;
        return em;
    }

    static byte[] digestInfo(byte[] hash, DigestAlgorithm digest) throws SignatureFormatException {
        try {
            return new DigestInfo(new AlgorithmIdentifier(digest.oid(), DERNull.INSTANCE), hash).getEncoded(
            ASN1Encoding.DER);
        } catch (IOException e) {
            throw new SignatureFormatException("Unable to encode DigestInfo", e);
        }
    }

    private RsaPadding() {
    }
}
