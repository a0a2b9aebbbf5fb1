/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.issuer;

import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.x509.Certificate;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;

import java.io.IOException;
import java.math.BigInteger;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;

/**
 * A finished certificate: its DER encoding and the views and fingerprints derived from it
 */
public class IssuedCertificate {
    private final byte[]                encoded;
    private final X509CertificateHolder holder;

    IssuedCertificate(Certificate certificate) throws IOException {
        this.encoded = certificate.getEncoded(ASN1Encoding.DER);
        this.holder = new X509CertificateHolder(certificate);
    }

    /**
     * @return hex SHA-256 of the DER encoding
     */
    public String fingerprint() {
        return Fingerprints.fingerprint(encoded);
    }

    public byte[] getEncoded() {
        return encoded.clone();
    }

    public X509CertificateHolder getHolder() {
        return holder;
    }

    public BigInteger getSerialNumber() {
        return holder.getSerialNumber();
    }

    public X509Certificate getX509Certificate() throws CertificateException {
        return new JcaX509CertificateConverter().getCertificate(holder);
    }

    /**
     * @return upper case hex SHA-1 of the DER encoding
     */
    public String thumbprint() {
        return Fingerprints.thumbprint(encoded);
    }

    @Override
    public String toString() {
        return "IssuedCertificate[" + holder.getSubject() + ", serial: " + getSerialNumber().toString(16)
        + ", thumbprint: " + thumbprint() + "]";
    }
}
