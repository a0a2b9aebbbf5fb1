/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.issuer;

import com.salesforce.slotca.issuer.CaException.Reason;
import com.salesforce.slotca.issuer.CertificateDraft.State;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.SubjectKeyIdentifier;
import org.bouncycastle.cert.X509CertificateHolder;

import java.io.IOException;
import java.math.BigInteger;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.util.Optional;

/**
 * Snapshot of the issuing certificate: what the authority linkage extensions of a new certificate are derived
 * from.
 *
 * @param subject              the issuer's subject, which becomes the new certificate's issuer
 * @param subjectKeyIdentifier the issuer's key identifier, or null if its certificate carries none
 * @param serialNumber         the serial number of the issuer's certificate
 */
public record IssuerContext(X500Name subject, byte[] subjectKeyIdentifier, BigInteger serialNumber) {

    public IssuerContext {
        if (subject == null || serialNumber == null) {
            throw new IllegalArgumentException("Issuer subject and serial number are required");
        }
        subjectKeyIdentifier = subjectKeyIdentifier == null ? null : subjectKeyIdentifier.clone();
    }

    public static IssuerContext from(X509Certificate certificate) {
        try {
            return from(new X509CertificateHolder(certificate.getEncoded()));
        } catch (CertificateEncodingException | IOException e) {
            throw new CaException(Reason.ENCODING_FAILURE, State.DRAFT, "Unable to decode issuer certificate", e);
        }
    }

    public static IssuerContext from(X509CertificateHolder certificate) {
        Extension ski = certificate.getExtension(Extension.subjectKeyIdentifier);
        byte[] keyId = null;
        if (ski != null) {
            keyId = SubjectKeyIdentifier.getInstance(ski.getParsedValue()).getKeyIdentifier();
        }
        return new IssuerContext(certificate.getSubject(), keyId, certificate.getSerialNumber());
    }

    public Optional<byte[]> getSubjectKeyIdentifier() {
        return Optional.ofNullable(subjectKeyIdentifier).map(byte[]::clone);
    }

    @Override
    public String toString() {
        return "IssuerContext[" + subject + ", serial: " + serialNumber.toString(16) + ", ski: " + (
        subjectKeyIdentifier == null ? "none" : org.bouncycastle.util.encoders.Hex.toHexString(subjectKeyIdentifier))
        + "]";
    }
}
