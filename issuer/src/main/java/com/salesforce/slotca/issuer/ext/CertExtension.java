/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.issuer.ext;

import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.x509.Extension;

import java.io.IOException;

/**
 * An extension to be placed in an issued certificate.
 */
public class CertExtension {
    private final boolean              isCritical;
    private final ASN1ObjectIdentifier oid;
    private final ASN1Encodable        value;

    public CertExtension(final ASN1ObjectIdentifier oid, final boolean isCritical, final ASN1Encodable value) {
        this.oid = oid;
        this.isCritical = isCritical;
        this.value = value;
    }

    public ASN1ObjectIdentifier getOid() {
        return oid;
    }

    public ASN1Encodable getValue() {
        return value;
    }

    public boolean isCritical() {
        return isCritical;
    }

    /**
     * @return the DER encoded extension
     */
    public Extension toExtension() {
        try {
            return new Extension(oid, isCritical, value.toASN1Primitive().getEncoded(ASN1Encoding.DER));
        } catch (final IOException e) {
            throw new IllegalStateException("Unable to encode extension: " + oid, e);
        }
    }

    @Override
    public String toString() {
        return "Extension [" + oid + (isCritical ? "!" : "") + "=" + value + "]";
    }

}
