/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.issuer.ext;

import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.AuthorityKeyIdentifier;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;

import java.math.BigInteger;

/**
 * Authority Key Identifier, in exactly one of its two forms: the issuer's key identifier, or the issuer's name and
 * serial number.
 */
public class AuthorityKeyIdExtension extends CertExtension {

    private final boolean keyIdentifierForm;

    AuthorityKeyIdExtension(final AuthorityKeyIdentifier aki, final boolean keyIdentifierForm) {
        super(Extension.authorityKeyIdentifier, false, aki);
        this.keyIdentifierForm = keyIdentifierForm;
    }

    public static AuthorityKeyIdExtension fromKeyIdentifier(final byte[] subjectKeyIdentifier) {
        return new AuthorityKeyIdExtension(new AuthorityKeyIdentifier(subjectKeyIdentifier), true);
    }

    public static AuthorityKeyIdExtension fromIssuerAndSerial(final X500Name issuer, final BigInteger serialNumber) {
        return new AuthorityKeyIdExtension(
        new AuthorityKeyIdentifier(new GeneralNames(new GeneralName(issuer)), serialNumber), false);
    }

    public boolean isKeyIdentifierForm() {
        return keyIdentifierForm;
    }
}
