/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.issuer.ext;

import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.x509.CertificatePolicies;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.PolicyInformation;

import java.util.List;

/**
 * Certificate Policies, one policy information entry per identifier and no qualifiers.
 */
public class CertificatePoliciesExtension extends CertExtension {
    /** CA/Browser Forum domain validated */
    public static final ASN1ObjectIdentifier DOMAIN_VALIDATED       = new ASN1ObjectIdentifier("2.23.140.1.2.1");
    /** CA/Browser Forum individual validated */
    public static final ASN1ObjectIdentifier INDIVIDUAL_VALIDATED   = new ASN1ObjectIdentifier("2.23.140.1.2.3");
    /** CA/Browser Forum organization validated */
    public static final ASN1ObjectIdentifier ORGANIZATION_VALIDATED = new ASN1ObjectIdentifier("2.23.140.1.2.2");

    CertificatePoliciesExtension(final PolicyInformation[] policies) {
        super(Extension.certificatePolicies, false, new CertificatePolicies(policies));
    }

    public static CertificatePoliciesExtension create(final List<ASN1ObjectIdentifier> policies) {
        if (policies.isEmpty()) {
            throw new IllegalArgumentException("At least one policy is required");
        }
        return new CertificatePoliciesExtension(
        policies.stream().map(PolicyInformation::new).toArray(PolicyInformation[]::new));
    }
}
