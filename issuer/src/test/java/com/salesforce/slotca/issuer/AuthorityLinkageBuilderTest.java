/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.issuer;

import com.salesforce.slotca.issuer.ext.AuthorityKeyIdExtension;
import com.salesforce.slotca.issuer.ext.CertExtension;
import com.salesforce.slotca.issuer.ext.CertificatePoliciesExtension;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.AccessDescription;
import org.bouncycastle.asn1.x509.AuthorityInformationAccess;
import org.bouncycastle.asn1.x509.AuthorityKeyIdentifier;
import org.bouncycastle.asn1.x509.CRLDistPoint;
import org.bouncycastle.asn1.x509.CertificatePolicies;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AuthorityLinkageBuilderTest {
    private static final String     AIA    = "http://pki.example.com/ca.crt";
    private static final X500Name   CA     = new X500Name("CN=Slot CA, O=Example");
    private static final String     CRL    = "http://pki.example.com/ca.crl";
    private static final BigInteger SERIAL = new BigInteger("0123456789abcdef", 16);
    private static final byte[]     SKI    = Hex.decode("aabbccddeeff00112233445566778899aabbccdd");

    @Test
    public void keyIdentifierWhenIssuerHasOne() {
        var builder = new AuthorityLinkageBuilder(null, null, List.of());
        List<CertExtension> linkage = builder.build(new IssuerContext(CA, SKI, SERIAL));
        assertEquals(1, linkage.size());
        var aki = (AuthorityKeyIdExtension) linkage.get(0);
        assertTrue(aki.isKeyIdentifierForm());
        assertFalse(aki.isCritical());

        var decoded = AuthorityKeyIdentifier.getInstance(aki.getValue());
        assertArrayEquals(SKI, decoded.getKeyIdentifier());
        assertNull(decoded.getAuthorityCertIssuer());
        assertNull(decoded.getAuthorityCertSerialNumber());
    }

    @Test
    public void issuerAndSerialWithoutKeyIdentifier() {
        var builder = new AuthorityLinkageBuilder(null, null, List.of());
        var aki = builder.authorityKeyIdentifier(new IssuerContext(CA, null, SERIAL));
        assertFalse(aki.isKeyIdentifierForm());

        var decoded = AuthorityKeyIdentifier.getInstance(aki.getValue());
        assertNull(decoded.getKeyIdentifier());
        assertEquals(SERIAL, decoded.getAuthorityCertSerialNumber());
        GeneralName[] names = decoded.getAuthorityCertIssuer().getNames();
        assertEquals(1, names.length);
        assertEquals(GeneralName.directoryName, names[0].getTagNo());
        assertEquals(CA, X500Name.getInstance(names[0].getName()));
    }

    @Test
    public void configuredLinkage() {
        var builder = new AuthorityLinkageBuilder(AIA, CRL,
                                                  List.of(CertificatePoliciesExtension.ORGANIZATION_VALIDATED));
        List<CertExtension> linkage = builder.build(new IssuerContext(CA, SKI, SERIAL));
        assertEquals(List.of(Extension.authorityKeyIdentifier, Extension.authorityInfoAccess,
                             Extension.cRLDistributionPoints, Extension.certificatePolicies),
                     linkage.stream().map(CertExtension::getOid).toList());
        linkage.forEach(e -> assertFalse(e.isCritical()));

        AccessDescription[] access = AuthorityInformationAccess.getInstance(linkage.get(1).getValue())
                                                               .getAccessDescriptions();
        assertEquals(1, access.length);
        assertEquals(AccessDescription.id_ad_caIssuers, access[0].getAccessMethod());
        assertEquals(new GeneralName(GeneralName.uniformResourceIdentifier, AIA), access[0].getAccessLocation());

        var points = CRLDistPoint.getInstance(linkage.get(2).getValue()).getDistributionPoints();
        assertEquals(1, points.length);
        var names = GeneralNames.getInstance(points[0].getDistributionPoint().getName());
        assertEquals(new GeneralName(GeneralName.uniformResourceIdentifier, CRL), names.getNames()[0]);

        var policies = CertificatePolicies.getInstance(linkage.get(3).getValue()).getPolicyInformation();
        assertEquals(CertificatePoliciesExtension.ORGANIZATION_VALIDATED, policies[0].getPolicyIdentifier());
    }

    @Test
    public void blankUrlsAreNotConfigured() {
        var builder = new AuthorityLinkageBuilder(" ", "", null);
        assertTrue(builder.authorityInformationAccess().isEmpty());
        assertTrue(builder.crlDistributionPoint().isEmpty());
        assertTrue(builder.certificatePolicies().isEmpty());
        assertEquals(1, builder.build(new IssuerContext(CA, null, SERIAL)).size());
    }
}
