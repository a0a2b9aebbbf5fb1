/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.issuer;

import com.salesforce.slotca.issuer.ext.AuthorityInfoAccessExtension;
import com.salesforce.slotca.issuer.ext.AuthorityKeyIdExtension;
import com.salesforce.slotca.issuer.ext.CertExtension;
import com.salesforce.slotca.issuer.ext.CertificatePoliciesExtension;
import com.salesforce.slotca.issuer.ext.CrlDistPointExtension;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Derives the extensions linking a new certificate to its issuer: Authority Key Identifier always, Authority
 * Information Access and CRL Distribution Points when their URLs are configured, and Certificate Policies when
 * policies are configured.
 */
public class AuthorityLinkageBuilder {
    private static final Logger log = LoggerFactory.getLogger(AuthorityLinkageBuilder.class);

    private final String                     authorityAccessUrl;
    private final List<ASN1ObjectIdentifier> certificatePolicies;
    private final String                     crlDistributionUrl;

    public AuthorityLinkageBuilder(String authorityAccessUrl, String crlDistributionUrl,
                                   List<ASN1ObjectIdentifier> certificatePolicies) {
        this.authorityAccessUrl = authorityAccessUrl;
        this.crlDistributionUrl = crlDistributionUrl;
        this.certificatePolicies = certificatePolicies == null ? List.of() : List.copyOf(certificatePolicies);
    }

    public AuthorityLinkageBuilder(IssuanceParameters parameters) {
        this(parameters.authorityAccessUrl(), parameters.crlDistributionUrl(), parameters.certificatePolicies());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public Optional<AuthorityInfoAccessExtension> authorityInformationAccess() {
        if (isBlank(authorityAccessUrl)) {
            return Optional.empty();
        }
        log.info("Adding authority information access extension: {}", authorityAccessUrl);
        return Optional.of(AuthorityInfoAccessExtension.caIssuers(authorityAccessUrl));
    }

    /**
     * Exactly one form: the issuer's key identifier when it has one, otherwise its name and serial number.
     */
    public AuthorityKeyIdExtension authorityKeyIdentifier(IssuerContext issuer) {
        Optional<byte[]> ski = issuer.getSubjectKeyIdentifier();
        if (ski.isPresent()) {
            log.info("Adding authority key identifier from key identifier: {}", Hex.toHexString(ski.get()));
            return AuthorityKeyIdExtension.fromKeyIdentifier(ski.get());
        }
        log.info("Adding authority key identifier from issuer and serial number: {} {}", issuer.subject(),
                 issuer.serialNumber().toString(16));
        return AuthorityKeyIdExtension.fromIssuerAndSerial(issuer.subject(), issuer.serialNumber());
    }

    /**
     * @return AKI, then AIA and CRL Distribution Points and Certificate Policies where configured
     */
    public List<CertExtension> build(IssuerContext issuer) {
        List<CertExtension> linkage = new ArrayList<>();
        linkage.add(authorityKeyIdentifier(issuer));
        authorityInformationAccess().ifPresent(linkage::add);
        crlDistributionPoint().ifPresent(linkage::add);
        certificatePolicies().ifPresent(linkage::add);
        return linkage;
    }

    public Optional<CertificatePoliciesExtension> certificatePolicies() {
        if (certificatePolicies.isEmpty()) {
            return Optional.empty();
        }
        log.info("Adding certificate policies: {}", certificatePolicies);
        return Optional.of(CertificatePoliciesExtension.create(certificatePolicies));
    }

    public Optional<CrlDistPointExtension> crlDistributionPoint() {
        if (isBlank(crlDistributionUrl)) {
            return Optional.empty();
        }
        log.info("Adding CRL distribution point: {}", crlDistributionUrl);
        return Optional.of(CrlDistPointExtension.create(crlDistributionUrl));
    }
}
