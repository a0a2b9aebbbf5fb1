/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.issuer;

import com.salesforce.slotca.issuer.ExtensionRule.Kind;
import com.salesforce.slotca.issuer.ext.CertExtension;
import com.salesforce.slotca.issuer.ext.ExtKeyUsageExtension;
import com.salesforce.slotca.issuer.ext.KeyUsageExtension;
import com.salesforce.slotca.issuer.ext.KeyUsageExtension.KeyUsage;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Narrows the extensions of an untrusted request to what the {@link ExtensionPolicy} allows. Filtering never fails:
 * a malformed or absent extension is treated as no request at all.
 */
public class ExtensionPolicyFilter {
    private static final Logger log = LoggerFactory.getLogger(ExtensionPolicyFilter.class);

    private final ExtensionPolicy policy;

    public ExtensionPolicyFilter(ExtensionPolicy policy) {
        this.policy = policy;
    }

    /**
     * The granted Extended Key Usage: the requested purposes found in the allow list, in request order. Absent when
     * none was requested and equally when none survives.
     */
    public Optional<ExtKeyUsageExtension> extendedKeyUsage(SigningRequest request) {
        Optional<Extension> requested = request.getExtension(Extension.extendedKeyUsage);
        if (requested.isEmpty()) {
            return Optional.empty();
        }
        Optional<ExtensionRule> rule = policy.rule(Extension.extendedKeyUsage);
        if (rule.isEmpty() || rule.get().kind() != Kind.EKU_ALLOW_LIST) {
            log.info("Dropping requested extended key usage, not allowed by policy");
            return Optional.empty();
        }
        final KeyPurposeId[] usages;
        try {
            usages = ExtendedKeyUsage.getInstance(requested.get().getParsedValue()).getUsages();
        } catch (IllegalArgumentException e) {
            log.info("Ignoring malformed extended key usage request", e);
            return Optional.empty();
        }
        List<KeyPurposeId> granted = new ArrayList<>();
        for (KeyPurposeId usage : usages) {
            if (rule.get().allowList().contains(usage.toOID())) {
                granted.add(usage);
            }
        }
        if (granted.isEmpty()) {
            log.info("No requested extended key usage of '{}' is allowed", Arrays.asList(usages));
            return Optional.empty();
        }
        log.info("Setting requested extended key usages '{}' to '{}'", Arrays.asList(usages), granted);
        return Optional.of(ExtKeyUsageExtension.create(granted, requested.get().isCritical()));
    }

    /**
     * @return the granted extensions, Key Usage before Extended Key Usage
     */
    public List<CertExtension> filter(SigningRequest request) {
        List<CertExtension> granted = new ArrayList<>();
        keyUsage(request).ifPresent(granted::add);
        extendedKeyUsage(request).ifPresent(granted::add);
        for (Extension requested : request.requestedExtensions()) {
            if (!Extension.keyUsage.equals(requested.getExtnId()) && !Extension.extendedKeyUsage.equals(
            requested.getExtnId())) {
                log.info("Dropping requested extension: {} rule: {}", requested.getExtnId(),
                         policy.rule(requested.getExtnId()).map(ExtensionRule::kind).orElse(null));
            }
        }
        return granted;
    }

    public ExtensionPolicy getPolicy() {
        return policy;
    }

    /**
     * The granted Key Usage: the requested usages ANDed with the policy mask, critical. Absent when none was
     * requested.
     */
    public Optional<KeyUsageExtension> keyUsage(SigningRequest request) {
        Optional<Extension> requested = request.getExtension(Extension.keyUsage);
        if (requested.isEmpty()) {
            return Optional.empty();
        }
        Optional<ExtensionRule> rule = policy.rule(Extension.keyUsage);
        if (rule.isEmpty() || rule.get().kind() != Kind.KEY_USAGE_MASK) {
            log.info("Dropping requested key usage, not allowed by policy");
            return Optional.empty();
        }
        final int usage;
        try {
            usage = KeyUsage.mask(org.bouncycastle.asn1.x509.KeyUsage.getInstance(requested.get().getParsedValue()));
        } catch (IllegalArgumentException e) {
            log.info("Ignoring malformed key usage request", e);
            return Optional.empty();
        }
        int allowed = usage & rule.get().keyUsageMask();
        log.info("Setting requested key usages '{}' to '{}'", KeyUsage.of(usage), KeyUsage.of(allowed));
        return Optional.of(KeyUsageExtension.create(allowed, true));
    }
}
