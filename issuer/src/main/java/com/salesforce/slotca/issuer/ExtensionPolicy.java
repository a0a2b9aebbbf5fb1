/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.issuer;

import com.salesforce.slotca.issuer.ext.KeyUsageExtension.KeyUsage;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.KeyPurposeId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The administrator approved constraints on what a requester may ask for. Requested extensions without a rule are
 * never granted.
 */
public record ExtensionPolicy(Map<ASN1ObjectIdentifier, ExtensionRule> rules) {

    /** Microsoft document signing */
    public static final ASN1ObjectIdentifier DOCUMENT_SIGNING = new ASN1ObjectIdentifier("1.3.6.1.4.1.311.10.3.12");

    public static final int            DEFAULT_KEY_USAGE_MASK = KeyUsage.mask(KeyUsage.DATA_ENCIPHERMENT,
                                                                              KeyUsage.DIGITAL_SIGNATURE,
                                                                              KeyUsage.KEY_AGREEMENT);
    public static final ExtensionPolicy DEFAULT                = newBuilder().build();

    public ExtensionPolicy {
        rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public Optional<ExtensionRule> rule(ASN1ObjectIdentifier extension) {
        return Optional.ofNullable(rules.get(extension));
    }

    public static class Builder {
        private Set<ASN1ObjectIdentifier> allowedExtendedKeyUsages = new LinkedHashSet<>(
        Set.of(KeyPurposeId.id_kp_codeSigning.toOID(), DOCUMENT_SIGNING, KeyPurposeId.id_kp_emailProtection.toOID()));
        private Set<ASN1ObjectIdentifier> denied                   = new LinkedHashSet<>();
        private int                       keyUsageMask             = DEFAULT_KEY_USAGE_MASK;

        public ExtensionPolicy build() {
            Map<ASN1ObjectIdentifier, ExtensionRule> rules = new LinkedHashMap<>();
            rules.put(Extension.keyUsage, ExtensionRule.keyUsageMask(keyUsageMask));
            rules.put(Extension.extendedKeyUsage, ExtensionRule.ekuAllowList(allowedExtendedKeyUsages));
            denied.forEach(oid -> rules.put(oid, ExtensionRule.deny()));
            return new ExtensionPolicy(rules);
        }

        public Builder deny(ASN1ObjectIdentifier extension) {
            denied.add(extension);
            return this;
        }

        public Set<ASN1ObjectIdentifier> getAllowedExtendedKeyUsages() {
            return allowedExtendedKeyUsages;
        }

        public Builder setAllowedExtendedKeyUsages(Set<ASN1ObjectIdentifier> allowedExtendedKeyUsages) {
            this.allowedExtendedKeyUsages = new LinkedHashSet<>(allowedExtendedKeyUsages);
            return this;
        }

        public Set<ASN1ObjectIdentifier> getDenied() {
            return denied;
        }

        public int getKeyUsageMask() {
            return keyUsageMask;
        }

        public Builder setKeyUsageMask(int keyUsageMask) {
            this.keyUsageMask = keyUsageMask;
            return this;
        }

        public Builder setKeyUsageMask(KeyUsage... usages) {
            return setKeyUsageMask(KeyUsage.mask(usages));
        }
    }
}
