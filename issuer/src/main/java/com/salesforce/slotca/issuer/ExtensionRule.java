/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.issuer;

import org.bouncycastle.asn1.ASN1ObjectIdentifier;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * What an {@link ExtensionPolicy} allows of one requested extension.
 *
 * @param kind         the kind of rule
 * @param keyUsageMask for {@link Kind#KEY_USAGE_MASK}, the usages that may be granted
 * @param allowList    for {@link Kind#EKU_ALLOW_LIST}, the purposes that may be granted
 */
public record ExtensionRule(Kind kind, int keyUsageMask, Set<ASN1ObjectIdentifier> allowList) {

    public ExtensionRule {
        allowList = Collections.unmodifiableSet(new LinkedHashSet<>(allowList));
    }

    public static ExtensionRule deny() {
        return new ExtensionRule(Kind.DENY, 0, Set.of());
    }

    public static ExtensionRule ekuAllowList(Set<ASN1ObjectIdentifier> allowed) {
        return new ExtensionRule(Kind.EKU_ALLOW_LIST, 0, allowed);
    }

    public static ExtensionRule keyUsageMask(int mask) {
        return new ExtensionRule(Kind.KEY_USAGE_MASK, mask, Set.of());
    }

    public enum Kind {
        /** Grant the requested key usage ANDed with the mask */
        KEY_USAGE_MASK,
        /** Grant the requested purposes that are in the allow list, in request order */
        EKU_ALLOW_LIST,
        /** Never grant */
        DENY;
    }
}
