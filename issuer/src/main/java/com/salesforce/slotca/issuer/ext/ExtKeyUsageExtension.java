/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.issuer.ext;

import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.KeyPurposeId;

import java.util.List;

public class ExtKeyUsageExtension extends CertExtension {

    private final List<KeyPurposeId> usages;

    ExtKeyUsageExtension(final List<KeyPurposeId> usages, final boolean critical) {
        super(Extension.extendedKeyUsage, critical, new ExtendedKeyUsage(usages.toArray(new KeyPurposeId[0])));
        this.usages = List.copyOf(usages);
    }

    /**
     * @param usages in the order they are to be encoded. Must not be empty
     */
    public static ExtKeyUsageExtension create(final List<KeyPurposeId> usages, final boolean critical) {
        if (usages.isEmpty()) {
            throw new IllegalArgumentException("Extended key usage requires at least one purpose");
        }
        return new ExtKeyUsageExtension(usages, critical);
    }

    public List<KeyPurposeId> getUsages() {
        return usages;
    }

}
