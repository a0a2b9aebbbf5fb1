/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.issuer.ext;

import org.bouncycastle.asn1.x509.Extension;

import java.util.EnumSet;

/**
 * Key Usage. The usages are carried as the bit mask of {@link org.bouncycastle.asn1.x509.KeyUsage}.
 */
public class KeyUsageExtension extends CertExtension {

    private final int mask;

    KeyUsageExtension(final int mask, final boolean critical) {
        super(Extension.keyUsage, critical, new org.bouncycastle.asn1.x509.KeyUsage(mask));
        this.mask = mask;
    }

    public static KeyUsageExtension create(final boolean critical, final KeyUsage... usages) {
        return new KeyUsageExtension(KeyUsage.mask(usages), critical);
    }

    public static KeyUsageExtension create(final int mask, final boolean critical) {
        return new KeyUsageExtension(mask, critical);
    }

    public int getMask() {
        return mask;
    }

    public enum KeyUsage {
        DIGITAL_SIGNATURE(org.bouncycastle.asn1.x509.KeyUsage.digitalSignature),
        NON_REPUDIATION(org.bouncycastle.asn1.x509.KeyUsage.nonRepudiation),
        KEY_ENCIPHERMENT(org.bouncycastle.asn1.x509.KeyUsage.keyEncipherment),
        DATA_ENCIPHERMENT(org.bouncycastle.asn1.x509.KeyUsage.dataEncipherment),
        KEY_AGREEMENT(org.bouncycastle.asn1.x509.KeyUsage.keyAgreement),
        KEY_CERT_SIGN(org.bouncycastle.asn1.x509.KeyUsage.keyCertSign),
        CRL_SIGN(org.bouncycastle.asn1.x509.KeyUsage.cRLSign),
        ENCIPHER_ONLY(org.bouncycastle.asn1.x509.KeyUsage.encipherOnly),
        DECIPHER_ONLY(org.bouncycastle.asn1.x509.KeyUsage.decipherOnly);

        private final int keyUsage;

        KeyUsage(final int keyUsage) {
            this.keyUsage = keyUsage;
        }

        public static int mask(final KeyUsage... usages) {
            int u = 0;
            for (final KeyUsage ku : usages) {
                u = u | ku.keyUsage;
            }
            return u;
        }

        /**
         * @return the usages present in the decoded extension value
         */
        public static int mask(final org.bouncycastle.asn1.x509.KeyUsage keyUsage) {
            int u = 0;
            for (final KeyUsage ku : values()) {
                if (keyUsage.hasUsages(ku.keyUsage)) {
                    u = u | ku.keyUsage;
                }
            }
            return u;
        }

        public static EnumSet<KeyUsage> of(final int mask) {
            final EnumSet<KeyUsage> usages = EnumSet.noneOf(KeyUsage.class);
            for (final KeyUsage ku : values()) {
                if (ku.isSet(mask)) {
                    usages.add(ku);
                }
            }
            return usages;
        }

        public boolean isSet(final int mask) {
            return (mask & keyUsage) != 0;
        }
    }

}
