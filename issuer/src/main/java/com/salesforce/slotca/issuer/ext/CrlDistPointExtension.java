/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.issuer.ext;

import org.bouncycastle.asn1.x509.CRLDistPoint;
import org.bouncycastle.asn1.x509.DistributionPoint;
import org.bouncycastle.asn1.x509.DistributionPointName;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;

/**
 * CRL Distribution Points
 */
public class CrlDistPointExtension extends CertExtension {

    CrlDistPointExtension(final DistributionPoint... points) {
        super(Extension.cRLDistributionPoints, false, new CRLDistPoint(points));
    }

    /**
     * Creates a {@link CrlDistPointExtension} with only a {@code distributionPoint} URI (no {@code reasons}, no
     * {@code cRLIssuer} specified).
     */
    public static CrlDistPointExtension create(final String uri) {
        final DistributionPointName dp = new DistributionPointName(
        new GeneralNames(new GeneralName(GeneralName.uniformResourceIdentifier, uri)));
        return new CrlDistPointExtension(new DistributionPoint(dp, null, null));
    }
}
