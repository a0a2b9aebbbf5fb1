/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.issuer.ext;

import org.bouncycastle.asn1.x509.AccessDescription;
import org.bouncycastle.asn1.x509.AuthorityInformationAccess;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;

/**
 * Authority Information Access pointing at where the issuing certificate can be fetched.
 */
public class AuthorityInfoAccessExtension extends CertExtension {

    AuthorityInfoAccessExtension(final AccessDescription... descriptions) {
        super(Extension.authorityInfoAccess, false, new AuthorityInformationAccess(descriptions));
    }

    public static AuthorityInfoAccessExtension caIssuers(final String uri) {
        final GeneralName location = new GeneralName(GeneralName.uniformResourceIdentifier, uri);
        return new AuthorityInfoAccessExtension(new AccessDescription(AccessDescription.id_ad_caIssuers, location));
    }
}
