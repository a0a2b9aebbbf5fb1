/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.issuer;

import com.salesforce.slotca.issuer.CaException.Reason;
import com.salesforce.slotca.issuer.CertificateDraft.State;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.pkcs.Attribute;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.Extensions;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentVerifierProviderBuilder;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.bouncycastle.pkcs.PKCSException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.security.Provider;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * An untrusted request for a certificate: the subject, its public key and the extensions it asks for, in request
 * order. Nothing requested is granted until it has passed the {@link ExtensionPolicyFilter}.
 */
public record SigningRequest(X500Name subject, SubjectPublicKeyInfo publicKey, List<Extension> requestedExtensions) {
    private static final Logger   log      = LoggerFactory.getLogger(SigningRequest.class);
    private static final Provider PROVIDER = new BouncyCastleProvider();

    public SigningRequest {
        if (subject == null || subject.getRDNs().length == 0) {
            throw new CaException(Reason.INVALID_REQUEST, State.DRAFT, "Request has no subject");
        }
        if (publicKey == null) {
            throw new CaException(Reason.INVALID_REQUEST, State.DRAFT, "Request has no public key");
        }
        requestedExtensions = requestedExtensions == null ? List.of() : Collections.unmodifiableList(
        new ArrayList<>(requestedExtensions));
    }

    /**
     * Decode a DER PKCS #10 request and check its proof of possession signature.
     */
    public static SigningRequest parse(byte[] pkcs10) {
        final PKCS10CertificationRequest request;
        try {
            request = new PKCS10CertificationRequest(pkcs10);
        } catch (IOException | RuntimeException e) {
            throw new CaException(Reason.INVALID_REQUEST, State.DRAFT, "Unable to decode certificate request", e);
        }
        return from(request);
    }

    /**
     * Accept a decoded PKCS #10 request once its proof of possession signature verifies.
     */
    public static SigningRequest from(PKCS10CertificationRequest request) {
        try {
            if (!request.isSignatureValid(
            new JcaContentVerifierProviderBuilder().setProvider(PROVIDER).build(request.getSubjectPublicKeyInfo()))) {
                throw new CaException(Reason.INVALID_REQUEST, State.DRAFT,
                                      "Request signature does not verify for: " + request.getSubject());
            }
        } catch (OperatorCreationException | PKCSException e) {
            throw new CaException(Reason.INVALID_REQUEST, State.DRAFT,
                                  "Unable to verify request signature for: " + request.getSubject(), e);
        }
        SigningRequest parsed = new SigningRequest(request.getSubject(), request.getSubjectPublicKeyInfo(),
                                                   requestedExtensions(request));
        log.info("Loaded request with subject: {} public key sha256: {}", parsed.subject(),
                 Fingerprints.publicKeyHash(parsed.publicKey()));
        return parsed;
    }

    private static List<Extension> requestedExtensions(PKCS10CertificationRequest request) {
        List<Extension> extensions = new ArrayList<>();
        for (Attribute attribute : request.getAttributes(PKCSObjectIdentifiers.pkcs_9_at_extensionRequest)) {
            for (ASN1Encodable value : attribute.getAttrValues()) {
                try {
                    Extensions requested = Extensions.getInstance(value);
                    for (ASN1ObjectIdentifier oid : requested.getExtensionOIDs()) {
                        extensions.add(requested.getExtension(oid));
                    }
                } catch (IllegalArgumentException e) {
                    log.debug("Ignoring malformed extension request of: {}", request.getSubject(), e);
                }
            }
        }
        return extensions;
    }

    /**
     * @return the first requested extension with the identifier, if any
     */
    public Optional<Extension> getExtension(ASN1ObjectIdentifier oid) {
        return requestedExtensions.stream().filter(e -> e.getExtnId().equals(oid)).findFirst();
    }
}
