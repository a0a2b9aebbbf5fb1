/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.issuer;

import com.salesforce.slotca.cryptography.RawSigner;
import com.salesforce.slotca.cryptography.SignatureFormatException;
import com.salesforce.slotca.cryptography.SignatureFormatter;
import com.salesforce.slotca.cryptography.SignerException;
import com.salesforce.slotca.cryptography.SigningKeyHandle;
import com.salesforce.slotca.issuer.CaException.Reason;
import com.salesforce.slotca.issuer.CertificateDraft.State;
import com.salesforce.slotca.issuer.ext.ExtKeyUsageExtension;
import com.salesforce.slotca.issuer.ext.KeyUsageExtension;
import com.salesforce.slotca.issuer.ext.KeyUsageExtension.KeyUsage;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.Extensions;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.operator.RuntimeOperatorException;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.bouncycastle.pkcs.PKCS10CertificationRequestBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Creates PKCS #10 requests for signing certificates, signed through a {@link RawSigner} with the digest and RSA
 * padding of the {@link IssuanceParameters}. The request asks for a non critical digitalSignature key usage and a
 * non critical extended key usage naming the one purpose of the {@link Usage}.
 */
public class CsrBuilder {
    private static final Logger log = LoggerFactory.getLogger(CsrBuilder.class);

    private final IssuanceParameters parameters;
    private final RawSigner          signer;

    public CsrBuilder(IssuanceParameters parameters, RawSigner signer) {
        this.parameters = parameters;
        this.signer = signer;
    }

    private static Reason reasonOf(Throwable cause) {
        if (cause instanceof SignerException e) {
            return Reason.of(e);
        }
        if (cause instanceof SignatureFormatException e) {
            return Reason.of(e);
        }
        return Reason.ENCODING_FAILURE;
    }

    /**
     * @param usage     what the requested certificate is for
     * @param subject   the requester's name
     * @param publicKey the public half of the key in the handle's slot
     * @param key       the key that proves possession by signing the request
     * @throws CaException if the request cannot be created; signing failures are reported at
     *                     {@link State#TBS_ENCODED}
     */
    public PKCS10CertificationRequest build(Usage usage, X500Name subject, SubjectPublicKeyInfo publicKey,
                                            SigningKeyHandle key) {
        if (subject == null || subject.getRDNs().length == 0) {
            throw new CaException(Reason.INVALID_REQUEST, State.DRAFT, "Request subject is required");
        }
        if (publicKey == null) {
            throw new CaException(Reason.INVALID_REQUEST, State.DRAFT, "Request public key is required");
        }
        final SignatureFormatter formatter;
        try {
            formatter = SignatureFormatter.forKey(key, parameters.digestAlgorithm(), parameters.rsaPadding(),
                                                  parameters.pssSaltLength(), parameters.entropy());
        } catch (SignatureFormatException e) {
            throw new CaException(Reason.of(e), State.DRAFT, "Unable to create request for: " + subject, e);
        }
        log.info("Creating {} request: {} key: {} public key sha256: {}", usage, subject, key,
                 Fingerprints.publicKeyHash(publicKey));

        Extensions extensions = new Extensions(
        new Extension[] { KeyUsageExtension.create(false, KeyUsage.DIGITAL_SIGNATURE).toExtension(),
                          ExtKeyUsageExtension.create(List.of(usage.getPurpose()), false).toExtension() });
        try {
            PKCS10CertificationRequest request = new PKCS10CertificationRequestBuilder(subject, publicKey)
            .addAttribute(PKCSObjectIdentifiers.pkcs_9_at_extensionRequest, extensions)
            .build(new RawContentSigner(formatter, signer));
            log.info("Created {} request: {} signed by: {}", usage, subject, formatter);
            return request;
        } catch (RuntimeOperatorException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            Reason reason = reasonOf(cause);
            log.warn("Unable to create request: {} reason: {}: {}", subject, reason, cause.toString());
            throw new CaException(reason, State.TBS_ENCODED, "Unable to create request for: " + subject, cause);
        }
    }

    public IssuanceParameters getParameters() {
        return parameters;
    }

    public enum Usage {
        CODE_SIGNING(KeyPurposeId.id_kp_codeSigning),
        DOCUMENT_SIGNING(KeyPurposeId.getInstance(ExtensionPolicy.DOCUMENT_SIGNING));

        private final KeyPurposeId purpose;

        Usage(KeyPurposeId purpose) {
            this.purpose = purpose;
        }

        /**
         * Accepts "codesign" or "code" and "docsign" or "doc", case insensitively and ignoring dashes.
         *
         * @throws IllegalArgumentException for any other name
         */
        public static Usage parse(String name) {
            if (name == null) {
                throw new IllegalArgumentException("No request usage named");
            }
            return switch (name.toLowerCase(Locale.ROOT).replace("-", "")) {
                case "code", "codesign" -> CODE_SIGNING;
                case "doc", "docsign" -> DOCUMENT_SIGNING;
                default -> throw new IllegalArgumentException("Unknown request usage: '" + name + "'");
            };
        }

        public KeyPurposeId getPurpose() {
            return purpose;
        }
    }
}
