/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.issuer;

import com.salesforce.slotca.cryptography.DigestAlgorithm;
import com.salesforce.slotca.cryptography.RawSigner;
import com.salesforce.slotca.cryptography.SignatureFormatException;
import com.salesforce.slotca.cryptography.SignatureFormatter;
import com.salesforce.slotca.cryptography.SignerException;
import com.salesforce.slotca.cryptography.SigningKeyHandle;
import com.salesforce.slotca.issuer.CaException.Reason;
import com.salesforce.slotca.issuer.CertificateDraft.State;
import com.salesforce.slotca.issuer.ext.CertExtension;
import com.salesforce.slotca.issuer.ext.KeyUsageExtension;
import com.salesforce.slotca.issuer.ext.KeyUsageExtension.KeyUsage;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.SubjectKeyIdentifier;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Issues certificates signed by a key the process never sees. The assembler encodes the certificate, hands the
 * formatted digest to the {@link RawSigner} and wraps the raw signature it returns. Holds no per issuance state, so
 * one instance may serve concurrent issuances; serializing access to the device is the signer's business.
 */
public class CertificateAssembler {
    private static final Logger log = LoggerFactory.getLogger(CertificateAssembler.class);

    private final ExtensionPolicyFilter   filter;
    private final AuthorityLinkageBuilder linkage;
    private final IssuanceParameters      parameters;
    private final RawSigner               signer;

    public CertificateAssembler(IssuanceParameters parameters, RawSigner signer) {
        this.parameters = parameters;
        this.signer = signer;
        this.filter = new ExtensionPolicyFilter(parameters.policy());
        this.linkage = new AuthorityLinkageBuilder(parameters);
    }

    /**
     * Create the self signed certificate of a CA whose key lives in the handle's slot.
     *
     * @param subject   the name of the CA
     * @param publicKey the public half of the slot's key
     * @param key       the slot's key
     */
    public IssuedCertificate createSelfSigned(X500Name subject, SubjectPublicKeyInfo publicKey, SigningKeyHandle key) {
        if (subject == null || subject.getRDNs().length == 0) {
            throw new CaException(Reason.INVALID_REQUEST, State.DRAFT, "CA subject is required");
        }
        if (publicKey == null) {
            throw new CaException(Reason.INVALID_REQUEST, State.DRAFT, "CA public key is required");
        }
        CertificateDraft draft = CertificateDraft.create(subject, subject, publicKey, parameters.clock().instant(),
                                                         parameters.caValidityDays(), parameters.entropy());
        log.info("Creating CA certificate: {} serial: {} key: {} public key sha256: {}", subject,
                 draft.getSerialNumber().toString(16), key, Fingerprints.publicKeyHash(publicKey));

        byte[] keyId = DigestAlgorithm.SHA2_256.hashOf(publicKey.getPublicKeyData().getBytes());
        List<CertExtension> extensions = new ArrayList<>();
        extensions.add(KeyUsageExtension.create(true, KeyUsage.KEY_CERT_SIGN, KeyUsage.CRL_SIGN,
                                                KeyUsage.DIGITAL_SIGNATURE));
        extensions.addAll(linkage.build(new IssuerContext(subject, keyId, draft.getSerialNumber())));
        extensions.add(new CertExtension(Extension.basicConstraints, true, new BasicConstraints(true)));
        extensions.add(new CertExtension(Extension.subjectKeyIdentifier, false, new SubjectKeyIdentifier(keyId)));
        return complete(draft, extensions, key);
    }

    public IssuanceParameters getParameters() {
        return parameters;
    }

    /**
     * Issue a certificate for the request, signed by the issuer's key.
     *
     * @param request the untrusted request; only the extensions the policy grants are carried over
     * @param issuer  the CA certificate's identity
     * @param key     the CA's key
     * @throws CaException if the certificate cannot be issued, carrying the reason and the stage it failed at
     */
    public IssuedCertificate issue(SigningRequest request, IssuerContext issuer, SigningKeyHandle key) {
        CertificateDraft draft = CertificateDraft.create(issuer.subject(), request.subject(), request.publicKey(),
                                                         parameters.clock().instant(), parameters.validityDays(),
                                                         parameters.entropy());
        log.info("Issuing certificate: {} serial: {} issuer: {} key: {}", request.subject(),
                 draft.getSerialNumber().toString(16), issuer.subject(), key);
        List<CertExtension> extensions;
        try {
            extensions = new ArrayList<>(filter.filter(request));
            extensions.addAll(linkage.build(issuer));
        } catch (CaException e) {
            throw abort(draft, e.getReason(), e);
        }
        return complete(draft, extensions, key);
    }

    private CaException abort(CertificateDraft draft, Reason reason, Throwable cause) {
        State stage = draft.getState();
        draft.abort();
        log.warn("Aborted certificate: {} serial: {} at: {} reason: {}: {}", draft.getSubject(),
                 draft.getSerialNumber().toString(16), stage, reason, cause.toString());
        return new CaException(reason, stage, "Unable to issue certificate for: " + draft.getSubject(), cause);
    }

    private IssuedCertificate complete(CertificateDraft draft, List<CertExtension> extensions, SigningKeyHandle key) {
        try {
            SignatureFormatter formatter = SignatureFormatter.forKey(key, parameters.digestAlgorithm(),
                                                                     parameters.rsaPadding(),
                                                                     parameters.pssSaltLength(),
                                                                     parameters.entropy());
            draft.applyExtensions(extensions);
            byte[] tbs = draft.encode(formatter.getAlgorithmIdentifier());
            draft.sign(formatter.sign(tbs, signer));
            IssuedCertificate issued = draft.finish();
            log.info("Issued certificate: {} serial: {} signed by: {} thumbprint: {}", draft.getSubject(),
                     draft.getSerialNumber().toString(16), formatter, issued.thumbprint());
            return issued;
        } catch (SignerException e) {
            throw abort(draft, Reason.of(e), e);
        } catch (SignatureFormatException e) {
            throw abort(draft, Reason.of(e), e);
        } catch (IOException | IllegalArgumentException e) {
            throw abort(draft, Reason.ENCODING_FAILURE, e);
        }
    }
}
