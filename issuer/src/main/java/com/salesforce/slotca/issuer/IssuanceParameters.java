/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.issuer;

import com.salesforce.slotca.cryptography.DigestAlgorithm;
import com.salesforce.slotca.cryptography.SignatureScheme;
import com.salesforce.slotca.cryptography.UnsupportedDigestException;
import com.salesforce.slotca.issuer.CaException.Reason;
import com.salesforce.slotca.issuer.CertificateDraft.State;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of a {@link CertificateAssembler}.
 *
 * @param policy              what requesters may be granted
 * @param authorityAccessUrl  where the issuing certificate can be fetched, or null for no AIA
 * @param crlDistributionUrl  where revocation lists are published, or null for no CRL distribution point
 * @param certificatePolicies policy identifiers asserted by issued certificates, possibly empty
 * @param validityDays        lifetime of issued certificates
 * @param caValidityDays      lifetime of self signed CA certificates
 * @param digestAlgorithm     hash of the certificate signature
 * @param rsaPadding          the scheme used when the signing key is RSA
 * @param pssSaltLength       PSS salt length in bytes, or {@link SignatureScheme#DIGEST_LENGTH_SALT}
 * @param clock               source of the validity window's start
 * @param entropy             source of serial numbers and PSS salts
 */
public record IssuanceParameters(ExtensionPolicy policy, String authorityAccessUrl, String crlDistributionUrl,
                                 List<ASN1ObjectIdentifier> certificatePolicies, int validityDays,
                                 int caValidityDays, DigestAlgorithm digestAlgorithm, SignatureScheme rsaPadding,
                                 int pssSaltLength, Clock clock, SecureRandom entropy) {

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private String                     authorityAccessUrl;
        private int                        caValidityDays      = 365;
        private List<ASN1ObjectIdentifier> certificatePolicies = new ArrayList<>();
        private Clock                      clock               = Clock.systemUTC();
        private String                     crlDistributionUrl;
        private DigestAlgorithm            digestAlgorithm     = DigestAlgorithm.DEFAULT;
        private SecureRandom               entropy;
        private ExtensionPolicy            policy              = ExtensionPolicy.DEFAULT;
        private int                        pssSaltLength       = SignatureScheme.DIGEST_LENGTH_SALT;
        private SignatureScheme            rsaPadding          = SignatureScheme.RSA_PSS;
        private int                        validityDays        = 30;

        public IssuanceParameters build() {
            if (validityDays <= 0 || caValidityDays <= 0) {
                throw new IllegalArgumentException("Validity must be at least one day");
            }
            return new IssuanceParameters(policy, authorityAccessUrl, crlDistributionUrl,
                                          List.copyOf(certificatePolicies), validityDays, caValidityDays,
                                          digestAlgorithm, rsaPadding, pssSaltLength, clock,
                                          entropy == null ? new SecureRandom() : entropy);
        }

        public String getAuthorityAccessUrl() {
            return authorityAccessUrl;
        }

        public Builder setAuthorityAccessUrl(String authorityAccessUrl) {
            this.authorityAccessUrl = authorityAccessUrl;
            return this;
        }

        public int getCaValidityDays() {
            return caValidityDays;
        }

        public Builder setCaValidityDays(int caValidityDays) {
            this.caValidityDays = caValidityDays;
            return this;
        }

        public List<ASN1ObjectIdentifier> getCertificatePolicies() {
            return certificatePolicies;
        }

        public Builder setCertificatePolicies(List<ASN1ObjectIdentifier> certificatePolicies) {
            this.certificatePolicies = new ArrayList<>(certificatePolicies);
            return this;
        }

        public Clock getClock() {
            return clock;
        }

        public Builder setClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public String getCrlDistributionUrl() {
            return crlDistributionUrl;
        }

        public Builder setCrlDistributionUrl(String crlDistributionUrl) {
            this.crlDistributionUrl = crlDistributionUrl;
            return this;
        }

        public DigestAlgorithm getDigestAlgorithm() {
            return digestAlgorithm;
        }

        public Builder setDigestAlgorithm(DigestAlgorithm digestAlgorithm) {
            this.digestAlgorithm = digestAlgorithm;
            return this;
        }

        /**
         * Select the digest by a configured name such as "SHA-256"
         *
         * @throws CaException with {@link Reason#UNSUPPORTED_DIGEST} if no supported digest has the name
         */
        public Builder setDigestAlgorithm(String name) {
            try {
                return setDigestAlgorithm(DigestAlgorithm.lookup(name));
            } catch (UnsupportedDigestException e) {
                throw new CaException(Reason.UNSUPPORTED_DIGEST, State.DRAFT, e.getMessage(), e);
            }
        }

        public SecureRandom getEntropy() {
            return entropy;
        }

        public Builder setEntropy(SecureRandom entropy) {
            this.entropy = entropy;
            return this;
        }

        public ExtensionPolicy getPolicy() {
            return policy;
        }

        public Builder setPolicy(ExtensionPolicy policy) {
            this.policy = policy;
            return this;
        }

        public int getPssSaltLength() {
            return pssSaltLength;
        }

        public Builder setPssSaltLength(int pssSaltLength) {
            this.pssSaltLength = pssSaltLength;
            return this;
        }

        public SignatureScheme getRsaPadding() {
            return rsaPadding;
        }

        public Builder setRsaPadding(SignatureScheme rsaPadding) {
            this.rsaPadding = rsaPadding;
            return this;
        }

        public int getValidityDays() {
            return validityDays;
        }

        public Builder setValidityDays(int validityDays) {
            this.validityDays = validityDays;
            return this;
        }
    }
}
