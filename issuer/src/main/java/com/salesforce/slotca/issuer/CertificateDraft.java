/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.issuer;

import com.salesforce.slotca.issuer.ext.CertExtension;
import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.ASN1EncodableVector;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.DERBitString;
import org.bouncycastle.asn1.DERSequence;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.asn1.x509.Certificate;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.Extensions;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.asn1.x509.TBSCertificate;
import org.bouncycastle.asn1.x509.Time;
import org.bouncycastle.asn1.x509.V3TBSCertificateGenerator;

import java.io.IOException;
import java.math.BigInteger;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The per issuance accumulator of a certificate. Subject, key, serial number and validity are fixed at creation;
 * the draft then moves forward through {@link State} one step at a time until it is finished or aborted. Not thread
 * safe, and never shared beyond a single issuance.
 */
public class CertificateDraft {
    public static final int SERIAL_NUMBER_BYTES = 16;

    private final X500Name             issuer;
    private final Instant              notAfter;
    private final Instant              notBefore;
    private final SubjectPublicKeyInfo publicKey;
    private final BigInteger           serialNumber;
    private final X500Name             subject;
    private       Certificate          certificate;
    private       List<CertExtension>  extensions = Collections.emptyList();
    private       AlgorithmIdentifier  signatureAlgorithm;
    private       State                state      = State.DRAFT;
    private       TBSCertificate       tbs;

    CertificateDraft(X500Name issuer, X500Name subject, SubjectPublicKeyInfo publicKey, BigInteger serialNumber,
                     Instant notBefore, Instant notAfter) {
        if (!notAfter.isAfter(notBefore)) {
            throw new IllegalArgumentException("Validity must end after it starts");
        }
        this.issuer = issuer;
        this.subject = subject;
        this.publicKey = publicKey;
        this.serialNumber = serialNumber;
        this.notBefore = notBefore;
        this.notAfter = notAfter;
    }

    /**
     * Start a draft valid from now, to the second, for the given number of days, with a fresh random serial number
     */
    public static CertificateDraft create(X500Name issuer, X500Name subject, SubjectPublicKeyInfo publicKey,
                                          Instant now, int validityDays, SecureRandom entropy) {
        Instant notBefore = now.truncatedTo(ChronoUnit.SECONDS);
        return new CertificateDraft(issuer, subject, publicKey, randomSerialNumber(entropy), notBefore,
                                    notBefore.plus(Duration.ofDays(validityDays)));
    }

    /**
     * @return a positive serial number drawn from {@value #SERIAL_NUMBER_BYTES} random bytes
     */
    public static BigInteger randomSerialNumber(SecureRandom entropy) {
        byte[] bytes = new byte[SERIAL_NUMBER_BYTES];
        BigInteger serial;
        do {
            entropy.nextBytes(bytes);
            serial = new BigInteger(1, bytes);
        } while (serial.signum() == 0);
        return serial;
    }

    /**
     * Discard everything derived after creation. Finalized drafts cannot be aborted.
     */
    public void abort() {
        if (state == State.FINALIZED) {
            throw new IllegalStateException("Cannot abort a finalized certificate");
        }
        state = State.ABORTED;
        extensions = Collections.emptyList();
        tbs = null;
        signatureAlgorithm = null;
        certificate = null;
    }

    public void applyExtensions(List<? extends CertExtension> extensions) {
        transition(State.DRAFT, State.EXTENSIONS_APPLIED);
        Set<ASN1ObjectIdentifier> seen = new HashSet<>();
        List<CertExtension> applied = new ArrayList<>(extensions.size());
        for (CertExtension extension : extensions) {
            if (!seen.add(extension.getOid())) {
                state = State.DRAFT;
                throw new IllegalArgumentException("Duplicate extension: " + extension.getOid());
            }
            applied.add(extension);
        }
        this.extensions = Collections.unmodifiableList(applied);
    }

    /**
     * @return the DER encoded TBSCertificate, exactly the bytes to be signed
     */
    public byte[] encode(AlgorithmIdentifier signatureAlgorithm) throws IOException {
        transition(State.EXTENSIONS_APPLIED, State.TBS_ENCODED);
        V3TBSCertificateGenerator generator = new V3TBSCertificateGenerator();
        generator.setSerialNumber(new ASN1Integer(serialNumber));
        generator.setSignature(signatureAlgorithm);
        generator.setIssuer(issuer);
        generator.setStartDate(new Time(Date.from(notBefore)));
        generator.setEndDate(new Time(Date.from(notAfter)));
        generator.setSubject(subject);
        generator.setSubjectPublicKeyInfo(publicKey);
        if (!extensions.isEmpty()) {
            generator.setExtensions(
            new Extensions(extensions.stream().map(CertExtension::toExtension).toArray(Extension[]::new)));
        }
        this.signatureAlgorithm = signatureAlgorithm;
        this.tbs = generator.generateTBSCertificate();
        return tbs.getEncoded(ASN1Encoding.DER);
    }

    /**
     * Finalize the signed certificate. The draft stays signed if the certificate cannot be parsed back.
     */
    public IssuedCertificate finish() throws IOException {
        if (state != State.SIGNED) {
            throw new IllegalStateException("Expected draft in " + State.SIGNED + " but was " + state);
        }
        IssuedCertificate issued = new IssuedCertificate(certificate);
        state = State.FINALIZED;
        return issued;
    }

    public List<CertExtension> getExtensions() {
        return extensions;
    }

    public X500Name getIssuer() {
        return issuer;
    }

    public Instant getNotAfter() {
        return notAfter;
    }

    public Instant getNotBefore() {
        return notBefore;
    }

    public SubjectPublicKeyInfo getPublicKey() {
        return publicKey;
    }

    public BigInteger getSerialNumber() {
        return serialNumber;
    }

    public State getState() {
        return state;
    }

    public X500Name getSubject() {
        return subject;
    }

    /**
     * Wrap the TBS, the signature algorithm and the raw signature into the certificate
     */
    public void sign(byte[] signature) {
        transition(State.TBS_ENCODED, State.SIGNED);
        ASN1EncodableVector v = new ASN1EncodableVector(3);
        v.add(tbs);
        v.add(signatureAlgorithm);
        v.add(new DERBitString(signature));
        certificate = Certificate.getInstance(new DERSequence(v));
    }

    @Override
    public String toString() {
        return "CertificateDraft[" + subject + ", serial: " + serialNumber.toString(16) + ", " + state + "]";
    }

    private void transition(State from, State to) {
        if (state != from) {
            throw new IllegalStateException("Expected draft in " + from + " but was " + state);
        }
        state = to;
    }

    public enum State {
        DRAFT, EXTENSIONS_APPLIED, TBS_ENCODED, SIGNED, FINALIZED, ABORTED
    }
}
