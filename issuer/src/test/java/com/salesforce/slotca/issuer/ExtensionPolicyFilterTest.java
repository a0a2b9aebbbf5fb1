/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.issuer;

import com.salesforce.slotca.issuer.ext.CertExtension;
import com.salesforce.slotca.issuer.ext.ExtKeyUsageExtension;
import com.salesforce.slotca.issuer.ext.KeyUsageExtension;
import org.bouncycastle.asn1.DERUTF8String;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.security.KeyPairGenerator;
import java.security.spec.ECGenParameterSpec;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ExtensionPolicyFilterTest {
    private static SubjectPublicKeyInfo publicKey;

    private final ExtensionPolicyFilter filter = new ExtensionPolicyFilter(ExtensionPolicy.DEFAULT);

    @BeforeAll
    public static void key() throws Exception {
        KeyPairGenerator gen = KeyPairGenerator.getInstance("EC");
        gen.initialize(new ECGenParameterSpec("secp256r1"));
        publicKey = SubjectPublicKeyInfo.getInstance(gen.generateKeyPair().getPublic().getEncoded());
    }

    private static SigningRequest request(Extension... extensions) {
        return new SigningRequest(new X500Name("CN=signer, O=slot"), publicKey, List.of(extensions));
    }

    private static Extension eku(boolean critical, KeyPurposeId... purposes) throws Exception {
        return Extension.create(Extension.extendedKeyUsage, critical, new ExtendedKeyUsage(purposes));
    }

    private static Extension ku(int usage) throws Exception {
        return Extension.create(Extension.keyUsage, false, new KeyUsage(usage));
    }

    @Test
    public void keyUsageIsMaskedByPolicy() throws Exception {
        Optional<KeyUsageExtension> granted = filter.keyUsage(
        request(ku(KeyUsage.digitalSignature | KeyUsage.keyEncipherment)));
        assertTrue(granted.isPresent());
        assertEquals(KeyUsage.digitalSignature, granted.get().getMask());
        assertTrue(granted.get().isCritical());
    }

    @Test
    public void keyUsageWithinMaskIsKept() throws Exception {
        int requested = KeyUsage.digitalSignature | KeyUsage.dataEncipherment | KeyUsage.keyAgreement;
        assertEquals(requested, filter.keyUsage(request(ku(requested))).get().getMask());
    }

    @Test
    public void keyUsageMaskedToNothingIsStillGranted() throws Exception {
        var granted = filter.keyUsage(request(ku(KeyUsage.keyCertSign | KeyUsage.cRLSign)));
        assertTrue(granted.isPresent());
        assertEquals(0, granted.get().getMask());
    }

    @Test
    public void noKeyUsageRequested() {
        assertTrue(filter.keyUsage(request()).isEmpty());
    }

    @Test
    public void extendedKeyUsageKeepsRequestOrder() throws Exception {
        var granted = filter.extendedKeyUsage(
        request(eku(true, KeyPurposeId.id_kp_emailProtection, KeyPurposeId.id_kp_serverAuth,
                    KeyPurposeId.id_kp_codeSigning)));
        assertTrue(granted.isPresent());
        assertEquals(List.of(KeyPurposeId.id_kp_emailProtection, KeyPurposeId.id_kp_codeSigning),
                     granted.get().getUsages());
        assertTrue(granted.get().isCritical());
    }

    @Test
    public void extendedKeyUsageKeepsRequestedCriticality() throws Exception {
        var granted = filter.extendedKeyUsage(request(eku(false, KeyPurposeId.id_kp_codeSigning)));
        assertFalse(granted.get().isCritical());
    }

    @Test
    public void documentSigningIsAllowedByDefault() throws Exception {
        var documentSigning = KeyPurposeId.getInstance(ExtensionPolicy.DOCUMENT_SIGNING);
        var granted = filter.extendedKeyUsage(request(eku(false, documentSigning)));
        assertEquals(List.of(documentSigning), granted.get().getUsages());
    }

    @Test
    public void extendedKeyUsageWithNothingAllowedIsAbsent() throws Exception {
        assertTrue(filter.extendedKeyUsage(
        request(eku(false, KeyPurposeId.id_kp_serverAuth, KeyPurposeId.id_kp_clientAuth))).isEmpty());
        assertTrue(filter.extendedKeyUsage(request()).isEmpty());
    }

    @Test
    public void malformedRequestsAreIgnored() throws Exception {
        var request = request(Extension.create(Extension.keyUsage, false, new DERUTF8String("all of them")),
                              Extension.create(Extension.extendedKeyUsage, false, new DERUTF8String("any")));
        assertTrue(filter.keyUsage(request).isEmpty());
        assertTrue(filter.extendedKeyUsage(request).isEmpty());
        assertTrue(filter.filter(request).isEmpty());
    }

    @Test
    public void deniedExtendedKeyUsageIsDropped() throws Exception {
        var denying = new ExtensionPolicyFilter(ExtensionPolicy.newBuilder().deny(Extension.extendedKeyUsage).build());
        var request = request(eku(false, KeyPurposeId.id_kp_codeSigning), ku(KeyUsage.digitalSignature));
        assertTrue(denying.extendedKeyUsage(request).isEmpty());
        assertEquals(1, denying.filter(request).size());
    }

    @Test
    public void customMask() throws Exception {
        var policy = ExtensionPolicy.newBuilder()
                                    .setKeyUsageMask(KeyUsageExtension.KeyUsage.NON_REPUDIATION,
                                                     KeyUsageExtension.KeyUsage.DIGITAL_SIGNATURE)
                                    .build();
        var granted = new ExtensionPolicyFilter(policy).keyUsage(
        request(ku(KeyUsage.digitalSignature | KeyUsage.nonRepudiation | KeyUsage.keyAgreement)));
        assertEquals(KeyUsage.digitalSignature | KeyUsage.nonRepudiation, granted.get().getMask());
    }

    @Test
    public void filterGrantsKeyUsageThenExtendedKeyUsageOnly() throws Exception {
        var request = request(Extension.create(Extension.basicConstraints, true, new BasicConstraints(true)),
                              eku(false, KeyPurposeId.id_kp_codeSigning), ku(KeyUsage.digitalSignature),
                              Extension.create(Extension.subjectAlternativeName, false,
                                               new DERUTF8String("ignored")));
        List<CertExtension> granted = filter.filter(request);
        assertEquals(2, granted.size());
        assertInstanceOf(KeyUsageExtension.class, granted.get(0));
        assertInstanceOf(ExtKeyUsageExtension.class, granted.get(1));
    }
}
