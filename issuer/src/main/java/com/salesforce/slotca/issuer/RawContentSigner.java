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
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.RuntimeOperatorException;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;

/**
 * Adapts a {@link SignatureFormatter} and its {@link RawSigner} to Bouncy Castle's {@link ContentSigner}, so the
 * PKIX builders can be signed by a key the process never sees. Collects the content, then formats and signs it in
 * one shot. Failures surface as {@link RuntimeOperatorException} wrapping the signer's or formatter's exception.
 */
public class RawContentSigner implements ContentSigner {
    private final SignatureFormatter    formatter;
    private final ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
    private final RawSigner             signer;

    public RawContentSigner(SignatureFormatter formatter, RawSigner signer) {
        this.formatter = formatter;
        this.signer = signer;
    }

    @Override
    public AlgorithmIdentifier getAlgorithmIdentifier() {
        return formatter.getAlgorithmIdentifier();
    }

    @Override
    public OutputStream getOutputStream() {
        return outputStream;
    }

    @Override
    public byte[] getSignature() {
        try {
            return formatter.sign(outputStream.toByteArray(), signer);
        } catch (SignerException | SignatureFormatException e) {
            throw new RuntimeOperatorException("Unable to sign with: " + formatter, e);
        }
    }
}
