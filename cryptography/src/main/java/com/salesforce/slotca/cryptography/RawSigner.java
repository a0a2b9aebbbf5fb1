/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.cryptography;

/**
 * The external signing capability: apply the private key in a slot to an already formatted buffer.
 * <p>
 * Implementations talk to a device that may require a physical touch or a PIN, so a call may block for a human
 * timescale. There is no timeout here; cancellation, if any, is the device layer's business. Callers must not have
 * more than one signature in flight per device session.
 */
@FunctionalInterface
public interface RawSigner {

    /**
     * Perform the raw private key operation.
     *
     * @param handle    the key to use
     * @param formatted the exact buffer the key operation processes, as produced by a {@link SignatureScheme}
     * @return the raw signature bytes, used verbatim as the certificate's signature value
     * @throws SignerException if the device is unavailable, the user declined, or the device failed
     */
    byte[] sign(SigningKeyHandle handle, byte[] formatted) throws SignerException;
}
