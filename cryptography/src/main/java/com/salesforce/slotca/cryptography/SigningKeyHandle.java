/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.cryptography;

/**
 * Opaque reference to a private key held by an external signer. Carries only what is needed to lay out a message
 * for the key's raw operation, never key material.
 *
 * @param algorithm   the key family
 * @param keySizeBits the RSA modulus length, or the EC curve's field size
 * @param slot        the signer's identifier of the key slot
 */
public record SigningKeyHandle(KeyAlgorithm algorithm, int keySizeBits, int slot) {

    public SigningKeyHandle {
        if (algorithm == null) {
            throw new IllegalArgumentException("Key algorithm must be supplied");
        }
        if (keySizeBits <= 0) {
            throw new IllegalArgumentException("Invalid key size: " + keySizeBits);
        }
    }

    /**
     * @return the length in bytes of the buffer the raw operation consumes
     */
    public int keySizeBytes() {
        return (keySizeBits + 7) / 8;
    }

    @Override
    public String toString() {
        return String.format("%s-%d@%02x", algorithm, keySizeBits, slot);
    }
}
