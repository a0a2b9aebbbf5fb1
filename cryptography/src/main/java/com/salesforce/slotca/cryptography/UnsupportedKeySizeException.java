/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.cryptography;

/**
 * The digest does not fit the key: a hash wider than an ECDSA curve's coordinate, or an RSA modulus too small for
 * the padded envelope.
 */
public class UnsupportedKeySizeException extends SignatureFormatException {
    private static final long serialVersionUID = 1L;

    public UnsupportedKeySizeException(String message) {
        super(message);
    }
}
