/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.cryptography;

/**
 * The named hash algorithm is not one the formatter can encode.
 */
public class UnsupportedDigestException extends SignatureFormatException {
    private static final long serialVersionUID = 1L;

    public UnsupportedDigestException(String message) {
        super(message);
    }
}
