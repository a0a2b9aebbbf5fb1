/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.cryptography;

import java.security.GeneralSecurityException;

/**
 * Raised when a to-be-signed message cannot be laid out for the raw private key operation of a signing key.
 */
public class SignatureFormatException extends GeneralSecurityException {
    private static final long serialVersionUID = 1L;

    public SignatureFormatException(String message) {
        super(message);
    }

    public SignatureFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
