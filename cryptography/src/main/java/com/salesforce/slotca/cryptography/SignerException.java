/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.cryptography;

import java.security.GeneralSecurityException;

/**
 * Failure reported by a {@link RawSigner}. These are surfaced to the caller verbatim and never retried here.
 */
public class SignerException extends GeneralSecurityException {
    private static final long serialVersionUID = 1L;
    private final        Failure failure;

    public SignerException(Failure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public SignerException(Failure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public Failure getFailure() {
        return failure;
    }

    public enum Failure {
        /** No device, or no key in the requested slot */
        DEVICE_UNAVAILABLE,
        /** Touch or PIN confirmation was refused */
        USER_DECLINED,
        DEVICE_ERROR;
    }
}
