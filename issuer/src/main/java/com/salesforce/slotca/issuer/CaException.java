/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.issuer;

import com.salesforce.slotca.cryptography.SignatureFormatException;
import com.salesforce.slotca.cryptography.SignerException;
import com.salesforce.slotca.cryptography.UnsupportedAlgorithmException;
import com.salesforce.slotca.cryptography.UnsupportedDigestException;
import com.salesforce.slotca.cryptography.UnsupportedKeySizeException;
import com.salesforce.slotca.issuer.CertificateDraft.State;

/**
 * Failure of an issuance. Carries why it failed and the state the draft was in, which separates configuration bugs
 * (unsupported algorithms) from request errors and from device or environment failures.
 */
public class CaException extends RuntimeException {
    private static final long serialVersionUID = -9188923051885159431L;

    private final Reason reason;
    private final State  stage;

    public CaException(Reason reason, State stage, String message) {
        super(message);
        this.reason = reason;
        this.stage = stage;
    }

    public CaException(Reason reason, State stage, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.stage = stage;
    }

    @Override
    public String getMessage() {
        return reason + " at " + stage + ": " + super.getMessage();
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * @return the state of the certificate draft when the failure occurred
     */
    public State getStage() {
        return stage;
    }

    public enum Reason {
        /** Malformed request, or missing subject or public key */
        INVALID_REQUEST,
        UNSUPPORTED_ALGORITHM,
        UNSUPPORTED_KEY_SIZE,
        UNSUPPORTED_DIGEST,
        /** Not raised: the extension policy filters rather than rejects */
        POLICY_VIOLATION,
        DEVICE_UNAVAILABLE,
        USER_DECLINED,
        DEVICE_ERROR,
        ENCODING_FAILURE;

        public static Reason of(SignerException e) {
            return switch (e.getFailure()) {
                case DEVICE_UNAVAILABLE -> DEVICE_UNAVAILABLE;
                case USER_DECLINED -> USER_DECLINED;
                case DEVICE_ERROR -> DEVICE_ERROR;
            };
        }

        public static Reason of(SignatureFormatException e) {
            if (e instanceof UnsupportedAlgorithmException) {
                return UNSUPPORTED_ALGORITHM;
            }
            if (e instanceof UnsupportedKeySizeException) {
                return UNSUPPORTED_KEY_SIZE;
            }
            if (e instanceof UnsupportedDigestException) {
                return UNSUPPORTED_DIGEST;
            }
            return ENCODING_FAILURE;
        }

        /**
         * @return true if the failure came from the signing device rather than from the request or configuration
         */
        public boolean isDeviceFailure() {
            return this == DEVICE_UNAVAILABLE || this == USER_DECLINED || this == DEVICE_ERROR;
        }
    }
}
