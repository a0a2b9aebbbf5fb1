/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.slotca.cryptography;

/**
 * The private key families an external signer may hold.
 */
public enum KeyAlgorithm {
    RSA, ECDSA;
}
