/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

/**
 * The reference through which a value was resolved.
 *
 * @param tx   the transaction that wrote the reference
 * @param key  the referring key
 * @param atTx the transaction at which the reference reads its target, or 0 for the latest value
 */
public record EntryReference(long tx, byte[] key, long atTx) {
}
