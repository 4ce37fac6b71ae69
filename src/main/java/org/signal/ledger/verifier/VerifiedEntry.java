/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

import io.micronaut.core.annotation.Nullable;

/**
 * A value whose inclusion in the ledger has been verified against the client's trusted state.
 *
 * @param key           the key holding the value
 * @param value         the value
 * @param txId          the transaction that wrote the value, or the reference if it was read through one
 * @param timestamp     the commit time of that transaction
 * @param revision      the revision of the key
 * @param referencedKey the requested key if it was a reference to {@code key}
 * @param verified      always {@code true}; failed verifications throw instead of returning
 */
public record VerifiedEntry(byte[] key, byte[] value, long txId, long timestamp, long revision,
                            @Nullable byte[] referencedKey, boolean verified) {
}
