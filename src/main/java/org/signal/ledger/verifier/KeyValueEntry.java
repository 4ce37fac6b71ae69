/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

import io.micronaut.core.annotation.Nullable;

/**
 * A value as returned by the ledger service. It carries no digest; the client derives one from these fields.
 *
 * @param tx           the transaction that wrote the value
 * @param key          the key holding the value
 * @param value        the value
 * @param referencedBy the reference the value was read through, if the requested key was a reference
 * @param revision     the revision of the key
 */
public record KeyValueEntry(long tx, byte[] key, byte[] value, @Nullable EntryReference referencedBy, long revision) {
}
