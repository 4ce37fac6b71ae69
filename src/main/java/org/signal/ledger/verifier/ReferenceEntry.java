/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

/**
 * A key that aliases another key's value.
 *
 * @param referringKey the alias
 * @param referredKey  the key whose value the alias resolves to
 * @param referredTxId the transaction at which the referred key is read, or 0 for its latest value
 */
public record ReferenceEntry(byte[] referringKey, byte[] referredKey, long referredTxId) implements LedgerEntry {

  @Override
  public EncodedEntry encode() {
    return EncodedEntry.encodeReference(referringKey, referredKey, referredTxId);
  }
}
