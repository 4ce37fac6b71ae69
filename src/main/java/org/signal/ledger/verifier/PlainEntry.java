/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

/**
 * A key bound to a value.
 */
public record PlainEntry(byte[] key, byte[] value) implements LedgerEntry {

  @Override
  public EncodedEntry encode() {
    return EncodedEntry.encodePlain(key, value);
  }
}
