/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

/**
 * Which value of a key to read. At most one of the selectors is non-zero.
 *
 * @param key        the key to read
 * @param atTx       read the value written by this transaction
 * @param sinceTx    read the latest value once the server has indexed at least this transaction
 * @param atRevision read this revision of the key; negative values count back from the latest
 */
public record EntryLookup(byte[] key, long atTx, long sinceTx, long atRevision) {

  public static EntryLookup latest(final byte[] key) {
    return new EntryLookup(key, 0, 0, 0);
  }

  public static EntryLookup atTx(final byte[] key, final long txId) {
    return new EntryLookup(key, txId, 0, 0);
  }

  public static EntryLookup sinceTx(final byte[] key, final long txId) {
    return new EntryLookup(key, 0, txId, 0);
  }

  public static EntryLookup atRevision(final byte[] key, final long revision) {
    return new EntryLookup(key, 0, 0, revision);
  }
}
