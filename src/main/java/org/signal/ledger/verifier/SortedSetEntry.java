/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

/**
 * Membership of a key in a sorted set.
 *
 * @param set   the name of the sorted set
 * @param score the member's score
 * @param key   the member key
 * @param atTx  the transaction at which the member key is read, or 0 for its latest value
 */
public record SortedSetEntry(byte[] set, double score, byte[] key, long atTx) implements LedgerEntry {

  @Override
  public EncodedEntry encode() {
    return EncodedEntry.encodeSortedSetMember(set, score, key, atTx);
  }
}
