/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

import java.util.HexFormat;
import org.signal.ledger.verifier.crypto.Digest;

/**
 * An entry as listed in a transaction: its encoded key and the hash of its encoded value.
 */
public record TxEntry(byte[] encodedKey, Digest valueHash) {

  public Digest digest(final int version) {
    return EncodedEntry.digest(version, encodedKey, valueHash);
  }

  @Override
  public String toString() {
    return "TxEntry{" +
        "encodedKey=" + HexFormat.of().formatHex(encodedKey) +
        ", valueHash=" + valueHash +
        '}';
  }
}
