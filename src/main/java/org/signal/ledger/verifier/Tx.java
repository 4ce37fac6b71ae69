/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.signal.ledger.verifier.crypto.InclusionProof;
import org.signal.ledger.verifier.crypto.MerkleTree;

/**
 * A transaction header together with the entries it committed, in commit order.
 */
public record Tx(TxMetadata metadata, List<TxEntry> entries) {

  public Tx {
    entries = List.copyOf(entries);
  }

  public MerkleTree entriesTree() {
    return MerkleTree.fromDigests(entries.stream().map(entry -> entry.digest(metadata.version())).toList());
  }

  /**
   * @param encodedKey the encoded key of an entry in this transaction
   * @return an inclusion proof for that entry in the entries tree, or empty if the transaction has no such entry
   */
  public Optional<InclusionProof> inclusionProof(final byte[] encodedKey) {
    for (int i = 0; i < entries.size(); i++) {
      if (Arrays.equals(entries.get(i).encodedKey(), encodedKey)) {
        return Optional.of(entriesTree().getInclusionProof(i));
      }
    }
    return Optional.empty();
  }
}
