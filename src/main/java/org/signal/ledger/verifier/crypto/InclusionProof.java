/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier.crypto;

import java.util.List;

/**
 * An audit path proving that the leaf at {@code leafIndex} belongs to a Merkle tree of {@code treeSize} leaves.
 *
 * @param leafIndex the zero-based index of the leaf
 * @param treeSize  the number of leaves in the tree
 * @param auditPath the sibling hashes from the leaf up to the root
 */
public record InclusionProof(long leafIndex, long treeSize, List<Digest> auditPath) {

  public InclusionProof {
    auditPath = List.copyOf(auditPath);
  }
}
