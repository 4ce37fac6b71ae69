/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier.crypto;

import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.List;

/**
 * A left-balanced binary Merkle tree over an ordered list of digests, hashed as described in
 * <a href="https://www.rfc-editor.org/rfc/rfc6962#section-2.1">RFC 6962 section 2.1</a>. The same construction backs
 * both the per-transaction entries tree and the binary linking tree over accumulated transaction hashes.
 */
public class MerkleTree {

  @VisibleForTesting
  static final byte LEAF_NODE_DOMAIN_INDICATOR = 0x00;
  @VisibleForTesting
  static final byte INTERMEDIATE_NODE_DOMAIN_INDICATOR = 0x01;

  private final List<Digest> leafHashes;

  private MerkleTree(final List<Digest> leafHashes) {
    this.leafHashes = leafHashes;
  }

  /**
   * Builds a tree whose leaves are the given digests.
   *
   * @param digests the leaf data, in log order; each is hashed with the leaf domain indicator
   */
  public static MerkleTree fromDigests(final List<Digest> digests) {
    return new MerkleTree(digests.stream().map(MerkleTree::leafHash).toList());
  }

  public static Digest leafHash(final Digest data) {
    return Digest.sha256(new byte[]{LEAF_NODE_DOMAIN_INDICATOR}, data.toByteArray());
  }

  public static Digest nodeHash(final Digest left, final Digest right) {
    return Digest.sha256(new byte[]{INTERMEDIATE_NODE_DOMAIN_INDICATOR}, left.toByteArray(), right.toByteArray());
  }

  public int size() {
    return leafHashes.size();
  }

  public Digest getRootHash() {
    if (leafHashes.isEmpty()) {
      throw new IllegalArgumentException("Cannot return root hash of an empty tree");
    }
    return subtreeHash(0, leafHashes.size());
  }

  /**
   * @param leafIndex the zero-based index of the leaf to prove
   * @return the audit path for the given leaf in this tree
   */
  public InclusionProof getInclusionProof(final int leafIndex) {
    if (leafIndex < 0 || leafIndex >= leafHashes.size()) {
      throw new IllegalArgumentException("Leaf index " + leafIndex + " out of range for tree of size " + size());
    }
    return new InclusionProof(leafIndex, leafHashes.size(), path(leafIndex, 0, leafHashes.size()));
  }

  /**
   * @param firstSize the size of an earlier version of this tree
   * @return the proof that the first {@code firstSize} leaves of this tree form a prefix of it
   */
  public List<Digest> getConsistencyProof(final int firstSize) {
    if (firstSize <= 0 || firstSize > leafHashes.size()) {
      throw new IllegalArgumentException("Cannot prove consistency from size " + firstSize + " to " + size());
    }
    return subproof(firstSize, 0, leafHashes.size(), true);
  }

  private List<Digest> path(final int leafIndex, final int start, final int end) {
    final int n = end - start;
    if (n == 1) {
      return new ArrayList<>();
    }

    final int k = largestPowerOfTwoLessThan(n);
    final List<Digest> path;
    if (leafIndex < k) {
      path = path(leafIndex, start, start + k);
      path.add(subtreeHash(start + k, end));
    } else {
      path = path(leafIndex - k, start + k, end);
      path.add(subtreeHash(start, start + k));
    }
    return path;
  }

  private List<Digest> subproof(final int m, final int start, final int end, final boolean completeSubtree) {
    final int n = end - start;
    if (m == n) {
      final List<Digest> proof = new ArrayList<>();
      if (!completeSubtree) {
        proof.add(subtreeHash(start, end));
      }
      return proof;
    }

    final int k = largestPowerOfTwoLessThan(n);
    final List<Digest> proof;
    if (m <= k) {
      proof = subproof(m, start, start + k, completeSubtree);
      proof.add(subtreeHash(start + k, end));
    } else {
      proof = subproof(m - k, start + k, end, false);
      proof.add(subtreeHash(start, start + k));
    }
    return proof;
  }

  private Digest subtreeHash(final int start, final int end) {
    final int n = end - start;
    if (n == 1) {
      return leafHashes.get(start);
    }
    final int k = largestPowerOfTwoLessThan(n);
    return nodeHash(subtreeHash(start, start + k), subtreeHash(start + k, end));
  }

  @VisibleForTesting
  static int largestPowerOfTwoLessThan(final int n) {
    if (n < 2) {
      throw new IllegalArgumentException("No power of two is less than " + n);
    }
    return Integer.highestOneBit(n - 1);
  }
}
