/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier.crypto;

import java.util.List;
import org.signal.ledger.verifier.MalformedProofException;

/**
 * Verifies inclusion and consistency proofs for trees built by {@link MerkleTree}, following the algorithms in
 * <a href="https://www.rfc-editor.org/rfc/rfc9162#section-2.1.3.2">RFC 9162 section 2.1.3.2</a> and
 * <a href="https://www.rfc-editor.org/rfc/rfc9162#section-2.1.4.2">section 2.1.4.2</a>.
 */
public final class MerkleProofVerifier {

  private MerkleProofVerifier() {
  }

  /**
   * Recomputes the root implied by {@code proof} and compares it to {@code expectedRoot}.
   *
   * @param proof        the audit path and the leaf's position
   * @param leafHash     the hash of the leaf node, i.e. {@link MerkleTree#leafHash(Digest)} of the leaf data
   * @param expectedRoot the root the leaf is claimed to belong to
   * @return whether the recomputed root matches {@code expectedRoot}
   * @throws MalformedProofException if the leaf position is not inside the tree
   */
  public static boolean verifyInclusion(final InclusionProof proof, final Digest leafHash, final Digest expectedRoot)
      throws MalformedProofException {

    if (proof.treeSize() <= 0 || proof.leafIndex() < 0 || proof.leafIndex() >= proof.treeSize()) {
      throw new MalformedProofException(
          "Leaf index " + proof.leafIndex() + " is outside a tree of size " + proof.treeSize());
    }

    long fn = proof.leafIndex();
    long sn = proof.treeSize() - 1;
    Digest r = leafHash;

    for (final Digest p : proof.auditPath()) {
      if (sn == 0) {
        return false;
      }
      if ((fn & 1) == 1 || fn == sn) {
        r = MerkleTree.nodeHash(p, r);
        while ((fn & 1) == 0 && fn != 0) {
          fn >>= 1;
          sn >>= 1;
        }
      } else {
        r = MerkleTree.nodeHash(r, p);
      }
      fn >>= 1;
      sn >>= 1;
    }

    return sn == 0 && r.equals(expectedRoot);
  }

  /**
   * Checks that the tree of {@code secondSize} leaves with root {@code secondRoot} is an append-only extension of the
   * tree of {@code firstSize} leaves with root {@code firstRoot}.
   *
   * @throws MalformedProofException if {@code firstSize} is not in {@code [1, secondSize]}
   */
  public static boolean verifyConsistency(final List<Digest> proof, final long firstSize, final long secondSize,
      final Digest firstRoot, final Digest secondRoot) throws MalformedProofException {

    if (firstSize <= 0 || firstSize > secondSize) {
      throw new MalformedProofException("Cannot prove consistency from size " + firstSize + " to " + secondSize);
    }

    if (firstSize == secondSize) {
      return proof.isEmpty() && firstRoot.equals(secondRoot);
    }

    if (proof.isEmpty()) {
      return false;
    }

    final boolean firstSizeIsPowerOfTwo = (firstSize & (firstSize - 1)) == 0;
    int next = 0;
    final Digest seed;
    if (firstSizeIsPowerOfTwo) {
      seed = firstRoot;
    } else {
      seed = proof.get(next++);
    }

    long fn = firstSize - 1;
    long sn = secondSize - 1;
    while ((fn & 1) == 1) {
      fn >>= 1;
      sn >>= 1;
    }

    Digest fr = seed;
    Digest sr = seed;

    for (; next < proof.size(); next++) {
      final Digest c = proof.get(next);
      if (sn == 0) {
        return false;
      }
      if ((fn & 1) == 1 || fn == sn) {
        fr = MerkleTree.nodeHash(c, fr);
        sr = MerkleTree.nodeHash(c, sr);
        while ((fn & 1) == 0 && fn != 0) {
          fn >>= 1;
          sn >>= 1;
        }
      } else {
        sr = MerkleTree.nodeHash(sr, c);
      }
      fn >>= 1;
      sn >>= 1;
    }

    return sn == 0 && fr.equals(firstRoot) && sr.equals(secondRoot);
  }
}
