/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

import java.util.List;
import org.signal.ledger.verifier.crypto.Digest;
import org.signal.ledger.verifier.crypto.InclusionProof;
import org.signal.ledger.verifier.crypto.MerkleProofVerifier;
import org.signal.ledger.verifier.crypto.MerkleTree;

/**
 * Verifies that one ledger state is an append-only extension of another.
 * <p>
 * Every transaction header commits to the root of a binary linking tree whose leaves are the accumulated hashes of
 * earlier transactions. A dual proof combines structural checks over those trees with a linear hash chain over the
 * transactions committed after the target's linking tree was last extended.
 */
public final class DualProofVerifier {

  private DualProofVerifier() {
  }

  /**
   * @param proof      the proof returned by the ledger service
   * @param sourceTxId the ID of the earlier transaction
   * @param targetTxId the ID of the later transaction
   * @param sourceAlh  the accumulated hash the caller holds for the source transaction
   * @param targetAlh  the accumulated hash the caller holds for the target transaction
   * @return whether the proof connects the two states
   * @throws MalformedProofException if the proof is missing required fields
   */
  public static boolean verifyDual(final DualProof proof, final long sourceTxId, final long targetTxId,
      final Digest sourceAlh, final Digest targetAlh) throws MalformedProofException {

    final TxMetadata source = proof.sourceTxMetadata();
    final TxMetadata target = proof.targetTxMetadata();

    if (source == null || target == null) {
      throw new MalformedProofException("Dual proof is missing transaction metadata");
    }
    if (proof.linearProof() == null) {
      throw new MalformedProofException("Dual proof is missing its linear proof");
    }

    if (source.id() != sourceTxId || target.id() != targetTxId) {
      return false;
    }
    if (sourceTxId == 0 || sourceTxId > targetTxId) {
      return false;
    }
    if (!sourceAlh.equals(source.alh()) || !targetAlh.equals(target.alh())) {
      return false;
    }

    if (sourceTxId < target.blTxId()) {
      final InclusionProof sourceInclusion =
          new InclusionProof(sourceTxId - 1, target.blTxId(), proof.inclusionProof());
      if (!MerkleProofVerifier.verifyInclusion(sourceInclusion, MerkleTree.leafHash(sourceAlh), target.blRoot())) {
        return false;
      }
    }

    if (source.blTxId() > 0) {
      if (source.blTxId() > target.blTxId()) {
        return false;
      }
      if (!MerkleProofVerifier.verifyConsistency(proof.consistencyProof(), source.blTxId(), target.blTxId(),
          source.blRoot(), target.blRoot())) {
        return false;
      }
    }

    if (target.blTxId() > 0) {
      if (proof.targetBlTxAlh() == null) {
        throw new MalformedProofException("Dual proof is missing the last linked accumulated hash");
      }
      final InclusionProof lastInclusion =
          new InclusionProof(target.blTxId() - 1, target.blTxId(), proof.lastInclusionProof());
      if (!MerkleProofVerifier.verifyInclusion(lastInclusion, MerkleTree.leafHash(proof.targetBlTxAlh()),
          target.blRoot())) {
        return false;
      }
    }

    if (sourceTxId < target.blTxId()) {
      return verifyLinear(proof.linearProof(), target.blTxId(), targetTxId, proof.targetBlTxAlh(), targetAlh);
    }
    return verifyLinear(proof.linearProof(), sourceTxId, targetTxId, sourceAlh, targetAlh);
  }

  /**
   * Recomputes accumulated hashes from {@code sourceTxId} to {@code targetTxId}, one transaction at a time.
   */
  public static boolean verifyLinear(final LinearProof proof, final long sourceTxId, final long targetTxId,
      final Digest sourceAlh, final Digest targetAlh) {

    if (proof.sourceTxId() != sourceTxId || proof.targetTxId() != targetTxId) {
      return false;
    }
    if (sourceTxId == 0 || sourceTxId > targetTxId) {
      return false;
    }

    final List<Digest> terms = proof.terms();
    if (terms.isEmpty() || terms.size() != targetTxId - sourceTxId + 1 || !sourceAlh.equals(terms.get(0))) {
      return false;
    }

    Digest calculatedAlh = terms.get(0);
    for (int i = 1; i < terms.size(); i++) {
      calculatedAlh = TxMetadata.accumulate(sourceTxId + i, calculatedAlh, terms.get(i));
    }

    return targetAlh.equals(calculatedAlh);
  }
}
