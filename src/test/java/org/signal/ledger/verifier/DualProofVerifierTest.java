/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.signal.ledger.verifier.crypto.Digest;
import org.signal.ledger.verifier.util.TestLedger;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.signal.ledger.verifier.util.Util.bytes;

class DualProofVerifierTest {

  private static final int TX_COUNT = 12;

  private TestLedger ledger;

  @BeforeEach
  void setUp() {
    ledger = new TestLedger("defaultdb");
    commitTransactions(ledger);
  }

  @ParameterizedTest
  @CsvSource({
      "0, 0",
      "1, 0",
      "0, 3",
      "1, 3",
      "1, 11"
  })
  void verifyDualForEveryPair(final int version, final int linkingLag) throws MalformedProofException {
    final TestLedger ledger = new TestLedger("defaultdb", version, linkingLag, null);
    commitTransactions(ledger);

    for (long source = 1; source <= TX_COUNT; source++) {
      for (long target = source; target <= TX_COUNT; target++) {
        assertTrue(DualProofVerifier.verifyDual(ledger.dualProof(source, target), source, target,
            ledger.alh(source), ledger.alh(target)), source + " -> " + target);
      }
    }
  }

  @Test
  void verifyDualSwappedRoots() throws MalformedProofException {
    final DualProof proof = ledger.dualProof(3, 9);

    assertFalse(DualProofVerifier.verifyDual(proof, 3, 9, ledger.alh(9), ledger.alh(3)));
    assertFalse(DualProofVerifier.verifyDual(proof, 3, 9, ledger.alh(4), ledger.alh(9)));
    assertFalse(DualProofVerifier.verifyDual(proof, 3, 9, ledger.alh(3), ledger.alh(8)));
  }

  @Test
  void verifyDualWrongTransactionIds() throws MalformedProofException {
    final DualProof proof = ledger.dualProof(3, 9);

    assertFalse(DualProofVerifier.verifyDual(proof, 4, 9, ledger.alh(3), ledger.alh(9)));
    assertFalse(DualProofVerifier.verifyDual(proof, 3, 10, ledger.alh(3), ledger.alh(9)));
  }

  @Test
  void verifyDualSourceAfterTarget() throws MalformedProofException {
    final DualProof proof = ledger.dualProof(3, 9);
    final DualProof reversed = new DualProof(proof.targetTxMetadata(), proof.sourceTxMetadata(),
        proof.inclusionProof(), proof.consistencyProof(), proof.targetBlTxAlh(), proof.lastInclusionProof(),
        proof.linearProof());

    assertFalse(DualProofVerifier.verifyDual(reversed, 9, 3, ledger.alh(9), ledger.alh(3)));
  }

  @Test
  void verifyDualTamperedTargetHeader() throws MalformedProofException {
    final DualProof proof = ledger.dualProof(3, 9);
    final TxMetadata target = proof.targetTxMetadata();
    final TxMetadata tampered = new TxMetadata(target.id(), target.prevAlh(), target.timestamp(), target.version(),
        target.entryCount(), Digest.ZERO, target.blTxId(), target.blRoot());

    final DualProof tamperedProof = new DualProof(proof.sourceTxMetadata(), tampered, proof.inclusionProof(),
        proof.consistencyProof(), proof.targetBlTxAlh(), proof.lastInclusionProof(), proof.linearProof());

    // the caller's alh no longer matches the header
    assertFalse(DualProofVerifier.verifyDual(tamperedProof, 3, 9, ledger.alh(3), ledger.alh(9)));

    // and a header that matches a forged alh does not match the linear proof
    assertFalse(DualProofVerifier.verifyDual(tamperedProof, 3, 9, ledger.alh(3), tampered.alh()));
  }

  @Test
  void verifyDualTamperedLinkingProofs() throws MalformedProofException {
    final DualProof proof = ledger.dualProof(3, 9);
    assertFalse(proof.inclusionProof().isEmpty());
    assertFalse(proof.consistencyProof().isEmpty());

    final DualProof badInclusion = new DualProof(proof.sourceTxMetadata(), proof.targetTxMetadata(),
        flipFirst(proof.inclusionProof()), proof.consistencyProof(), proof.targetBlTxAlh(),
        proof.lastInclusionProof(), proof.linearProof());
    assertFalse(DualProofVerifier.verifyDual(badInclusion, 3, 9, ledger.alh(3), ledger.alh(9)));

    final DualProof badConsistency = new DualProof(proof.sourceTxMetadata(), proof.targetTxMetadata(),
        proof.inclusionProof(), flipFirst(proof.consistencyProof()), proof.targetBlTxAlh(),
        proof.lastInclusionProof(), proof.linearProof());
    assertFalse(DualProofVerifier.verifyDual(badConsistency, 3, 9, ledger.alh(3), ledger.alh(9)));

    final DualProof badLastInclusion = new DualProof(proof.sourceTxMetadata(), proof.targetTxMetadata(),
        proof.inclusionProof(), proof.consistencyProof(), ledger.alh(7), proof.lastInclusionProof(),
        proof.linearProof());
    assertFalse(DualProofVerifier.verifyDual(badLastInclusion, 3, 9, ledger.alh(3), ledger.alh(9)));
  }

  @Test
  void verifyDualTruncatedLinearProof() throws MalformedProofException {
    final TestLedger laggingLedger = new TestLedger("defaultdb", 1, 4, null);
    commitTransactions(laggingLedger);

    final DualProof proof = laggingLedger.dualProof(2, 10);
    final LinearProof linearProof = proof.linearProof();
    assertTrue(linearProof.terms().size() > 2);

    final LinearProof truncated = new LinearProof(linearProof.sourceTxId(), linearProof.targetTxId(),
        linearProof.terms().subList(0, linearProof.terms().size() - 1));

    assertFalse(DualProofVerifier.verifyDual(
        new DualProof(proof.sourceTxMetadata(), proof.targetTxMetadata(), proof.inclusionProof(),
            proof.consistencyProof(), proof.targetBlTxAlh(), proof.lastInclusionProof(), truncated),
        2, 10, laggingLedger.alh(2), laggingLedger.alh(10)));
  }

  @Test
  void verifyDualMissingFields() {
    final DualProof proof = ledger.dualProof(3, 9);

    assertThrows(MalformedProofException.class, () -> DualProofVerifier.verifyDual(
        new DualProof(null, proof.targetTxMetadata(), proof.inclusionProof(), proof.consistencyProof(),
            proof.targetBlTxAlh(), proof.lastInclusionProof(), proof.linearProof()),
        3, 9, ledger.alh(3), ledger.alh(9)));

    assertThrows(MalformedProofException.class, () -> DualProofVerifier.verifyDual(
        new DualProof(proof.sourceTxMetadata(), proof.targetTxMetadata(), proof.inclusionProof(),
            proof.consistencyProof(), proof.targetBlTxAlh(), proof.lastInclusionProof(), null),
        3, 9, ledger.alh(3), ledger.alh(9)));

    assertThrows(MalformedProofException.class, () -> DualProofVerifier.verifyDual(
        new DualProof(proof.sourceTxMetadata(), proof.targetTxMetadata(), proof.inclusionProof(),
            proof.consistencyProof(), null, proof.lastInclusionProof(), proof.linearProof()),
        3, 9, ledger.alh(3), ledger.alh(9)));
  }

  @Test
  void verifyLinear() {
    final LinearProof proof = ledger.linearProof(4, 8);

    assertTrue(DualProofVerifier.verifyLinear(proof, 4, 8, ledger.alh(4), ledger.alh(8)));
    assertFalse(DualProofVerifier.verifyLinear(proof, 4, 8, ledger.alh(3), ledger.alh(8)));
    assertFalse(DualProofVerifier.verifyLinear(proof, 4, 8, ledger.alh(4), ledger.alh(7)));
    assertFalse(DualProofVerifier.verifyLinear(proof, 4, 9, ledger.alh(4), ledger.alh(8)));
    assertFalse(DualProofVerifier.verifyLinear(proof, 0, 8, ledger.alh(4), ledger.alh(8)));

    final List<Digest> terms = new ArrayList<>(proof.terms());
    terms.set(2, Digest.ZERO);
    assertFalse(DualProofVerifier.verifyLinear(new LinearProof(4, 8, terms), 4, 8, ledger.alh(4), ledger.alh(8)));
  }

  @Test
  void verifyLinearSingleTransaction() {
    assertTrue(DualProofVerifier.verifyLinear(ledger.linearProof(5, 5), 5, 5, ledger.alh(5), ledger.alh(5)));
    assertFalse(DualProofVerifier.verifyLinear(new LinearProof(5, 5, List.of()), 5, 5, ledger.alh(5),
        ledger.alh(5)));
  }

  private static void commitTransactions(final TestLedger ledger) {
    for (int i = 1; i <= TX_COUNT; i++) {
      if (i % 3 == 0) {
        ledger.commit(new PlainEntry(bytes("key-" + i), bytes("value-" + i)),
            new ReferenceEntry(bytes("alias-" + i), bytes("key-" + i), 0),
            new SortedSetEntry(bytes("set"), i, bytes("key-" + i), i));
      } else {
        ledger.commit(new PlainEntry(bytes("key-" + i), bytes("value-" + i)));
      }
    }
  }

  private static List<Digest> flipFirst(final List<Digest> digests) {
    final List<Digest> flipped = new ArrayList<>(digests);
    final byte[] bytes = flipped.get(0).toByteArray();
    bytes[0] ^= 1;
    flipped.set(0, Digest.fromBytes(bytes));
    return flipped;
  }
}
