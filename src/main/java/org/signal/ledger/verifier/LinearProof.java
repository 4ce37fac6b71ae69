/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

import java.util.List;
import org.signal.ledger.verifier.crypto.Digest;

/**
 * A hash chain linking two transactions. The first term is the accumulated hash of {@code sourceTxId}; each later
 * term is the inner hash of the next transaction.
 */
public record LinearProof(long sourceTxId, long targetTxId, List<Digest> terms) {

  public LinearProof {
    terms = List.copyOf(terms);
  }
}
