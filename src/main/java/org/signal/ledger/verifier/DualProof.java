/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

import io.micronaut.core.annotation.Nullable;
import java.util.List;
import org.signal.ledger.verifier.crypto.Digest;

/**
 * Proof that the state at a source transaction is an ancestor of the state at a target transaction.
 *
 * @param sourceTxMetadata   the header of the source transaction
 * @param targetTxMetadata   the header of the target transaction
 * @param inclusionProof     audit path of the source's accumulated hash in the target's binary linking tree; empty
 *                           unless the source is inside that tree
 * @param consistencyProof   proof that the target's linking tree extends the source's; empty if the source's tree is
 *                           empty
 * @param targetBlTxAlh      the accumulated hash of the last transaction in the target's linking tree, or
 *                           {@code null} if that tree is empty
 * @param lastInclusionProof audit path of {@code targetBlTxAlh} as the last leaf of the target's linking tree
 * @param linearProof        the hash chain covering transactions not yet in the target's linking tree
 */
public record DualProof(TxMetadata sourceTxMetadata,
                        TxMetadata targetTxMetadata,
                        List<Digest> inclusionProof,
                        List<Digest> consistencyProof,
                        @Nullable Digest targetBlTxAlh,
                        List<Digest> lastInclusionProof,
                        LinearProof linearProof) {

  public DualProof {
    inclusionProof = List.copyOf(inclusionProof);
    consistencyProof = List.copyOf(consistencyProof);
    lastInclusionProof = List.copyOf(lastInclusionProof);
  }
}
