/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

import org.signal.ledger.verifier.crypto.InclusionProof;

/**
 * A value together with proof of its inclusion in its transaction and of that transaction's relation to the trusted
 * state.
 */
public record VerifiableEntry(KeyValueEntry entry, VerifiableTx verifiableTx, InclusionProof inclusionProof) {
}
