/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

import io.micronaut.core.annotation.Nullable;

/**
 * A transaction together with a proof relating it to the state the client already trusts.
 *
 * @param tx        the transaction
 * @param dualProof the proof between the transaction and the trusted state
 * @param signature the server's signature over its state at the proof's target, if the server signs states
 */
public record VerifiableTx(Tx tx, DualProof dualProof, @Nullable byte[] signature) {
}
