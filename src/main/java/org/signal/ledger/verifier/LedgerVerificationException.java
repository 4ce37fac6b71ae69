/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

/**
 * Indicates that a response from the ledger service could not be verified. Subclasses distinguish tampering from
 * structurally invalid proofs and invalid server signatures; none of them are transport failures.
 */
public abstract class LedgerVerificationException extends Exception {

  LedgerVerificationException(final String message) {
    super(message);
  }
}
