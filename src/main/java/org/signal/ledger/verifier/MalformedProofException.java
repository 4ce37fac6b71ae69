/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

/**
 * Indicates that the ledger service returned a proof that is structurally invalid, e.g. a leaf index outside of the
 * tree or missing transaction metadata.
 */
public class MalformedProofException extends LedgerVerificationException {

  public MalformedProofException(final String message) {
    super(message);
  }
}
