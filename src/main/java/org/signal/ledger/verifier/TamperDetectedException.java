/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

/**
 * Indicates that a recomputed digest, an inclusion proof or a dual proof did not match what the ledger service
 * claimed. This means the service returned data that is inconsistent with the client's trusted state.
 */
public class TamperDetectedException extends LedgerVerificationException {

  private final VerificationStage stage;

  public TamperDetectedException(final VerificationStage stage, final String message) {
    super(message + " (" + stage + ")");
    this.stage = stage;
  }

  /**
   * @return the last stage the call was trying to reach when the mismatch was found
   */
  public VerificationStage getStage() {
    return stage;
  }
}
