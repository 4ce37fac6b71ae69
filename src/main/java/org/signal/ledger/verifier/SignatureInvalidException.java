/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

/**
 * Indicates that a server signing key is configured but a state was missing a signature or its signature did not
 * match.
 */
public class SignatureInvalidException extends LedgerVerificationException {

  public SignatureInvalidException(final String message) {
    super(message);
  }
}
