/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

/**
 * The steps a verified operation moves through. A call only reaches {@link #ANCHOR_ADVANCED} if every earlier step
 * succeeded; any failure after {@link #REQUEST_SENT} ends in {@link #REJECTED} without touching the trust anchor.
 */
public enum VerificationStage {
  ANCHOR_LOADED,
  REQUEST_SENT,
  DIGEST_RECOMPUTED,
  INCLUSION_VERIFIED,
  DUAL_VERIFIED,
  ANCHOR_ADVANCED,
  REJECTED
}
