/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

/**
 * A log entry whose digest the client recomputes from raw data. Each kind of entry knows its own encoding.
 */
public interface LedgerEntry {

  EncodedEntry encode();
}
