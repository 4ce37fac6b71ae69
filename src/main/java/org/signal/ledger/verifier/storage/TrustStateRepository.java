/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier.storage;

import java.io.IOException;
import java.util.Optional;

/**
 * Stores serialized trust states so that a client keeps its root of trust across restarts. States are keyed by the
 * server they were verified against and the database they belong to.
 */
public interface TrustStateRepository {

  /**
   * @return the most recently stored serialized {@link StoredTrustState} for the given server and database
   */
  Optional<byte[]> getTrustState(String serverIdentity, String database) throws IOException;

  /**
   * Store a serialized {@link StoredTrustState}, replacing any previous state for the same server and database.
   */
  void storeTrustState(String serverIdentity, String database, byte[] serializedTrustState) throws IOException;
}
