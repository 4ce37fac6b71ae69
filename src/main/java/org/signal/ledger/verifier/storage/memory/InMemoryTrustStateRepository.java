/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier.storage.memory;

import io.micronaut.context.annotation.Secondary;
import jakarta.inject.Singleton;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.signal.ledger.verifier.storage.TrustStateRepository;

/**
 * A trust state repository that lasts as long as the process. Used unless a persistent repository is configured.
 */
@Singleton
@Secondary
public class InMemoryTrustStateRepository implements TrustStateRepository {

  private final Map<String, byte[]> trustStates = new ConcurrentHashMap<>();

  @Override
  public Optional<byte[]> getTrustState(final String serverIdentity, final String database) {
    return Optional.ofNullable(trustStates.get(key(serverIdentity, database))).map(byte[]::clone);
  }

  @Override
  public void storeTrustState(final String serverIdentity, final String database,
      final byte[] serializedTrustState) {
    trustStates.put(key(serverIdentity, database), serializedTrustState.clone());
  }

  private static String key(final String serverIdentity, final String database) {
    return serverIdentity + "/" + database;
  }
}
