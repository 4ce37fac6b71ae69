/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier.trust;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.Striped;
import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micronaut.core.annotation.Nullable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.security.interfaces.ECPublicKey;
import java.security.spec.InvalidKeySpecException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import org.signal.ledger.verifier.SignatureInvalidException;
import org.signal.ledger.verifier.crypto.Digest;
import org.signal.ledger.verifier.metrics.MetricsUtil;
import org.signal.ledger.verifier.storage.StoredTrustState;
import org.signal.ledger.verifier.storage.TrustStateRepository;
import org.signal.ledger.verifier.util.ECPublicKeyDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the highest verified state of each database of one ledger server.
 * <p>
 * A database's trusted transaction ID never decreases: {@link #set(String, TrustState)} checks the stored state and
 * replaces it while holding that database's lock, so two verified operations finishing at the same time can never
 * leave an older state in place of a newer one. Reads never block and always observe a state that was fully accepted.
 * Accepted states are written through to a {@link TrustStateRepository} before they become visible.
 */
public class TrustAnchorCache {

  public enum SetResult {
    /**
     * The new state replaced the stored one.
     */
    ADVANCED,
    /**
     * The new state was not newer than the stored one and was ignored.
     */
    STALE
  }

  private static final Logger logger = LoggerFactory.getLogger(TrustAnchorCache.class);
  private static final int LOCK_STRIPES = 64;

  private final String serverIdentity;
  private final TrustStateRepository repository;
  private final AtomicReference<ECPublicKey> serverSigningKey;
  private final Map<String, TrustState> trustStates = new ConcurrentHashMap<>();
  private final Striped<Lock> databaseLocks = Striped.lock(LOCK_STRIPES);
  private final Counter advancedCounter;
  private final Counter staleCounter;
  private final Counter getStoredStateCounter;

  /**
   * @param serverIdentity   identifies the ledger server, e.g. its host and port; states of different servers never
   *                         mix in a shared repository
   * @param repository       where accepted states are persisted
   * @param serverSigningKey if present, every accepted state must carry the server's signature
   * @param meterRegistry    the registry for cache metrics
   */
  public TrustAnchorCache(final String serverIdentity,
      final TrustStateRepository repository,
      @Nullable final ECPublicKey serverSigningKey,
      final MeterRegistry meterRegistry) {
    this.serverIdentity = serverIdentity;
    this.repository = repository;
    this.serverSigningKey = new AtomicReference<>(serverSigningKey);
    this.advancedCounter = meterRegistry.counter(MetricsUtil.name(TrustAnchorCache.class, "advanced"));
    this.staleCounter = meterRegistry.counter(MetricsUtil.name(TrustAnchorCache.class, "stale"));
    this.getStoredStateCounter = meterRegistry.counter(MetricsUtil.name(TrustAnchorCache.class, "getStoredState"));
  }

  /**
   * Requires all states accepted from now on to be signed by the holder of the given key.
   *
   * @param pem a PEM-encoded elliptic curve public key
   */
  public void loadPublicKey(final String pem) throws InvalidKeySpecException {
    serverSigningKey.set(ECPublicKeyDeserializer.parsePublicKey(pem));
  }

  public Optional<ECPublicKey> getServerSigningKey() {
    return Optional.ofNullable(serverSigningKey.get());
  }

  /**
   * @return the trusted state of the given database; an {@linkplain TrustState#empty(String) empty} state if no state
   * has been accepted yet
   * @throws SignatureInvalidException if a persisted state is not signed by the configured server key
   */
  public TrustState get(final String database) throws SignatureInvalidException {
    final TrustState cached = trustStates.get(database);
    if (cached != null) {
      return cached;
    }

    final Lock lock = databaseLocks.get(database);
    lock.lock();
    try {
      final TrustState loaded = trustStates.get(database);
      if (loaded != null) {
        return loaded;
      }

      final TrustState stored = loadStoredState(database);
      if (!stored.isEmpty()) {
        verifySignature(stored);
        trustStates.put(database, stored);
      }
      return stored;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Replaces the trusted state of a database if the new state is strictly newer.
   *
   * @return {@link SetResult#STALE} if the stored state is at or beyond {@code newState}
   * @throws SignatureInvalidException if a server key is configured and {@code newState} is not signed by it
   */
  public SetResult set(final String database, final TrustState newState) throws SignatureInvalidException {
    if (!database.equals(newState.database())) {
      throw new IllegalArgumentException(
          "State for database " + newState.database() + " cannot be trusted for " + database);
    }

    final Lock lock = databaseLocks.get(database);
    lock.lock();
    try {
      final TrustState current = get(database);
      if (newState.txId() <= current.txId()) {
        logger.debug("Ignoring state at tx {} for {}; already trusting tx {}",
            newState.txId(), database, current.txId());
        staleCounter.increment();
        return SetResult.STALE;
      }

      verifySignature(newState);

      try {
        repository.storeTrustState(serverIdentity, database, toStoredTrustState(newState).toByteArray());
      } catch (final IOException e) {
        throw new UncheckedIOException(e);
      }

      trustStates.put(database, newState);
      advancedCounter.increment();
      logger.debug("Trusted state for {} advanced from tx {} to tx {}", database, current.txId(), newState.txId());
      return SetResult.ADVANCED;
    } finally {
      lock.unlock();
    }
  }

  /**
   * @throws SignatureInvalidException if a server key is configured and {@code state} is not signed by it
   */
  public void verifySignature(final TrustState state) throws SignatureInvalidException {
    final ECPublicKey key = serverSigningKey.get();
    if (key != null && !state.hasValidSignature(key)) {
      logger.error("Invalid server signature on state for {} at tx {}", state.database(), state.txId());
      throw new SignatureInvalidException(
          "State for " + state.database() + " at tx " + state.txId() + " is not signed by the server key");
    }
  }

  private TrustState loadStoredState(final String database) {
    getStoredStateCounter.increment();
    try {
      final Optional<byte[]> serialized = repository.getTrustState(serverIdentity, database);
      if (serialized.isEmpty()) {
        return TrustState.empty(database);
      }

      final StoredTrustState stored = StoredTrustState.parseFrom(serialized.get());
      if (!database.equals(stored.getDatabase())) {
        throw new IllegalStateException("Stored state for " + database + " belongs to " + stored.getDatabase());
      }
      return fromStoredTrustState(stored);
    } catch (final InvalidProtocolBufferException e) {
      logger.error("Stored trust state for {} could not be parsed", database, e);
      throw new UncheckedIOException(e);
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @VisibleForTesting
  static StoredTrustState toStoredTrustState(final TrustState state) {
    final StoredTrustState.Builder builder = StoredTrustState.newBuilder()
        .setDatabase(state.database())
        .setTxId(state.txId())
        .setTxHash(ByteString.copyFrom(state.txHash().toByteArray()));
    if (state.signature() != null) {
      builder.setSignature(ByteString.copyFrom(state.signature()));
    }
    return builder.build();
  }

  @VisibleForTesting
  static TrustState fromStoredTrustState(final StoredTrustState stored) {
    return new TrustState(stored.getDatabase(),
        stored.getTxId(),
        Digest.fromBytes(stored.getTxHash().toByteArray()),
        stored.getSignature().isEmpty() ? null : stored.getSignature().toByteArray());
  }
}
