/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

import com.google.common.annotations.VisibleForTesting;
import io.grpc.StatusRuntimeException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micronaut.context.annotation.Requires;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.signal.ledger.verifier.metrics.MetricsUtil;
import org.signal.ledger.verifier.trust.TrustState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

/**
 * Periodically checks that the ledger server's current state of each configured database extends the state this
 * client already trusts. A database whose history fails verification is reported once and no longer audited, so the
 * trusted state recorded before the failure is preserved for investigation. Unreachable servers and malformed
 * responses are retried on the next run.
 */
@Singleton
@Requires(property = "auditor.enabled", value = "true")
public class ConsistencyAuditor {

  private static final Logger logger = LoggerFactory.getLogger(ConsistencyAuditor.class);

  private final ConsistencyAuditorConfiguration configuration;
  private final VerifiedLedgerClient verifiedLedgerClient;
  private final Set<String> tamperedDatabases = ConcurrentHashMap.newKeySet();
  private final Counter auditedCounter;
  private final Counter tamperDetectedCounter;
  private final Counter transportErrorCounter;
  private final Counter malformedProofCounter;
  private final Timer auditTimer;

  public ConsistencyAuditor(final ConsistencyAuditorConfiguration configuration,
      final VerifiedLedgerClient verifiedLedgerClient,
      final MeterRegistry meterRegistry) {
    this.configuration = configuration;
    this.verifiedLedgerClient = verifiedLedgerClient;
    this.auditedCounter = meterRegistry.counter(MetricsUtil.name(ConsistencyAuditor.class, "audited"));
    this.tamperDetectedCounter = meterRegistry.counter(MetricsUtil.name(ConsistencyAuditor.class, "tamperDetected"));
    this.transportErrorCounter = meterRegistry.counter(MetricsUtil.name(ConsistencyAuditor.class, "transportError"));
    this.malformedProofCounter = meterRegistry.counter(MetricsUtil.name(ConsistencyAuditor.class, "malformedProof"));
    this.auditTimer = meterRegistry.timer(MetricsUtil.name(ConsistencyAuditor.class, "auditTimer"));
  }

  @Scheduled(fixedDelay = "${auditor.interval:1m}")
  void auditLedger() {
    final Timer.Sample sample = Timer.start();

    try {
      final long audited = Flux.fromIterable(configuration.databases())
          .filter(database -> !tamperedDatabases.contains(database))
          .filter(this::auditDatabase)
          .count()
          .blockOptional()
          .orElse(0L);

      logger.debug("Audited {} of {} databases", audited, configuration.databases().size());
    } finally {
      sample.stop(auditTimer);
    }
  }

  /**
   * Verifies the server's current state of one database against the trusted state, advancing the trusted state if
   * the server's history checks out.
   *
   * @return whether the database was verified
   */
  @VisibleForTesting
  boolean auditDatabase(final String database) {
    try {
      final TrustState serverState = verifiedLedgerClient.currentState(database);
      if (serverState.isEmpty()) {
        logger.debug("{} has no transactions yet", database);
        return true;
      }

      final VerifiedTx verifiedTx = verifiedLedgerClient.verifiedTxById(database, serverState.txId());
      if (!verifiedTx.metadata().alh().equals(serverState.txHash())) {
        throw new TamperDetectedException(VerificationStage.DUAL_VERIFIED,
            "Current state of " + database + " does not match transaction " + serverState.txId());
      }

      auditedCounter.increment();
      logger.debug("Verified {} up to tx {}", database, serverState.txId());
      return true;
    } catch (final StatusRuntimeException e) {
      transportErrorCounter.increment();
      logger.warn("Could not reach the ledger server while auditing {}; will retry", database, e);
      return false;
    } catch (final MalformedProofException e) {
      malformedProofCounter.increment();
      logger.warn("Malformed response while auditing {}; will retry", database, e);
      return false;
    } catch (final LedgerVerificationException e) {
      tamperDetectedCounter.increment();
      tamperedDatabases.add(database);
      logger.error("Verification of {} failed; no longer auditing it", database, e);
      return false;
    }
  }

  @VisibleForTesting
  Set<String> getTamperedDatabases() {
    return Collections.unmodifiableSet(tamperedDatabases);
  }
}
