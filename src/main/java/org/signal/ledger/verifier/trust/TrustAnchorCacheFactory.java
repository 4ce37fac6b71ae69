/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier.trust;

import io.micrometer.core.instrument.MeterRegistry;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import org.signal.ledger.verifier.LedgerClientConfiguration;
import org.signal.ledger.verifier.storage.TrustStateRepository;

@Factory
class TrustAnchorCacheFactory {

  @Singleton
  TrustAnchorCache trustAnchorCache(final LedgerClientConfiguration configuration,
      final TrustStateRepository repository,
      final MeterRegistry meterRegistry) {
    return new TrustAnchorCache(configuration.serverIdentity(), repository, configuration.serverSigningPublicKey(),
        meterRegistry);
  }
}
