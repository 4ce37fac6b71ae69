/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier.client;

import io.grpc.ChannelCredentials;
import io.grpc.Grpc;
import io.grpc.InsecureChannelCredentials;
import io.grpc.ManagedChannel;
import io.grpc.TlsChannelCredentials;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import org.signal.ledger.verifier.LedgerClientConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Factory
class LedgerServiceStubFactory {

  private static final Logger logger = LoggerFactory.getLogger(LedgerServiceStubFactory.class);

  @Bean(preDestroy = "shutdown")
  @Singleton
  ManagedChannel ledgerServiceChannel(final LedgerClientConfiguration configuration) {
    final ChannelCredentials credentials = configuration.tls()
        ? TlsChannelCredentials.create()
        : InsecureChannelCredentials.create();

    if (!configuration.tls()) {
      logger.warn("Connecting to ledger server {} without TLS", configuration.serverIdentity());
    }

    return Grpc.newChannelBuilderForAddress(configuration.host(), configuration.port(), credentials).build();
  }

  @Singleton
  LedgerServiceGrpc.LedgerServiceBlockingStub ledgerServiceStub(final ManagedChannel channel) {
    return LedgerServiceGrpc.newBlockingStub(channel);
  }
}
