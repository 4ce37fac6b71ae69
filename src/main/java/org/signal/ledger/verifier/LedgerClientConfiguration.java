/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.core.annotation.Nullable;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.security.interfaces.ECPublicKey;
import java.time.Duration;

/**
 * Configuration parameters for a {@link VerifiedLedgerClient}.
 *
 * @param host                   the ledger server's host name
 * @param port                   the ledger server's gRPC port
 * @param database               the database operations target until {@link VerifiedLedgerClient#useDatabase(String)}
 *                               selects another
 * @param tls                    whether to connect with TLS
 * @param requestTimeout         the deadline applied to every call to the ledger server
 * @param serverSigningPublicKey a PEM-encoded elliptic curve key; if set, every trusted state must carry the server's
 *                               signature
 */
@ConfigurationProperties("ledger")
public record LedgerClientConfiguration(
    @NotBlank
    String host,
    @Positive
    int port,
    @NotBlank
    String database,
    boolean tls,
    @NotNull
    Duration requestTimeout,
    @Nullable
    ECPublicKey serverSigningPublicKey) {

  /**
   * @return the name under which trusted states for this server are persisted
   */
  public String serverIdentity() {
    return host + ":" + port;
  }
}
