/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

import io.micronaut.context.annotation.ConfigurationProperties;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/**
 * Configuration parameters for a {@link ConsistencyAuditor}.
 *
 * @param databases the databases whose history the auditor follows
 */
@ConfigurationProperties("auditor")
record ConsistencyAuditorConfiguration(
    @NotEmpty
    List<String> databases) {
}
