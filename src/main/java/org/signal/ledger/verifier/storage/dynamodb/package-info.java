/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

/**
 * Persists trusted ledger states in a DynamoDB table. Enabled once both the table and its region are configured;
 * otherwise trusted states stay in memory or on the local file system.
 */
@Configuration
@Requires(property = "trust-store.dynamodb.table-name")
@Requires(property = "trust-store.dynamodb.region")
package org.signal.ledger.verifier.storage.dynamodb;

import io.micronaut.context.annotation.Configuration;
import io.micronaut.context.annotation.Requires;
