/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier.storage.dynamodb;

import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Context;
import io.micronaut.core.annotation.Nullable;
import jakarta.validation.constraints.NotBlank;
import java.net.URI;

/**
 * Where trusted ledger states are kept when they live in DynamoDB.
 *
 * @param tableName the table holding one item per ledger server and database, keyed by the string attribute
 *                  {@code K}
 * @param region    the AWS region of the table
 * @param endpoint  overrides the regional DynamoDB endpoint, for example to reach a local emulator
 */
@Context
@ConfigurationProperties("trust-store.dynamodb")
record DynamoDbConfiguration(
    @NotBlank
    String tableName,
    @NotBlank
    String region,
    @Nullable
    URI endpoint) {
}
