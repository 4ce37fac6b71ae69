/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier.storage.dynamodb;

import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

/**
 * Builds the DynamoDB client backing {@link DynamoDbTrustStateRepository}.
 */
@Factory
class DynamoDbClientFactory {

  @Bean(preDestroy = "close")
  @Singleton
  DynamoDbClient trustStoreDynamoDbClient(final DynamoDbConfiguration trustStoreConfiguration) {
    final DynamoDbClientBuilder builder = DynamoDbClient.builder()
        .region(Region.of(trustStoreConfiguration.region()));

    if (trustStoreConfiguration.endpoint() != null) {
      builder.endpointOverride(trustStoreConfiguration.endpoint());
    }

    return builder.build();
  }
}
