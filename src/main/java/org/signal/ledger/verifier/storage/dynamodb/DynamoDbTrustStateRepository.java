/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier.storage.dynamodb;

import com.google.common.annotations.VisibleForTesting;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import org.signal.ledger.verifier.storage.TrustStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

/**
 * A trust state repository that uses DynamoDB as its backing store, with one item per server and database.
 */
@Singleton
public class DynamoDbTrustStateRepository implements TrustStateRepository {

  private static final Logger logger = LoggerFactory.getLogger(DynamoDbTrustStateRepository.class);
  // "<server identity>/<database>"; string
  @VisibleForTesting
  static final String KEY = "K";
  // serialized trust state; bytes
  @VisibleForTesting
  static final String ATTR_TRUST_STATE = "S";
  private final DynamoDbClient dynamoDbClient;
  private final DynamoDbConfiguration dynamoDbConfiguration;

  public DynamoDbTrustStateRepository(final DynamoDbClient dynamoDbClient,
      final DynamoDbConfiguration dynamoDbConfiguration) {
    this.dynamoDbClient = dynamoDbClient;
    this.dynamoDbConfiguration = dynamoDbConfiguration;
  }

  @Override
  public Optional<byte[]> getTrustState(final String serverIdentity, final String database) throws IOException {
    try {
      final GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
          .tableName(dynamoDbConfiguration.tableName())
          .key(Map.of(KEY, keyAttributeValue(serverIdentity, database)))
          .consistentRead(true)
          .build());
      if (!response.hasItem() || !response.item().containsKey(ATTR_TRUST_STATE)) {
        logger.info("Trust state for {} on {} not found", database, serverIdentity);
        return Optional.empty();
      }
      return Optional.of(response.item().get(ATTR_TRUST_STATE).b().asByteArray());
    } catch (final AwsServiceException | SdkClientException e) {
      logger.error("Unexpected error getting trust state", e);
      throw new IOException(e);
    }
  }

  @Override
  public void storeTrustState(final String serverIdentity, final String database,
      final byte[] serializedTrustState) throws IOException {
    final PutItemRequest request = PutItemRequest.builder()
        .tableName(dynamoDbConfiguration.tableName())
        .item(Map.of(
            KEY, keyAttributeValue(serverIdentity, database),
            ATTR_TRUST_STATE, AttributeValue.builder().b(SdkBytes.fromByteArray(serializedTrustState)).build()))
        .build();
    try {
      dynamoDbClient.putItem(request);
    } catch (final AwsServiceException | SdkClientException e) {
      logger.error("Unexpected error writing trust state", e);
      throw new IOException(e);
    }
  }

  @VisibleForTesting
  static AttributeValue keyAttributeValue(final String serverIdentity, final String database) {
    return AttributeValue.builder().s(serverIdentity + "/" + database).build();
  }
}
