/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier.storage.dynamodb;

import io.micronaut.context.annotation.Property;
import io.micronaut.test.annotation.MockBean;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.signal.ledger.verifier.storage.TrustStateRepository;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemResponse;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.signal.ledger.verifier.util.Util.generateRandomBytes;

@MicronautTest
@Property(name = "trust-store.dynamodb.table-name", value = DynamoDbTrustStateRepositoryTest.TABLE_NAME)
@Property(name = "trust-store.dynamodb.region", value = "us-east-1")
public class DynamoDbTrustStateRepositoryTest {

  static final String TABLE_NAME = "TrustStateRepositoryTest";
  private static final String SERVER_IDENTITY = "localhost:3322";

  @Inject
  DynamoDbClient dynamoDbClient;

  @Inject
  TrustStateRepository trustStateRepository;

  @MockBean(DynamoDbClient.class)
  DynamoDbClient dynamoDbClient() {
    return mock(DynamoDbClient.class);
  }

  @BeforeEach
  void setUp() {
    reset(dynamoDbClient);
  }

  @Test
  void testDynamoDbRepositoryIsSelected() {
    assertInstanceOf(DynamoDbTrustStateRepository.class, trustStateRepository);
  }

  @Test
  void testStoreTrustState() throws IOException {
    when(dynamoDbClient.putItem(any(PutItemRequest.class))).thenReturn(PutItemResponse.builder().build());

    final byte[] state = generateRandomBytes(64);
    trustStateRepository.storeTrustState(SERVER_IDENTITY, "defaultdb", state);

    final ArgumentCaptor<PutItemRequest> captor = ArgumentCaptor.forClass(PutItemRequest.class);
    verify(dynamoDbClient).putItem(captor.capture());

    assertEquals(TABLE_NAME, captor.getValue().tableName());
    assertEquals("localhost:3322/defaultdb", captor.getValue().item().get(DynamoDbTrustStateRepository.KEY).s());
    assertArrayEquals(state,
        captor.getValue().item().get(DynamoDbTrustStateRepository.ATTR_TRUST_STATE).b().asByteArray());
  }

  @Test
  void testGetTrustState() throws IOException {
    final byte[] state = generateRandomBytes(64);
    when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder()
        .item(Map.of(
            DynamoDbTrustStateRepository.KEY,
            DynamoDbTrustStateRepository.keyAttributeValue(SERVER_IDENTITY, "defaultdb"),
            DynamoDbTrustStateRepository.ATTR_TRUST_STATE,
            AttributeValue.builder().b(SdkBytes.fromByteArray(state)).build()))
        .build());

    final Optional<byte[]> retrieved = trustStateRepository.getTrustState(SERVER_IDENTITY, "defaultdb");
    assertArrayEquals(state, retrieved.orElseThrow());

    final ArgumentCaptor<GetItemRequest> captor = ArgumentCaptor.forClass(GetItemRequest.class);
    verify(dynamoDbClient).getItem(captor.capture());
    assertEquals(TABLE_NAME, captor.getValue().tableName());
    assertTrue(captor.getValue().consistentRead());
    assertEquals(Map.of(DynamoDbTrustStateRepository.KEY,
            DynamoDbTrustStateRepository.keyAttributeValue(SERVER_IDENTITY, "defaultdb")),
        captor.getValue().key());
  }

  @Test
  void testGetMissingTrustState() throws IOException {
    when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().build());

    assertTrue(trustStateRepository.getTrustState(SERVER_IDENTITY, "defaultdb").isEmpty());
  }

  @Test
  void testDynamoDbErrorsBecomeIOExceptions() {
    when(dynamoDbClient.getItem(any(GetItemRequest.class)))
        .thenThrow(ResourceNotFoundException.builder().message("no such table").build());
    when(dynamoDbClient.putItem(any(PutItemRequest.class)))
        .thenThrow(SdkClientException.create("unreachable"));

    assertThrows(IOException.class, () -> trustStateRepository.getTrustState(SERVER_IDENTITY, "defaultdb"));
    assertThrows(IOException.class,
        () -> trustStateRepository.storeTrustState(SERVER_IDENTITY, "defaultdb", generateRandomBytes(8)));
  }
}
