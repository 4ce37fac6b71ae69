/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.signal.ledger.verifier.crypto.Digest;
import org.signal.ledger.verifier.util.Util;

import java.nio.ByteBuffer;

import static org.junit.jupiter.api.Assertions.*;

class TxMetadataTest {

  private static final Digest PREV_ALH = Digest.fromBytes(Util.generateRandomBytes(Digest.LENGTH));
  private static final Digest ENTRIES_HASH = Digest.fromBytes(Util.generateRandomBytes(Digest.LENGTH));
  private static final Digest BL_ROOT = Digest.fromBytes(Util.generateRandomBytes(Digest.LENGTH));

  @Test
  void innerHashVersion0() {
    final TxMetadata metadata = new TxMetadata(5, PREV_ALH, 1234, 0, 2, ENTRIES_HASH, 4, BL_ROOT);

    final byte[] expected = ByteBuffer.allocate(8 + 4 + 32 + 8 + 32)
        .putLong(1234)
        .putInt(2)
        .put(ENTRIES_HASH.toByteArray())
        .putLong(4)
        .put(BL_ROOT.toByteArray())
        .array();

    assertEquals(Digest.sha256(expected), metadata.innerHash());
  }

  @Test
  void innerHashVersion1() {
    final TxMetadata metadata = new TxMetadata(5, PREV_ALH, 1234, 1, 2, ENTRIES_HASH, 4, BL_ROOT);

    final byte[] expected = ByteBuffer.allocate(8 + 2 + 2 + 4 + 32 + 8 + 32)
        .putLong(1234)
        .putShort((short) 1)
        .putShort((short) 0)
        .putInt(2)
        .put(ENTRIES_HASH.toByteArray())
        .putLong(4)
        .put(BL_ROOT.toByteArray())
        .array();

    assertEquals(Digest.sha256(expected), metadata.innerHash());
  }

  @Test
  void alh() {
    final TxMetadata metadata = new TxMetadata(5, PREV_ALH, 1234, 1, 2, ENTRIES_HASH, 4, BL_ROOT);

    assertEquals(Digest.sha256(ByteBuffer.allocate(8).putLong(5).array(), PREV_ALH.toByteArray(),
        metadata.innerHash().toByteArray()), metadata.alh());
    assertEquals(metadata.alh(), TxMetadata.accumulate(5, PREV_ALH, metadata.innerHash()));
  }

  @Test
  void alhCoversEveryField() {
    final TxMetadata metadata = new TxMetadata(5, PREV_ALH, 1234, 1, 2, ENTRIES_HASH, 4, BL_ROOT);

    assertNotEquals(metadata.alh(), new TxMetadata(6, PREV_ALH, 1234, 1, 2, ENTRIES_HASH, 4, BL_ROOT).alh());
    assertNotEquals(metadata.alh(), new TxMetadata(5, Digest.ZERO, 1234, 1, 2, ENTRIES_HASH, 4, BL_ROOT).alh());
    assertNotEquals(metadata.alh(), new TxMetadata(5, PREV_ALH, 1235, 1, 2, ENTRIES_HASH, 4, BL_ROOT).alh());
    assertNotEquals(metadata.alh(), new TxMetadata(5, PREV_ALH, 1234, 0, 2, ENTRIES_HASH, 4, BL_ROOT).alh());
    assertNotEquals(metadata.alh(), new TxMetadata(5, PREV_ALH, 1234, 1, 3, ENTRIES_HASH, 4, BL_ROOT).alh());
    assertNotEquals(metadata.alh(), new TxMetadata(5, PREV_ALH, 1234, 1, 2, Digest.ZERO, 4, BL_ROOT).alh());
    assertNotEquals(metadata.alh(), new TxMetadata(5, PREV_ALH, 1234, 1, 2, ENTRIES_HASH, 3, BL_ROOT).alh());
    assertNotEquals(metadata.alh(), new TxMetadata(5, PREV_ALH, 1234, 1, 2, ENTRIES_HASH, 4, Digest.ZERO).alh());
  }

  @ParameterizedTest
  @ValueSource(ints = {-1, 2, 7})
  void unsupportedVersion(final int version) {
    assertThrows(IllegalArgumentException.class,
        () -> new TxMetadata(1, Digest.ZERO, 0, version, 1, ENTRIES_HASH, 0, Digest.ZERO));
  }
}
