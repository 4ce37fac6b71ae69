/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

import com.google.common.annotations.VisibleForTesting;
import java.nio.ByteBuffer;
import java.util.HexFormat;
import org.signal.ledger.verifier.crypto.Digest;

/**
 * The encoded key and value of a log entry, as stored by the ledger. The prefix bytes keep plain values, references
 * and sorted set members in disjoint parts of the key and value space.
 *
 * @param key   the encoded key
 * @param value the encoded value
 */
public record EncodedEntry(byte[] key, byte[] value) {

  @VisibleForTesting
  static final byte SET_KEY_PREFIX = 0x00;
  @VisibleForTesting
  static final byte SORTED_SET_KEY_PREFIX = 0x01;
  @VisibleForTesting
  static final byte PLAIN_VALUE_PREFIX = 0x00;
  @VisibleForTesting
  static final byte REFERENCE_VALUE_PREFIX = 0x01;

  private static final int MAX_KEY_LENGTH_V1 = 0xffff;

  public static EncodedEntry encodePlain(final byte[] key, final byte[] value) {
    return new EncodedEntry(prefixed(SET_KEY_PREFIX, key), prefixed(PLAIN_VALUE_PREFIX, value));
  }

  public static EncodedEntry encodeReference(final byte[] referringKey, final byte[] referredKey,
      final long referredTxId) {

    final byte[] encodedReferredKey = prefixed(SET_KEY_PREFIX, referredKey);
    final ByteBuffer value = ByteBuffer.allocate(1 + Long.BYTES + encodedReferredKey.length);
    value.put(REFERENCE_VALUE_PREFIX);
    value.putLong(referredTxId);
    value.put(encodedReferredKey);

    return new EncodedEntry(prefixed(SET_KEY_PREFIX, referringKey), value.array());
  }

  public static EncodedEntry encodeSortedSetMember(final byte[] set, final double score, final byte[] key,
      final long atTx) {

    final byte[] encodedKey = prefixed(SET_KEY_PREFIX, key);
    final ByteBuffer zKey = ByteBuffer.allocate(
        1 + Long.BYTES + set.length + Double.BYTES + Long.BYTES + encodedKey.length + Long.BYTES);
    zKey.put(SORTED_SET_KEY_PREFIX);
    zKey.putLong(set.length);
    zKey.put(set);
    zKey.putDouble(score);
    zKey.putLong(encodedKey.length);
    zKey.put(encodedKey);
    zKey.putLong(atTx);

    return new EncodedEntry(zKey.array(), new byte[0]);
  }

  /**
   * @param version the header version of the transaction that holds this entry
   * @return the bytes whose hash is this entry's digest
   */
  public byte[] preimage(final int version) {
    return preimage(version, key, Digest.sha256(value));
  }

  public Digest digest(final int version) {
    return Digest.sha256(preimage(version));
  }

  /**
   * Computes the digest of an entry from its encoded key and the hash of its encoded value. Transactions only carry
   * value hashes, so this is also how sibling leaves of an entries tree are rebuilt.
   */
  public static Digest digest(final int version, final byte[] encodedKey, final Digest valueHash) {
    return Digest.sha256(preimage(version, encodedKey, valueHash));
  }

  private static byte[] preimage(final int version, final byte[] encodedKey, final Digest valueHash) {
    final byte[] valueHashBytes = valueHash.toByteArray();

    return switch (version) {
      case 0 -> ByteBuffer.allocate(encodedKey.length + Digest.LENGTH)
          .put(encodedKey)
          .put(valueHashBytes)
          .array();
      case 1 -> {
        if (encodedKey.length > MAX_KEY_LENGTH_V1) {
          throw new IllegalArgumentException("Encoded key too long: " + encodedKey.length);
        }
        // entry metadata is not supported, so its length is always zero
        yield ByteBuffer.allocate(Short.BYTES + Short.BYTES + encodedKey.length + Digest.LENGTH)
            .putShort((short) 0)
            .putShort((short) encodedKey.length)
            .put(encodedKey)
            .put(valueHashBytes)
            .array();
      }
      default -> throw new IllegalArgumentException("Unsupported transaction header version: " + version);
    };
  }

  private static byte[] prefixed(final byte prefix, final byte[] bytes) {
    final byte[] result = new byte[bytes.length + 1];
    result[0] = prefix;
    System.arraycopy(bytes, 0, result, 1, bytes.length);
    return result;
  }

  @Override
  public String toString() {
    return "EncodedEntry{" +
        "key=" + HexFormat.of().formatHex(key) +
        ", value=" + HexFormat.of().formatHex(value) +
        '}';
  }
}
