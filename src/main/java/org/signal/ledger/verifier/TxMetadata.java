/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier;

import java.nio.ByteBuffer;
import org.signal.ledger.verifier.crypto.Digest;

/**
 * The header of a committed transaction.
 *
 * @param id           the transaction ID; IDs start at 1 and increase by one per transaction
 * @param prevAlh      the accumulated linear hash of the previous transaction
 * @param timestamp    the commit time in seconds since the Unix epoch
 * @param version      the header format version, 0 or 1
 * @param entryCount   the number of entries in the transaction
 * @param entriesHash  the root of the Merkle tree over the transaction's entry digests
 * @param blTxId       the last transaction included in the binary linking tree when this one was committed
 * @param blRoot       the root of the binary linking tree over the accumulated hashes of transactions
 *                     {@code 1..blTxId}
 */
public record TxMetadata(long id, Digest prevAlh, long timestamp, int version, int entryCount, Digest entriesHash,
                         long blTxId, Digest blRoot) {

  public static final int MAX_SUPPORTED_VERSION = 1;

  public TxMetadata {
    if (version < 0 || version > MAX_SUPPORTED_VERSION) {
      throw new IllegalArgumentException("Unsupported transaction header version: " + version);
    }
  }

  /**
   * @return the digest of this header's fields other than its ID and the previous accumulated hash
   */
  public Digest innerHash() {
    final ByteBuffer buffer;
    if (version == 0) {
      buffer = ByteBuffer.allocate(Long.BYTES + Integer.BYTES + Digest.LENGTH + Long.BYTES + Digest.LENGTH);
      buffer.putLong(timestamp);
    } else {
      buffer = ByteBuffer.allocate(
          Long.BYTES + Short.BYTES + Short.BYTES + Integer.BYTES + Digest.LENGTH + Long.BYTES + Digest.LENGTH);
      buffer.putLong(timestamp);
      buffer.putShort((short) version);
      // no transaction metadata
      buffer.putShort((short) 0);
    }
    buffer.putInt(entryCount);
    buffer.put(entriesHash.toByteArray());
    buffer.putLong(blTxId);
    buffer.put(blRoot.toByteArray());

    return Digest.sha256(buffer.array());
  }

  /**
   * @return the accumulated linear hash of this transaction, {@code H(id ‖ prevAlh ‖ innerHash)}
   */
  public Digest alh() {
    return accumulate(id, prevAlh, innerHash());
  }

  static Digest accumulate(final long id, final Digest previous, final Digest innerHash) {
    return Digest.sha256(ByteBuffer.allocate(Long.BYTES).putLong(id).array(),
        previous.toByteArray(),
        innerHash.toByteArray());
  }
}
