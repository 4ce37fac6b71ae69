/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier.crypto;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * An immutable 32-byte SHA-256 digest. Digests are only ever compared by their bytes.
 */
public final class Digest {

  public static final int LENGTH = 32;

  /**
   * The all-zero digest, used as the accumulated hash of the (non-existent) transaction zero and as the root of an
   * empty linking tree.
   */
  public static final Digest ZERO = new Digest(new byte[LENGTH]);

  private final byte[] bytes;

  private Digest(final byte[] bytes) {
    this.bytes = bytes;
  }

  /**
   * @param bytes the raw digest bytes; copied
   * @return a digest wrapping the given bytes
   * @throws IllegalArgumentException if {@code bytes} is not exactly {@value LENGTH} bytes long
   */
  public static Digest fromBytes(final byte[] bytes) {
    if (bytes == null || bytes.length != LENGTH) {
      throw new IllegalArgumentException("Digests must be exactly " + LENGTH + " bytes long");
    }
    return new Digest(bytes.clone());
  }

  /**
   * Computes the SHA-256 digest of the concatenation of the given parts.
   */
  public static Digest sha256(final byte[]... parts) {
    final MessageDigest messageDigest = getMessageDigest();
    for (final byte[] part : parts) {
      messageDigest.update(part);
    }
    return new Digest(messageDigest.digest());
  }

  /**
   * Infallibly returns a new {@code MessageDigest} instance that uses the SHA-256 algorithm. While getting a new
   * {@code MessageDigest} can fail in general, every implementation of the Java platform is required to support
   * SHA-256.
   */
  public static MessageDigest getMessageDigest() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (final NoSuchAlgorithmException e) {
      throw new AssertionError("Every implementation of the Java platform is required to support SHA-256", e);
    }
  }

  public byte[] toByteArray() {
    return bytes.clone();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Digest other)) {
      return false;
    }
    return MessageDigest.isEqual(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return HexFormat.of().formatHex(bytes);
  }
}
