/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier.trust;

import io.micronaut.core.annotation.Nullable;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.security.Signature;
import java.security.SignatureException;
import java.security.interfaces.ECPublicKey;
import java.util.HexFormat;
import org.signal.ledger.verifier.crypto.Digest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The client's root of trust for one database: the highest transaction whose accumulated hash it has verified.
 *
 * @param database  the database the state belongs to
 * @param txId      the transaction ID, or 0 if nothing is trusted yet
 * @param txHash    the accumulated linear hash of {@code txId}
 * @param signature the server's DER-encoded ECDSA signature over {@link #signedPayload()}, if any
 */
public record TrustState(String database, long txId, Digest txHash, @Nullable byte[] signature) {

  private static final Logger logger = LoggerFactory.getLogger(TrustState.class);

  static final String SIGNATURE_ALGORITHM = "SHA256withECDSA";

  public static TrustState empty(final String database) {
    return new TrustState(database, 0, Digest.ZERO, null);
  }

  public boolean isEmpty() {
    return txId == 0;
  }

  /**
   * @return {@code len(database) ‖ database ‖ txId ‖ txHash}, the bytes the server signs
   */
  public byte[] signedPayload() {
    final byte[] databaseBytes = database.getBytes(StandardCharsets.UTF_8);
    return ByteBuffer.allocate(Integer.BYTES + databaseBytes.length + Long.BYTES + Digest.LENGTH)
        .putInt(databaseBytes.length)
        .put(databaseBytes)
        .putLong(txId)
        .put(txHash.toByteArray())
        .array();
  }

  public boolean hasValidSignature(final ECPublicKey serverSigningKey) {
    if (signature == null || signature.length == 0) {
      return false;
    }

    try {
      final Signature verifier = Signature.getInstance(SIGNATURE_ALGORITHM);
      verifier.initVerify(serverSigningKey);
      verifier.update(signedPayload());
      return verifier.verify(signature);
    } catch (final SignatureException e) {
      // the signature bytes could not be decoded
      logger.debug("Malformed state signature", e);
      return false;
    } catch (final InvalidKeyException e) {
      logger.error("Server signing key cannot verify ECDSA signatures", e);
      return false;
    } catch (final NoSuchAlgorithmException e) {
      throw new AssertionError("SHA256withECDSA support is unavailable", e);
    }
  }

  @Override
  public String toString() {
    return "TrustState{" +
        "database='" + database + '\'' +
        ", txId=" + txId +
        ", txHash=" + txHash +
        ", signature=" + (signature == null ? "none" : HexFormat.of().formatHex(signature)) +
        '}';
  }
}
