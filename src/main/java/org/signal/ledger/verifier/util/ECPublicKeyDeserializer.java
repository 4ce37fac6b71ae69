/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier.util;

import io.micronaut.context.annotation.Prototype;
import io.micronaut.core.convert.ConversionContext;
import io.micronaut.core.convert.TypeConverter;
import java.security.KeyFactory;
import java.security.NoSuchAlgorithmException;
import java.security.interfaces.ECPublicKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.Optional;

/**
 * Parses PEM-encoded ("BEGIN PUBLIC KEY") elliptic curve public keys, such as the ledger server's state signing key.
 */
@Prototype
public class ECPublicKeyDeserializer implements TypeConverter<String, ECPublicKey> {

  private static final String PEM_HEADER = "-----BEGIN PUBLIC KEY-----";
  private static final String PEM_FOOTER = "-----END PUBLIC KEY-----";

  @Override
  public Optional<ECPublicKey> convert(final String pem, final Class<ECPublicKey> targetType,
      final ConversionContext context) {
    try {
      return Optional.of(parsePublicKey(pem));
    } catch (final InvalidKeySpecException e) {
      context.reject(pem, e);
      return Optional.empty();
    }
  }

  /**
   * @param pem a PEM-encoded SubjectPublicKeyInfo structure; the armor lines are optional
   * @return the elliptic curve public key
   * @throws InvalidKeySpecException if the input is not a PEM-encoded elliptic curve public key
   */
  public static ECPublicKey parsePublicKey(final String pem) throws InvalidKeySpecException {
    final String base64 = pem
        .replace(PEM_HEADER, "")
        .replace(PEM_FOOTER, "")
        .replaceAll("\\s", "");

    try {
      final byte[] publicKeyBytes = Base64.getDecoder().decode(base64);
      return (ECPublicKey) KeyFactory.getInstance("EC").generatePublic(new X509EncodedKeySpec(publicKeyBytes));
    } catch (final IllegalArgumentException | ClassCastException e) {
      throw new InvalidKeySpecException("Not a PEM-encoded elliptic curve public key", e);
    } catch (final NoSuchAlgorithmException e) {
      throw new AssertionError("EC key support is unavailable", e);
    }
  }
}
