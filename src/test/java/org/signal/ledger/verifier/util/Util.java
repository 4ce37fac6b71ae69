/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier.util;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

public class Util {

  public static byte[] generateRandomBytes(final int length) {
    final byte[] bytes = new byte[length];
    new SecureRandom().nextBytes(bytes);
    return bytes;
  }

  public static byte[] bytes(final String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }
}
