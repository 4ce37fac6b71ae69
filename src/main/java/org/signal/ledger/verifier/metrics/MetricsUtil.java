/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.ledger.verifier.metrics;

public class MetricsUtil {

  public static final String PREFIX = "ledgerVerifier";

  /**
   * @return a dot-separated metric name qualified by the project prefix and the simple name of {@code clazz}
   */
  public static String name(final Class<?> clazz, final String metricName) {
    return PREFIX + "." + clazz.getSimpleName() + "." + metricName;
  }
}
