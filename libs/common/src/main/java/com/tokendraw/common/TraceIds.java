package com.tokendraw.common;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

public final class TraceIds {
  private static final int SUFFIX_LENGTH = 9;
  private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /**
   * Builds a sortable identifier of the form {@code <prefix>_<epochMillis>_<base36 suffix>}.
   */
  public static String newPrefixedId(String prefix, Clock clock) {
    if (prefix == null || prefix.isBlank()) {
      throw new IllegalArgumentException("prefix is required");
    }
    final StringBuilder suffix = new StringBuilder(SUFFIX_LENGTH);
    final ThreadLocalRandom random = ThreadLocalRandom.current();
    for (int i = 0; i < SUFFIX_LENGTH; i++) {
      suffix.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
    }
    return prefix + "_" + clock.millis() + "_" + suffix;
  }
}
