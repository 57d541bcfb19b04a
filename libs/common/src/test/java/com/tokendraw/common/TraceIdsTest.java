package com.tokendraw.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class TraceIdsTest {

  @Test
  void prefixedIdCarriesPrefixAndClockMillis() {
    final Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);

    final String id = TraceIds.newPrefixedId("round", clock);

    assertThat(id).matches("round_1700000000000_[0-9a-z]{9}");
  }

  @Test
  void prefixedIdsDifferForSameInstant() {
    final Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);

    assertThat(TraceIds.newPrefixedId("payout", clock))
        .isNotEqualTo(TraceIds.newPrefixedId("payout", clock));
  }

  @Test
  void rejectsBlankPrefix() {
    assertThatThrownBy(() -> TraceIds.newPrefixedId(" ", Clock.systemUTC()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
