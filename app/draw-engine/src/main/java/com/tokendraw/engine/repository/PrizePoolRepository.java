package com.tokendraw.engine.repository;

import java.time.Instant;
import java.util.OptionalLong;

public interface PrizePoolRepository {

  void saveCurrentAmount(long amount, Instant updatedAt);

  OptionalLong loadCurrentAmount();
}
