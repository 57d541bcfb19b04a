package com.tokendraw.engine.repository;

import com.tokendraw.engine.model.Payout;
import java.util.List;

public interface PayoutRepository {

  void save(Payout payout);

  /** Most recent first. */
  List<Payout> findRecentPayouts(int limit);
}
