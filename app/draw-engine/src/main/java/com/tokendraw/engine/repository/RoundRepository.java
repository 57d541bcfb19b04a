package com.tokendraw.engine.repository;

import com.tokendraw.engine.model.Round;
import java.util.List;

public interface RoundRepository {

  void save(Round round);

  /** Most recent first. */
  List<Round> findRecentRounds(int limit);
}
