/*
 * Where: draw engine data access
 * What: storage that keeps nothing, used when persistence is disabled
 * Why: the engine runs fully in memory without a database
 */
package com.tokendraw.engine.repository;

import com.tokendraw.engine.model.Holder;
import com.tokendraw.engine.model.Payout;
import com.tokendraw.engine.model.Round;
import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(
    name = "draw.persistence.enabled",
    havingValue = "false",
    matchIfMissing = true)
public class NoopDrawRepository
    implements HolderRepository, RoundRepository, PayoutRepository, PrizePoolRepository {

  @Override
  public void upsert(Holder holder) {}

  @Override
  public List<Holder> findAll() {
    return List.of();
  }

  @Override
  public void save(Round round) {}

  @Override
  public List<Round> findRecentRounds(int limit) {
    return List.of();
  }

  @Override
  public void save(Payout payout) {}

  @Override
  public List<Payout> findRecentPayouts(int limit) {
    return List.of();
  }

  @Override
  public void saveCurrentAmount(long amount, Instant updatedAt) {}

  @Override
  public OptionalLong loadCurrentAmount() {
    return OptionalLong.empty();
  }
}
