package com.tokendraw.engine.repository;

import static com.tokendraw.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "draw.persistence.enabled", havingValue = "true")
public class JdbcPrizePoolRepository implements PrizePoolRepository {

  // Single-row table.
  private static final int POOL_ID = 1;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public void saveCurrentAmount(long amount, Instant updatedAt) {
    final String sql =
        """
        INSERT INTO prize_pool (id, current_amount, updated_at)
        VALUES (:id, :amount, :updatedAt)
        ON CONFLICT (id) DO UPDATE
        SET current_amount = EXCLUDED.current_amount,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", POOL_ID)
            .addValue("amount", amount)
            .addValue("updatedAt", toTimestamp(updatedAt));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public OptionalLong loadCurrentAmount() {
    final List<Long> amounts =
        jdbcTemplate.query(
            "SELECT current_amount FROM prize_pool WHERE id = :id",
            new MapSqlParameterSource("id", POOL_ID),
            (rs, rowNum) -> rs.getLong("current_amount"));
    return amounts.isEmpty() ? OptionalLong.empty() : OptionalLong.of(amounts.get(0));
  }
}
