package com.tokendraw.engine.repository;

import static com.tokendraw.common.JdbcTimestampUtils.readInstant;
import static com.tokendraw.common.JdbcTimestampUtils.toTimestamp;

import com.tokendraw.engine.model.Payout;
import com.tokendraw.engine.model.PayoutStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "draw.persistence.enabled", havingValue = "true")
public class JdbcPayoutRepository implements PayoutRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public void save(Payout payout) {
    final String sql =
        """
        INSERT INTO payouts (
          payout_id,
          round_id,
          winner_address,
          winner_amount,
          creator_amount,
          total_amount,
          status,
          attempts,
          settlement_reference,
          error_message,
          created_at,
          completed_at,
          failed_at
        ) VALUES (
          :payoutId,
          :roundId,
          :winnerAddress,
          :winnerAmount,
          :creatorAmount,
          :totalAmount,
          :status,
          :attempts,
          :settlementReference,
          :errorMessage,
          :createdAt,
          :completedAt,
          :failedAt
        )
        ON CONFLICT (payout_id) DO UPDATE
        SET status = EXCLUDED.status,
            attempts = EXCLUDED.attempts,
            settlement_reference = EXCLUDED.settlement_reference,
            error_message = EXCLUDED.error_message,
            completed_at = EXCLUDED.completed_at,
            failed_at = EXCLUDED.failed_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("payoutId", payout.payoutId())
            .addValue("roundId", payout.roundId())
            .addValue("winnerAddress", payout.winnerAddress())
            .addValue("winnerAmount", payout.winnerAmount())
            .addValue("creatorAmount", payout.creatorAmount())
            .addValue("totalAmount", payout.totalAmount())
            .addValue("status", payout.status().name())
            .addValue("attempts", payout.attempts())
            .addValue("settlementReference", payout.settlementReference())
            .addValue("errorMessage", payout.errorMessage())
            .addValue("createdAt", toTimestamp(payout.createdAt()))
            .addValue("completedAt", toTimestamp(payout.completedAt()))
            .addValue("failedAt", toTimestamp(payout.failedAt()));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public List<Payout> findRecentPayouts(int limit) {
    final String sql =
        """
        SELECT payout_id, round_id, winner_address, winner_amount, creator_amount, status,
               attempts, settlement_reference, error_message, created_at, completed_at, failed_at
        FROM payouts
        ORDER BY created_at DESC
        LIMIT :limit
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource("limit", limit), this::mapRow);
  }

  private Payout mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Payout(
        rs.getString("payout_id"),
        rs.getString("round_id"),
        rs.getString("winner_address"),
        rs.getLong("winner_amount"),
        rs.getLong("creator_amount"),
        PayoutStatus.valueOf(rs.getString("status")),
        rs.getInt("attempts"),
        rs.getString("settlement_reference"),
        rs.getString("error_message"),
        readInstant(rs, "created_at"),
        readInstant(rs, "completed_at"),
        readInstant(rs, "failed_at"));
  }
}
