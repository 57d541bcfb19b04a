package com.tokendraw.engine.repository;

import static com.tokendraw.common.JdbcTimestampUtils.readInstant;
import static com.tokendraw.common.JdbcTimestampUtils.toTimestamp;

import com.tokendraw.engine.model.Holder;
import com.tokendraw.engine.model.Round;
import com.tokendraw.engine.model.RoundStatus;
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
public class JdbcRoundRepository implements RoundRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public void save(Round round) {
    final String sql =
        """
        INSERT INTO rounds (
          round_id,
          trace_id,
          start_time,
          end_time,
          pot_amount,
          eligible_holders_count,
          winner_address,
          winner_balance,
          winner_payout,
          creator_payout,
          payout_id,
          settlement_reference,
          status,
          error_message
        ) VALUES (
          :roundId,
          :traceId,
          :startTime,
          :endTime,
          :potAmount,
          :eligibleHolders,
          :winnerAddress,
          :winnerBalance,
          :winnerPayout,
          :creatorPayout,
          :payoutId,
          :settlementReference,
          :status,
          :errorMessage
        )
        ON CONFLICT (round_id) DO UPDATE
        SET end_time = EXCLUDED.end_time,
            winner_address = EXCLUDED.winner_address,
            winner_balance = EXCLUDED.winner_balance,
            winner_payout = EXCLUDED.winner_payout,
            creator_payout = EXCLUDED.creator_payout,
            payout_id = EXCLUDED.payout_id,
            settlement_reference = EXCLUDED.settlement_reference,
            status = EXCLUDED.status,
            error_message = EXCLUDED.error_message
        """;
    final Holder winner = round.winner();
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("roundId", round.roundId())
            .addValue("traceId", round.traceId())
            .addValue("startTime", toTimestamp(round.startTime()))
            .addValue("endTime", toTimestamp(round.endTime()))
            .addValue("potAmount", round.potAmountAtStart())
            .addValue("eligibleHolders", round.eligibleHolderCountAtStart())
            .addValue("winnerAddress", winner == null ? null : winner.address())
            .addValue("winnerBalance", winner == null ? null : winner.balance())
            .addValue("winnerPayout", round.winnerPayout())
            .addValue("creatorPayout", round.creatorPayout())
            .addValue("payoutId", round.payoutId())
            .addValue("settlementReference", round.settlementReference())
            .addValue("status", round.status().name())
            .addValue("errorMessage", round.errorMessage());
    jdbcTemplate.update(sql, params);
  }

  @Override
  public List<Round> findRecentRounds(int limit) {
    final String sql =
        """
        SELECT round_id, trace_id, start_time, end_time, pot_amount, eligible_holders_count,
               winner_address, winner_balance, winner_payout, creator_payout,
               payout_id, settlement_reference, status, error_message
        FROM rounds
        ORDER BY start_time DESC
        LIMIT :limit
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource("limit", limit), this::mapRow);
  }

  private Round mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String winnerAddress = rs.getString("winner_address");
    final Holder winner =
        winnerAddress == null
            ? null
            : new Holder(winnerAddress, rs.getLong("winner_balance"), 0.0d, true, null);
    return new Round(
        rs.getString("round_id"),
        rs.getString("trace_id"),
        readInstant(rs, "start_time"),
        rs.getLong("pot_amount"),
        rs.getInt("eligible_holders_count"),
        winner,
        rs.getLong("winner_payout"),
        rs.getLong("creator_payout"),
        rs.getString("payout_id"),
        rs.getString("settlement_reference"),
        RoundStatus.valueOf(rs.getString("status")),
        rs.getString("error_message"),
        readInstant(rs, "end_time"));
  }
}
