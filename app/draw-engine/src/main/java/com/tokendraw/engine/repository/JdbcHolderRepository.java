/*
 * Where: draw engine data access
 * What: upserts observed holders into the holders table
 * Why: a restart resumes with the last known holder set before the first rescan lands
 */
package com.tokendraw.engine.repository;

import static com.tokendraw.common.JdbcTimestampUtils.readInstant;
import static com.tokendraw.common.JdbcTimestampUtils.toTimestamp;

import com.tokendraw.engine.model.Holder;
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
public class JdbcHolderRepository implements HolderRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public void upsert(Holder holder) {
    final String sql =
        """
        INSERT INTO holders (address, balance, percentage_of_supply, is_eligible, last_observed_at)
        VALUES (:address, :balance, :percentage, :eligible, :lastObservedAt)
        ON CONFLICT (address) DO UPDATE
        SET balance = EXCLUDED.balance,
            percentage_of_supply = EXCLUDED.percentage_of_supply,
            is_eligible = EXCLUDED.is_eligible,
            last_observed_at = EXCLUDED.last_observed_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("address", holder.address())
            .addValue("balance", holder.balance())
            .addValue("percentage", holder.percentageOfSupply())
            .addValue("eligible", holder.eligible())
            .addValue("lastObservedAt", toTimestamp(holder.lastObservedAt()));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public List<Holder> findAll() {
    final String sql =
        """
        SELECT address, balance, percentage_of_supply, is_eligible, last_observed_at
        FROM holders
        ORDER BY balance DESC, address
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  private Holder mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Holder(
        rs.getString("address"),
        rs.getLong("balance"),
        rs.getDouble("percentage_of_supply"),
        rs.getBoolean("is_eligible"),
        readInstant(rs, "last_observed_at"));
  }
}
