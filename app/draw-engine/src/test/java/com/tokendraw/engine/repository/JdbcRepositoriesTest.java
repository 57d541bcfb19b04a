/*
 * Where: JDBC repository integration tests
 * What: upserts and recent-first reads against Postgres
 */
package com.tokendraw.engine.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.tokendraw.engine.model.Holder;
import com.tokendraw.engine.model.Payout;
import com.tokendraw.engine.model.PayoutStatus;
import com.tokendraw.engine.model.Round;
import com.tokendraw.engine.model.RoundStatus;
import java.time.Instant;
import java.util.List;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
class JdbcRepositoriesTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-01T12:00:00Z");

  @Container
  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

  private static NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeAll
  static void migrate() {
    final DriverManagerDataSource dataSource =
        new DriverManagerDataSource(
            POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
    Flyway.configure().dataSource(dataSource).locations("classpath:db/migration").load().migrate();
    jdbcTemplate = new NamedParameterJdbcTemplate(dataSource);
  }

  @BeforeEach
  void cleanup() {
    for (String table : List.of("holders", "rounds", "payouts", "prize_pool")) {
      jdbcTemplate.update("DELETE FROM " + table, new MapSqlParameterSource());
    }
  }

  @Test
  void holderUpsertReplacesBalanceAndEligibility() {
    final JdbcHolderRepository repository = new JdbcHolderRepository(jdbcTemplate);

    repository.upsert(Holder.observed("holder-1", 500L, 1_000L, 100L, BASE_TIME));
    repository.upsert(Holder.observed("holder-1", 50L, 1_000L, 100L, BASE_TIME.plusSeconds(5)));

    final List<Holder> holders = repository.findAll();
    assertThat(holders).hasSize(1);
    assertThat(holders.get(0).balance()).isEqualTo(50L);
    assertThat(holders.get(0).eligible()).isFalse();
    assertThat(holders.get(0).lastObservedAt()).isEqualTo(BASE_TIME.plusSeconds(5));
  }

  @Test
  void roundSaveUpdatesStatusOfExistingRound() {
    final JdbcRoundRepository repository = new JdbcRoundRepository(jdbcTemplate);
    final Holder winner = Holder.observed("winner-1", 700L, 1_000L, 1L, BASE_TIME);
    final Round started = Round.start("round_1", "trace-1", BASE_TIME, 10_000_000L, 2);
    final Round selected = started.winnerSelected(winner);
    final Payout payout =
        Payout.pending("payout_1", "round_1", "winner-1", 5_000_000L, 5_000_000L, BASE_TIME)
            .withAttempts(1)
            .completed("sig-1", BASE_TIME.plusSeconds(10));

    repository.save(selected);
    repository.save(
        selected
            .processingPayout(5_000_000L, 5_000_000L)
            .completed(payout, BASE_TIME.plusSeconds(10)));

    final List<Round> rounds = repository.findRecentRounds(10);
    assertThat(rounds).hasSize(1);
    final Round stored = rounds.get(0);
    assertThat(stored.status()).isEqualTo(RoundStatus.COMPLETED);
    assertThat(stored.winner().address()).isEqualTo("winner-1");
    assertThat(stored.winnerPayout()).isEqualTo(5_000_000L);
    assertThat(stored.payoutId()).isEqualTo("payout_1");
    assertThat(stored.settlementReference()).isEqualTo("sig-1");
    assertThat(stored.endTime()).isEqualTo(BASE_TIME.plusSeconds(10));
  }

  @Test
  void recentRoundsAreNewestFirstAndLimited() {
    final JdbcRoundRepository repository = new JdbcRoundRepository(jdbcTemplate);
    for (int i = 0; i < 3; i++) {
      repository.save(
          Round.start("round_" + i, "trace-" + i, BASE_TIME.plusSeconds(i * 300L), 1L, 0)
              .failed("no entropy", BASE_TIME.plusSeconds(i * 300L + 1)));
    }

    assertThat(repository.findRecentRounds(2))
        .extracting(Round::roundId)
        .containsExactly("round_2", "round_1");
  }

  @Test
  void payoutSaveKeepsLatestAttemptState() {
    final JdbcPayoutRepository repository = new JdbcPayoutRepository(jdbcTemplate);
    final Payout pending =
        Payout.pending("payout_1", "round_1", "winner-1", 600L, 400L, BASE_TIME);

    repository.save(pending.withAttempts(3).failed("blockhash expired", BASE_TIME.plusSeconds(30)));
    repository.save(
        pending.resetForRetry().withAttempts(1).completed("sig-2", BASE_TIME.plusSeconds(90)));

    final List<Payout> payouts = repository.findRecentPayouts(10);
    assertThat(payouts).hasSize(1);
    assertThat(payouts.get(0).status()).isEqualTo(PayoutStatus.COMPLETED);
    assertThat(payouts.get(0).attempts()).isEqualTo(1);
    assertThat(payouts.get(0).settlementReference()).isEqualTo("sig-2");
    assertThat(payouts.get(0).totalAmount()).isEqualTo(1_000L);
  }

  @Test
  void prizePoolStoresSingleCurrentAmount() {
    final JdbcPrizePoolRepository repository = new JdbcPrizePoolRepository(jdbcTemplate);
    assertThat(repository.loadCurrentAmount()).isEmpty();

    repository.saveCurrentAmount(10_000_000L, BASE_TIME);
    repository.saveCurrentAmount(10_500_000L, BASE_TIME.plusSeconds(300));

    assertThat(repository.loadCurrentAmount()).hasValue(10_500_000L);
  }
}
