/*
 * Where: draw engine configuration binding
 * What: round cadence, presentation timing and payout split
 * Why: a split that does not add up to 100 must stop startup instead of mispaying a round
 */
package com.tokendraw.engine.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "draw.engine")
public record DrawEngineProperties(
    Boolean enabled,
    Duration spinInterval,
    Duration tickInterval,
    Duration spinGuard,
    Duration presentationDelay,
    Duration potRefreshInterval,
    @Positive Integer historySize,
    @DecimalMin("0.0") @DecimalMax("100.0") Double winnerPercentage,
    @DecimalMin("0.0") @DecimalMax("100.0") Double creatorPercentage,
    @Positive Integer errorMessageMaxLength) {

  public DrawEngineProperties {
    enabled = enabled == null ? Boolean.TRUE : enabled;
    spinInterval = spinInterval == null ? Duration.ofMinutes(5) : spinInterval;
    tickInterval = tickInterval == null ? Duration.ofMinutes(1) : tickInterval;
    spinGuard = spinGuard == null ? Duration.ofSeconds(10) : spinGuard;
    presentationDelay = presentationDelay == null ? Duration.ofSeconds(4) : presentationDelay;
    potRefreshInterval = potRefreshInterval == null ? Duration.ofSeconds(10) : potRefreshInterval;
    historySize = historySize == null ? 50 : historySize;
    winnerPercentage = winnerPercentage == null ? 50.0d : winnerPercentage;
    creatorPercentage = creatorPercentage == null ? 50.0d : creatorPercentage;
    errorMessageMaxLength = errorMessageMaxLength == null ? 1000 : errorMessageMaxLength;
  }

  @AssertTrue(message = "winner-percentage and creator-percentage must sum to 100")
  public boolean isPayoutSplitValid() {
    return Math.abs(winnerPercentage + creatorPercentage - 100.0d) < 1e-9;
  }

  @AssertTrue(message = "spin-interval must be positive")
  public boolean isSpinIntervalValid() {
    return !spinInterval.isNegative() && !spinInterval.isZero();
  }
}
