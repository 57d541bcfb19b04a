/*
 * Where: draw engine configuration binding
 * What: payout wallets, retry policy and history retention
 * Why: operational parameters of disbursement stay outside the code
 */
package com.tokendraw.engine.config;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "draw.payout")
public record PayoutProperties(
    @Positive Integer maxRetryAttempts,
    Duration retryBaseDelay,
    @Positive Integer historySize,
    String payoutMint,
    String disbursingWallet,
    String creatorWallet,
    @PositiveOrZero Long minimumDisbursingBalance,
    @Positive Integer errorMessageMaxLength,
    Duration confirmTimeout) {

  public PayoutProperties {
    maxRetryAttempts = maxRetryAttempts == null ? 3 : maxRetryAttempts;
    retryBaseDelay = retryBaseDelay == null ? Duration.ofSeconds(5) : retryBaseDelay;
    historySize = historySize == null ? 100 : historySize;
    payoutMint =
        payoutMint == null || payoutMint.isBlank() ? PotProperties.WRAPPED_SOL_MINT : payoutMint;
    minimumDisbursingBalance =
        minimumDisbursingBalance == null ? 100_000_000L : minimumDisbursingBalance;
    errorMessageMaxLength = errorMessageMaxLength == null ? 1000 : errorMessageMaxLength;
    confirmTimeout = confirmTimeout == null ? Duration.ofSeconds(60) : confirmTimeout;
  }

  public boolean hasCreatorWallet() {
    return creatorWallet != null && !creatorWallet.isBlank();
  }
}
