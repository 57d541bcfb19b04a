/*
 * Where: draw engine configuration binding
 * What: prize pool growth parameters and the optional funding source
 * Why: growth rate and caps differ per deployment
 */
package com.tokendraw.engine.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "draw.pot")
public record PotProperties(
    @DecimalMin("0.0") @DecimalMax("1.0") Double growthRate,
    @PositiveOrZero Long baseAmount,
    @PositiveOrZero Long maxGrowth,
    String fundingWallet,
    String fundingMint,
    @DecimalMin("0.0") @DecimalMax("1.0") Double fundingShare) {

  public static final String WRAPPED_SOL_MINT = "So11111111111111111111111111111111111111112";

  public PotProperties {
    growthRate = growthRate == null ? 0.05d : growthRate;
    baseAmount = baseAmount == null ? 10_000_000L : baseAmount;
    maxGrowth = maxGrowth == null ? 1_000_000_000L : maxGrowth;
    fundingMint = fundingMint == null || fundingMint.isBlank() ? WRAPPED_SOL_MINT : fundingMint;
    fundingShare = fundingShare == null ? 0.7d : fundingShare;
  }

  public boolean fundingEnabled() {
    return fundingWallet != null && !fundingWallet.isBlank();
  }
}
