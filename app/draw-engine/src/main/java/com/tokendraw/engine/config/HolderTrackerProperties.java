/*
 * Where: draw engine configuration binding
 * What: tracked mint, eligibility threshold, exclusions and adaptive rescan tiers
 * Why: small populations are rescanned more often than large ones
 */
package com.tokendraw.engine.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "draw.holders")
public record HolderTrackerProperties(
    @NotBlank String tokenMint,
    @DecimalMin("0.0") @DecimalMax("100.0") Double minimumHoldPercentage,
    List<String> excludedAddresses,
    @Positive Integer smallPopulation,
    @Positive Integer mediumPopulation,
    Duration fastInterval,
    Duration mediumInterval,
    Duration slowInterval,
    @Positive Integer topHoldersLimit) {

  /** System program, wrapped SOL mint and the incinerator. */
  public static final Set<String> SYSTEM_ADDRESSES =
      Set.of(
          "11111111111111111111111111111111",
          "So11111111111111111111111111111111111111112",
          "1nc1nerator11111111111111111111111111111111");

  public static final String SYSTEM_ADDRESS_PREFIX = "1111111111111111111111111111111";

  public HolderTrackerProperties {
    minimumHoldPercentage = minimumHoldPercentage == null ? 0.1d : minimumHoldPercentage;
    excludedAddresses = excludedAddresses == null ? List.of() : List.copyOf(excludedAddresses);
    smallPopulation = smallPopulation == null ? 50 : smallPopulation;
    mediumPopulation = mediumPopulation == null ? 200 : mediumPopulation;
    fastInterval = fastInterval == null ? Duration.ofSeconds(5) : fastInterval;
    mediumInterval = mediumInterval == null ? Duration.ofSeconds(15) : mediumInterval;
    slowInterval = slowInterval == null ? Duration.ofSeconds(30) : slowInterval;
    topHoldersLimit = topHoldersLimit == null ? 10 : topHoldersLimit;
  }

  public Duration intervalFor(int eligibleHolders) {
    if (eligibleHolders < smallPopulation) {
      return fastInterval;
    }
    if (eligibleHolders < mediumPopulation) {
      return mediumInterval;
    }
    return slowInterval;
  }

  public boolean isExcluded(String address) {
    return SYSTEM_ADDRESSES.contains(address)
        || excludedAddresses.contains(address)
        || address.startsWith(SYSTEM_ADDRESS_PREFIX);
  }
}
