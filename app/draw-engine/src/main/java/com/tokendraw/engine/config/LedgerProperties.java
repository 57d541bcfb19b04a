/*
 * Where: draw engine configuration binding
 * What: ledger RPC endpoints, retry policy and the external signer
 * Why: failover needs an ordered endpoint list and a shared retry budget
 */
package com.tokendraw.engine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "ledger")
public record LedgerProperties(
    @NotBlank String primaryUrl,
    List<String> backupUrls,
    @Positive Integer maxRetries,
    Duration backoffBase,
    Duration confirmPollInterval,
    String commitment,
    Duration connectTimeout,
    Duration readTimeout,
    @Valid Signer signer) {

  public LedgerProperties {
    backupUrls =
        backupUrls == null
            ? List.of()
            : backupUrls.stream().filter(url -> url != null && !url.isBlank()).toList();
    maxRetries = maxRetries == null ? 3 : maxRetries;
    backoffBase = backoffBase == null ? Duration.ofSeconds(2) : backoffBase;
    confirmPollInterval = confirmPollInterval == null ? Duration.ofSeconds(2) : confirmPollInterval;
    commitment = commitment == null || commitment.isBlank() ? "confirmed" : commitment;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(30) : readTimeout;
    signer = signer == null ? new Signer(false, null, null) : signer;
  }

  /** Primary first, then backups in configured order. */
  public List<String> endpointUrls() {
    final List<String> urls = new ArrayList<>();
    urls.add(primaryUrl);
    urls.addAll(backupUrls);
    return urls;
  }

  public record Signer(boolean enabled, String baseUrl, String signPath) {

    public Signer {
      signPath = signPath == null || signPath.isBlank() ? "/v1/transactions/sign" : signPath;
    }
  }
}
