/*
 * Where: draw engine configuration
 * What: one JSON-RPC client per configured ledger endpoint, wrapped in the failover gateway
 * Why: each endpoint keeps its own base URL and timeouts
 */
package com.tokendraw.engine.config;

import com.tokendraw.engine.ledger.LedgerClient;
import com.tokendraw.engine.ledger.LedgerGateway;
import com.tokendraw.engine.ledger.SolanaRpcClient;
import com.tokendraw.engine.service.DrawMetrics;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class LedgerClientConfig {

  @Bean
  LedgerGateway ledgerGateway(
      RestClient.Builder builder, LedgerProperties properties, DrawMetrics metrics) {
    final List<LedgerClient> clients =
        properties.endpointUrls().stream()
            .map(url -> (LedgerClient) newClient(builder, url, properties))
            .toList();
    return new LedgerGateway(clients, properties, metrics);
  }

  private SolanaRpcClient newClient(
      RestClient.Builder builder, String url, LedgerProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    final RestClient restClient = builder.clone().requestFactory(requestFactory).build();
    return new SolanaRpcClient(url, restClient, properties.commitment());
  }
}
