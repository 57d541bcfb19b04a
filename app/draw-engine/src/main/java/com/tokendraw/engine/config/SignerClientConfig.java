/*
 * Where: draw engine configuration
 * What: wires the remote transaction signer when one is configured
 * Why: without a signer the payout pipeline runs in simulated mode
 */
package com.tokendraw.engine.config;

import com.tokendraw.engine.ledger.RemoteTransactionSigner;
import com.tokendraw.engine.ledger.TransactionSigner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
@ConditionalOnProperty(prefix = "ledger.signer", name = "enabled", havingValue = "true")
public class SignerClientConfig {

  @Bean
  RestClient signerRestClient(RestClient.Builder builder, LedgerProperties properties) {
    return builder.clone().baseUrl(properties.signer().baseUrl()).build();
  }

  @Bean
  TransactionSigner transactionSigner(
      RestClient signerRestClient, LedgerProperties properties, PayoutProperties payoutProperties) {
    return new RemoteTransactionSigner(
        signerRestClient, properties.signer().signPath(), payoutProperties.disbursingWallet());
  }
}
