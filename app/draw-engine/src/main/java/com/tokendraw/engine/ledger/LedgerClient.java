package com.tokendraw.engine.ledger;

import com.tokendraw.engine.model.SignatureStatus;
import com.tokendraw.engine.model.TokenAccount;
import java.util.List;
import java.util.Optional;

/**
 * Read and submit capability against a single ledger RPC endpoint.
 *
 * <p>Implementations throw {@link LedgerIntegrationException} on any transport or RPC failure and
 * never retry themselves; {@link LedgerGateway} owns retries and failover.
 */
public interface LedgerClient {

  String endpoint();

  boolean isHealthy();

  long getTokenSupply(String mint);

  /** Every token account of the mint, regardless of owner. */
  List<TokenAccount> getTokenAccounts(String mint);

  String getLatestBlockhash();

  List<TokenAccount> getTokenAccountsByOwner(String owner, String mint);

  /** Submits a signed base64 wire transaction and returns its signature. */
  String sendTransaction(String encodedTransaction);

  /** Empty while the ledger has not seen the signature yet. */
  Optional<SignatureStatus> getSignatureStatus(String signature);
}
