package com.tokendraw.engine.ledger.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SignTransactionRequest(
    String requestId, String payer, String mint, String recentBlockhash, List<Transfer> transfers) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Transfer(String recipient, long amount, boolean createRecipientAccount) {}
}
