/*
 * Where: draw engine domain model
 * What: the transfers a payout submits in one ledger transaction
 * Why: the signer receives a complete plan and never reads payout state directly
 */
package com.tokendraw.engine.model;

import java.util.List;

public record DisbursementPlan(
    String payoutId, String payer, String mint, List<TransferInstruction> transfers) {

  public DisbursementPlan {
    transfers = List.copyOf(transfers);
  }

  public long totalAmount() {
    return transfers.stream().mapToLong(TransferInstruction::amount).sum();
  }
}
