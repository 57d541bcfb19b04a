package com.tokendraw.engine.ledger;

import com.tokendraw.engine.model.DisbursementPlan;

/** Holds the disbursing key and turns a plan into a signed wire transaction. */
public interface TransactionSigner {

  String signerAddress();

  /** Returns the base64 encoded signed transaction bound to {@code recentBlockhash}. */
  String sign(DisbursementPlan plan, String recentBlockhash);
}
