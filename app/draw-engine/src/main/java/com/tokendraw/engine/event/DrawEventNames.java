package com.tokendraw.engine.event;

public final class DrawEventNames {

  public static final String COUNTDOWN = "countdown";
  public static final String SPIN_START = "spinStart";
  public static final String WINNER_SELECTED = "winnerSelected";
  public static final String PAYOUT_COMPLETED = "payoutCompleted";
  public static final String PAYOUT_FAILED = "payoutFailed";
  public static final String POT_UPDATE = "potUpdate";
  public static final String POT_GROWTH_UPDATE = "potGrowthUpdate";
  public static final String HOLDER_UPDATE = "holderUpdate";
  public static final String ELIGIBILITY_CHANGE = "eligibilityChange";
  public static final String NEW_HOLDER_ALERT = "newHolderAlert";
  public static final String ENGINE_STATE_CHANGED = "engineStateChanged";

  private DrawEventNames() {}
}
