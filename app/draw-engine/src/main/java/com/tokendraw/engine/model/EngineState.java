/*
 * Where: draw engine domain model
 * What: states of the round cycle state machine
 * Why: one engine-wide state field serializes rounds
 */
package com.tokendraw.engine.model;

public enum EngineState {
  WAITING,
  SPINNING,
  WINNER_SELECTED,
  PROCESSING_PAYOUT,
  COMPLETED,
  PAUSED
}
