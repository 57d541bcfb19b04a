package com.tokendraw.engine.model;

public record AdminStatus(
    EngineStatus engine,
    HolderStats holders,
    PayoutStats payouts,
    boolean ledgerHealthy,
    String ledgerEndpoint) {}
