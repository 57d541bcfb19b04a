package com.tokendraw.engine.model;

public record EngineStats(
    int totalRounds,
    int completedRounds,
    int failedRounds,
    long totalWinnerPayouts,
    long averagePot,
    long currentPot,
    EngineState state) {}
