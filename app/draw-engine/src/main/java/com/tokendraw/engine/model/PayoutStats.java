package com.tokendraw.engine.model;

public record PayoutStats(
    int totalPayouts,
    int completedPayouts,
    int failedPayouts,
    int simulatedPayouts,
    int pendingPayouts,
    long totalPaidOut,
    long totalWinnerPayouts,
    long totalCreatorPayouts,
    long averagePayoutAmount,
    double successRate) {}
