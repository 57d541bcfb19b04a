package com.tokendraw.engine.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public record HolderStats(
    int totalHolders,
    int eligibleHolders,
    long totalSupply,
    long minimumHoldAmount,
    double minimumHoldPercentage,
    Instant lastUpdate,
    boolean tracking,
    Duration rescanInterval,
    List<Holder> topHolders) {}
