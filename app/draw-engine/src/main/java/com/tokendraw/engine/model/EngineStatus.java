package com.tokendraw.engine.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public record EngineStatus(
    EngineState state,
    boolean running,
    long currentPot,
    Instant nextSpinTime,
    Duration spinInterval,
    Round currentRound,
    List<Round> recentRounds) {}
