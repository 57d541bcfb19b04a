package com.tokendraw.engine.event;

import com.tokendraw.engine.model.EngineState;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record DrawEvent(
    String name,
    String roundId,
    String traceId,
    EngineState engineState,
    Instant occurredAt,
    Map<String, Object> data) {

  public DrawEvent {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("event name is required");
    }
    // LinkedHashMap keeps null values, which Map.copyOf would reject.
    data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }
}
