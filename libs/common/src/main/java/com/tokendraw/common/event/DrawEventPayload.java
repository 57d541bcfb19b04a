/*
 * Where: shared event payload definition
 * What: wire shape of a draw event relayed to external listeners
 * Why: dashboard and persistence consumers read one payload layout
 */
package com.tokendraw.common.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DrawEventPayload(
    String eventId,
    String eventName,
    String occurredAt,
    String roundId,
    String engineState,
    String traceId,
    Map<String, Object> data) {

  public DrawEventPayload {
    data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }
}
