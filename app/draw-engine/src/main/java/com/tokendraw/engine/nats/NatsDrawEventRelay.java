/*
 * Where: draw engine event boundary
 * What: relays every draw event to NATS as a JSON payload
 * Why: dashboards and other services follow the round cycle without polling the engine
 */
package com.tokendraw.engine.nats;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokendraw.common.event.DrawEventPayload;
import com.tokendraw.engine.config.NatsProperties;
import com.tokendraw.engine.event.DrawEvent;
import com.tokendraw.engine.event.DrawEventListener;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.Connection;
import io.nats.client.impl.Headers;
import java.util.UUID;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true")
public class NatsDrawEventRelay implements DrawEventListener {

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "NATS Connection is a shared Spring-managed component and cannot be copied")
  private final Connection connection;

  private final ObjectMapper objectMapper;
  private final NatsProperties properties;

  public NatsDrawEventRelay(
      Connection connection, ObjectMapper objectMapper, NatsProperties properties) {
    this.connection = connection;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  @Override
  public void onEvent(DrawEvent event) {
    final String eventId = UUID.randomUUID().toString();
    final DrawEventPayload payload =
        new DrawEventPayload(
            eventId,
            event.name(),
            event.occurredAt() == null ? null : event.occurredAt().toString(),
            event.roundId(),
            event.engineState() == null ? null : event.engineState().name(),
            event.traceId(),
            event.data());
    final byte[] body;
    try {
      body = objectMapper.writeValueAsBytes(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize draw event " + event.name(), ex);
    }
    final Headers headers = new Headers();
    headers.add("Nats-Msg-Id", eventId);
    connection.publish(subjectFor(event.name()), headers, body);
  }

  String subjectFor(String eventName) {
    return properties.subjectPrefix() + "." + eventName;
  }
}
