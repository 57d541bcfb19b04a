/*
 * Where: draw engine configuration binding
 * What: NATS connection and the subject prefix draw events are relayed under
 * Why: each environment relays to its own subject tree
 */
package com.tokendraw.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(
    boolean enabled, String url, Integer connectionTimeout, String subjectPrefix) {

  public NatsProperties {
    connectionTimeout = connectionTimeout == null ? 5 : connectionTimeout;
    subjectPrefix = subjectPrefix == null || subjectPrefix.isBlank() ? "draw.events" : subjectPrefix;
  }
}
