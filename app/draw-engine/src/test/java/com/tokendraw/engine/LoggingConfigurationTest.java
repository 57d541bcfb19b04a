/*
 * Where: draw-engine logging configuration test
 * What: JSON encoder and MDC correlation fields are present
 * Why: round and payout logs must stay correlatable
 */
package com.tokendraw.engine;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class LoggingConfigurationTest {

  @Test
  void logbackConfigurationContainsJsonAndCorrelationFields() throws IOException {
    final ClassPathResource resource = new ClassPathResource("logback-spring.xml");
    assertThat(resource.exists()).isTrue();

    final String configText =
        new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);

    assertThat(configText).contains("LoggingEventCompositeJsonEncoder");
    assertThat(configText).contains("\"trace_id\":\"%X{trace_id:-}\"");
    assertThat(configText).contains("\"round_id\":\"%X{round_id:-}\"");
    assertThat(configText).contains("\"payout_id\":\"%X{payout_id:-}\"");
  }
}
