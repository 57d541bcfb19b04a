/*
 * Where: draw engine infrastructure configuration
 * What: clock and the single-thread executor that dispatches draw events
 * Why: listeners must never run on, or stall, a scheduler thread
 */
package com.tokendraw.engine.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SchedulingConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean(destroyMethod = "shutdown")
  public ExecutorService drawEventExecutor() {
    return Executors.newSingleThreadExecutor(
        new ThreadFactoryBuilder().setNameFormat("draw-events-%d").setDaemon(true).build());
  }
}
