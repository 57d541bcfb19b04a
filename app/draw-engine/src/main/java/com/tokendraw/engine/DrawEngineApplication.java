/*
 * Where: draw engine entry point
 * What: boots Spring with configuration scanning and scheduling
 * Why: the round cycle, rescans and payouts all run on the shared task scheduler
 */
package com.tokendraw.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class DrawEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(DrawEngineApplication.class, args);
  }
}
