package com.flamingo.ai.companybrain.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for application metrics. */
@Configuration
public class MetricsConfig {

  /**
   * Enables the @Timed annotation on the query pipeline and collaborator clients.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Tags every meter with the application name. */
  @Bean
  public MeterRegistryCustomizer<MeterRegistry> applicationTagCustomizer(
      @Value("${spring.application.name:companybrain}") String applicationName) {
    return registry -> registry.config().commonTags("application", applicationName);
  }
}
