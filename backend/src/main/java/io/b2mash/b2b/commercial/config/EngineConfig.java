package io.b2mash.b2b.commercial.config;

import io.b2mash.b2b.commercial.engine.DocumentLifecycle;
import io.b2mash.b2b.commercial.engine.TransformationBuilder;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Exposes the lifecycle engine as beans sharing one injectable clock. */
@Configuration
public class EngineConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public DocumentLifecycle documentLifecycle(Clock clock) {
    return new DocumentLifecycle(clock);
  }

  @Bean
  public TransformationBuilder transformationBuilder(Clock clock, DocumentLifecycle lifecycle) {
    return new TransformationBuilder(clock, lifecycle);
  }
}
