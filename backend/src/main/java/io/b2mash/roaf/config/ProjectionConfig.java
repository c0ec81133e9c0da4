package io.b2mash.roaf.config;

import io.b2mash.roaf.picklist.PicklistPackLoader;
import io.b2mash.roaf.picklist.PicklistRegistry;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.support.ResourcePatternResolver;
import tools.jackson.databind.ObjectMapper;

@Configuration
@EnableConfigurationProperties(ProjectionProperties.class)
public class ProjectionConfig {

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  PicklistPackLoader picklistPackLoader(
      ResourcePatternResolver resourcePatternResolver, ObjectMapper objectMapper) {
    return new PicklistPackLoader(resourcePatternResolver, objectMapper);
  }

  /** Loaded once; the registry is immutable and shared by every projection. */
  @Bean
  PicklistRegistry picklistRegistry(PicklistPackLoader loader, ProjectionProperties properties) {
    return loader.load(properties.picklistLocation());
  }
}
