package io.b2mash.medicaid.config;

import io.b2mash.medicaid.rules.CachingRulesProvider;
import io.b2mash.medicaid.rules.ClasspathRulesProvider;
import io.b2mash.medicaid.rules.JurisdictionResolver;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.io.support.ResourcePatternResolver;
import tools.jackson.databind.json.JsonMapper;

@Configuration
@EnableConfigurationProperties({RulesProperties.class, PlanningProperties.class})
public class PlanningConfig {

  @Bean
  ClasspathRulesProvider classpathRulesProvider(
      ResourcePatternResolver resourceResolver,
      JurisdictionResolver jurisdictionResolver,
      RulesProperties rulesProperties) {
    return new ClasspathRulesProvider(
        resourceResolver,
        JsonMapper.builder().build(),
        jurisdictionResolver,
        rulesProperties.location());
  }

  @Bean
  @Primary
  CachingRulesProvider rulesProvider(
      ClasspathRulesProvider classpathRulesProvider, RulesProperties rulesProperties) {
    return new CachingRulesProvider(
        classpathRulesProvider, rulesProperties.cacheTtl(), rulesProperties.cacheMaximumSize());
  }

  @Bean
  Clock clock() {
    return Clock.systemDefaultZone();
  }
}
