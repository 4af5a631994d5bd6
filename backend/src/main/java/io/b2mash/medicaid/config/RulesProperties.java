package io.b2mash.medicaid.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for the Medicaid rules provider chain.
 *
 * @param location classpath pattern of the rules-year JSON files
 * @param cacheTtl how long a loaded rule set is served before it is fetched again
 * @param cacheMaximumSize upper bound on cached (jurisdiction, year) entries
 */
@ConfigurationProperties(prefix = "medicaid.rules")
public record RulesProperties(String location, Duration cacheTtl, long cacheMaximumSize) {

  public RulesProperties {
    if (location == null || location.isBlank()) {
      location = "classpath:medicaid-rules/*.json";
    }
    if (cacheTtl == null) {
      cacheTtl = Duration.ofHours(1);
    }
    if (cacheMaximumSize <= 0) {
      cacheMaximumSize = 500;
    }
  }
}
