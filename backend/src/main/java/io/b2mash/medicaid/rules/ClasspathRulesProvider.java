package io.b2mash.medicaid.rules;

import io.b2mash.medicaid.exception.RulesNotFoundException;
import io.b2mash.medicaid.rules.RulesDefinition.JurisdictionRules;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;
import tools.jackson.databind.ObjectMapper;

/**
 * Rules provider backed by JSON files on the classpath, one file per rules year. Files are read
 * and validated once at construction; a malformed file fails startup with the file name.
 * Jurisdiction keys in the files go through the same {@link JurisdictionResolver} table as request
 * input, so "FL" and "florida" in data both land on {@code florida}.
 */
public class ClasspathRulesProvider implements RulesProvider {

  private static final Logger log = LoggerFactory.getLogger(ClasspathRulesProvider.class);

  private final Map<RulesKey, RuleSet> rules;

  public ClasspathRulesProvider(
      ResourcePatternResolver resourceResolver,
      ObjectMapper objectMapper,
      JurisdictionResolver jurisdictionResolver,
      String location) {
    this.rules = Map.copyOf(load(resourceResolver, objectMapper, jurisdictionResolver, location));
    log.info("Loaded {} Medicaid rule sets from {}", rules.size(), location);
  }

  @Override
  public RuleSet getRules(Jurisdiction jurisdiction, int year) {
    var ruleSet = rules.get(new RulesKey(jurisdiction, year));
    if (ruleSet == null) {
      throw new RulesNotFoundException(jurisdiction, year);
    }
    return ruleSet;
  }

  @Override
  public RuleSet getLatestRules(Jurisdiction jurisdiction, int year) {
    return rules.values().stream()
        .filter(r -> r.jurisdiction().equals(jurisdiction) && r.year() <= year)
        .max(Comparator.comparingInt(RuleSet::year))
        .orElseThrow(() -> new RulesNotFoundException(jurisdiction, year));
  }

  /** Returns the (jurisdiction, year) pairs this provider can serve. */
  public Set<RulesKey> availableKeys() {
    return rules.keySet();
  }

  private static Map<RulesKey, RuleSet> load(
      ResourcePatternResolver resourceResolver,
      ObjectMapper objectMapper,
      JurisdictionResolver jurisdictionResolver,
      String location) {
    Resource[] resources;
    try {
      resources = resourceResolver.getResources(location);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to scan for Medicaid rules at " + location, e);
    }

    var loaded = new HashMap<RulesKey, RuleSet>();
    for (Resource resource : resources) {
      RulesDefinition definition;
      try {
        definition = objectMapper.readValue(resource.getInputStream(), RulesDefinition.class);
      } catch (Exception e) {
        throw new IllegalStateException(
            "Failed to parse Medicaid rules: " + resource.getFilename(), e);
      }
      if (definition.jurisdictions() == null) {
        log.warn("Rules file {} declares no jurisdictions", resource.getFilename());
        continue;
      }
      for (JurisdictionRules entry : definition.jurisdictions()) {
        RuleSet ruleSet;
        try {
          ruleSet = toRuleSet(entry, definition.year(), jurisdictionResolver);
        } catch (RuntimeException e) {
          throw new IllegalStateException(
              "Invalid Medicaid rules for "
                  + entry.jurisdiction()
                  + " in "
                  + resource.getFilename()
                  + ": "
                  + e.getMessage(),
              e);
        }
        var key = new RulesKey(ruleSet.jurisdiction(), ruleSet.year());
        if (loaded.putIfAbsent(key, ruleSet) != null) {
          throw new IllegalStateException(
              "Duplicate Medicaid rules for " + key + " in " + resource.getFilename());
        }
      }
    }
    return loaded;
  }

  static RuleSet toRuleSet(
      JurisdictionRules entry, int year, JurisdictionResolver jurisdictionResolver) {
    var jurisdiction = jurisdictionResolver.resolve(entry.jurisdiction());
    BigDecimal resourceLimitMarried =
        entry.resourceLimitMarried() != null
            ? entry.resourceLimitMarried()
            : entry.resourceLimitSingle() != null
                ? entry.resourceLimitSingle().multiply(BigDecimal.valueOf(2))
                : null;
    BigDecimal incomeLimitMarried =
        entry.incomeLimitMarried() != null ? entry.incomeLimitMarried() : entry.incomeLimitSingle();
    return new RuleSet(
        jurisdiction,
        year,
        entry.resourceLimitSingle(),
        resourceLimitMarried,
        entry.incomeLimitSingle(),
        incomeLimitMarried,
        entry.lookbackMonths() != null ? entry.lookbackMonths() : 0,
        entry.annualGiftExclusion(),
        entry.penaltyDivisor(),
        entry.exemptTransferCategories() != null
            ? new HashSet<>(entry.exemptTransferCategories())
            : Set.of());
  }
}
