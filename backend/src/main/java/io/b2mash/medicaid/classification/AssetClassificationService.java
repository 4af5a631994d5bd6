package io.b2mash.medicaid.classification;

import io.b2mash.medicaid.config.PlanningProperties;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Stateless classifier for declared assets and income. Asset keys are normalized (lower case,
 * spaces and hyphens to underscores) before they are matched against the configured non-countable
 * categories; any key that is not listed is countable.
 */
@Service
public class AssetClassificationService {

  private static final Logger log = LoggerFactory.getLogger(AssetClassificationService.class);
  private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-]+");

  static final String NON_COUNTABLE_BUCKET = "non_countable";

  private final Set<String> nonCountableCategories;

  public AssetClassificationService(PlanningProperties planningProperties) {
    this.nonCountableCategories =
        planningProperties.nonCountableAssetCategories().stream()
            .map(AssetClassificationService::normalizeKey)
            .collect(Collectors.toUnmodifiableSet());
  }

  /**
   * Classifies assets as countable or non-countable. Never throws for unknown keys: Medicaid
   * presumes an asset countable unless it is explicitly exempt.
   *
   * @param assets asset values keyed by asset type; null map or null values count as zero
   * @return countable and non-countable totals
   */
  public AssetClassification classifyAssets(Map<String, BigDecimal> assets) {
    BigDecimal countable = BigDecimal.ZERO;
    BigDecimal nonCountable = BigDecimal.ZERO;
    if (assets == null) {
      return new AssetClassification(countable, nonCountable);
    }

    for (var entry : assets.entrySet()) {
      BigDecimal amount = entry.getValue() != null ? entry.getValue() : BigDecimal.ZERO;
      String key = entry.getKey() != null ? normalizeKey(entry.getKey()) : "";
      if (NON_COUNTABLE_BUCKET.equals(key) || nonCountableCategories.contains(key)) {
        nonCountable = nonCountable.add(amount);
      } else {
        countable = countable.add(amount);
      }
    }

    log.debug(
        "Classified {} asset entries: countable={}, nonCountable={}",
        assets.size(),
        countable,
        nonCountable);
    return new AssetClassification(countable, nonCountable);
  }

  /**
   * Sums all income sources into one monthly figure. Negative entries are kept as-is so corrective
   * adjustments can be modeled.
   */
  public BigDecimal totalIncome(Map<String, BigDecimal> income) {
    if (income == null) {
      return BigDecimal.ZERO;
    }
    return income.values().stream()
        .filter(v -> v != null)
        .reduce(BigDecimal.ZERO, BigDecimal::add);
  }

  static String normalizeKey(String key) {
    return SEPARATORS.matcher(key.trim().toLowerCase()).replaceAll("_");
  }
}
