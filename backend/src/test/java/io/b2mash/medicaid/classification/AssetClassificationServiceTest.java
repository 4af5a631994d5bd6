package io.b2mash.medicaid.classification;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.medicaid.config.PlanningProperties;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AssetClassificationServiceTest {

  private final AssetClassificationService service =
      new AssetClassificationService(PlanningProperties.defaults());

  @Test
  void classifyAssets_splitsCountableAndExemptCategories() {
    var result =
        service.classifyAssets(
            Map.of(
                "savings", new BigDecimal("25000"),
                "checking", new BigDecimal("3500.50"),
                "home", new BigDecimal("250000"),
                "burial_funds", new BigDecimal("1500")));

    assertThat(result.countable()).isEqualByComparingTo("28500.50");
    assertThat(result.nonCountable()).isEqualByComparingTo("251500");
    assertThat(result.total()).isEqualByComparingTo("280000.50");
  }

  @Test
  void classifyAssets_treatsUnknownKeysAsCountable() {
    var result = service.classifyAssets(Map.of("rare_stamp_collection", new BigDecimal("9000")));

    assertThat(result.countable()).isEqualByComparingTo("9000");
    assertThat(result.nonCountable()).isEqualByComparingTo("0");
  }

  @Test
  void classifyAssets_normalizesKeysBeforeMatching() {
    var result =
        service.classifyAssets(
            Map.of(
                "Primary Residence", new BigDecimal("100000"),
                "Burial-Funds", new BigDecimal("2000"),
                "Non Countable", new BigDecimal("500")));

    assertThat(result.countable()).isEqualByComparingTo("0");
    assertThat(result.nonCountable()).isEqualByComparingTo("102500");
  }

  @Test
  void classifyAssets_handlesNullMapAndNullValues() {
    assertThat(service.classifyAssets(null).total()).isEqualByComparingTo("0");

    var assets = new HashMap<String, BigDecimal>();
    assets.put("savings", null);
    assets.put("investments", new BigDecimal("10"));
    assertThat(service.classifyAssets(assets).countable()).isEqualByComparingTo("10");
  }

  @Test
  void classifyAssets_usesConfiguredCategories() {
    var custom =
        new AssetClassificationService(
            new PlanningProperties(null, List.of("farm-land"), null, null));

    var result =
        custom.classifyAssets(
            Map.of("farm_land", new BigDecimal("80000"), "home", new BigDecimal("200000")));

    assertThat(result.nonCountable()).isEqualByComparingTo("80000");
    assertThat(result.countable()).isEqualByComparingTo("200000");
  }

  @Test
  void totalIncome_sumsSourcesIncludingNegativeAdjustments() {
    var income =
        Map.of(
            "social_security", new BigDecimal("1800"),
            "pension", new BigDecimal("650.25"),
            "adjustment", new BigDecimal("-50"));

    assertThat(service.totalIncome(income)).isEqualByComparingTo("2400.25");
    assertThat(service.totalIncome(null)).isEqualByComparingTo("0");
  }
}
