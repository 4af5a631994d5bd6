package io.b2mash.medicaid.rules;

import java.math.BigDecimal;
import java.util.List;

/** DTO record for deserializing a rules-year JSON file from the classpath. */
public record RulesDefinition(int year, List<JurisdictionRules> jurisdictions) {

  public record JurisdictionRules(
      String jurisdiction,
      String programName,
      BigDecimal resourceLimitSingle,
      BigDecimal resourceLimitMarried,
      BigDecimal incomeLimitSingle,
      BigDecimal incomeLimitMarried,
      Integer lookbackMonths,
      BigDecimal annualGiftExclusion,
      BigDecimal penaltyDivisor,
      List<String> exemptTransferCategories) {}
}
