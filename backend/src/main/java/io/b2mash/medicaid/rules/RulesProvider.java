package io.b2mash.medicaid.rules;

/**
 * Supplies jurisdiction and year scoped Medicaid thresholds. Implementations may be slow or sit
 * behind a cache; callers only rely on the result being current at call time.
 */
public interface RulesProvider {

  /**
   * Returns the rule set for the given jurisdiction and rules year.
   *
   * @throws io.b2mash.medicaid.exception.RulesNotFoundException if no rules exist for the pair
   */
  RuleSet getRules(Jurisdiction jurisdiction, int year);

  /**
   * Returns the most recent rule set published for the jurisdiction in or before {@code year}.
   * Rules stay in force until a newer year is published.
   *
   * @throws io.b2mash.medicaid.exception.RulesNotFoundException naming {@code year} if the
   *     jurisdiction has no rules up to it
   */
  RuleSet getLatestRules(Jurisdiction jurisdiction, int year);
}
