package io.b2mash.medicaid.rules;

/** Lookup key for a rule set: canonical jurisdiction plus rules year. */
public record RulesKey(Jurisdiction jurisdiction, int year) {

  @Override
  public String toString() {
    return jurisdiction.key() + "/" + year;
  }
}
