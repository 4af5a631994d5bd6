package io.b2mash.medicaid.classification;

import java.math.BigDecimal;

/**
 * Split of a household's declared assets into the portion that counts toward the resource limit
 * and the portion that is exempt.
 */
public record AssetClassification(BigDecimal countable, BigDecimal nonCountable) {

  public BigDecimal total() {
    return countable.add(nonCountable);
  }
}
