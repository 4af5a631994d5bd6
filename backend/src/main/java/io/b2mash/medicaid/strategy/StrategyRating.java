package io.b2mash.medicaid.strategy;

/** Ordinal scale shared by strategy priority, effectiveness and effort. */
public enum StrategyRating {
  LOW,
  MEDIUM,
  HIGH
}
