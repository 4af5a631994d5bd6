package io.b2mash.medicaid.lookback;

public enum DocumentationRisk {
  LOW,
  HIGH
}
