package io.b2mash.medicaid.rules;

import java.util.Objects;

/**
 * Canonical jurisdiction key (lower-case state name with underscores, e.g. {@code new_york}).
 * Instances are produced by {@link JurisdictionResolver}; the engine never sees raw state input.
 */
public record Jurisdiction(String key) {

  public Jurisdiction {
    Objects.requireNonNull(key, "key must not be null");
    if (key.isBlank() || !key.equals(key.toLowerCase()) || key.contains(" ")) {
      throw new IllegalArgumentException("Not a canonical jurisdiction key: '" + key + "'");
    }
  }

  /** Human-readable name, e.g. "New York" for {@code new_york}. */
  public String displayName() {
    var sb = new StringBuilder();
    for (String word : key.split("_")) {
      if (sb.length() > 0) {
        sb.append(' ');
      }
      if (word.equals("of") || word.isEmpty()) {
        sb.append(word);
      } else {
        sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
      }
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return key;
  }
}
