package io.b2mash.medicaid.rules;

import io.b2mash.medicaid.exception.InvalidHouseholdInputException;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Single canonicalization table for jurisdiction input. Accepts postal abbreviations, full state
 * names and their case/whitespace/hyphen variants and maps them to a canonical {@link
 * Jurisdiction}. Input that is not a known alias is still normalized so the rules provider can
 * report it as not found.
 */
@Component
public class JurisdictionResolver {

  private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-.]+");
  private static final Pattern EDGE_UNDERSCORES = Pattern.compile("^_+|_+$");

  private static final String[][] STATES = {
    {"AL", "alabama"}, {"AK", "alaska"}, {"AZ", "arizona"}, {"AR", "arkansas"},
    {"CA", "california"}, {"CO", "colorado"}, {"CT", "connecticut"}, {"DE", "delaware"},
    {"DC", "district_of_columbia"}, {"FL", "florida"}, {"GA", "georgia"}, {"HI", "hawaii"},
    {"ID", "idaho"}, {"IL", "illinois"}, {"IN", "indiana"}, {"IA", "iowa"},
    {"KS", "kansas"}, {"KY", "kentucky"}, {"LA", "louisiana"}, {"ME", "maine"},
    {"MD", "maryland"}, {"MA", "massachusetts"}, {"MI", "michigan"}, {"MN", "minnesota"},
    {"MS", "mississippi"}, {"MO", "missouri"}, {"MT", "montana"}, {"NE", "nebraska"},
    {"NV", "nevada"}, {"NH", "new_hampshire"}, {"NJ", "new_jersey"}, {"NM", "new_mexico"},
    {"NY", "new_york"}, {"NC", "north_carolina"}, {"ND", "north_dakota"}, {"OH", "ohio"},
    {"OK", "oklahoma"}, {"OR", "oregon"}, {"PA", "pennsylvania"}, {"RI", "rhode_island"},
    {"SC", "south_carolina"}, {"SD", "south_dakota"}, {"TN", "tennessee"}, {"TX", "texas"},
    {"UT", "utah"}, {"VT", "vermont"}, {"VA", "virginia"}, {"WA", "washington"},
    {"WV", "west_virginia"}, {"WI", "wisconsin"}, {"WY", "wyoming"}
  };

  private static final Map<String, String> ALIASES = buildAliases();

  /**
   * Resolves raw jurisdiction input to its canonical form.
   *
   * @param raw state name or postal abbreviation, in any case
   * @return the canonical jurisdiction
   * @throws InvalidHouseholdInputException if the input is null or blank
   */
  public Jurisdiction resolve(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidHouseholdInputException("Jurisdiction is required");
    }
    String normalized = normalize(raw);
    if (normalized.isEmpty()) {
      throw new InvalidHouseholdInputException("Jurisdiction '" + raw + "' is not recognized");
    }
    return new Jurisdiction(ALIASES.getOrDefault(normalized, normalized));
  }

  static String normalize(String raw) {
    String joined = SEPARATORS.matcher(raw.trim().toLowerCase()).replaceAll("_");
    return EDGE_UNDERSCORES.matcher(joined).replaceAll("");
  }

  private static Map<String, String> buildAliases() {
    var aliases = new HashMap<String, String>();
    for (String[] state : STATES) {
      aliases.put(state[0].toLowerCase(), state[1]);
      aliases.put(state[1], state[1]);
    }
    aliases.put("washington_dc", "district_of_columbia");
    aliases.put("d_c", "district_of_columbia");
    return Map.copyOf(aliases);
  }
}
