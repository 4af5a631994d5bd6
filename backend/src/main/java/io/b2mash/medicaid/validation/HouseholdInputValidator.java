package io.b2mash.medicaid.validation;

import io.b2mash.medicaid.exception.InvalidHouseholdInputException;
import io.b2mash.medicaid.household.ClientInfo;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Validates household input before any rules are evaluated. Collects every violation and throws
 * once, so the caller sees all problems in one response. Only field names are logged, never
 * client values.
 */
@Component
public class HouseholdInputValidator {

  private static final Logger log = LoggerFactory.getLogger(HouseholdInputValidator.class);

  private final Validator validator;

  public HouseholdInputValidator(Validator validator) {
    this.validator = validator;
  }

  /**
   * Validates client information and declared assets.
   *
   * @throws InvalidHouseholdInputException listing every violation found
   */
  public void validate(ClientInfo clientInfo, Map<String, BigDecimal> assets) {
    List<String> violations = new ArrayList<>();

    if (clientInfo == null) {
      violations.add("Client information is required");
    } else {
      validator.validate(clientInfo).stream()
          .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
          .map(HouseholdInputValidator::describe)
          .forEach(violations::add);
    }

    if (assets != null) {
      assets.forEach(
          (type, value) -> {
            if (value != null && value.signum() < 0) {
              violations.add("Asset '" + type + "' must not be negative");
            }
          });
    }

    if (!violations.isEmpty()) {
      log.warn("Household input rejected: violations={}", violations.size());
      throw new InvalidHouseholdInputException(violations);
    }
  }

  private static String describe(ConstraintViolation<ClientInfo> violation) {
    return violation.getPropertyPath() + ": " + violation.getMessage();
  }
}
