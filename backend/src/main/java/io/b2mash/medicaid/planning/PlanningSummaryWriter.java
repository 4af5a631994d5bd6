package io.b2mash.medicaid.planning;

import io.b2mash.medicaid.eligibility.EligibilityVerdict;
import io.b2mash.medicaid.household.ClientInfo;
import io.b2mash.medicaid.lookback.DocumentationRisk;
import io.b2mash.medicaid.lookback.TransferAnalysis;
import io.b2mash.medicaid.penalty.PenaltyResult;
import io.b2mash.medicaid.rules.RuleSet;
import io.b2mash.medicaid.strategy.Strategy;
import io.b2mash.medicaid.support.Money;
import java.util.List;
import org.springframework.stereotype.Component;

/** Renders the plain-text summary attached to a divestment planning result. */
@Component
public class PlanningSummaryWriter {

  public String write(
      ClientInfo client,
      RuleSet rules,
      TransferAnalysis analysis,
      PenaltyResult penalty,
      EligibilityVerdict eligibility,
      List<Strategy> strategies) {
    var sb = new StringBuilder();
    String name = client.name() != null && !client.name().isBlank() ? client.name() : "Client";
    sb.append("Divestment plan for ")
        .append(name)
        .append(" (")
        .append(rules.jurisdiction().displayName())
        .append(", ")
        .append(rules.year())
        .append(" rules)\n");

    sb.append("Lookback: ")
        .append(analysis.transfersInWindow().size())
        .append(" transfer(s) inside the ")
        .append(rules.lookbackMonths())
        .append("-month window starting ")
        .append(analysis.lookbackStart())
        .append(", ")
        .append(analysis.transfersOutOfWindow().size())
        .append(" outside it, ")
        .append(analysis.exemptTransfers().size())
        .append(" exempt.\n");

    sb.append("Non-exempt total: ").append(Money.format(analysis.nonExemptTotal())).append('\n');

    if (penalty.hasPenalty()) {
      sb.append("Penalty: ")
          .append(Money.months(penalty.penaltyMonths()))
          .append(" months (")
          .append(penalty.penaltyDays())
          .append(" days), ending ")
          .append(penalty.penaltyEndDate())
          .append(".\n");
    } else {
      sb.append("Penalty: none.\n");
    }

    sb.append("Resources: ")
        .append(Money.format(eligibility.countableAssets()))
        .append(" countable against a ")
        .append(Money.format(eligibility.resourceLimit()))
        .append(" limit (")
        .append(eligibility.isResourceEligible() ? "eligible" : "not eligible")
        .append("). Income: ")
        .append(Money.format(eligibility.totalMonthlyIncome()))
        .append(" per month against ")
        .append(Money.format(eligibility.incomeLimit()))
        .append(" (")
        .append(eligibility.isIncomeEligible() ? "eligible" : "not eligible")
        .append(").\n");

    if (analysis.documentationRisk() == DocumentationRisk.HIGH) {
      sb.append("Documentation risk: HIGH (")
          .append(analysis.documentationIssues().size())
          .append(" issue(s)).\n");
    }

    sb.append("Strategies: ").append(strategies.size());
    if (!strategies.isEmpty()) {
      sb.append(", top priority: ").append(strategies.get(0).description());
    }
    return sb.toString();
  }
}
