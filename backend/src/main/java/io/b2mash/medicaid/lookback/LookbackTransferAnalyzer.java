package io.b2mash.medicaid.lookback;

import io.b2mash.medicaid.lookback.DocumentationIssue.IssueType;
import io.b2mash.medicaid.rules.RuleSet;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Stateless analyzer that places a transfer history against the lookback window of a rule set.
 *
 * <p>Transfers with an unusable date or amount (not positive, or above one billion) are reported
 * as documentation issues and left out of every window set. Transfers without documentation are
 * reported but still analyzed. Within the window, exempt transfers are set aside, gifts are
 * aggregated per recipient and calendar year before the annual exclusion is applied, and every
 * other transfer counts in full.
 */
@Service
public class LookbackTransferAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(LookbackTransferAnalyzer.class);

  private static final String GIFT = "gift";

  /** Amounts above this are treated as data entry errors. */
  static final BigDecimal MAX_TRANSFER_AMOUNT = new BigDecimal("1000000000");

  /**
   * Analyzes a transfer history.
   *
   * @param transfers submitted transfer records, possibly empty
   * @param rules rule set supplying the window length, gift exclusion and exempt categories
   * @param now planning date the lookback window ends on
   * @return the window partition, exclusion accounting and documentation issues
   */
  public TransferAnalysis analyze(List<TransferRecord> transfers, RuleSet rules, LocalDate now) {
    LocalDate lookbackStart = now.minusMonths(rules.lookbackMonths());

    List<TransferRecord> inWindow = new ArrayList<>();
    List<TransferRecord> outOfWindow = new ArrayList<>();
    List<TransferRecord> exempt = new ArrayList<>();
    List<DocumentationIssue> issues = new ArrayList<>();
    Map<GiftGroupKey, GiftGroup> giftGroups = new LinkedHashMap<>();
    BigDecimal nonExemptTotal = BigDecimal.ZERO;

    List<TransferRecord> records = transfers != null ? transfers : List.of();
    for (int i = 0; i < records.size(); i++) {
      TransferRecord transfer = records.get(i);

      if (!transfer.hasDocumentation()) {
        issues.add(
            new DocumentationIssue(
                i,
                transfer,
                IssueType.MISSING_DOCUMENTATION,
                "Missing documentation for transfer of "
                    + transfer.amount()
                    + " to "
                    + transfer.recipient()));
      }

      var date = TransferDates.parse(transfer.date());
      if (date.isEmpty()) {
        issues.add(
            new DocumentationIssue(
                i,
                transfer,
                IssueType.INVALID_DATE,
                "Invalid date '" + transfer.date() + "' for transfer to " + transfer.recipient()));
        continue;
      }

      if (transfer.amount() == null
          || transfer.amount().signum() <= 0
          || transfer.amount().compareTo(MAX_TRANSFER_AMOUNT) > 0) {
        issues.add(
            new DocumentationIssue(
                i,
                transfer,
                IssueType.INVALID_AMOUNT,
                "Invalid amount "
                    + transfer.amount()
                    + " for transfer to "
                    + transfer.recipient()));
        continue;
      }

      if (date.get().isBefore(lookbackStart)) {
        outOfWindow.add(transfer);
        continue;
      }
      inWindow.add(transfer);

      if (isExempt(transfer, rules)) {
        exempt.add(transfer);
      } else if (isGift(transfer)) {
        var key = new GiftGroupKey(normalizeRecipient(transfer.recipient()), date.get().getYear());
        giftGroups
            .computeIfAbsent(key, k -> new GiftGroup(transfer.recipient()))
            .add(transfer.amount());
      } else {
        nonExemptTotal = nonExemptTotal.add(transfer.amount());
      }
    }

    List<GiftExclusion> exclusions = new ArrayList<>();
    for (var entry : giftGroups.entrySet()) {
      BigDecimal total = entry.getValue().total;
      BigDecimal excluded = total.min(rules.annualGiftExclusion());
      BigDecimal excess = total.subtract(rules.annualGiftExclusion()).max(BigDecimal.ZERO);
      exclusions.add(
          new GiftExclusion(
              entry.getValue().displayRecipient, entry.getKey().year(), total, excluded, excess));
      nonExemptTotal = nonExemptTotal.add(excess);
    }

    var risk = issues.isEmpty() ? DocumentationRisk.LOW : DocumentationRisk.HIGH;
    log.debug(
        "Lookback analysis: transfers={}, inWindow={}, outOfWindow={}, exempt={},"
            + " nonExemptTotal={}, issues={}",
        records.size(),
        inWindow.size(),
        outOfWindow.size(),
        exempt.size(),
        nonExemptTotal,
        issues.size());

    return new TransferAnalysis(
        lookbackStart, inWindow, outOfWindow, exempt, nonExemptTotal, exclusions, issues, risk);
  }

  /**
   * A transfer is exempt when its purpose matches an exempt category of the rule set or its
   * details document a care arrangement (both duration and weekly hours).
   */
  static boolean isExempt(TransferRecord transfer, RuleSet rules) {
    if (transfer.details() != null && transfer.details().documentsQualifyingCare()) {
      return true;
    }
    String purpose = normalizePurpose(transfer.purpose());
    if (purpose.isEmpty()) {
      return false;
    }
    return rules.exemptTransferCategories().stream()
        .map(LookbackTransferAnalyzer::normalizePurpose)
        .anyMatch(category -> purpose.equals(category) || purpose.contains(category));
  }

  static boolean isGift(TransferRecord transfer) {
    return transfer.purpose() != null && transfer.purpose().toLowerCase().contains(GIFT);
  }

  private static String normalizePurpose(String purpose) {
    if (purpose == null) {
      return "";
    }
    return purpose.trim().toLowerCase().replaceAll("[_\\-\\s]+", " ");
  }

  private static String normalizeRecipient(String recipient) {
    return recipient == null ? "" : recipient.trim().toLowerCase().replaceAll("\\s+", " ");
  }

  private record GiftGroupKey(String recipient, int year) {}

  private static final class GiftGroup {
    private final String displayRecipient;
    private BigDecimal total = BigDecimal.ZERO;

    private GiftGroup(String displayRecipient) {
      this.displayRecipient = displayRecipient;
    }

    private void add(BigDecimal amount) {
      total = total.add(amount);
    }
  }
}
