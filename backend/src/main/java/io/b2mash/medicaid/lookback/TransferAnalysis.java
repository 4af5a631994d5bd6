package io.b2mash.medicaid.lookback;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Result of partitioning a transfer history against the lookback window. Immutable once computed.
 *
 * @param lookbackStart first day inside the lookback window
 * @param transfersInWindow valid transfers dated on or after {@code lookbackStart}
 * @param transfersOutOfWindow valid transfers dated before {@code lookbackStart}
 * @param exemptTransfers in-window transfers that never count toward a penalty
 * @param nonExemptTotal amount that counts toward the penalty
 * @param giftExclusionsApplied annual exclusion accounting per recipient and calendar year
 * @param documentationIssues data-quality problems found while analyzing
 * @param documentationRisk HIGH when any documentation issue exists
 */
public record TransferAnalysis(
    LocalDate lookbackStart,
    List<TransferRecord> transfersInWindow,
    List<TransferRecord> transfersOutOfWindow,
    List<TransferRecord> exemptTransfers,
    BigDecimal nonExemptTotal,
    List<GiftExclusion> giftExclusionsApplied,
    List<DocumentationIssue> documentationIssues,
    DocumentationRisk documentationRisk) {

  public TransferAnalysis {
    transfersInWindow = List.copyOf(transfersInWindow);
    transfersOutOfWindow = List.copyOf(transfersOutOfWindow);
    exemptTransfers = List.copyOf(exemptTransfers);
    giftExclusionsApplied = List.copyOf(giftExclusionsApplied);
    documentationIssues = List.copyOf(documentationIssues);
  }

  public boolean hasDocumentationIssues() {
    return !documentationIssues.isEmpty();
  }

  public BigDecimal exemptTotal() {
    return sum(exemptTransfers);
  }

  public BigDecimal outOfWindowTotal() {
    return sum(transfersOutOfWindow);
  }

  /** Gift amounts absorbed by the annual exclusion. */
  public BigDecimal excludedGiftTotal() {
    return giftExclusionsApplied.stream()
        .map(GiftExclusion::excluded)
        .reduce(BigDecimal.ZERO, BigDecimal::add);
  }

  private static BigDecimal sum(List<TransferRecord> transfers) {
    return transfers.stream().map(TransferRecord::amount).reduce(BigDecimal.ZERO, BigDecimal::add);
  }
}
