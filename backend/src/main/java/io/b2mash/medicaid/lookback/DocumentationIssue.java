package io.b2mash.medicaid.lookback;

/**
 * A non-fatal data-quality problem found on a transfer record.
 *
 * @param transferIndex position of the transfer in the submitted list
 * @param transfer the offending transfer
 * @param type kind of issue
 * @param message human-readable description
 */
public record DocumentationIssue(
    int transferIndex, TransferRecord transfer, IssueType type, String message) {

  public enum IssueType {
    INVALID_DATE,
    MISSING_DOCUMENTATION,
    INVALID_AMOUNT
  }
}
