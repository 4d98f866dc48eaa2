package ca.gc.cra.trail.domain.audit;

import java.util.List;
import java.util.Objects;

/**
 * Result of verifying every stored record and the links between them.
 *
 * @param records number of records examined
 * @param verified number of records whose hash and signature verified
 * @param anchors number of records whose predecessor is not present (1 for an intact chain, even after purge)
 * @param tailHash hash of the last record of the chain, or {@code null} when empty or broken
 * @param issues problems found, in discovery order
 * @since 0.1.0
 */
public record ChainReport(int records, int verified, int anchors, String tailHash, List<Issue> issues) {
  public ChainReport {
    issues = List.copyOf(Objects.requireNonNull(issues, "issues"));
  }

  /**
   * Indicates whether the chain is intact.
   *
   * @return {@code true} when no issues were found
   */
  public boolean valid() {
    return issues.isEmpty();
  }

  /** Kinds of chain problems. */
  public enum IssueKind {
    UNREADABLE,
    HASH_MISMATCH,
    BAD_SIGNATURE,
    FORK,
    DETACHED,
    MULTIPLE_ANCHORS
  }

  /**
   * One chain problem.
   *
   * @param fileName record file concerned
   * @param kind problem kind
   * @param detail human-readable detail
   */
  public record Issue(String fileName, IssueKind kind, String detail) {}
}
