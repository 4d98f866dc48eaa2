package ca.gc.cra.trail.application.audit;

import ca.gc.cra.trail.domain.audit.AuditRecord;
import ca.gc.cra.trail.domain.audit.ChainReport;
import ca.gc.cra.trail.domain.audit.ChainReport.Issue;
import ca.gc.cra.trail.domain.audit.ChainReport.IssueKind;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Verifies stored records: each record hash is recomputed, each signature is checked, and the links are walked
 * from the anchor to the tail.
 *
 * <p>The anchor is the record whose predecessor is absent. After retention purges old processed records the anchor
 * is no longer the genesis record, so one anchor with a non-null {@code prev_hash} is still an intact chain.
 * Several anchors, forks (two records claiming the same predecessor), and records not reachable from the anchor
 * are reported as issues.</p>
 *
 * @since 0.1.0
 */
public final class ChainVerifier {
  private final RecordVerifier verifier;

  /**
   * Creates a chain verifier.
   *
   * @param verifier signature verifier holding the public key
   */
  public ChainVerifier(RecordVerifier verifier) {
    this.verifier = Objects.requireNonNull(verifier, "verifier");
  }

  /**
   * Verifies a single serialized record, ignoring chain links.
   *
   * @param json record JSON
   * @return {@code true} when its hash and signature both verify
   */
  public boolean verifyRecord(String json) {
    try {
      Map<String, Object> map = AuditJson.parse(json);
      String stated = asString(map.get(AuditRecord.RECORD_HASH_FIELD));
      return stated != null
          && stated.equals(RecordHashes.compute(map))
          && verifier.verify(stated, asString(map.get(AuditRecord.SIGNATURE_FIELD)));
    } catch (IllegalArgumentException ex) {
      return false;
    }
  }

  /**
   * Verifies a set of stored records as one chain.
   *
   * @param records stored records in any order
   * @return chain report
   */
  public ChainReport verify(List<StoredRecord> records) {
    Objects.requireNonNull(records, "records");
    List<Issue> issues = new ArrayList<>();
    Map<String, Node> byHash = new LinkedHashMap<>();
    int verified = 0;

    for (StoredRecord stored : records) {
      Map<String, Object> map;
      try {
        map = AuditJson.parse(stored.json());
      } catch (IllegalArgumentException ex) {
        issues.add(new Issue(stored.fileName(), IssueKind.UNREADABLE, ex.getMessage()));
        continue;
      }
      String stated = asString(map.get(AuditRecord.RECORD_HASH_FIELD));
      String prev = asString(map.get(AuditRecord.PREV_HASH_FIELD));
      if (stated == null) {
        issues.add(new Issue(stored.fileName(), IssueKind.UNREADABLE, "record_hash missing"));
        continue;
      }
      boolean ok = true;
      if (!stated.equals(RecordHashes.compute(map))) {
        issues.add(new Issue(stored.fileName(), IssueKind.HASH_MISMATCH,
            "content does not match record_hash " + stated));
        ok = false;
      }
      if (!verifier.verify(stated, asString(map.get(AuditRecord.SIGNATURE_FIELD)))) {
        issues.add(new Issue(stored.fileName(), IssueKind.BAD_SIGNATURE, "signature does not verify"));
        ok = false;
      }
      if (ok) {
        verified++;
      }
      if (byHash.putIfAbsent(stated, new Node(stored.fileName(), stated, prev)) != null) {
        issues.add(new Issue(stored.fileName(), IssueKind.FORK, "duplicate record_hash " + stated));
      }
    }

    Map<String, List<Node>> children = new HashMap<>();
    List<Node> anchors = new ArrayList<>();
    for (Node node : byHash.values()) {
      if (node.prevHash() == null || !byHash.containsKey(node.prevHash())) {
        anchors.add(node);
      } else {
        children.computeIfAbsent(node.prevHash(), key -> new ArrayList<>()).add(node);
      }
    }
    for (Map.Entry<String, List<Node>> entry : children.entrySet()) {
      List<Node> successors = entry.getValue();
      for (int i = 1; i < successors.size(); i++) {
        issues.add(new Issue(successors.get(i).fileName(), IssueKind.FORK,
            "second successor of " + entry.getKey()));
      }
    }
    if (anchors.size() > 1) {
      for (Node anchor : anchors) {
        issues.add(new Issue(anchor.fileName(), IssueKind.MULTIPLE_ANCHORS,
            anchor.prevHash() == null
                ? "starts a chain"
                : "references missing predecessor " + anchor.prevHash()));
      }
    }

    String tail = null;
    if (anchors.size() == 1) {
      Set<String> visited = new HashSet<>();
      Node current = anchors.get(0);
      while (current != null && visited.add(current.recordHash())) {
        tail = current.recordHash();
        List<Node> next = children.get(current.recordHash());
        current = next == null ? null : next.get(0);
      }
      for (Node node : byHash.values()) {
        if (!visited.contains(node.recordHash())) {
          issues.add(new Issue(node.fileName(), IssueKind.DETACHED, "not reachable from chain anchor"));
        }
      }
    }

    return new ChainReport(records.size(), verified, anchors.size(), issues.isEmpty() ? tail : null, issues);
  }

  private static String asString(Object value) {
    return value == null ? null : value.toString();
  }

  /**
   * Serialized record with its file name.
   *
   * @param fileName record file name
   * @param json record JSON
   */
  public record StoredRecord(String fileName, String json) {
    public StoredRecord {
      Objects.requireNonNull(fileName, "fileName");
      Objects.requireNonNull(json, "json");
    }
  }

  private record Node(String fileName, String recordHash, String prevHash) {}
}
