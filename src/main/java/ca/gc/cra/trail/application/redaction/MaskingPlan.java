package ca.gc.cra.trail.application.redaction;

import ca.gc.cra.trail.application.util.Digests;
import ca.gc.cra.trail.domain.redaction.Detector;
import ca.gc.cra.trail.domain.redaction.Finding;
import ca.gc.cra.trail.domain.redaction.PiiPattern;
import ca.gc.cra.trail.domain.redaction.RedactionResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;

/**
 * Collects candidate spans from both tiers, resolves overlaps, and renders the masked text.
 *
 * <p>Overlap rules: remote spans are accepted first and always win against local spans. Among spans of the same
 * tier the longer span wins, then the higher priority rule, then the earlier position. A losing span is not
 * dropped: the winner grows to the union of both, keeping its own category, so no character a rule matched is
 * left in clear. All spans refer to offsets in the original text, so placeholders never interact with matching.</p>
 */
final class MaskingPlan {
  private static final Comparator<Span> PREFERENCE = Comparator
      .comparingInt((Span span) -> span.end() - span.begin()).reversed()
      .thenComparingInt(Span::priority)
      .thenComparingInt(Span::begin);

  private final String text;
  private final List<Span> remote = new ArrayList<>();
  private final List<Span> local = new ArrayList<>();

  MaskingPlan(String text) {
    this.text = Objects.requireNonNull(text, "text");
  }

  void addRemote(String category, int begin, int end) {
    int clampedEnd = Math.min(end, text.length());
    if (begin < 0 || begin >= clampedEnd) {
      return;
    }
    remote.add(new Span(begin, clampedEnd, category, Detector.REMOTE_CLASSIFIER, 0));
  }

  void addLocalMatches() {
    for (PiiPattern rule : PiiPattern.values()) {
      Matcher matcher = rule.pattern().matcher(text);
      while (matcher.find()) {
        local.add(new Span(matcher.start(), matcher.end(), rule.category(), Detector.LOCAL_PATTERN,
            rule.ordinal()));
      }
    }
  }

  RedactionResult render(Detector detectorUsed, String limitations, String degradedReason) {
    List<Span> accepted = new ArrayList<>();
    acceptNonOverlapping(remote, accepted);
    acceptNonOverlapping(local, accepted);
    accepted.sort(Comparator.comparingInt(Span::begin));

    StringBuilder masked = new StringBuilder(text.length());
    List<Finding> findings = new ArrayList<>(accepted.size());
    int cursor = 0;
    int maskedChars = 0;
    for (Span span : accepted) {
      masked.append(text, cursor, span.begin());
      masked.append(PiiPattern.placeholder(span.category()));
      String original = text.substring(span.begin(), span.end());
      findings.add(new Finding(span.category(), Digests.sha256Hex(original), span.detector()));
      maskedChars += span.end() - span.begin();
      cursor = span.end();
    }
    masked.append(text, cursor, text.length());

    return new RedactionResult(
        masked.toString(),
        findings,
        detectorUsed,
        findings.size(),
        score(maskedChars, text.length()),
        limitations,
        degradedReason);
  }

  private static void acceptNonOverlapping(List<Span> candidates, List<Span> accepted) {
    List<Span> ordered = new ArrayList<>(candidates);
    ordered.sort(PREFERENCE);
    for (Span candidate : ordered) {
      Span merged = null;
      int begin = candidate.begin();
      int end = candidate.end();
      Iterator<Span> it = accepted.iterator();
      while (it.hasNext()) {
        Span existing = it.next();
        if (begin < existing.end() && existing.begin() < end) {
          if (merged == null) {
            merged = existing;
          }
          begin = Math.min(begin, existing.begin());
          end = Math.max(end, existing.end());
          it.remove();
        }
      }
      if (merged == null) {
        accepted.add(candidate);
      } else {
        accepted.add(new Span(begin, end, merged.category(), merged.detector(), merged.priority()));
      }
    }
  }

  static double score(int maskedChars, int totalChars) {
    if (totalChars == 0) {
      return 0.0;
    }
    return Math.round(((double) maskedChars / totalChars) * 100.0) / 100.0;
  }

  private record Span(int begin, int end, String category, Detector detector, int priority) {}
}
