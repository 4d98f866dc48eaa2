package ca.gc.cra.trail.application.redaction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.trail.application.util.Digests;
import ca.gc.cra.trail.domain.redaction.Detector;
import ca.gc.cra.trail.domain.redaction.Finding;
import ca.gc.cra.trail.domain.redaction.PiiPattern;
import ca.gc.cra.trail.domain.redaction.RedactionResult;
import ca.gc.cra.trail.testutil.FakeTextAnalysisPort;
import ca.gc.cra.trail.testutil.RecordingMetricsPort;
import java.util.List;
import org.junit.jupiter.api.Test;

class RemoteAugmentedRedactorTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void remoteFindingWinsOverlapAndLocalRulesStillRun() {
    String text = "Mail jane@example.com or call 03-1234-5678, Jane Doe";
    int emailStart = text.indexOf("jane@");
    int nameStart = text.indexOf("Jane Doe");
    FakeTextAnalysisPort classifier = new FakeTextAnalysisPort("en")
        .withEntity("EMAIL_ADDRESS", emailStart - 5, emailStart + "jane@example.com".length())
        .withEntity("NAME", nameStart, nameStart + "Jane Doe".length());

    RedactionResult result = new RemoteAugmentedRedactor(classifier, metrics).mask(text, "en", true);

    assertEquals("[MASKED_EMAIL_ADDRESS] or call [MASKED_PHONE_JP], [MASKED_NAME]", result.maskedText());
    assertEquals(Detector.REMOTE_CLASSIFIER, result.detectorUsed());
    assertEquals(List.of(Detector.REMOTE_CLASSIFIER, Detector.LOCAL_PATTERN, Detector.REMOTE_CLASSIFIER),
        result.findings().stream().map(Finding::maskingMethod).toList());
    assertEquals(RedactionResult.REMOTE_LIMITATIONS, result.limitations());
    assertNull(result.degradedReason());
  }

  @Test
  void partialRemoteSpanIsWidenedToCoverOverlappingLocalMatch() {
    String text = "Contact john.doe@example.com today";
    int start = text.indexOf("john");
    FakeTextAnalysisPort classifier = new FakeTextAnalysisPort("en").withEntity("NAME", start, start + 4);

    RedactionResult result = new RemoteAugmentedRedactor(classifier, metrics).mask(text, "en", true);

    assertEquals("Contact [MASKED_NAME] today", result.maskedText());
    assertFalse(PiiPattern.EMAIL.pattern().matcher(result.maskedText()).find(), result.maskedText());
    assertEquals(1, result.totalMasked());
    Finding finding = result.findings().get(0);
    assertEquals(Detector.REMOTE_CLASSIFIER, finding.maskingMethod());
    assertEquals(Digests.sha256Hex("john.doe@example.com"), finding.originalSpanHash());
  }

  @Test
  void unsupportedLanguageDegradesToLocalRules() {
    FakeTextAnalysisPort classifier = new FakeTextAnalysisPort("en");

    RedactionResult result = new RemoteAugmentedRedactor(classifier, metrics)
        .mask("連絡先 test@example.com", "ja", true);

    assertEquals("連絡先 [MASKED_EMAIL]", result.maskedText());
    assertEquals(Detector.LOCAL_PATTERN, result.detectorUsed());
    assertTrue(result.degraded());
    assertTrue(result.degradedReason().contains("'ja'"), result.degradedReason());
    assertEquals(0, classifier.piiCalls());
    assertEquals(1L, metrics.count("redaction.degraded"));
  }

  @Test
  void classifierFailureDegradesWithScrubbedReason() {
    FakeTextAnalysisPort classifier =
        new FakeTextAnalysisPort("en").failingPii("timeout while sending leak@example.com");

    RedactionResult result = new RemoteAugmentedRedactor(classifier, metrics)
        .mask("reach me at test@example.com", "en", true);

    assertEquals("reach me at [MASKED_EMAIL]", result.maskedText());
    assertEquals(Detector.LOCAL_PATTERN, result.detectorUsed());
    assertNotNull(result.degradedReason());
    assertTrue(result.degradedReason().contains("[MASKED_EMAIL]"), result.degradedReason());
    assertFalse(result.degradedReason().contains("leak@example.com"), result.degradedReason());
    assertEquals(1L, metrics.count("redaction.degraded"));
  }

  @Test
  void remoteNotRequestedSkipsClassifier() {
    FakeTextAnalysisPort classifier = new FakeTextAnalysisPort("en").withEntity("NAME", 0, 4);

    RedactionResult result = new RemoteAugmentedRedactor(classifier, metrics).mask("John x@y.io", "en", false);

    assertEquals("John [MASKED_EMAIL]", result.maskedText());
    assertEquals(0, classifier.piiCalls());
    assertEquals(0L, metrics.count("redaction.degraded"));
  }

  @Test
  void outOfRangeOffsetsAreIgnored() {
    FakeTextAnalysisPort classifier = new FakeTextAnalysisPort("en")
        .withEntity("NAME", 10, 20)
        .withEntity("NAME", 3, 500);

    RedactionResult result = new RemoteAugmentedRedactor(classifier, metrics).mask("Hi Bob", "en", true);

    assertEquals("Hi [MASKED_NAME]", result.maskedText());
    assertEquals(1, result.totalMasked());
  }
}
