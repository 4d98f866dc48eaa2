package ca.gc.cra.trail.adapter.aws;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.trail.application.port.analysis.PiiEntity;
import ca.gc.cra.trail.application.port.analysis.RedactionDegradedException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.comprehend.ComprehendClient;
import software.amazon.awssdk.services.comprehend.ComprehendServiceClientConfiguration;
import software.amazon.awssdk.services.comprehend.model.DetectPiiEntitiesRequest;
import software.amazon.awssdk.services.comprehend.model.DetectPiiEntitiesResponse;

class ComprehendTextAnalysisAdapterTest {

  @Test
  void truncationKeepsCodePointsWhole() {
    String text = "aé日😀";

    assertEquals("aé日", ComprehendTextAnalysisAdapter.truncateUtf8(text, 6));
    assertEquals("aé日", ComprehendTextAnalysisAdapter.truncateUtf8(text, 9));
    assertEquals(text, ComprehendTextAnalysisAdapter.truncateUtf8(text, 10));
    assertEquals("ab", ComprehendTextAnalysisAdapter.truncateUtf8("abc", 2));
  }

  @Test
  void truncatedTextFitsBudget() {
    String text = "日".repeat(50_000);

    String truncated = ComprehendTextAnalysisAdapter.truncateUtf8(text, ComprehendTextAnalysisAdapter.MAX_TEXT_BYTES);

    assertTrue(truncated.getBytes(StandardCharsets.UTF_8).length <= ComprehendTextAnalysisAdapter.MAX_TEXT_BYTES);
    assertEquals(ComprehendTextAnalysisAdapter.MAX_TEXT_BYTES / 3, truncated.length());
  }

  @Test
  void codePointOffsetsBecomeUtf16Indexes() {
    String text = "😀 Bob";

    assertEquals(2, ComprehendTextAnalysisAdapter.toUtf16(text, 1));
    assertEquals(text.length(), ComprehendTextAnalysisAdapter.toUtf16(text, 99));
  }

  @Test
  void piiEntitiesBelowThresholdAreDropped() throws Exception {
    FakeComprehendClient client = new FakeComprehendClient(DetectPiiEntitiesResponse.builder()
        .entities(
            entity("NAME", 0.99f, 2, 5),
            entity("ADDRESS", 0.10f, 0, 1))
        .build());
    ComprehendTextAnalysisAdapter adapter = new ComprehendTextAnalysisAdapter(client, 0.8);
    String text = "😀 Bob";

    List<PiiEntity> entities = adapter.detectPii(text, "en");

    assertEquals(1, entities.size());
    assertEquals("NAME", entities.get(0).category());
    assertEquals("Bob", text.substring(entities.get(0).begin(), entities.get(0).end()));
  }

  @Test
  void languageSupportIsLimited() {
    ComprehendTextAnalysisAdapter adapter = new ComprehendTextAnalysisAdapter(new FakeComprehendClient(null), 0.5);

    assertTrue(adapter.supportsPii("en"));
    assertTrue(adapter.supportsPii("ES"));
    assertFalse(adapter.supportsPii("ja"));
    assertThrows(RedactionDegradedException.class, () -> adapter.detectPii("x", "ja"));
  }

  @Test
  void sdkFailureDegrades() {
    SdkClientException failure = SdkClientException.create("Unable to execute HTTP request");
    ComprehendTextAnalysisAdapter adapter =
        new ComprehendTextAnalysisAdapter(new FakeComprehendClient(null, failure), 0.5);

    RedactionDegradedException ex =
        assertThrows(RedactionDegradedException.class, () -> adapter.detectPii("hello", "en"));

    assertSame(failure, ex.getCause());
    assertTrue(ex.getMessage().startsWith("Comprehend DetectPiiEntities failed"), ex.getMessage());
  }

  private static software.amazon.awssdk.services.comprehend.model.PiiEntity entity(
      String type, float score, int begin, int end) {
    return software.amazon.awssdk.services.comprehend.model.PiiEntity.builder()
        .type(type)
        .score(score)
        .beginOffset(begin)
        .endOffset(end)
        .build();
  }

  private static final class FakeComprehendClient implements ComprehendClient {
    private final DetectPiiEntitiesResponse response;
    private final RuntimeException failure;

    private FakeComprehendClient(DetectPiiEntitiesResponse response) {
      this(response, null);
    }

    private FakeComprehendClient(DetectPiiEntitiesResponse response, RuntimeException failure) {
      this.response = response;
      this.failure = failure;
    }

    @Override
    public DetectPiiEntitiesResponse detectPiiEntities(DetectPiiEntitiesRequest request) {
      if (failure != null) {
        throw failure;
      }
      return response;
    }

    @Override
    public String serviceName() {
      return "comprehend";
    }

    @Override
    public ComprehendServiceClientConfiguration serviceClientConfiguration() {
      throw new UnsupportedOperationException();
    }

    @Override
    public void close() {}
  }
}
