package ca.gc.cra.trail.adapter.aws;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.trail.application.port.sink.LogEvent;
import ca.gc.cra.trail.application.port.sink.SinkAuthorizationException;
import ca.gc.cra.trail.application.port.sink.ThrottlingException;
import ca.gc.cra.trail.application.port.sink.TransportException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsServiceClientConfiguration;
import software.amazon.awssdk.services.cloudwatchlogs.model.CreateLogStreamRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.CreateLogStreamResponse;
import software.amazon.awssdk.services.cloudwatchlogs.model.LimitExceededException;
import software.amazon.awssdk.services.cloudwatchlogs.model.PutLogEventsRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.PutLogEventsResponse;
import software.amazon.awssdk.services.cloudwatchlogs.model.ResourceNotFoundException;

class CloudWatchLogSinkAdapterTest {
  private static final String HASH = "d".repeat(64);

  @Test
  void clientLeavesRetriesToTheDeliveryEngine() {
    ClientOverrideConfiguration config = CloudWatchLogSinkAdapter.overrideConfiguration(Duration.ofSeconds(7));

    assertEquals(Optional.of(0), config.retryPolicy().map(RetryPolicy::numRetries));
    assertEquals(Optional.of(Duration.ofSeconds(7)), config.apiCallTimeout());
    assertEquals(Optional.of(Duration.ofSeconds(7)), config.apiCallAttemptTimeout());
  }

  @Test
  void limitExceededIsThrottling() {
    assertEquals(ThrottlingException.class,
        CloudWatchLogSinkAdapter.translate(LimitExceededException.builder().message("limit").build()).getClass());
  }

  @Test
  void throttlingErrorCodeIsThrottling() {
    assertEquals(ThrottlingException.class, CloudWatchLogSinkAdapter.translate(service("ThrottlingException", 400))
        .getClass());
  }

  @Test
  void forbiddenIsAuthorization() {
    assertEquals(SinkAuthorizationException.class,
        CloudWatchLogSinkAdapter.translate(service("Whatever", 403)).getClass());
    assertEquals(SinkAuthorizationException.class,
        CloudWatchLogSinkAdapter.translate(service("UnrecognizedClientException", 400)).getClass());
  }

  @Test
  void missingCredentialsIsAuthorization() {
    SdkClientException ex = SdkClientException.builder()
        .message("Unable to load credentials from any of the providers in the chain")
        .build();

    assertEquals(SinkAuthorizationException.class, CloudWatchLogSinkAdapter.translate(ex).getClass());
  }

  @Test
  void otherFailuresAreTransport() {
    assertEquals(TransportException.class,
        CloudWatchLogSinkAdapter.translate(SdkClientException.create("connect timed out")).getClass());
    assertEquals(TransportException.class,
        CloudWatchLogSinkAdapter.translate(service("InternalFailure", 500)).getClass());
  }

  @Test
  void missingStreamIsCreatedAndRetried() throws Exception {
    FakeLogsClient client = new FakeLogsClient();
    client.failures.add(ResourceNotFoundException.builder().message("stream missing").build());
    CloudWatchLogSinkAdapter adapter = new CloudWatchLogSinkAdapter(client);

    adapter.put("/trail/audit", "host-1", List.of(new LogEvent(5L, "{}", HASH)));

    assertEquals(List.of("/trail/audit/host-1"), client.createdStreams);
    assertEquals(2, client.puts.size());
    assertEquals("{}", client.puts.get(1).logEvents().get(0).message());
  }

  @Test
  void throttledPutSurfacesAsThrottling() {
    FakeLogsClient client = new FakeLogsClient();
    client.failures.add(LimitExceededException.builder().message("Rate exceeded").build());
    CloudWatchLogSinkAdapter adapter = new CloudWatchLogSinkAdapter(client);

    assertThrows(ThrottlingException.class,
        () -> adapter.put("/trail/audit", "host-1", List.of(new LogEvent(5L, "{}", HASH))));
  }

  private static AwsServiceException service(String code, int status) {
    return AwsServiceException.builder()
        .message(code)
        .statusCode(status)
        .awsErrorDetails(AwsErrorDetails.builder().errorCode(code).errorMessage(code).build())
        .build();
  }

  private static final class FakeLogsClient implements CloudWatchLogsClient {
    private final Deque<SdkException> failures = new ArrayDeque<>();
    private final List<PutLogEventsRequest> puts = new ArrayList<>();
    private final List<String> createdStreams = new ArrayList<>();

    @Override
    public PutLogEventsResponse putLogEvents(PutLogEventsRequest request) {
      puts.add(request);
      SdkException failure = failures.pollFirst();
      if (failure != null) {
        throw failure;
      }
      return PutLogEventsResponse.builder().build();
    }

    @Override
    public CreateLogStreamResponse createLogStream(CreateLogStreamRequest request) {
      createdStreams.add(request.logGroupName() + "/" + request.logStreamName());
      return CreateLogStreamResponse.builder().build();
    }

    @Override
    public String serviceName() {
      return "logs";
    }

    @Override
    public CloudWatchLogsServiceClientConfiguration serviceClientConfiguration() {
      throw new UnsupportedOperationException();
    }

    @Override
    public void close() {}
  }
}
