package ca.gc.cra.trail.adapter.aws;

import ca.gc.cra.trail.application.port.sink.LogEvent;
import ca.gc.cra.trail.application.port.sink.LogSinkPort;
import ca.gc.cra.trail.application.port.sink.SinkAuthorizationException;
import ca.gc.cra.trail.application.port.sink.ThrottlingException;
import ca.gc.cra.trail.application.port.sink.TransportException;
import ca.gc.cra.trail.logging.Logs;
import ca.gc.cra.trail.validation.Strings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClientBuilder;
import software.amazon.awssdk.services.cloudwatchlogs.model.CreateLogStreamRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.InputLogEvent;
import software.amazon.awssdk.services.cloudwatchlogs.model.LimitExceededException;
import software.amazon.awssdk.services.cloudwatchlogs.model.PutLogEventsRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.PutLogEventsResponse;
import software.amazon.awssdk.services.cloudwatchlogs.model.ResourceAlreadyExistsException;
import software.amazon.awssdk.services.cloudwatchlogs.model.ResourceNotFoundException;

/**
 * <strong>What:</strong> CloudWatch Logs implementation of {@link LogSinkPort} (AWS SDK v2).
 * <p><strong>Behavior:</strong> Each record is one {@code PutLogEvents} event whose message is the serialized
 * record, so the content-addressed {@code record_hash} travels with it. A missing log stream is created once per
 * adapter and the call retried; a missing log group is reported as a transport failure.</p>
 * <p><strong>Error mapping:</strong> throttling and {@code LimitExceededException} become
 * {@link ThrottlingException}; HTTP 401/403, {@code AccessDenied}, {@code UnrecognizedClient}, expired tokens and
 * missing credentials become {@link SinkAuthorizationException}; everything else, including the API call timeout,
 * becomes {@link TransportException}.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; the SDK client is thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CloudWatchLogSinkAdapter implements LogSinkPort {
  private static final Logger log = LoggerFactory.getLogger(CloudWatchLogSinkAdapter.class);
  private static final Set<String> AUTH_ERROR_CODES = Set.of(
      "AccessDeniedException",
      "AccessDenied",
      "UnrecognizedClientException",
      "InvalidClientTokenId",
      "ExpiredTokenException",
      "ExpiredToken",
      "InvalidSignatureException",
      "SignatureDoesNotMatch",
      "MissingAuthenticationToken");

  private final CloudWatchLogsClient client;
  private final Set<String> createdStreams = new HashSet<>();

  /**
   * Creates a sink with its own client.
   *
   * @param region AWS region, or {@code null} for the SDK default chain
   * @param timeout API call timeout
   */
  public CloudWatchLogSinkAdapter(String region, Duration timeout) {
    this(createClient(region, timeout));
  }

  CloudWatchLogSinkAdapter(CloudWatchLogsClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public void put(String logGroup, String logStream, List<LogEvent> events) throws TransportException {
    String group = Strings.requireLogName("logGroup", logGroup);
    String stream = Strings.requireLogName("logStream", logStream);
    Objects.requireNonNull(events, "events");
    if (events.isEmpty()) {
      return;
    }
    List<InputLogEvent> input = new ArrayList<>(events.size());
    for (LogEvent event : events) {
      input.add(InputLogEvent.builder().timestamp(event.timestampMillis()).message(event.message()).build());
    }
    PutLogEventsRequest request = PutLogEventsRequest.builder()
        .logGroupName(group)
        .logStreamName(stream)
        .logEvents(input)
        .build();
    try {
      submit(request);
    } catch (ResourceNotFoundException ex) {
      if (!createStreamOnce(group, stream)) {
        throw new TransportException("Log group or stream not found: " + group + "/" + stream, ex);
      }
      try {
        submit(request);
      } catch (SdkException retryEx) {
        throw translate(retryEx);
      }
    } catch (SdkException ex) {
      throw translate(ex);
    }
  }

  @Override
  public void close() {
    client.close();
  }

  private void submit(PutLogEventsRequest request) throws TransportException {
    PutLogEventsResponse response = client.putLogEvents(request);
    if (response.rejectedLogEventsInfo() != null) {
      throw new TransportException("CloudWatch Logs rejected events: " + response.rejectedLogEventsInfo());
    }
  }

  private synchronized boolean createStreamOnce(String group, String stream) throws TransportException {
    if (!createdStreams.add(group + "\u0000" + stream)) {
      return false;
    }
    try {
      client.createLogStream(CreateLogStreamRequest.builder().logGroupName(group).logStreamName(stream).build());
      log.info("Created CloudWatch log stream {}/{}", group, stream);
    } catch (ResourceAlreadyExistsException ex) {
      log.debug("Log stream {}/{} already exists", group, stream);
    } catch (ResourceNotFoundException ex) {
      throw new TransportException("Log group not found: " + group, ex);
    } catch (SdkException ex) {
      throw translate(ex);
    }
    return true;
  }

  static TransportException translate(SdkException ex) {
    String detail = "CloudWatch Logs call failed: " + Logs.describe(ex);
    if (ex instanceof LimitExceededException
        || (ex instanceof AwsServiceException throttled && throttled.isThrottlingException())) {
      return new ThrottlingException(detail, ex);
    }
    if (ex instanceof AwsServiceException service) {
      String code = service.awsErrorDetails() == null ? null : service.awsErrorDetails().errorCode();
      if (service.statusCode() == 401 || service.statusCode() == 403
          || (code != null && AUTH_ERROR_CODES.contains(code))) {
        return new SinkAuthorizationException(detail, ex);
      }
    }
    if (ex instanceof SdkClientException && ex.getMessage() != null
        && ex.getMessage().toLowerCase(Locale.ROOT).contains("unable to load credentials")) {
      return new SinkAuthorizationException(detail, ex);
    }
    return new TransportException(detail, ex);
  }

  private static CloudWatchLogsClient createClient(String region, Duration timeout) {
    CloudWatchLogsClientBuilder builder = CloudWatchLogsClient.builder()
        .overrideConfiguration(overrideConfiguration(timeout));
    if (region != null && !region.isBlank()) {
      builder.region(Region.of(region.trim()));
    }
    return builder.build();
  }

  /** SDK retries are disabled; the delivery engine owns the attempt cap and backoff. */
  static ClientOverrideConfiguration overrideConfiguration(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    return ClientOverrideConfiguration.builder()
        .retryPolicy(RetryPolicy.none())
        .apiCallTimeout(timeout)
        .apiCallAttemptTimeout(timeout)
        .build();
  }
}
