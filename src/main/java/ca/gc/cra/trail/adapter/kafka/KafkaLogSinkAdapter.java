package ca.gc.cra.trail.adapter.kafka;

import ca.gc.cra.trail.application.port.sink.LogEvent;
import ca.gc.cra.trail.application.port.sink.LogSinkPort;
import ca.gc.cra.trail.application.port.sink.SinkAuthorizationException;
import ca.gc.cra.trail.application.port.sink.ThrottlingException;
import ca.gc.cra.trail.application.port.sink.TransportException;
import ca.gc.cra.trail.logging.Logs;
import ca.gc.cra.trail.validation.Net;
import ca.gc.cra.trail.validation.Strings;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.AuthenticationException;
import org.apache.kafka.common.errors.AuthorizationException;
import org.apache.kafka.common.errors.ThrottlingQuotaExceededException;
import org.apache.kafka.common.serialization.StringSerializer;

/**
 * Kafka log sink that publishes serialized audit records to a topic derived from the log group.
 * <p>The record key is the record hash, so downstream consumers can deduplicate redeliveries; the log stream
 * travels in the {@code trail.stream} header. Each {@link #put(String, String, List)} waits for the broker
 * acknowledgement of every event, bounded by the configured timeout.</p>
 *
 * @implNote Log group {@code /trail/audit} maps to topic {@code trail.audit}.
 * @since 0.1.0
 */
public final class KafkaLogSinkAdapter implements LogSinkPort {
  static final String STREAM_HEADER = "trail.stream";

  private final Producer<String, String> producer;
  private final Duration timeout;

  /**
   * Creates a sink backed by a new {@link KafkaProducer}.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers
   * @param timeout acknowledgement timeout per submission
   * @throws IllegalArgumentException if {@code bootstrapServers} is invalid
   */
  public KafkaLogSinkAdapter(String bootstrapServers, Duration timeout) {
    this(createProducer(bootstrapServers, timeout), timeout);
  }

  KafkaLogSinkAdapter(Producer<String, String> producer, Duration timeout) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  @Override
  public void put(String logGroup, String logStream, List<LogEvent> events) throws TransportException {
    String topic = topicFor(logGroup);
    Strings.requireLogName("logStream", logStream);
    Objects.requireNonNull(events, "events");
    List<Future<RecordMetadata>> acks = new ArrayList<>(events.size());
    try {
      for (LogEvent event : events) {
        ProducerRecord<String, String> record =
            new ProducerRecord<>(topic, null, event.timestampMillis(), event.recordHash(), event.message());
        record.headers().add(STREAM_HEADER, logStream.getBytes(StandardCharsets.UTF_8));
        acks.add(producer.send(record));
      }
      long deadline = System.nanoTime() + timeout.toNanos();
      for (Future<RecordMetadata> ack : acks) {
        ack.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
      }
    } catch (ExecutionException ex) {
      throw translate(ex.getCause() == null ? ex : ex.getCause());
    } catch (KafkaException ex) {
      throw translate(ex);
    } catch (TimeoutException ex) {
      throw new TransportException("Kafka did not acknowledge within " + timeout.toMillis() + " ms", ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new TransportException("Interrupted while waiting for Kafka acknowledgement", ex);
    }
  }

  /**
   * Flushes pending Kafka records and closes the producer.
   *
   * @implNote Waits up to five seconds for in-flight send operations to complete.
   */
  @Override
  public void close() {
    producer.flush();
    producer.close(Duration.ofSeconds(5));
  }

  static String topicFor(String logGroup) {
    String group = Strings.requireLogName("logGroup", logGroup);
    String topic = group.replaceFirst("^/+", "").replace('/', '.').replace('#', '_');
    return Strings.sanitizeTopic("logGroup", topic);
  }

  private static TransportException translate(Throwable cause) {
    String detail = "Kafka rejected audit record: " + Logs.describe(cause);
    if (cause instanceof ThrottlingQuotaExceededException) {
      return new ThrottlingException(detail, cause);
    }
    if (cause instanceof AuthorizationException || cause instanceof AuthenticationException) {
      return new SinkAuthorizationException(detail, cause);
    }
    return new TransportException(detail, cause);
  }

  private static Producer<String, String> createProducer(String bootstrapServers, Duration timeout) {
    String servers = Net.validateBootstrapServers(bootstrapServers);
    Objects.requireNonNull(timeout, "timeout");
    int timeoutMillis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, servers);
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, timeoutMillis);
    props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, timeoutMillis);
    props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, timeoutMillis + 5);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    return new KafkaProducer<>(props);
  }
}
