package ca.gc.cra.trail.config;

import ca.gc.cra.trail.adapter.aws.CloudWatchLogSinkAdapter;
import ca.gc.cra.trail.adapter.aws.ComprehendTextAnalysisAdapter;
import ca.gc.cra.trail.adapter.kafka.KafkaLogSinkAdapter;
import ca.gc.cra.trail.application.audit.AuditRecordBuilder;
import ca.gc.cra.trail.application.audit.AuditTrailService;
import ca.gc.cra.trail.application.audit.ChainVerifier;
import ca.gc.cra.trail.application.audit.RecordSigner;
import ca.gc.cra.trail.application.audit.RecordVerifier;
import ca.gc.cra.trail.application.delivery.DeliveryEngine;
import ca.gc.cra.trail.application.delivery.RecordSender;
import ca.gc.cra.trail.application.port.ClockPort;
import ca.gc.cra.trail.application.port.MetricsPort;
import ca.gc.cra.trail.application.port.SleeperPort;
import ca.gc.cra.trail.application.port.analysis.TextAnalysisPort;
import ca.gc.cra.trail.application.port.assistant.AssistantPort;
import ca.gc.cra.trail.application.port.sink.LogSinkPort;
import ca.gc.cra.trail.application.redaction.LocalPatternRedactor;
import ca.gc.cra.trail.application.redaction.PiiRedactor;
import ca.gc.cra.trail.application.redaction.RemoteAugmentedRedactor;
import ca.gc.cra.trail.application.redaction.TextAnalyzer;
import ca.gc.cra.trail.infrastructure.crypto.PemKeyStore;
import ca.gc.cra.trail.infrastructure.exec.SubprocessAssistantAdapter;
import ca.gc.cra.trail.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.trail.infrastructure.persistence.FileChainState;
import ca.gc.cra.trail.infrastructure.persistence.FileDeliveryJournal;
import ca.gc.cra.trail.infrastructure.persistence.FileDeliveryLock;
import ca.gc.cra.trail.infrastructure.persistence.FileRecordStore;
import ca.gc.cra.trail.infrastructure.sink.FileLogSinkAdapter;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires TRAIL use cases to concrete adapters.
 * <p><strong>Role:</strong> Translates the typed configuration records into record creation, delivery and
 * verification graphs for one command run.</p>
 * <p><strong>Lifecycle:</strong> owns every client it creates (sinks, classifier, metrics) and closes them in
 * reverse order in {@link #close()}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; used from the CLI thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final StoreConfig storeConfig;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final SleeperPort sleeper;
  private final Deque<AutoCloseable> owned = new ArrayDeque<>();
  private FileRecordStore store;
  private FileChainState chainState;
  private ComprehendTextAnalysisAdapter classifier;

  /**
   * Creates a root with OpenTelemetry metrics and the system clock.
   *
   * @param storeConfig store and key locations
   */
  public CompositionRoot(StoreConfig storeConfig) {
    this(storeConfig, new OpenTelemetryMetricsAdapter(), ClockPort.SYSTEM, SleeperPort.SYSTEM);
    owned.push((AutoCloseable) metrics);
  }

  /**
   * Creates a root with explicit collaborators.
   *
   * @param storeConfig store and key locations
   * @param metrics metrics sink
   * @param clock clock
   * @param sleeper sleeper used for backoff and pacing
   */
  public CompositionRoot(StoreConfig storeConfig, MetricsPort metrics, ClockPort clock, SleeperPort sleeper) {
    this.storeConfig = Objects.requireNonNull(storeConfig, "storeConfig");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  /** Metrics sink shared by every use case of this root. */
  public MetricsPort metrics() {
    return metrics;
  }

  /** Key store over the configured key directory. */
  public PemKeyStore keyStore() {
    return new PemKeyStore(storeConfig.keyDir());
  }

  /**
   * Opens the record store, creating its directories when missing.
   *
   * @return record store
   * @throws IOException when the store cannot be created
   */
  public FileRecordStore recordStore() throws IOException {
    if (store == null) {
      store = new FileRecordStore(storeConfig.storeDir(), clock);
    }
    return store;
  }

  /**
   * Opens the chain state of the record store.
   *
   * @return chain state
   * @throws IOException when the chain directory cannot be created
   */
  public FileChainState chainState() throws IOException {
    if (chainState == null) {
      FileRecordStore records = recordStore();
      chainState = new FileChainState(storeConfig.storeDir(), records::exists);
    }
    return chainState;
  }

  /**
   * Builds the record creation use case.
   *
   * @param config redaction settings
   * @return audit trail service
   * @throws SetupException when the signing key is missing
   * @throws IOException when the store cannot be opened
   */
  public AuditTrailService auditTrailService(RedactionConfig config) throws SetupException, IOException {
    Objects.requireNonNull(config, "config");
    RecordSigner signer = new RecordSigner(keyStore().loadPrivateKey());
    PiiRedactor redactor = config.remote()
        ? new RemoteAugmentedRedactor(classifier(config), metrics)
        : new LocalPatternRedactor(metrics);
    TextAnalyzer analyzer = config.analysis() ? new TextAnalyzer(classifier(config)) : null;
    return new AuditTrailService(
        redactor, analyzer, new AuditRecordBuilder(signer, clock), chainState(), recordStore(), metrics);
  }

  /**
   * Builds the upload use case.
   *
   * @param config delivery settings
   * @return delivery engine
   * @throws IOException when the store cannot be opened
   */
  public DeliveryEngine deliveryEngine(DeliveryConfig config) throws IOException {
    Objects.requireNonNull(config, "config");
    return new DeliveryEngine(
        recordStore(),
        new FileDeliveryJournal(storeConfig.storeDir()),
        new FileDeliveryLock(storeConfig.storeDir()),
        sink(config),
        config.toSettings(),
        clock,
        sleeper,
        metrics);
  }

  /**
   * Builds the single-record send use case.
   *
   * @param config delivery settings
   * @return record sender
   */
  public RecordSender recordSender(DeliveryConfig config) {
    Objects.requireNonNull(config, "config");
    return new RecordSender(sink(config), config.toSettings(), clock, sleeper, metrics);
  }

  /**
   * Builds the chain verifier.
   *
   * @return chain verifier holding the public key
   * @throws SetupException when no key is available
   */
  public ChainVerifier chainVerifier() throws SetupException {
    return new ChainVerifier(new RecordVerifier(keyStore().loadOrDerivePublicKey()));
  }

  /**
   * Builds the subprocess assistant adapter.
   *
   * @param command program and arguments, optionally containing {@code {prompt_file}}
   * @param timeout maximum run time
   * @return assistant port
   */
  public AssistantPort assistant(List<String> command, Duration timeout) {
    return new SubprocessAssistantAdapter(command, timeout);
  }

  LogSinkPort sink(DeliveryConfig config) {
    LogSinkPort sink = switch (config.sink()) {
      case CLOUDWATCH -> new CloudWatchLogSinkAdapter(config.region().orElse(null), config.sinkTimeout());
      case KAFKA -> new KafkaLogSinkAdapter(config.kafkaBootstrap().orElseThrow(), config.sinkTimeout());
      case FILE -> new FileLogSinkAdapter(config.fileSinkDir().orElseThrow());
    };
    owned.push(sink);
    log.debug("Delivery sink {} targeting {}/{}", config.sink(), config.logGroup(), config.logStream());
    return sink;
  }

  private TextAnalysisPort classifier(RedactionConfig config) {
    if (classifier == null) {
      classifier = new ComprehendTextAnalysisAdapter(
          config.region().orElse(null), config.classifierTimeout(), config.confidenceThreshold());
      owned.push(classifier);
    }
    return classifier;
  }

  @Override
  public void close() {
    while (!owned.isEmpty()) {
      AutoCloseable resource = owned.pop();
      try {
        resource.close();
      } catch (Exception ex) {
        log.warn("Failed to close {}: {}", resource.getClass().getSimpleName(), ex.getMessage());
      }
    }
  }
}
