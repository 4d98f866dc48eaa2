package ca.gc.cra.trail.application.delivery;

import ca.gc.cra.trail.application.port.ClockPort;
import ca.gc.cra.trail.application.port.MetricsPort;
import ca.gc.cra.trail.application.port.SleeperPort;
import ca.gc.cra.trail.application.port.sink.LogEvent;
import ca.gc.cra.trail.application.port.sink.LogSinkPort;
import ca.gc.cra.trail.application.port.sink.SinkAuthorizationException;
import ca.gc.cra.trail.application.port.sink.ThrottlingException;
import ca.gc.cra.trail.application.port.sink.TransportException;
import ca.gc.cra.trail.domain.delivery.DeliveryAttempt;
import ca.gc.cra.trail.domain.delivery.DeliveryAttempt.Attempting;
import ca.gc.cra.trail.domain.delivery.DeliveryAttempt.Backoff;
import ca.gc.cra.trail.domain.delivery.DeliveryOutcome;
import ca.gc.cra.trail.logging.Logs;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the {@link DeliveryAttempt} state machine for one record until it is terminal.
 */
final class AttemptRunner {
  private static final Logger log = LoggerFactory.getLogger(AttemptRunner.class);

  private final LogSinkPort sink;
  private final DeliverySettings settings;
  private final ClockPort clock;
  private final SleeperPort sleeper;
  private final MetricsPort metrics;

  AttemptRunner(
      LogSinkPort sink, DeliverySettings settings, ClockPort clock, SleeperPort sleeper, MetricsPort metrics) {
    this.sink = Objects.requireNonNull(sink, "sink");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  Result deliver(String fileName, String json, String recordHash) throws InterruptedException {
    DeliveryAttempt state = DeliveryAttempt.start();
    boolean unauthorized = false;
    long started = clock.nowMillis();
    while (!state.terminal()) {
      if (state instanceof Backoff backoff) {
        long wait = backoff.remainingMillis(clock.nowMillis());
        log.debug("Backing off {} ms before attempt {} for {}", wait, backoff.attemptNumber() + 1, fileName);
        sleeper.sleep(wait);
        state = backoff.resume();
        continue;
      }
      Attempting attempt = (Attempting) state;
      try {
        sink.put(settings.logGroup(), settings.logStream(),
            List.of(new LogEvent(clock.nowMillis(), json, recordHash)));
        state = attempt.acknowledged();
      } catch (ThrottlingException ex) {
        metrics.increment("delivery.throttled");
        state = attempt.throttled(settings.retryPolicy(), clock.nowMillis());
        log.warn("Sink throttled {} on attempt {}: {}", fileName, attempt.attemptNumber(), Logs.describe(ex));
      } catch (SinkAuthorizationException ex) {
        unauthorized = true;
        state = attempt.failed(DeliveryOutcome.SINK_UNAUTHORIZED + ": " + Logs.describe(ex));
      } catch (TransportException ex) {
        state = attempt.failed(Logs.describe(ex));
      } catch (RuntimeException ex) {
        log.debug("Unexpected sink failure for {}", fileName, ex);
        state = attempt.failed("unexpected sink failure: " + Logs.describe(ex));
      }
    }
    if (state instanceof DeliveryAttempt.Succeeded) {
      metrics.observe("delivery.latencyMillis", clock.nowMillis() - started);
      return new Result(new DeliveryOutcome(fileName, DeliveryOutcome.Status.DELIVERED, state.attemptNumber(), null),
          false);
    }
    DeliveryAttempt.Failed failed = (DeliveryAttempt.Failed) state;
    log.error("Delivery of {} failed after {} attempt(s): {}", fileName, failed.attemptNumber(), failed.reason());
    return new Result(
        new DeliveryOutcome(fileName, DeliveryOutcome.Status.FAILED, failed.attemptNumber(), failed.reason()),
        unauthorized);
  }

  record Result(DeliveryOutcome outcome, boolean unauthorized) {
    boolean delivered() {
      return outcome.status() == DeliveryOutcome.Status.DELIVERED;
    }
  }
}
