package ca.gc.cra.trail.testutil;

import ca.gc.cra.trail.application.port.ClockPort;
import ca.gc.cra.trail.application.port.SleeperPort;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Clock and sleeper in one: sleeping records the duration and advances the clock instead of blocking.
 */
public final class ManualClock implements ClockPort, SleeperPort {
  private long nowMillis;
  private final List<Long> sleeps = new ArrayList<>();

  public ManualClock(Instant start) {
    this.nowMillis = start.toEpochMilli();
  }

  @Override
  public synchronized long nowMillis() {
    return nowMillis;
  }

  @Override
  public synchronized void sleep(long millis) {
    sleeps.add(millis);
    nowMillis += millis;
  }

  public synchronized void advance(Duration duration) {
    nowMillis += duration.toMillis();
  }

  public synchronized List<Long> sleeps() {
    return List.copyOf(sleeps);
  }
}
