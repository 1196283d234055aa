package io.storefront.toolkit.core.time;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A {@link Clock} that only moves when told to.
 * <p>
 * Components read time through an injected clock, so window, TTL and cooldown logic can be
 * driven deterministically by advancing this clock instead of sleeping.
 */
public class ManualClock extends Clock {

  private final AtomicReference<Instant> now;
  private final ZoneId zone;

  public ManualClock() {
    this(Instant.EPOCH.plus(Duration.ofDays(1)));
  }

  public ManualClock(Instant start) {
    this(new AtomicReference<>(Objects.requireNonNull(start, "start cannot be null")), ZoneOffset.UTC);
  }

  private ManualClock(AtomicReference<Instant> now, ZoneId zone) {
    this.now = now;
    this.zone = zone;
  }

  public Instant advance(Duration amount) {
    Objects.requireNonNull(amount, "amount cannot be null");
    return now.updateAndGet(current -> current.plus(amount));
  }

  public void set(Instant instant) {
    now.set(Objects.requireNonNull(instant, "instant cannot be null"));
  }

  @Override
  public ZoneId getZone() {
    return zone;
  }

  @Override
  public Clock withZone(ZoneId zone) {
    // shares the same time source
    return new ManualClock(now, zone);
  }

  @Override
  public Instant instant() {
    return now.get();
  }

  @Override
  public long millis() {
    return now.get().toEpochMilli();
  }
}
