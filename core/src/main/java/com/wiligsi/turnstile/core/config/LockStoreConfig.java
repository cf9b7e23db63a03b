package com.wiligsi.turnstile.core.config;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Settings shared by every lock store. A config is read once when the process starts and passed
 * to the store's constructor; changing a setting means building a new store.
 *
 * @author Steven Miller
 */
public final class LockStoreConfig {

  public static final String LOCK_LIFETIME_ENV = "TICKET_LOCK_LIFETIME";
  public static final Duration DEFAULT_LOCK_LIFETIME = Duration.ofSeconds(60);
  public static final Duration DEFAULT_WAIT_TIME = Duration.ofSeconds(1);
  public static final int DEFAULT_MAX_WRITE_ATTEMPTS = 25;

  private static final Logger LOG = Logger.getLogger(LockStoreConfig.class.getName());

  private final Duration lockLifetime;
  private final Duration waitTime;
  private final int maxWriteAttempts;
  private final Clock clock;

  private LockStoreConfig(Builder builder) {
    this.lockLifetime = builder.lockLifetime;
    this.waitTime = builder.waitTime;
    this.maxWriteAttempts = builder.maxWriteAttempts;
    this.clock = builder.clock;
  }

  public static LockStoreConfig defaults() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Build a config from the process environment. {@value #LOCK_LIFETIME_ENV} holds the default
   * lock lifetime in seconds and may be fractional. Values that can't be used are logged and
   * replaced by the default.
   *
   * @param environment - usually {@code System.getenv()}
   * @return a builder seeded from the environment
   */
  public static Builder fromEnvironment(Map<String, String> environment) {
    final Builder builder = newBuilder();
    final String rawLifetime = environment.get(LOCK_LIFETIME_ENV);
    if (rawLifetime == null || rawLifetime.isBlank()) {
      return builder;
    }

    try {
      final double seconds = Double.parseDouble(rawLifetime.trim());
      if (!(seconds > 0) || Double.isInfinite(seconds)) {
        LOG.warning(
            String.format(
                "Ignoring %s='%s'. The lock lifetime must be a positive number of seconds",
                LOCK_LIFETIME_ENV, rawLifetime
            )
        );
        return builder;
      }
      builder.setLockLifetime(Duration.ofNanos(Math.round(seconds * 1_000_000_000d)));
    } catch (NumberFormatException formatException) {
      LOG.warning(
          String.format(
              "Cannot convert %s='%s' to a number of seconds", LOCK_LIFETIME_ENV, rawLifetime
          )
      );
    }
    return builder;
  }

  /**
   * How long a Ticket stays valid when the caller doesn't say otherwise.
   *
   * @return the default lock lifetime
   */
  public Duration getLockLifetime() {
    return lockLifetime;
  }

  /**
   * How long a waiter sleeps between checks of the queue.
   *
   * @return the poll interval
   */
  public Duration getWaitTime() {
    return waitTime;
  }

  /**
   * How many times a read-modify-write is attempted before a conflict is reported.
   *
   * @return the attempt limit
   */
  public int getMaxWriteAttempts() {
    return maxWriteAttempts;
  }

  public Clock getClock() {
    return clock;
  }

  public Builder toBuilder() {
    return newBuilder()
        .setLockLifetime(lockLifetime)
        .setWaitTime(waitTime)
        .setMaxWriteAttempts(maxWriteAttempts)
        .setClock(clock);
  }

  @Override
  public String toString() {
    return String.format(
        "LockStoreConfig{lockLifetime=%s, waitTime=%s, maxWriteAttempts=%d}",
        lockLifetime, waitTime, maxWriteAttempts
    );
  }

  public static final class Builder {

    private Duration lockLifetime = DEFAULT_LOCK_LIFETIME;
    private Duration waitTime = DEFAULT_WAIT_TIME;
    private int maxWriteAttempts = DEFAULT_MAX_WRITE_ATTEMPTS;
    private Clock clock = Clock.systemUTC();

    private Builder() {
    }

    public Builder setLockLifetime(Duration lockLifetime) {
      this.lockLifetime = requirePositive("lockLifetime", lockLifetime);
      return this;
    }

    public Builder setWaitTime(Duration waitTime) {
      this.waitTime = requirePositive("waitTime", waitTime);
      return this;
    }

    public Builder setMaxWriteAttempts(int maxWriteAttempts) {
      if (maxWriteAttempts < 1) {
        throw new IllegalArgumentException("maxWriteAttempts must be at least 1");
      }
      this.maxWriteAttempts = maxWriteAttempts;
      return this;
    }

    public Builder setClock(Clock clock) {
      if (clock == null) {
        throw new IllegalArgumentException("clock must not be null");
      }
      this.clock = clock;
      return this;
    }

    public LockStoreConfig build() {
      return new LockStoreConfig(this);
    }

    private static Duration requirePositive(String name, Duration value) {
      if (value == null || value.isNegative() || value.isZero()) {
        throw new IllegalArgumentException(
            String.format("%s must be positive but was '%s'", name, value)
        );
      }
      return value;
    }
  }
}
