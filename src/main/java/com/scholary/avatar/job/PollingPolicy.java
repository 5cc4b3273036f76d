package com.scholary.avatar.job;

import java.time.Duration;
import java.util.Objects;

/**
 * How long a job may run and how often it is polled.
 *
 * @param budget wall-clock limit measured from submission
 * @param interval fixed pause between two polls
 */
public record PollingPolicy(Duration budget, Duration interval) {

  public static final PollingPolicy DEFAULT =
      new PollingPolicy(Duration.ofSeconds(600), Duration.ofSeconds(5));

  public PollingPolicy {
    Objects.requireNonNull(budget, "budget");
    Objects.requireNonNull(interval, "interval");
    if (budget.isNegative() || budget.isZero()) {
      throw new IllegalArgumentException("budget must be positive: " + budget);
    }
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("interval must be positive: " + interval);
    }
  }

  /** Upper bound on polls for a job that never finishes. */
  public long maxPolls() {
    long budgetMs = budget.toMillis();
    long intervalMs = interval.toMillis();
    return (budgetMs + intervalMs - 1) / intervalMs;
  }
}
