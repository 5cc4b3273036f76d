package com.scholary.avatar.job;

import java.time.Duration;

/** Pauses the calling thread between polls. Replaced in tests to simulate elapsed time. */
@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration) throws InterruptedException;

  static Sleeper threadSleep() {
    return duration -> Thread.sleep(duration.toMillis());
  }
}
