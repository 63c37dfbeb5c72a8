package dev.scriptorium.crawl;

import java.time.Duration;

/** Blocking pause, swappable in tests. */
@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration) throws InterruptedException;

  /** Sleeper backed by {@link Thread#sleep(long)}. */
  static Sleeper system() {
    return duration -> {
      long ms = Math.max(0, duration.toMillis());
      if (ms > 0) {
        Thread.sleep(ms);
      }
    };
  }
}
