package dev.scriptorium.crawl;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Mandatory pause before each page fetch, throttling the request rate toward the target site. */
public class PolitenessDelay {

  private static final Logger log = LoggerFactory.getLogger(PolitenessDelay.class);

  private final Duration delay;
  private final Sleeper sleeper;

  public PolitenessDelay(Duration delay, Sleeper sleeper) {
    if (delay.isNegative()) {
      throw new IllegalArgumentException("Politeness delay must not be negative: " + delay);
    }
    this.delay = delay;
    this.sleeper = sleeper;
  }

  public Duration delay() {
    return delay;
  }

  /**
   * Wait out the delay. An interrupt cancels the session and restores the interrupt flag.
   *
   * @param session the crawl being throttled
   */
  public void await(CrawlSession session) {
    if (delay.isZero()) {
      return;
    }
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted during politeness delay, cancelling crawl {}", session.id());
      session.cancel();
    }
  }
}
