package dev.scriptorium.crawl;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jspecify.annotations.Nullable;

/**
 * Mutable state of one crawl: its ledger plus the cancellation signal.
 *
 * <p>Owned by the orchestrator for the duration of a crawl. Cancellation is cooperative: it is
 * observed at phase boundaries and before each fetch, never in the middle of one.
 */
public class CrawlSession {

  private final UUID id;
  private final String baseUrl;
  private final CrawlLedger ledger;
  private final Clock clock;
  private final @Nullable Instant deadline;
  private final AtomicBoolean cancelled = new AtomicBoolean();

  public CrawlSession(
      UUID id, String baseUrl, CrawlLedger ledger, Clock clock, @Nullable Instant deadline) {
    this.id = id;
    this.baseUrl = baseUrl;
    this.ledger = ledger;
    this.clock = clock;
    this.deadline = deadline;
  }

  public UUID id() {
    return id;
  }

  public String baseUrl() {
    return baseUrl;
  }

  public CrawlLedger ledger() {
    return ledger;
  }

  public void cancel() {
    cancelled.set(true);
  }

  /** True once {@link #cancel()} was called or the deadline has passed. */
  public boolean isCancelled() {
    if (cancelled.get()) {
      return true;
    }
    return deadline != null && !clock.instant().isBefore(deadline);
  }

  /** True while another fetch may be issued: not cancelled and budget left. */
  public boolean canFetch() {
    return !isCancelled() && ledger.budgetRemaining();
  }
}
