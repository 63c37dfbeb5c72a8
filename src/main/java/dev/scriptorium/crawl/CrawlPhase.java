package dev.scriptorium.crawl;

/**
 * States of a crawl session, in the order the orchestrator walks them. {@link #ABORTED} is
 * reachable from any state on a setup failure; per-page failures never lead there.
 */
public enum CrawlPhase {
  IDLE,
  DISCOVERING_NAV,
  SCRAPING_HOME,
  SCRAPING_SECTIONS,
  SWEEPING_REMAINDER,
  PERSISTING,
  DONE,
  ABORTED;

  public boolean isTerminal() {
    return this == DONE || this == ABORTED;
  }
}
