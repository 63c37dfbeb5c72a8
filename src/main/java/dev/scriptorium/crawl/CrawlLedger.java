package dev.scriptorium.crawl;

import dev.scriptorium.extract.PageRecord;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Frontier and dedup ledger of one crawl session: the visited set, the ordered records and the
 * page budget.
 *
 * <p>Nothing is ever removed. Methods are synchronized so a parallel fetcher can rely on {@link
 * #claim(String)} and {@link #record(PageRecord)} as atomic per-URL steps; the single-worker
 * crawler never contends.
 */
public class CrawlLedger {

  private final int maxPages;
  private final Set<String> visited = new LinkedHashSet<>();
  private final List<PageRecord> records = new ArrayList<>();

  /**
   * @param maxPages ceiling on stored records, at least 1
   */
  public CrawlLedger(int maxPages) {
    if (maxPages < 1) {
      throw new IllegalArgumentException("maxPages must be at least 1, got: " + maxPages);
    }
    this.maxPages = maxPages;
  }

  public synchronized boolean alreadyVisited(String url) {
    return visited.contains(url);
  }

  /**
   * Mark a URL visited ahead of fetching it.
   *
   * @return true if the caller now owns the fetch, false if the URL was already visited
   */
  public synchronized boolean claim(String url) {
    return visited.add(url);
  }

  /**
   * Append a record and mark its URL visited.
   *
   * @throws IllegalStateException if the budget is exhausted or the URL already has a record
   */
  public synchronized void record(PageRecord page) {
    if (records.size() >= maxPages) {
      throw new IllegalStateException("Page budget of " + maxPages + " exhausted");
    }
    for (PageRecord existing : records) {
      if (existing.url().equals(page.url())) {
        throw new IllegalStateException("Page already recorded: " + page.url());
      }
    }
    visited.add(page.url());
    records.add(page);
  }

  public synchronized boolean budgetRemaining() {
    return records.size() < maxPages;
  }

  public synchronized int pagesScraped() {
    return records.size();
  }

  public int maxPages() {
    return maxPages;
  }

  /** Snapshot of the records in scrape order. */
  public synchronized List<PageRecord> records() {
    return List.copyOf(records);
  }

  /** Snapshot of every URL visited so far, in visit order. */
  public synchronized Set<String> visited() {
    return Set.copyOf(visited);
  }
}
