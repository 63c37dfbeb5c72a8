package dev.scriptorium.crawl;

import dev.scriptorium.export.CrawlOutput;
import dev.scriptorium.extract.PageRecord;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of a completed crawl.
 *
 * @param sessionId the crawl session
 * @param pages stored records in scrape order
 * @param failedUrls URLs that failed to load or returned a non-success status
 * @param cancelled whether the crawl stopped early on cancellation or deadline
 * @param output the persisted files
 */
public record CrawlSiteResult(
    UUID sessionId,
    List<PageRecord> pages,
    List<String> failedUrls,
    boolean cancelled,
    CrawlOutput output) {

  public CrawlSiteResult {
    pages = pages == null ? List.of() : List.copyOf(pages);
    failedUrls = failedUrls == null ? List.of() : List.copyOf(failedUrls);
  }
}
