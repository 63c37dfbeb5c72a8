package dev.scriptorium.crawl;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Immutable snapshot of a crawl's progress.
 *
 * <p>Created and updated by {@link CrawlProgressTracker}; each mutation produces a new record.
 *
 * @param sessionId the crawl session
 * @param phase current state of the session
 * @param pagesScraped records stored so far
 * @param pagesFailed fetches that failed or returned a non-success status
 * @param pagesEmpty pages loaded fine but dropped for having no usable text
 * @param maxPages the session's page budget
 * @param failedUrls URLs counted in {@code pagesFailed}
 * @param startedAt when the crawl started
 */
public record CrawlProgress(
        UUID sessionId,
        CrawlPhase phase,
        int pagesScraped,
        int pagesFailed,
        int pagesEmpty,
        int maxPages,
        List<String> failedUrls,
        Instant startedAt
) {

    public CrawlProgress {
        failedUrls = failedUrls == null ? List.of() : List.copyOf(failedUrls);
    }

    CrawlProgress withPhase(CrawlPhase newPhase) {
        return new CrawlProgress(sessionId, newPhase, pagesScraped, pagesFailed, pagesEmpty,
                maxPages, failedUrls, startedAt);
    }
}
