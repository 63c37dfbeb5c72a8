package dev.scriptorium.crawl;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

import org.springframework.stereotype.Component;

/**
 * Thread-safe in-memory tracker for crawl sessions.
 *
 * <p>Maintains a {@link ConcurrentHashMap} of {@link CrawlProgress} snapshots keyed by session ID.
 * Each update atomically reads the current state, creates a new immutable record with the
 * updated field, and writes it back using {@code computeIfPresent()}. Live sessions are kept
 * alongside so that {@link #cancel(UUID)} can reach a running crawl from another thread.
 *
 * <p>The most recent {@value #MAX_FINISHED_SESSIONS} finished crawls stay queryable; older
 * finished snapshots are evicted. Running crawls are never evicted.
 */
@Component
public class CrawlProgressTracker {

    private final ConcurrentHashMap<UUID, CrawlProgress> sessions = new ConcurrentHashMap<>();
    static final int MAX_FINISHED_SESSIONS = 32;

    private final ConcurrentHashMap<UUID, CrawlSession> liveSessions = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<UUID> finished = new ConcurrentLinkedQueue<>();
    private final Clock clock;

    public CrawlProgressTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * Start tracking a new crawl in {@link CrawlPhase#IDLE}.
     *
     * @param session the session about to run
     */
    public void startCrawl(CrawlSession session) {
        liveSessions.put(session.id(), session);
        sessions.put(session.id(), new CrawlProgress(
                session.id(),
                CrawlPhase.IDLE,
                0,
                0,
                0,
                session.ledger().maxPages(),
                List.of(),
                clock.instant()
        ));
    }

    /**
     * Move a crawl to another phase. Terminal phases also release the live session.
     *
     * @param sessionId the crawl
     * @param phase     the phase being entered
     */
    public void enterPhase(UUID sessionId, CrawlPhase phase) {
        CrawlProgress updated =
                sessions.computeIfPresent(sessionId, (id, progress) -> progress.withPhase(phase));
        if (phase.isTerminal() && liveSessions.remove(sessionId) != null && updated != null) {
            finished.add(sessionId);
            evictFinished();
        }
    }

    /**
     * Record that a page was scraped and stored.
     *
     * @param sessionId the crawl
     */
    public void recordPageScraped(UUID sessionId) {
        sessions.computeIfPresent(sessionId, (id, progress) ->
                new CrawlProgress(
                        progress.sessionId(),
                        progress.phase(),
                        progress.pagesScraped() + 1,
                        progress.pagesFailed(),
                        progress.pagesEmpty(),
                        progress.maxPages(),
                        progress.failedUrls(),
                        progress.startedAt()
                )
        );
    }

    /**
     * Record that a page loaded but had no usable content.
     *
     * @param sessionId the crawl
     */
    public void recordPageEmpty(UUID sessionId) {
        sessions.computeIfPresent(sessionId, (id, progress) ->
                new CrawlProgress(
                        progress.sessionId(),
                        progress.phase(),
                        progress.pagesScraped(),
                        progress.pagesFailed(),
                        progress.pagesEmpty() + 1,
                        progress.maxPages(),
                        progress.failedUrls(),
                        progress.startedAt()
                )
        );
    }

    /**
     * Record that a page failed to load or returned a non-success status.
     *
     * @param sessionId the crawl
     * @param url       the URL that failed
     */
    public void recordFailure(UUID sessionId, String url) {
        sessions.computeIfPresent(sessionId, (id, progress) -> {
            List<String> updatedFailures = new ArrayList<>(progress.failedUrls());
            updatedFailures.add(url);
            return new CrawlProgress(
                    progress.sessionId(),
                    progress.phase(),
                    progress.pagesScraped(),
                    progress.pagesFailed() + 1,
                    progress.pagesEmpty(),
                    progress.maxPages(),
                    updatedFailures,
                    progress.startedAt()
            );
        });
    }

    /**
     * Ask a running crawl to stop before its next fetch.
     *
     * @param sessionId the crawl to cancel
     * @return true if a live session was found
     */
    public boolean cancel(UUID sessionId) {
        CrawlSession session = liveSessions.get(sessionId);
        if (session == null) {
            return false;
        }
        session.cancel();
        return true;
    }

    /**
     * Get the current progress snapshot for a crawl.
     *
     * @param sessionId the crawl to check
     * @return progress snapshot, or empty if not tracking this session
     */
    public Optional<CrawlProgress> getProgress(UUID sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * Stop tracking a crawl.
     *
     * @param sessionId the crawl to forget
     */
    public void removeCrawl(UUID sessionId) {
        sessions.remove(sessionId);
        liveSessions.remove(sessionId);
        finished.remove(sessionId);
    }

    private void evictFinished() {
        while (finished.size() > MAX_FINISHED_SESSIONS) {
            UUID oldest = finished.poll();
            if (oldest == null) {
                return;
            }
            sessions.remove(oldest);
        }
    }
}
