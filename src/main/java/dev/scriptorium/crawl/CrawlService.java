package dev.scriptorium.crawl;

import dev.scriptorium.browser.BrowserProperties;
import dev.scriptorium.browser.BrowserSession;
import dev.scriptorium.browser.BrowserSessionFactory;
import dev.scriptorium.browser.BrowserSetupException;
import dev.scriptorium.browser.NavigationResult;
import dev.scriptorium.export.CrawlOutput;
import dev.scriptorium.export.CrawlOutputWriter;
import dev.scriptorium.extract.ContentExtractor;
import dev.scriptorium.extract.PageRecord;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Crawl orchestrator: discovers the site's navigation, scrapes the home page, then each section
 * with a few of its subsections, and finally sweeps leftover internal links while budget remains.
 *
 * <p>Runs on a single browser page, strictly sequentially. Every fetch is preceded by a budget and
 * cancellation check, and every fetch after the home page by the politeness delay. A failing page
 * is logged and skipped; only a browser that cannot be launched, or output that cannot be
 * written, aborts the crawl.
 */
@Service
public class CrawlService {

  private static final Logger log = LoggerFactory.getLogger(CrawlService.class);

  /** Subsections fetched per navigation section. */
  static final int MAX_SUBSECTIONS_PER_SECTION = 5;

  /** Leftover links fetched by the final sweep. */
  static final int MAX_SWEEP_PAGES = 10;

  private final BrowserSessionFactory browserSessionFactory;
  private final NavigationDiscoverer navigationDiscoverer;
  private final ContentExtractor contentExtractor;
  private final CrawlProgressTracker progressTracker;
  private final CrawlOutputWriter outputWriter;
  private final PolitenessDelay politenessDelay;
  private final CrawlProperties crawlProperties;
  private final BrowserProperties browserProperties;
  private final Clock clock;

  public CrawlService(
      BrowserSessionFactory browserSessionFactory,
      NavigationDiscoverer navigationDiscoverer,
      ContentExtractor contentExtractor,
      CrawlProgressTracker progressTracker,
      CrawlOutputWriter outputWriter,
      PolitenessDelay politenessDelay,
      CrawlProperties crawlProperties,
      BrowserProperties browserProperties,
      Clock clock) {
    this.browserSessionFactory = browserSessionFactory;
    this.navigationDiscoverer = navigationDiscoverer;
    this.contentExtractor = contentExtractor;
    this.progressTracker = progressTracker;
    this.outputWriter = outputWriter;
    this.politenessDelay = politenessDelay;
    this.crawlProperties = crawlProperties;
    this.browserProperties = browserProperties;
    this.clock = clock;
  }

  /**
   * Crawl the configured site with the configured page budget.
   *
   * @return the stored records and the files they were written to
   */
  public CrawlSiteResult crawlSite() {
    return crawlSite(crawlProperties.baseUrl(), crawlProperties.maxPages());
  }

  /**
   * Crawl a site and persist the records.
   *
   * @param baseUrl home page of the site
   * @param maxPages ceiling on stored pages, at least 1
   * @return the stored records and the files they were written to
   * @throws BrowserSetupException if the browser cannot be launched
   * @throws UncheckedIOException if the output files cannot be written
   */
  public CrawlSiteResult crawlSite(String baseUrl, int maxPages) {
    UrlClassifier classifier = new UrlClassifier(baseUrl);
    CrawlSession session = newSession(UrlNormalizer.normalize(classifier.baseUrl()), maxPages);
    progressTracker.startCrawl(session);
    log.info(
        "Starting crawl {} of {} (maxPages={}, politenessDelay={})",
        session.id(),
        session.baseUrl(),
        maxPages,
        politenessDelay.delay());

    CrawlRun run;
    try (BrowserSession browser = openBrowser(session)) {
      run = new CrawlRun(session, browser, classifier);
      List<String> sections = discoverNavigation(run);
      scrapeHome(run);
      scrapeSections(run, sections);
      sweepRemainder(run);
    }

    CrawlOutput output = persist(session);
    progressTracker.enterPhase(session.id(), CrawlPhase.DONE);
    log.info(
        "Crawl {} complete: {} pages scraped from {}",
        session.id(),
        session.ledger().pagesScraped(),
        session.baseUrl());
    return new CrawlSiteResult(
        session.id(),
        session.ledger().records(),
        run.failedUrls,
        session.isCancelled(),
        output);
  }

  /**
   * Request cancellation of a running crawl. Takes effect before its next fetch.
   *
   * @param sessionId the crawl to cancel
   * @return true if the crawl was still running
   */
  public boolean cancel(UUID sessionId) {
    return progressTracker.cancel(sessionId);
  }

  private CrawlSession newSession(String baseUrl, int maxPages) {
    Instant deadline =
        crawlProperties.maxDuration() == null
            ? null
            : clock.instant().plus(crawlProperties.maxDuration());
    return new CrawlSession(UUID.randomUUID(), baseUrl, new CrawlLedger(maxPages), clock, deadline);
  }

  private BrowserSession openBrowser(CrawlSession session) {
    try {
      return browserSessionFactory.open();
    } catch (BrowserSetupException e) {
      log.error("Crawl {} aborted: {}", session.id(), e.getMessage());
      progressTracker.enterPhase(session.id(), CrawlPhase.ABORTED);
      throw e;
    }
  }

  // --- Phases ---

  private List<String> discoverNavigation(CrawlRun run) {
    if (!enterPhase(run.session, CrawlPhase.DISCOVERING_NAV)) {
      return List.of();
    }
    log.info("Extracting navigation structure from {}", run.session.baseUrl());
    try {
      NavigationResult home = run.browser.navigate(run.session.baseUrl());
      if (!home.isOk()) {
        log.warn(
            "Home page {} returned HTTP {}, no navigation discovered", home.url(), home.status());
        return List.of();
      }
      run.browser.pause(browserProperties.homeSettleDelay());
    } catch (RuntimeException e) {
      log.error("Could not load home page for discovery: {}", e.getMessage());
      return List.of();
    }
    List<String> sections = navigationDiscoverer.discoverSections(run.browser, run.classifier);
    log.info("Found {} navigation links: {}", sections.size(), sections);
    return sections;
  }

  private void scrapeHome(CrawlRun run) {
    if (!enterPhase(run.session, CrawlPhase.SCRAPING_HOME)) {
      return;
    }
    scrapePage(run, run.session.baseUrl());
  }

  private void scrapeSections(CrawlRun run, List<String> sections) {
    if (!enterPhase(run.session, CrawlPhase.SCRAPING_SECTIONS)) {
      return;
    }
    for (String sectionUrl : sections) {
      if (run.session.ledger().alreadyVisited(sectionUrl)) {
        continue;
      }
      if (!politeFetchAllowed(run)) {
        return;
      }
      log.info("Scraping main section: {}", sectionUrl);
      FetchOutcome outcome = scrapePage(run, sectionUrl);
      if (!outcome.pageLoaded()) {
        continue;
      }

      List<String> subsections =
          navigationDiscoverer.subsections(run.browser, run.classifier, sectionUrl);
      int fetched = 0;
      for (String subsectionUrl : subsections) {
        if (fetched >= MAX_SUBSECTIONS_PER_SECTION) {
          break;
        }
        if (run.session.ledger().alreadyVisited(subsectionUrl)) {
          continue;
        }
        if (!politeFetchAllowed(run)) {
          return;
        }
        scrapePage(run, subsectionUrl);
        fetched++;
      }
    }
  }

  private void sweepRemainder(CrawlRun run) {
    if (!enterPhase(run.session, CrawlPhase.SWEEPING_REMAINDER)) {
      return;
    }
    Set<String> harvested = new LinkedHashSet<>();
    for (PageRecord page : run.session.ledger().records()) {
      if (!politeFetchAllowed(run)) {
        return;
      }
      try {
        NavigationResult revisit = run.browser.navigate(page.url());
        if (revisit.isOk()) {
          harvested.addAll(navigationDiscoverer.internalLinks(run.browser, run.classifier));
        }
      } catch (RuntimeException e) {
        log.warn("Could not revisit {} for links: {}", page.url(), e.getMessage());
      }
    }

    List<String> remaining =
        harvested.stream()
            .filter(url -> !run.session.ledger().alreadyVisited(url))
            .limit(MAX_SWEEP_PAGES)
            .toList();
    log.info("Sweeping {} remaining internal links", remaining.size());
    for (String url : remaining) {
      if (!politeFetchAllowed(run)) {
        return;
      }
      scrapePage(run, url);
    }
  }

  private CrawlOutput persist(CrawlSession session) {
    progressTracker.enterPhase(session.id(), CrawlPhase.PERSISTING);
    try {
      return outputWriter.write(session.baseUrl(), session.ledger().records());
    } catch (IOException e) {
      log.error("Crawl {} aborted: could not write output: {}", session.id(), e.getMessage());
      progressTracker.enterPhase(session.id(), CrawlPhase.ABORTED);
      throw new UncheckedIOException(e);
    }
  }

  // --- Single page ---

  /**
   * Fetch, extract and record one page. The URL is marked visited before the fetch, so a page
   * that fails is never attempted again in this session.
   */
  private FetchOutcome scrapePage(CrawlRun run, String url) {
    CrawlSession session = run.session;
    if (!session.canFetch()) {
      return FetchOutcome.SKIPPED;
    }
    if (!session.ledger().claim(url)) {
      return FetchOutcome.SKIPPED;
    }

    log.info(
        "Scraping [{}/{}]: {}",
        session.ledger().pagesScraped() + 1,
        session.ledger().maxPages(),
        url);
    try {
      NavigationResult result = run.browser.navigate(url);
      if (!result.isOk()) {
        log.warn("Failed to load {}: HTTP {}", url, result.status());
        run.recordFailure(url);
        return FetchOutcome.FAILED;
      }

      Optional<PageRecord> page = contentExtractor.extract(run.browser, url, run.browser.content());
      if (page.isEmpty()) {
        log.warn("No content extracted from: {}", url);
        progressTracker.recordPageEmpty(session.id());
        return FetchOutcome.EMPTY;
      }

      session.ledger().record(page.get());
      progressTracker.recordPageScraped(session.id());
      log.info("Successfully scraped: {} ({} words)", url, page.get().wordCount());
      return FetchOutcome.SCRAPED;
    } catch (RuntimeException e) {
      log.error("Error scraping {}: {}", url, e.getMessage());
      run.recordFailure(url);
      return FetchOutcome.FAILED;
    }
  }

  /** Politeness delay, then a fresh budget and cancellation check. */
  private boolean politeFetchAllowed(CrawlRun run) {
    if (!run.session.canFetch()) {
      return false;
    }
    politenessDelay.await(run.session);
    return run.session.canFetch();
  }

  private boolean enterPhase(CrawlSession session, CrawlPhase phase) {
    progressTracker.enterPhase(session.id(), phase);
    if (session.isCancelled()) {
      log.info("Crawl {} cancelled, skipping {}", session.id(), phase);
      return false;
    }
    if (!session.ledger().budgetRemaining()) {
      log.info("Page budget reached, skipping {}", phase);
      return false;
    }
    return true;
  }

  private enum FetchOutcome {
    SCRAPED,
    EMPTY,
    FAILED,
    SKIPPED;

    boolean pageLoaded() {
      return this == SCRAPED || this == EMPTY;
    }
  }

  /** Per-crawl collaborators handed through the phases. */
  private final class CrawlRun {
    private final CrawlSession session;
    private final BrowserSession browser;
    private final UrlClassifier classifier;
    private final List<String> failedUrls = new ArrayList<>();

    private CrawlRun(CrawlSession session, BrowserSession browser, UrlClassifier classifier) {
      this.session = session;
      this.browser = browser;
      this.classifier = classifier;
    }

    private void recordFailure(String url) {
      failedUrls.add(url);
      progressTracker.recordFailure(session.id(), url);
    }
  }
}
