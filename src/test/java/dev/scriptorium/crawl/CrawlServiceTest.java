package dev.scriptorium.crawl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.scriptorium.browser.BrowserProperties;
import dev.scriptorium.browser.BrowserSetupException;
import dev.scriptorium.export.CrawlOutputWriter;
import dev.scriptorium.extract.ContentExtractor;
import dev.scriptorium.extract.PageRecord;
import dev.scriptorium.fixture.FakeBrowserSession;
import dev.scriptorium.fixture.RecordingSleeper;
import dev.scriptorium.fixture.SteppingClock;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CrawlServiceTest {

  private static final String HOME = "https://example.com/";
  private static final String ABOUT = "https://example.com/about";
  private static final String SERVICES = "https://example.com/services";
  private static final String TAX = "https://example.com/services/tax";
  private static final String AUDIT = "https://example.com/services/audit";
  private static final String PRIVACY = "https://example.com/privacy";

  private static final String HOME_PAGE =
      """
      <html><head><title>Example Co</title>
      <meta name="description" content="Example home"></head>
      <body>
      <header><nav>
      <a href="/about">About</a>
      <a href="/services">Services</a>
      <a href="/style.css">Styles</a>
      <a href="https://other.com/about">Partner</a>
      </nav></header>
      <main>
      <h1>Welcome to Example</h1>
      <p>We build things for corporate clients.</p>
      </main>
      <a href="/privacy">Privacy policy</a>
      </body></html>
      """;

  @TempDir Path outputDir;

  private SteppingClock clock;
  private RecordingSleeper sleeper;
  private FakeBrowserSession browser;
  private CrawlProgressTracker tracker;

  @BeforeEach
  void setUp() {
    clock = new SteppingClock(Instant.parse("2026-03-01T10:00:00Z"));
    sleeper = new RecordingSleeper(clock);
    browser = new FakeBrowserSession();
    tracker = new CrawlProgressTracker(clock);
  }

  @Test
  void crawlVisitsHomeSectionsSubsectionsThenSweep() {
    exampleSite();

    CrawlSiteResult result = service(null).crawlSite(HOME, 50);

    assertThat(result.pages())
        .extracting(PageRecord::url)
        .containsExactly(HOME, ABOUT, SERVICES, TAX, AUDIT, PRIVACY);
    assertThat(result.failedUrls()).isEmpty();
    assertThat(result.cancelled()).isFalse();
    assertThat(result.output().pageCount()).isEqualTo(6);
    assertThat(browser.isClosed()).isTrue();
  }

  @Test
  void homeRecordCarriesTitleContentAndMeta() {
    exampleSite();

    PageRecord home = service(null).crawlSite(HOME, 50).pages().get(0);

    assertThat(home.title()).isEqualTo("Welcome to Example");
    assertThat(home.content())
        .isEqualTo("Welcome to Example\nWe build things for corporate clients.");
    assertThat(home.metaDescription()).isEqualTo("Example home");
    assertThat(home.scrapedAt()).isEqualTo(Instant.parse("2026-03-01T10:00:00Z"));
  }

  @Test
  void budgetOfOneStoresOnlyHomePage() {
    exampleSite();

    CrawlSiteResult result = service(null).crawlSite("https://example.com", 1);

    assertThat(result.pages()).extracting(PageRecord::url).containsExactly(HOME);
    assertThat(browser.navigations()).containsExactly(HOME, HOME);
    assertThat(sleeper.sleeps()).isEmpty();
  }

  @Test
  void storedPagesNeverExceedBudget() {
    exampleSite();

    CrawlSiteResult result = service(null).crawlSite(HOME, 3);

    assertThat(result.pages()).extracting(PageRecord::url).containsExactly(HOME, ABOUT, SERVICES);
    assertThat(browser.navigationsTo(TAX)).isZero();
  }

  @Test
  void everyFetchAfterHomeWaitsForPolitenessDelay() {
    exampleSite();

    service(null).crawlSite(HOME, 50);

    // 2 sections, 2 subsections, 5 sweep revisits, 1 sweep fetch
    assertThat(sleeper.sleeps()).hasSize(10).containsOnly(Duration.ofSeconds(1));
  }

  @Test
  void noUrlIsFetchedTwiceForScraping() {
    exampleSite();

    service(null).crawlSite(HOME, 50);

    // home is loaded for discovery, scraping and the sweep revisit
    assertThat(browser.navigationsTo(HOME)).isEqualTo(3);
    // sections and subsections are scraped once and revisited once by the sweep
    assertThat(browser.navigationsTo(ABOUT)).isEqualTo(2);
    assertThat(browser.navigationsTo(TAX)).isEqualTo(2);
    assertThat(browser.navigationsTo(PRIVACY)).isEqualTo(1);
  }

  @Test
  void subsectionsAreCappedPerSection() {
    StringBuilder links = new StringBuilder();
    for (int i = 1; i <= 7; i++) {
      links.append("<a href=\"/services/s").append(i).append("\">Item ").append(i).append("</a>\n");
      browser.page(SERVICES + "/s" + i, page("Service " + i, "Details for service number " + i));
    }
    browser
        .page(HOME, page("Home", "Welcome to Example", "<nav><a href=\"/services\">Services</a></nav>"))
        .page(SERVICES, page("Services", "Everything we offer", links.toString()));

    CrawlSiteResult result = service(null).crawlSite(HOME, 50);

    assertThat(result.pages())
        .extracting(PageRecord::url)
        .containsSubsequence(HOME, SERVICES, SERVICES + "/s1", SERVICES + "/s5");
    assertThat(browser.navigationsTo(SERVICES + "/s1")).isEqualTo(2);
    // s6 and s7 are left to the sweep
    assertThat(result.pages())
        .extracting(PageRecord::url)
        .containsSubsequence(SERVICES + "/s5", SERVICES + "/s6", SERVICES + "/s7");
  }

  @Test
  void missingSectionIsSkippedAndCrawlContinues() {
    browser
        .page(
            HOME,
            page(
                "Home",
                "Welcome to Example",
                "<nav><a href=\"/careers\">Careers</a><a href=\"/about\">About</a></nav>"))
        .page(ABOUT, page("About", "About our company history"));

    CrawlSiteResult result = service(null).crawlSite(HOME, 50);

    assertThat(result.pages()).extracting(PageRecord::url).containsExactly(HOME, ABOUT);
    assertThat(result.failedUrls()).containsExactly("https://example.com/careers");
    assertThat(browser.navigationsTo("https://example.com/careers")).isEqualTo(1);
  }

  @Test
  void navigationErrorIsSkippedAndCrawlContinues() {
    browser
        .page(
            HOME,
            page(
                "Home",
                "Welcome to Example",
                "<nav><a href=\"/team\">Team</a><a href=\"/about\">About</a></nav>"))
        .page(ABOUT, page("About", "About our company history"))
        .failing("https://example.com/team");

    CrawlSiteResult result = service(null).crawlSite(HOME, 50);

    assertThat(result.pages()).extracting(PageRecord::url).containsExactly(HOME, ABOUT);
    assertThat(result.failedUrls()).containsExactly("https://example.com/team");
  }

  @Test
  void pageWithoutContentIsNotStoredNorRetried() {
    browser
        .page(
            HOME,
            page("Home", "Welcome to Example", "<nav><a href=\"/blog\">Blog</a></nav>"))
        .page("https://example.com/blog", "<html><body><main>Home\nMenu\n</main></body></html>");

    CrawlSiteResult result = service(null).crawlSite(HOME, 50);

    assertThat(result.pages()).extracting(PageRecord::url).containsExactly(HOME);
    assertThat(result.failedUrls()).isEmpty();
    assertThat(browser.navigationsTo("https://example.com/blog")).isEqualTo(1);
  }

  @Test
  void homeThatFailsToLoadStillProducesOutput() {
    browser.page(HOME, 503, page("Down", "Maintenance in progress"));

    CrawlSiteResult result = service(null).crawlSite(HOME, 50);

    assertThat(result.pages()).isEmpty();
    assertThat(result.failedUrls()).containsExactly(HOME);
    assertThat(Files.exists(result.output().dataFile())).isTrue();
  }

  @Test
  void deadlineStopsFurtherFetches() {
    exampleSite();

    CrawlSiteResult result = service(Duration.ofMillis(1500)).crawlSite(HOME, 50);

    // the second politeness delay crosses the deadline
    assertThat(result.cancelled()).isTrue();
    assertThat(result.pages()).extracting(PageRecord::url).containsExactly(HOME, ABOUT);
    assertThat(browser.navigationsTo(SERVICES)).isZero();
    assertThat(result.output().pageCount()).isEqualTo(2);
  }

  @Test
  void progressEndsInDoneWithCounts() {
    exampleSite();
    CrawlService service = service(null);

    CrawlSiteResult result = service.crawlSite(HOME, 50);

    CrawlProgress progress = tracker.getProgress(result.sessionId()).orElseThrow();
    assertThat(progress.phase()).isEqualTo(CrawlPhase.DONE);
    assertThat(progress.pagesScraped()).isEqualTo(6);
    assertThat(service.cancel(result.sessionId())).isFalse();
  }

  @Test
  void browserSetupFailureAbortsCrawl() {
    CrawlProgressTracker mockTracker = mock(CrawlProgressTracker.class);
    BrowserSetupException failure =
        new BrowserSetupException("Chromium not installed", new IllegalStateException());
    CrawlService service =
        new CrawlService(
            () -> {
              throw failure;
            },
            new NavigationDiscoverer(),
            new ContentExtractor(clock),
            mockTracker,
            new CrawlOutputWriter(outputDir),
            new PolitenessDelay(Duration.ofSeconds(1), sleeper),
            properties(null),
            noSettling(),
            clock);

    assertThatThrownBy(() -> service.crawlSite(HOME, 50)).isSameAs(failure);
    verify(mockTracker).enterPhase(any(), eq(CrawlPhase.ABORTED));
  }

  @Test
  void unwritableOutputAbortsCrawl() throws IOException {
    exampleSite();
    CrawlOutputWriter writer = mock(CrawlOutputWriter.class);
    when(writer.write(anyString(), anyList())).thenThrow(new IOException("disk full"));
    CrawlService service =
        new CrawlService(
            () -> browser,
            new NavigationDiscoverer(),
            new ContentExtractor(clock),
            tracker,
            writer,
            new PolitenessDelay(Duration.ofSeconds(1), sleeper),
            properties(null),
            noSettling(),
            clock);

    assertThatThrownBy(() -> service.crawlSite(HOME, 1))
        .isInstanceOf(UncheckedIOException.class)
        .hasMessageContaining("disk full");
  }

  private CrawlService service(@Nullable Duration maxDuration) {
    return new CrawlService(
        () -> browser,
        new NavigationDiscoverer(),
        new ContentExtractor(clock),
        tracker,
        new CrawlOutputWriter(outputDir),
        new PolitenessDelay(Duration.ofSeconds(1), sleeper),
        properties(maxDuration),
        noSettling(),
        clock);
  }

  private CrawlProperties properties(@Nullable Duration maxDuration) {
    return new CrawlProperties(HOME, Duration.ofSeconds(1), 50, maxDuration, outputDir);
  }

  private static BrowserProperties noSettling() {
    return new BrowserProperties(
        true, null, null, Duration.ZERO, Duration.ZERO, Duration.ZERO);
  }

  private void exampleSite() {
    browser
        .page(HOME, HOME_PAGE)
        .page(ABOUT, page("About", "About our company history and values"))
        .page(
            SERVICES,
            page(
                "Services",
                "Tax and audit services for businesses",
                "<a href=\"/services/tax\">Tax</a>\n<a href=\"/services/audit\">Audit</a>"))
        .page(TAX, page("Tax", "Tax planning for small companies"))
        .page(AUDIT, page("Audit", "Independent audit of annual accounts"))
        .page(PRIVACY, page("Privacy", "How we handle personal data"));
  }

  private static String page(String heading, String text) {
    return page(heading, text, "");
  }

  private static String page(String heading, String text, String extraMarkup) {
    return "<html><head><title>" + heading + "</title></head><body>\n"
        + extraMarkup + "\n"
        + "<main>\n<h1>" + heading + "</h1>\n<p>" + text + "</p>\n</main>\n"
        + "</body></html>";
  }
}
