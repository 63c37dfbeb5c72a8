package dev.scriptorium.extract;

import static org.assertj.core.api.Assertions.assertThat;

import dev.scriptorium.fixture.FakeBrowserSession;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ContentExtractorTest {

  private static final String URL = "https://example.com/about";
  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  private final ContentExtractor extractor = new ContentExtractor(Clock.fixed(NOW, ZoneOffset.UTC));
  private FakeBrowserSession browser;

  @BeforeEach
  void setUp() {
    browser = new FakeBrowserSession();
  }

  @Test
  void extractsMainRegionWithMetadata() {
    PageRecord page =
        extract(
            """
            <html><head><title>About | Example</title>
            <meta name="description" content="Who we are"></head>
            <body>
            <nav><a href="/">Home</a></nav>
            <main>
            <h1>About Example</h1>
            <p>Founded in 1999 in Lisbon.</p>
            <h2>Our values</h2>
            </main>
            <footer>Copyright notice here</footer>
            </body></html>
            """)
            .orElseThrow();

    assertThat(page.url()).isEqualTo(URL);
    assertThat(page.title()).isEqualTo("About Example");
    assertThat(page.content()).isEqualTo("About Example\nFounded in 1999 in Lisbon.\nOur values");
    assertThat(page.headings()).containsExactly("About Example", "Our values");
    assertThat(page.metaDescription()).isEqualTo("Who we are");
    assertThat(page.scrapedAt()).isEqualTo(NOW);
    assertThat(page.wordCount()).isEqualTo(9);
  }

  @Test
  void titleFallsBackToDocumentTitle() {
    PageRecord page =
        extract(
            """
            <html><head><title> About | Example </title></head>
            <body><article>
            Plain article text without headings
            </article></body></html>
            """)
            .orElseThrow();

    assertThat(page.title()).isEqualTo("About | Example");
    assertThat(page.content()).isEqualTo("Plain article text without headings");
    assertThat(page.headings()).isEmpty();
  }

  @Test
  void firstContentRegionWins() {
    PageRecord page =
        extract(
            """
            <html><body>
            <div class="content">Content class region text</div>
            <article>Article region text</article>
            </body></html>
            """)
            .orElseThrow();

    assertThat(page.content()).isEqualTo("Article region text");
  }

  @Test
  void fallsBackToBodyText() {
    PageRecord page =
        extract(
            """
            <html><body>
            <div>Loose body text without a region</div>
            </body></html>
            """)
            .orElseThrow();

    assertThat(page.content()).isEqualTo("Loose body text without a region");
  }

  @Test
  void blankRegionFallsThroughToNextSource() {
    PageRecord page =
        extract(
            """
            <html><body>
            <main>  </main>
            <div id="content">Region text by id</div>
            </body></html>
            """)
            .orElseThrow();

    assertThat(page.content()).isEqualTo("Region text by id");
  }

  @Test
  void failingRegionQueryFallsThroughToNextSource() {
    browser.brokenSelector("main").brokenSelector("h1");

    PageRecord page =
        extract(
            """
            <html><head><title>Fallback title</title></head><body>
            <main>Main region text</main>
            <article>Article region text</article>
            </body></html>
            """)
            .orElseThrow();

    assertThat(page.content()).isEqualTo("Article region text");
    assertThat(page.title()).isEqualTo("Fallback title");
  }

  @Test
  void pageWithOnlyBoilerplateYieldsNothing() {
    Optional<PageRecord> page =
        extract("<html><body><main>\nHome\nMenu\nok\n</main></body></html>");

    assertThat(page).isEmpty();
  }

  @Test
  void headingsIgnoreBoilerplateRegions() {
    PageRecord page =
        extract(
            """
            <html><body>
            <header><h2>Site banner</h2></header>
            <main>
            <h1>Services</h1>
            <p>Tax and audit for companies.</p>
            </main>
            <aside><h3>Related</h3></aside>
            </body></html>
            """)
            .orElseThrow();

    assertThat(page.headings()).containsExactly("Services");
  }

  private Optional<PageRecord> extract(String html) {
    browser.page(URL, html);
    browser.navigate(URL);
    return extractor.extract(browser, URL, browser.content());
  }
}
