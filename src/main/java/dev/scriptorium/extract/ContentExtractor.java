package dev.scriptorium.extract;

import dev.scriptorium.browser.BrowserSession;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a loaded page into a {@link PageRecord}.
 *
 * <p>Rendered text comes from the live page, so script-built content is captured; structure
 * (headings, meta description, the last-resort text) comes from a jsoup copy of the markup with
 * boilerplate regions removed. The body text is resolved through an ordered chain of sources and
 * the first one yielding non-blank text wins.
 */
@Component
public class ContentExtractor {

  private static final Logger log = LoggerFactory.getLogger(ContentExtractor.class);

  /** Regions that never hold page content. */
  static final String BOILERPLATE_SELECTOR =
      "script, style, noscript, nav, footer, header, aside, .advertisement, .ads, .ad-banner";

  /** Semantic content regions, most specific first. */
  static final List<String> CONTENT_SELECTORS =
      List.of(
          "main",
          "article",
          ".content",
          "#content",
          ".main-content",
          ".page-content",
          ".entry-content",
          ".post-content",
          "[role=\"main\"]");

  private static final String HEADING_SELECTOR = "h1, h2, h3, h4, h5, h6";

  private final Clock clock;

  public ContentExtractor(Clock clock) {
    this.clock = clock;
  }

  /**
   * Extract a record from the page currently loaded in {@code session}.
   *
   * @param session browser positioned on {@code url}
   * @param url canonical URL the record is stored under
   * @param markup rendered markup of the page
   * @return the record, or empty when the cleaned text is empty
   */
  public Optional<PageRecord> extract(BrowserSession session, String url, String markup) {
    Document stripped = Jsoup.parse(markup == null ? "" : markup, url);
    stripped.select(BOILERPLATE_SELECTOR).remove();

    String title = resolveTitle(session, stripped);
    String content = TextCleaner.clean(resolveBodyText(session, stripped, url));
    if (content.isEmpty()) {
      return Optional.empty();
    }

    return Optional.of(
        PageRecord.of(
            url,
            title,
            content,
            headings(stripped),
            metaDescription(stripped),
            clock.instant()));
  }

  private String resolveTitle(BrowserSession session, Document stripped) {
    Optional<String> heading = query("h1", () -> session.innerText("h1")).map(TextCleaner::strip);
    if (heading.isPresent() && !heading.get().isEmpty()) {
      return heading.get();
    }
    return TextCleaner.strip(stripped.title());
  }

  private String resolveBodyText(BrowserSession session, Document stripped, String url) {
    for (Supplier<Optional<String>> source : bodyTextSources(session, stripped)) {
      Optional<String> text = source.get();
      if (text.isPresent() && !text.get().isBlank()) {
        return text.get();
      }
    }
    log.debug("No text found in any content region of {}", url);
    return "";
  }

  private List<Supplier<Optional<String>>> bodyTextSources(
      BrowserSession session, Document stripped) {
    List<Supplier<Optional<String>>> sources = new ArrayList<>();
    for (String selector : CONTENT_SELECTORS) {
      sources.add(() -> query(selector, () -> session.innerText(selector)));
    }
    sources.add(() -> query("body", () -> session.innerText("body")));
    sources.add(() -> Optional.of(stripped.body().wholeText()));
    return sources;
  }

  private static Optional<String> query(String selector, Supplier<Optional<String>> lookup) {
    try {
      return lookup.get();
    } catch (RuntimeException e) {
      log.debug("Text query {} failed, trying next source: {}", selector, e.getMessage());
      return Optional.empty();
    }
  }

  private static List<String> headings(Document stripped) {
    List<String> headings = new ArrayList<>();
    for (Element heading : stripped.select(HEADING_SELECTOR)) {
      String text = heading.text();
      if (!text.isBlank()) {
        headings.add(text);
      }
    }
    return headings;
  }

  private static String metaDescription(Document stripped) {
    Element meta = stripped.selectFirst("meta[name=description]");
    return meta == null ? "" : meta.attr("content");
  }
}
