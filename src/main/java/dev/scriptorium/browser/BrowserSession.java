package dev.scriptorium.browser;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * A single live browser page driven by the crawler.
 *
 * <p>All DOM accessors are best-effort: a missing element, a selector timeout and a selector error
 * all collapse to an empty result rather than an exception. Only {@link #navigate(String)} throws,
 * and only for failures that leave the page unusable for the requested URL.
 */
public interface BrowserSession extends AutoCloseable {

  /**
   * Navigate to a URL and wait until the page has settled.
   *
   * @param url absolute URL to load
   * @return the HTTP status of the main document response
   * @throws NavigationException on network error or navigation timeout
   */
  NavigationResult navigate(String url);

  /** Current rendered markup of the page. */
  String content();

  /** Rendered text of the first element matching {@code selector}. */
  Optional<String> innerText(String selector);

  /** All anchors matching {@code selector}, in document order. */
  List<LinkElement> links(String selector);

  /**
   * Hover every element matching {@code selector} to reveal hidden menus.
   *
   * @return number of elements hovered successfully
   */
  int hoverAll(String selector);

  /** Cooperative wait on the page, e.g. to let dynamic content render. */
  void pause(Duration duration);

  @Override
  void close();
}
