package dev.scriptorium.crawl;

import dev.scriptorium.browser.BrowserSession;
import dev.scriptorium.browser.LinkElement;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads links off the page currently loaded in a {@link BrowserSession}.
 *
 * <p>Every link source is collected independently: a source that fails contributes nothing and
 * the remaining sources still run. All returned URLs are canonical and deduplicated with
 * first-seen order preserved.
 */
@Component
public class NavigationDiscoverer {

  private static final Logger log = LoggerFactory.getLogger(NavigationDiscoverer.class);

  /** Menu items that only reveal their children on hover. */
  static final String DROPDOWN_TRIGGERS =
      "nav .dropdown, nav .has-dropdown, .menu-item-has-children";

  /** Containers conventionally holding the primary navigation. */
  static final List<String> NAVIGATION_SELECTORS =
      List.of(
          "nav a[href]",
          ".navigation a[href]",
          ".nav a[href]",
          ".menu a[href]",
          ".navbar a[href]",
          "header a[href]",
          ".main-nav a[href]",
          ".primary-nav a[href]");

  static final String ALL_ANCHORS = "a[href]";

  /**
   * Collect the section URLs of a loaded home page.
   *
   * <ol>
   *   <li>Hover dropdown triggers so hidden menu entries get rendered
   *   <li>Anchors inside navigation containers whose href names a main section
   *   <li>Any anchor whose visible text names a main section
   * </ol>
   *
   * @param session browser positioned on the home page
   * @param classifier classifier bound to the crawled site
   * @return section URLs in first-seen order
   */
  public List<String> discoverSections(BrowserSession session, UrlClassifier classifier) {
    int revealed = guarded("dropdown triggers", () -> session.hoverAll(DROPDOWN_TRIGGERS), 0);
    log.debug("Hovered {} dropdown triggers", revealed);

    Set<String> sections = new LinkedHashSet<>();
    for (String selector : NAVIGATION_SELECTORS) {
      for (LinkElement link : linksOrEmpty(session, selector)) {
        if (!classifier.isMainSection(link.href())) {
          continue;
        }
        accept(classifier, link.href()).ifPresent(url -> {
          if (sections.add(url)) {
            log.info("Found navigation link: {}", url);
          }
        });
      }
    }

    for (LinkElement link : linksOrEmpty(session, ALL_ANCHORS)) {
      if (!classifier.hasSectionText(link.text())) {
        continue;
      }
      accept(classifier, link.href()).ifPresent(url -> {
        if (sections.add(url)) {
          log.info("Found section link by text '{}': {}", link.text().strip(), url);
        }
      });
    }
    return List.copyOf(sections);
  }

  /**
   * All valid same-site links on the loaded page, with no section restriction.
   *
   * @param session browser positioned on any page of the site
   * @param classifier classifier bound to the crawled site
   * @return canonical URLs in document order
   */
  public List<String> internalLinks(BrowserSession session, UrlClassifier classifier) {
    Set<String> links = new LinkedHashSet<>();
    for (LinkElement link : linksOrEmpty(session, ALL_ANCHORS)) {
      accept(classifier, link.href()).ifPresent(links::add);
    }
    return new ArrayList<>(links);
  }

  /**
   * Links on the loaded page whose path nests under {@code parentUrl}.
   *
   * @param session browser positioned on the parent page
   * @param classifier classifier bound to the crawled site
   * @param parentUrl canonical URL of the section
   * @return canonical subsection URLs in document order
   */
  public List<String> subsections(
      BrowserSession session, UrlClassifier classifier, String parentUrl) {
    return internalLinks(session, classifier).stream()
        .filter(url -> classifier.isSubsection(parentUrl, url))
        .toList();
  }

  private static Optional<String> accept(UrlClassifier classifier, String href) {
    return classifier.resolve(href)
        .filter(classifier::isValid)
        .map(UrlNormalizer::normalize);
  }

  private static List<LinkElement> linksOrEmpty(BrowserSession session, String selector) {
    return guarded(selector, () -> session.links(selector), List.of());
  }

  private static <T> T guarded(String source, Supplier<T> collector, T fallback) {
    try {
      return collector.get();
    } catch (RuntimeException e) {
      log.warn("Link discovery from {} failed: {}", source, e.getMessage());
      return fallback;
    }
  }
}
