package dev.scriptorium.crawl;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Pure predicates deciding which links the crawler may follow and how they relate.
 *
 * <p>An instance is bound to the site's base URL and holds no other state, so every method returns
 * the same answer for the same input regardless of crawl progress.
 */
public final class UrlClassifier {

  /** Extensions of resources that are never pages: documents, images, styles, scripts, archives. */
  static final List<String> DENIED_EXTENSIONS =
      List.of(
          ".pdf", ".doc", ".docx", ".xls", ".xlsx", ".ppt", ".pptx",
          ".jpg", ".jpeg", ".png", ".gif", ".svg", ".webp", ".bmp", ".ico",
          ".css", ".js", ".json",
          ".zip", ".gz", ".tar", ".rar", ".7z",
          ".xml", ".rss", ".atom",
          ".mp3", ".mp4", ".avi", ".mov", ".woff", ".woff2", ".ttf");

  /** Substrings that mark in-page anchors, non-HTTP schemes and back-office areas. */
  static final List<String> DENIED_SUBSTRINGS =
      List.of("#", "mailto:", "tel:", "javascript:", "login", "admin", "wp-admin");

  /** Keywords naming the top-level sections of a corporate site, matched against hrefs. */
  static final List<String> SECTION_KEYWORDS =
      List.of(
          "about", "services", "team", "resources", "contact",
          "portfolio", "blog", "news", "careers", "clients");

  /** Keywords matched against visible link text when a site has no semantic navigation. */
  static final List<String> SECTION_TEXT_KEYWORDS =
      List.of("about", "services", "team", "resources", "contact", "portfolio", "blog");

  private final URI baseUri;
  private final String baseHost;

  /**
   * @param baseUrl absolute URL of the site's home page
   * @throws IllegalArgumentException if the base URL is not absolute or has no host
   */
  public UrlClassifier(String baseUrl) {
    URI uri;
    try {
      uri = URI.create(baseUrl.trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Base URL is malformed: " + baseUrl, e);
    }
    if (uri.getScheme() == null || uri.getHost() == null) {
      throw new IllegalArgumentException("Base URL must be absolute: " + baseUrl);
    }
    if (uri.getRawPath() == null || uri.getRawPath().isEmpty()) {
      // "https://x.com".resolve("about") would otherwise yield "https://x.comabout"
      uri = uri.resolve("/");
    }
    this.baseUri = uri;
    this.baseHost = UrlNormalizer.hostAndPort(uri.toString()).orElseThrow();
  }

  /** The base URL this classifier is bound to, with an explicit root path. */
  public String baseUrl() {
    return baseUri.toString();
  }

  /**
   * Resolve a raw href against the base URL.
   *
   * @return the absolute URL, or empty when the href is blank or cannot be parsed
   */
  public Optional<String> resolve(String href) {
    if (href == null || href.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(baseUri.resolve(href.trim()).toString());
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }

  /**
   * True iff the URL is on the base host, does not point at a denied file type and contains none
   * of the denied substrings.
   */
  public boolean isValid(String url) {
    if (url == null || url.isBlank()) {
      return false;
    }
    Optional<String> host = UrlNormalizer.hostAndPort(url);
    if (host.isEmpty() || !host.get().equals(baseHost)) {
      return false;
    }
    String lower = url.toLowerCase(Locale.ROOT);
    String path = UrlNormalizer.trimmedPath(url).orElse("").toLowerCase(Locale.ROOT);
    for (String extension : DENIED_EXTENSIONS) {
      if (path.endsWith(extension)) {
        return false;
      }
    }
    for (String pattern : DENIED_SUBSTRINGS) {
      if (lower.contains(pattern)) {
        return false;
      }
    }
    return true;
  }

  /** True iff the raw href mentions one of the top-level section keywords (case-insensitive). */
  public boolean isMainSection(String href) {
    return containsAny(href, SECTION_KEYWORDS);
  }

  /** True iff the visible link text mentions one of the section keywords (case-insensitive). */
  public boolean hasSectionText(String linkText) {
    return containsAny(linkText, SECTION_TEXT_KEYWORDS);
  }

  /**
   * True iff the child's slash-trimmed path starts with the parent's and the two differ. This is a
   * string prefix test, so {@code /services-archive} counts as nested under {@code /services}.
   */
  public boolean isSubsection(String parentUrl, String childUrl) {
    Optional<String> parentPath = UrlNormalizer.trimmedPath(parentUrl);
    Optional<String> childPath = UrlNormalizer.trimmedPath(childUrl);
    if (parentPath.isEmpty() || childPath.isEmpty()) {
      return false;
    }
    return childPath.get().startsWith(parentPath.get())
        && !childPath.get().equals(parentPath.get());
  }

  private static boolean containsAny(String value, List<String> keywords) {
    if (value == null || value.isEmpty()) {
      return false;
    }
    String lower = value.toLowerCase(Locale.ROOT);
    for (String keyword : keywords) {
      if (lower.contains(keyword)) {
        return true;
      }
    }
    return false;
  }
}
