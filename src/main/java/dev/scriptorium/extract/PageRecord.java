package dev.scriptorium.extract;

import java.time.Instant;
import java.util.List;

/**
 * One successfully scraped page, ready for chunking and embedding downstream.
 *
 * <p>Immutable. {@code content} is never blank and {@code wordCount} always equals the number of
 * whitespace-delimited tokens in it; both are enforced at construction.
 *
 * @param url canonical absolute URL, unique within a crawl session
 * @param title best-effort page title, possibly empty
 * @param content cleaned, whitespace-normalized body text
 * @param headings heading texts (levels 1-6) in document order, duplicates kept
 * @param metaDescription value of {@code <meta name="description">}, or empty
 * @param scrapedAt wall-clock time of extraction
 * @param wordCount token count of {@code content}
 */
public record PageRecord(
    String url,
    String title,
    String content,
    List<String> headings,
    String metaDescription,
    Instant scrapedAt,
    int wordCount) {

  public PageRecord {
    if (url == null || url.isBlank()) {
      throw new IllegalArgumentException("url must not be blank");
    }
    if (content == null || content.isBlank()) {
      throw new IllegalArgumentException("content must not be blank for " + url);
    }
    if (wordCount != TextCleaner.wordCount(content)) {
      throw new IllegalArgumentException(
          "wordCount " + wordCount + " does not match content of " + url);
    }
    title = title == null ? "" : title;
    headings = headings == null ? List.of() : List.copyOf(headings);
    metaDescription = metaDescription == null ? "" : metaDescription;
  }

  /** Creates a record deriving {@code wordCount} from {@code content}. */
  public static PageRecord of(
      String url,
      String title,
      String content,
      List<String> headings,
      String metaDescription,
      Instant scrapedAt) {
    return new PageRecord(
        url, title, content, headings, metaDescription, scrapedAt, TextCleaner.wordCount(content));
  }
}
