package dev.scriptorium.export;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.scriptorium.extract.PageRecord;
import java.time.Instant;
import java.util.List;

/**
 * Wire form of a {@link PageRecord}: snake_case names and {@code scraped_at} as fractional epoch
 * seconds.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({
  "url",
  "title",
  "content",
  "headings",
  "meta_description",
  "scraped_at",
  "word_count"
})
public record PageRecordJson(
    String url,
    String title,
    String content,
    List<String> headings,
    String metaDescription,
    double scrapedAt,
    int wordCount) {

  public static PageRecordJson from(PageRecord page) {
    return new PageRecordJson(
        page.url(),
        page.title(),
        page.content(),
        page.headings(),
        page.metaDescription(),
        epochSeconds(page.scrapedAt()),
        page.wordCount());
  }

  private static double epochSeconds(Instant instant) {
    return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
  }
}
