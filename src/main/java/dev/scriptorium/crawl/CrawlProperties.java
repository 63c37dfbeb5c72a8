package dev.scriptorium.crawl;

import java.nio.file.Path;
import java.time.Duration;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Crawl settings bound from {@code scriptorium.crawl.*}. Validated on binding; the application
 * fails to start if a value is out of range.
 *
 * @param baseUrl home page of the site to crawl
 * @param politenessDelay pause before every page fetch
 * @param maxPages hard ceiling on stored pages per crawl
 * @param maxDuration optional deadline for a whole crawl, measured from its start
 * @param outputDir directory receiving the scraped data and summary files
 */
@ConfigurationProperties(prefix = "scriptorium.crawl")
public record CrawlProperties(
    String baseUrl,
    Duration politenessDelay,
    int maxPages,
    @Nullable Duration maxDuration,
    Path outputDir) {

  public CrawlProperties {
    if (baseUrl == null || baseUrl.isBlank()) {
      throw new IllegalStateException("scriptorium.crawl.base-url must be set");
    }
    if (politenessDelay == null) {
      politenessDelay = Duration.ofSeconds(1);
    }
    if (politenessDelay.isNegative()) {
      throw new IllegalStateException(
          "scriptorium.crawl.politeness-delay must not be negative, got: " + politenessDelay);
    }
    if (maxPages < 1) {
      throw new IllegalStateException(
          "scriptorium.crawl.max-pages must be at least 1, got: " + maxPages);
    }
    if (maxDuration != null && (maxDuration.isZero() || maxDuration.isNegative())) {
      throw new IllegalStateException(
          "scriptorium.crawl.max-duration must be positive, got: " + maxDuration);
    }
    if (outputDir == null) {
      outputDir = Path.of("data");
    }
  }
}
