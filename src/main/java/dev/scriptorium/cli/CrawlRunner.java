package dev.scriptorium.cli;

import dev.scriptorium.crawl.CrawlProperties;
import dev.scriptorium.crawl.CrawlService;
import dev.scriptorium.crawl.CrawlSiteResult;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Crawls the configured site once at startup. The first non-option program argument, when present,
 * replaces {@code scriptorium.crawl.base-url}; {@code --key=value} options are left to Spring's
 * property binding. Disabled with {@code scriptorium.runner.enabled=false}.
 */
@Component
@ConditionalOnProperty(
    prefix = "scriptorium.runner",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class CrawlRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(CrawlRunner.class);

  private final CrawlService crawlService;
  private final CrawlProperties properties;

  public CrawlRunner(CrawlService crawlService, CrawlProperties properties) {
    this.crawlService = crawlService;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    List<String> positional = args.getNonOptionArgs();
    String baseUrl =
        !positional.isEmpty() && !positional.get(0).isBlank()
            ? positional.get(0)
            : properties.baseUrl();
    CrawlSiteResult result = crawlService.crawlSite(baseUrl, properties.maxPages());
    log.info(
        "Scraping completed. Total pages scraped: {} ({} failed{}). Data: {}, summary: {}",
        result.pages().size(),
        result.failedUrls().size(),
        result.cancelled() ? ", cancelled early" : "",
        result.output().dataFile(),
        result.output().summaryFile());
  }
}
