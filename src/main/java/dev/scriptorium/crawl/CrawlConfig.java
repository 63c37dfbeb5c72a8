package dev.scriptorium.crawl;

import dev.scriptorium.export.CrawlOutputWriter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the collaborators that take their settings from {@code scriptorium.crawl.*}. */
@Configuration
public class CrawlConfig {

  @Bean
  @ConditionalOnMissingBean
  public Sleeper sleeper() {
    return Sleeper.system();
  }

  @Bean
  public PolitenessDelay politenessDelay(CrawlProperties properties, Sleeper sleeper) {
    return new PolitenessDelay(properties.politenessDelay(), sleeper);
  }

  @Bean
  public CrawlOutputWriter crawlOutputWriter(CrawlProperties properties) {
    return new CrawlOutputWriter(properties.outputDir());
  }
}
