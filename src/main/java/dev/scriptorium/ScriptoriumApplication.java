package dev.scriptorium;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Scriptorium crawler.
 *
 * <p>Runs without a web server: {@link dev.scriptorium.cli.CrawlRunner} crawls the configured site
 * once, writes the page records and exits.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ScriptoriumApplication {
    public static void main(String[] args) {
        SpringApplication.run(ScriptoriumApplication.class, args);
    }
}
