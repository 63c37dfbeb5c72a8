package dev.scriptorium.export;

import java.nio.file.Path;

/**
 * Files written for one crawl.
 *
 * @param dataFile JSON array of page records, read by the chunking pipeline
 * @param summaryFile human-readable listing of scraped pages
 * @param pageCount number of records in {@code dataFile}
 */
public record CrawlOutput(Path dataFile, Path summaryFile, int pageCount) {}
