package dev.scriptorium.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.scriptorium.extract.PageRecord;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists the records of a crawl for the downstream chunking pipeline.
 *
 * <p>Produces two files per crawl, overwriting earlier ones: {@value #DATA_FILE} with the records
 * in scrape order and {@value #SUMMARY_FILE} listing base URL, page count and every URL with its
 * title.
 */
public class CrawlOutputWriter {

  private static final Logger log = LoggerFactory.getLogger(CrawlOutputWriter.class);

  static final String DATA_FILE = "scraped_data.json";
  static final String SUMMARY_FILE = "scraping_summary.txt";

  private final Path outputDir;
  private final ObjectMapper objectMapper;

  /**
   * @param outputDir directory receiving both files, created on first write
   */
  public CrawlOutputWriter(Path outputDir) {
    this.outputDir = outputDir;
    this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
  }

  public Path outputDir() {
    return outputDir;
  }

  /**
   * Write the data and summary files.
   *
   * @param baseUrl the crawled site
   * @param records records in scrape order
   * @return paths of the written files
   * @throws IOException if the directory or a file cannot be written
   */
  public CrawlOutput write(String baseUrl, List<PageRecord> records) throws IOException {
    Files.createDirectories(outputDir);
    Path dataPath = outputDir.resolve(DATA_FILE);
    Path summaryPath = outputDir.resolve(SUMMARY_FILE);

    List<PageRecordJson> json = records.stream().map(PageRecordJson::from).toList();
    try (BufferedWriter writer = Files.newBufferedWriter(dataPath, StandardCharsets.UTF_8)) {
      objectMapper.writeValue(writer, json);
    }
    log.info("Scraped data saved to {}", dataPath);

    writeSummary(baseUrl, records, summaryPath);
    return new CrawlOutput(dataPath, summaryPath, records.size());
  }

  private void writeSummary(String baseUrl, List<PageRecord> records, Path path)
      throws IOException {
    try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      writer.write("Web Scraping Summary");
      writer.newLine();
      writer.write("====================");
      writer.newLine();
      writer.newLine();
      writer.write("Base URL: " + baseUrl);
      writer.newLine();
      writer.write("Total pages scraped: " + records.size());
      writer.newLine();
      writer.write("Scraped URLs:");
      writer.newLine();
      int index = 1;
      for (PageRecord page : records) {
        String title = page.title().isEmpty() ? "No title" : page.title();
        writer.write("%d. %s - %s".formatted(index++, page.url(), title));
        writer.newLine();
      }
    }
  }
}
