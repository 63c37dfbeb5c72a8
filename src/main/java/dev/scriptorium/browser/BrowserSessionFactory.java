package dev.scriptorium.browser;

/** Opens browser sessions for a crawl. One session is used per crawl. */
@FunctionalInterface
public interface BrowserSessionFactory {

  /**
   * Launch a browser and open a fresh page.
   *
   * @throws BrowserSetupException if the browser or its context cannot be created
   */
  BrowserSession open();
}
