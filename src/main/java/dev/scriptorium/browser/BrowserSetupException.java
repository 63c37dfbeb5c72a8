package dev.scriptorium.browser;

/** The browser, its context or its page could not be created. Fatal to the crawl session. */
public class BrowserSetupException extends RuntimeException {

  public BrowserSetupException(String message, Throwable cause) {
    super(message, cause);
  }
}
