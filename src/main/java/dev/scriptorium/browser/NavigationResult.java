package dev.scriptorium.browser;

/**
 * Outcome of a page navigation.
 *
 * @param url the URL that was requested
 * @param status HTTP status of the main document, or 0 when the browser reported no response
 */
public record NavigationResult(String url, int status) {

  public boolean isOk() {
    return status == 200;
  }
}
