package dev.scriptorium.browser;

/** A page could not be loaded: network failure, navigation timeout or a crashed page. */
public class NavigationException extends RuntimeException {

  public NavigationException(String url, Throwable cause) {
    super("Navigation to " + url + " failed: " + cause.getMessage(), cause);
  }
}
