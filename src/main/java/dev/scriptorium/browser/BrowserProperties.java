package dev.scriptorium.browser;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Browser settings bound from {@code scriptorium.browser.*}.
 *
 * @param headless run Chromium without a window
 * @param navigationTimeout upper bound for a page load, including the network-idle wait
 * @param selectorTimeout upper bound for a single DOM query or hover
 * @param settleDelay pause after each page load so late scripts can render
 * @param homeSettleDelay pause on the home page before navigation discovery
 * @param hoverDelay pause after each dropdown hover
 */
@ConfigurationProperties(prefix = "scriptorium.browser")
public record BrowserProperties(
    boolean headless,
    Duration navigationTimeout,
    Duration selectorTimeout,
    Duration settleDelay,
    Duration homeSettleDelay,
    Duration hoverDelay) {

  public BrowserProperties {
    navigationTimeout = positiveOrDefault(navigationTimeout, Duration.ofSeconds(30), "navigation-timeout");
    selectorTimeout = positiveOrDefault(selectorTimeout, Duration.ofSeconds(5), "selector-timeout");
    settleDelay = nonNegativeOrDefault(settleDelay, Duration.ofSeconds(2), "settle-delay");
    homeSettleDelay =
        nonNegativeOrDefault(homeSettleDelay, Duration.ofSeconds(3), "home-settle-delay");
    hoverDelay = nonNegativeOrDefault(hoverDelay, Duration.ofMillis(500), "hover-delay");
  }

  /** Headless defaults used by tests and ad-hoc callers. */
  public static BrowserProperties defaults() {
    return new BrowserProperties(true, null, null, null, null, null);
  }

  private static Duration positiveOrDefault(Duration value, Duration fallback, String name) {
    if (value == null) {
      return fallback;
    }
    if (value.isZero() || value.isNegative()) {
      throw new IllegalStateException(
          "scriptorium.browser." + name + " must be positive, got: " + value);
    }
    return value;
  }

  private static Duration nonNegativeOrDefault(Duration value, Duration fallback, String name) {
    if (value == null) {
      return fallback;
    }
    if (value.isNegative()) {
      throw new IllegalStateException(
          "scriptorium.browser." + name + " must not be negative, got: " + value);
    }
    return value;
  }
}
