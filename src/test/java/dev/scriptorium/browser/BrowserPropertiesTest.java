package dev.scriptorium.browser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class BrowserPropertiesTest {

  @Test
  void defaultsMatchDocumentedValues() {
    BrowserProperties properties = BrowserProperties.defaults();

    assertThat(properties.headless()).isTrue();
    assertThat(properties.navigationTimeout()).isEqualTo(Duration.ofSeconds(30));
    assertThat(properties.selectorTimeout()).isEqualTo(Duration.ofSeconds(5));
    assertThat(properties.settleDelay()).isEqualTo(Duration.ofSeconds(2));
    assertThat(properties.homeSettleDelay()).isEqualTo(Duration.ofSeconds(3));
    assertThat(properties.hoverDelay()).isEqualTo(Duration.ofMillis(500));
  }

  @Test
  void zeroDelaysAreAllowed() {
    BrowserProperties properties =
        new BrowserProperties(false, null, null, Duration.ZERO, Duration.ZERO, Duration.ZERO);

    assertThat(properties.settleDelay()).isZero();
    assertThat(properties.headless()).isFalse();
  }

  @Test
  void zeroTimeoutIsRejected() {
    assertThatThrownBy(() -> new BrowserProperties(true, Duration.ZERO, null, null, null, null))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("navigation-timeout");
  }

  @Test
  void negativeDelayIsRejected() {
    assertThatThrownBy(
            () -> new BrowserProperties(true, null, null, Duration.ofSeconds(-1), null, null))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("settle-delay");
  }

  @Test
  void navigationResultOkOnlyFor200() {
    assertThat(new NavigationResult("https://example.com/", 200).isOk()).isTrue();
    assertThat(new NavigationResult("https://example.com/", 301).isOk()).isFalse();
    assertThat(new NavigationResult("https://example.com/", 0).isOk()).isFalse();
  }

  @Test
  void linkElementNormalizesMissingValues() {
    LinkElement link = new LinkElement(null, null);

    assertThat(link.href()).isEmpty();
    assertThat(link.text()).isEmpty();
  }
}
