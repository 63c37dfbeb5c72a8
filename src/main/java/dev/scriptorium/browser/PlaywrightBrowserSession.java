package dev.scriptorium.browser;

import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitUntilState;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link BrowserSession} backed by a single Playwright {@link Page}. Not thread-safe. */
public class PlaywrightBrowserSession implements BrowserSession {

  private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserSession.class);

  private final Playwright playwright;
  private final Page page;
  private final BrowserProperties properties;

  PlaywrightBrowserSession(Playwright playwright, Page page, BrowserProperties properties) {
    this.playwright = playwright;
    this.page = page;
    this.properties = properties;
  }

  @Override
  public NavigationResult navigate(String url) {
    Response response;
    try {
      response =
          page.navigate(
              url,
              new Page.NavigateOptions()
                  .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                  .setTimeout(properties.navigationTimeout().toMillis()));
    } catch (PlaywrightException e) {
      throw new NavigationException(url, e);
    }
    waitForNetworkIdle(url);
    pause(properties.settleDelay());
    return new NavigationResult(url, response == null ? 0 : response.status());
  }

  private void waitForNetworkIdle(String url) {
    try {
      // long-polling pages never go idle
      page.waitForLoadState(
          LoadState.NETWORKIDLE,
          new Page.WaitForLoadStateOptions().setTimeout(properties.navigationTimeout().toMillis()));
    } catch (TimeoutError e) {
      log.debug("Network idle not reached for {}", url);
    }
  }

  @Override
  public String content() {
    return page.content();
  }

  @Override
  public Optional<String> innerText(String selector) {
    try {
      ElementHandle element = page.querySelector(selector);
      if (element == null) {
        return Optional.empty();
      }
      return Optional.ofNullable(element.innerText());
    } catch (PlaywrightException e) {
      log.debug("Selector {} unavailable: {}", selector, e.getMessage());
      return Optional.empty();
    }
  }

  @Override
  public List<LinkElement> links(String selector) {
    List<ElementHandle> elements;
    try {
      elements = page.querySelectorAll(selector);
    } catch (PlaywrightException e) {
      log.debug("Link query {} failed: {}", selector, e.getMessage());
      return List.of();
    }
    List<LinkElement> links = new ArrayList<>(elements.size());
    for (ElementHandle element : elements) {
      try {
        String href = element.getAttribute("href");
        if (href != null) {
          links.add(new LinkElement(href, element.innerText()));
        }
      } catch (PlaywrightException e) {
        log.debug("Skipping detached anchor for {}: {}", selector, e.getMessage());
      }
    }
    return links;
  }

  @Override
  public int hoverAll(String selector) {
    List<ElementHandle> triggers;
    try {
      triggers = page.querySelectorAll(selector);
    } catch (PlaywrightException e) {
      log.debug("Dropdown query {} failed: {}", selector, e.getMessage());
      return 0;
    }
    int hovered = 0;
    for (ElementHandle trigger : triggers) {
      try {
        trigger.hover(
            new ElementHandle.HoverOptions().setTimeout(properties.selectorTimeout().toMillis()));
        pause(properties.hoverDelay());
        hovered++;
      } catch (PlaywrightException e) {
        log.debug("Hover failed on {}: {}", selector, e.getMessage());
      }
    }
    return hovered;
  }

  @Override
  public void pause(Duration duration) {
    if (!duration.isZero()) {
      page.waitForTimeout(duration.toMillis());
    }
  }

  @Override
  public void close() {
    try {
      page.context().browser().close();
    } catch (PlaywrightException e) {
      log.warn("Error closing browser: {}", e.getMessage());
    } finally {
      playwright.close();
    }
  }
}
