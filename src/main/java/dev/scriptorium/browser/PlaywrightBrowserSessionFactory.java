package dev.scriptorium.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Launches headless Chromium through Playwright for Java.
 *
 * <p>Each call creates its own {@link Playwright} driver, so sessions never share browser state.
 * Closing the returned session tears the whole stack down.
 */
@Component
public class PlaywrightBrowserSessionFactory implements BrowserSessionFactory {

  private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserSessionFactory.class);

  private final BrowserProperties properties;

  public PlaywrightBrowserSessionFactory(BrowserProperties properties) {
    this.properties = properties;
  }

  @Override
  public BrowserSession open() {
    Playwright playwright;
    try {
      playwright = Playwright.create();
    } catch (PlaywrightException e) {
      throw new BrowserSetupException("Could not start Playwright driver", e);
    }
    try {
      Browser browser =
          playwright
              .chromium()
              .launch(new BrowserType.LaunchOptions().setHeadless(properties.headless()));
      BrowserContext context = browser.newContext();
      Page page = context.newPage();
      page.setDefaultTimeout(properties.selectorTimeout().toMillis());
      page.setDefaultNavigationTimeout(properties.navigationTimeout().toMillis());
      log.info("Launched Chromium {} (headless={})", browser.version(), properties.headless());
      return new PlaywrightBrowserSession(playwright, page, properties);
    } catch (PlaywrightException e) {
      playwright.close();
      throw new BrowserSetupException("Could not launch Chromium", e);
    }
  }
}
