package dev.scriptorium.browser;

/** An anchor read from the live DOM: raw {@code href} attribute and visible link text. */
public record LinkElement(String href, String text) {
  public LinkElement {
    href = href == null ? "" : href;
    text = text == null ? "" : text;
  }
}
