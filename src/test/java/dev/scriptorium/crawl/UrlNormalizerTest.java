package dev.scriptorium.crawl;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class UrlNormalizerTest {

    @Test
    void removesFragment() {
        assertThat(UrlNormalizer.normalize("https://example.com/about#team"))
                .isEqualTo("https://example.com/about");
    }

    @Test
    void removesTrailingSlashExceptAtRoot() {
        assertThat(UrlNormalizer.normalize("https://example.com/about/"))
                .isEqualTo("https://example.com/about");
        assertThat(UrlNormalizer.normalize("https://example.com/"))
                .isEqualTo("https://example.com/");
    }

    @Test
    void addsRootPathToBareHost() {
        assertThat(UrlNormalizer.normalize("https://example.com"))
                .isEqualTo("https://example.com/");
    }

    @Test
    void lowercasesSchemeAndHostButNotPath() {
        assertThat(UrlNormalizer.normalize("HTTPS://Example.COM/About"))
                .isEqualTo("https://example.com/About");
    }

    @Test
    void dropsDefaultPortKeepsOthers() {
        assertThat(UrlNormalizer.normalize("https://example.com:443/a"))
                .isEqualTo("https://example.com/a");
        assertThat(UrlNormalizer.normalize("http://example.com:8080/a"))
                .isEqualTo("http://example.com:8080/a");
    }

    @Test
    void stripsTrackingParamsAndSortsTheRest() {
        assertThat(UrlNormalizer.normalize("https://example.com/p?utm_source=x&b=2&gclid=y&a=1"))
                .isEqualTo("https://example.com/p?a=1&b=2");
    }

    @Test
    void dropsQueryWhenOnlyTrackingParams() {
        assertThat(UrlNormalizer.normalize("https://example.com/p?utm_medium=email&ref=nav"))
                .isEqualTo("https://example.com/p");
    }

    @Test
    void malformedUrlIsReturnedUnchanged() {
        assertThat(UrlNormalizer.normalize("not a url")).isEqualTo("not a url");
    }

    @Test
    void normalizationIsIdempotent() {
        String once = UrlNormalizer.normalize("https://Example.com/services/?utm_campaign=z#top");

        assertThat(UrlNormalizer.normalize(once)).isEqualTo(once);
    }

    @Test
    void hostAndPortIncludesExplicitPort() {
        assertThat(UrlNormalizer.hostAndPort("https://Example.com:8443/a")).contains("example.com:8443");
        assertThat(UrlNormalizer.hostAndPort("https://example.com/a")).contains("example.com");
        assertThat(UrlNormalizer.hostAndPort("/relative")).isEmpty();
    }

    @Test
    void trimmedPathDropsSurroundingSlashes() {
        assertThat(UrlNormalizer.trimmedPath("https://example.com/services/tax/")).contains("services/tax");
        assertThat(UrlNormalizer.trimmedPath("https://example.com/")).contains("");
    }
}
