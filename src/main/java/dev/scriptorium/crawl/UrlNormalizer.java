package dev.scriptorium.crawl;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Canonicalises URLs so that trivially different spellings of the same page share one ledger key.
 * Removes fragments and tracking query params, normalizes trailing slashes and host casing.
 */
public final class UrlNormalizer {

    private static final Logger log = LoggerFactory.getLogger(UrlNormalizer.class);

    private static final Set<String> TRACKING_PARAMS = Set.of(
            "utm_source", "utm_medium", "utm_campaign", "utm_term", "utm_content",
            "gclid", "fbclid", "ref", "source"
    );

    private UrlNormalizer() {
        // utility class
    }

    /**
     * Canonical form of a URL:
     * - Remove fragments (#section)
     * - Remove common tracking query params (utm_*, gclid, fbclid, ref, source)
     * - Sort the remaining query params
     * - Remove trailing slash unless URL is just the domain root
     * - Lowercase scheme and host (path is case-sensitive), drop default ports
     *
     * @param url the URL to normalize
     * @return normalized URL string, or the input unchanged if malformed
     */
    public static String normalize(String url) {
        if (url == null || url.isBlank()) {
            return url;
        }

        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            log.warn("Malformed URL, returning unchanged: {}", url);
            return url;
        }

        if (uri.getScheme() == null || uri.getHost() == null) {
            log.warn("URL missing scheme or host, returning unchanged: {}", url);
            return url;
        }

        String scheme = uri.getScheme().toLowerCase();
        String host = uri.getHost().toLowerCase();
        int port = uri.getPort();
        String path = uri.getRawPath();
        String query = uri.getRawQuery();

        if (path == null || path.isEmpty()) {
            path = "/";
        }
        if (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }

        String filteredQuery = filterQueryParams(query);

        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://").append(host);
        if (port != -1 && !isDefaultPort(scheme, port)) {
            sb.append(':').append(port);
        }
        sb.append(path);
        if (filteredQuery != null && !filteredQuery.isEmpty()) {
            sb.append('?').append(filteredQuery);
        }

        return sb.toString();
    }

    /**
     * Host and explicit port of a URL ({@code example.com}, {@code example.com:8080}), lower-cased.
     *
     * @param url an absolute URL
     * @return the authority, or empty if the URL is malformed or has no host
     */
    public static Optional<String> hostAndPort(String url) {
        try {
            URI uri = new URI(url);
            if (uri.getHost() == null) {
                return Optional.empty();
            }
            String host = uri.getHost().toLowerCase();
            return Optional.of(uri.getPort() == -1 ? host : host + ":" + uri.getPort());
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }

    /**
     * Path of a URL with leading and trailing slashes removed; the site root yields "".
     *
     * @param url an absolute URL
     * @return the trimmed path, or empty if the URL is malformed
     */
    public static Optional<String> trimmedPath(String url) {
        try {
            String path = new URI(url).getPath();
            if (path == null) {
                return Optional.of("");
            }
            int start = 0;
            int end = path.length();
            while (start < end && path.charAt(start) == '/') {
                start++;
            }
            while (end > start && path.charAt(end - 1) == '/') {
                end--;
            }
            return Optional.of(path.substring(start, end));
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }

    private static String filterQueryParams(String query) {
        if (query == null || query.isEmpty()) {
            return null;
        }
        String filtered = Arrays.stream(query.split("&"))
                .filter(param -> !param.isEmpty())
                .filter(param -> {
                    String key = param.contains("=") ? param.substring(0, param.indexOf('=')) : param;
                    return !TRACKING_PARAMS.contains(key.toLowerCase());
                })
                .sorted()
                .collect(Collectors.joining("&"));
        return filtered.isEmpty() ? null : filtered;
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80)
                || ("https".equals(scheme) && port == 443);
    }
}
