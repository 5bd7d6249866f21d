package dev.bulletin.document;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Canonicalizes article URLs so that two ingestions of the same page compare equal.
 * Lower-cases scheme and host, drops the fragment and tracking query parameters,
 * omits default ports and a trailing path slash, and sorts the remaining parameters.
 */
public final class UrlNormalizer {

    private static final Logger log = LoggerFactory.getLogger(UrlNormalizer.class);

    private static final Set<String> PLACEHOLDERS = Set.of(
            "#", "-", "about:blank", "none", "null", "n/a", "undefined"
    );

    private UrlNormalizer() {
        // utility class
    }

    /**
     * Canonical form of a URL, or empty when the value is blank, a placeholder,
     * malformed, or lacks a scheme or host.
     *
     * @param url the raw URL field
     * @return the canonical URL if the input identifies a real location
     */
    public static Optional<String> canonicalize(@Nullable String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        String trimmed = url.strip();
        if (PLACEHOLDERS.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }

        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            log.debug("Malformed URL, not usable as identity: {}", trimmed);
            return Optional.empty();
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            return Optional.empty();
        }

        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        if (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        String query = filterQueryParams(uri.getRawQuery());

        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://").append(host);
        if (port != -1 && !isDefaultPort(scheme, port)) {
            sb.append(':').append(port);
        }
        sb.append(path);
        if (query != null) {
            sb.append('?').append(query);
        }
        return Optional.of(sb.toString());
    }

    static boolean isTrackingParam(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        return lower.equals("source") || lower.startsWith("utm_");
    }

    private static @Nullable String filterQueryParams(@Nullable String query) {
        if (query == null || query.isEmpty()) {
            return null;
        }
        String filtered = Arrays.stream(query.split("&"))
                .filter(param -> !param.isEmpty())
                .filter(param -> {
                    int eq = param.indexOf('=');
                    return !isTrackingParam(eq >= 0 ? param.substring(0, eq) : param);
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
