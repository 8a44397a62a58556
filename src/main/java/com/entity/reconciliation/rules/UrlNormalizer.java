package com.entity.reconciliation.rules;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Canonical form for web application URLs: lower-case scheme and host, scheme/port
 * mismatches fixed, default ports dropped, empty path replaced by {@code /}, query and
 * fragment removed.
 */
public final class UrlNormalizer {

    private UrlNormalizer() {
    }

    /**
     * @throws IllegalArgumentException if the URL is empty, unparseable, or lacks a scheme or host
     */
    public static String normalize(String rawUrl) {
        if (rawUrl == null || rawUrl.isEmpty()) {
            throw new IllegalArgumentException("empty URL");
        }

        URI uri;
        try {
            uri = new URI(rawUrl);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("invalid URL: " + e.getMessage(), e);
        }

        if (uri.getScheme() == null) {
            throw new IllegalArgumentException("URL missing scheme");
        }
        String authority = uri.getRawAuthority();
        if (authority == null || authority.isEmpty()) {
            throw new IllegalArgumentException("URL missing host");
        }

        String userInfo = null;
        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            userInfo = authority.substring(0, at);
            authority = authority.substring(at + 1);
        }

        String host = authority;
        String port = "";
        int colon = authority.lastIndexOf(':');
        if (colon >= 0 && colon > authority.lastIndexOf(']')) {
            host = authority.substring(0, colon);
            port = authority.substring(colon + 1);
        }
        if (host.isEmpty()) {
            throw new IllegalArgumentException("URL missing host");
        }

        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if ("443".equals(port) && "http".equals(scheme)) {
            scheme = "https";
        } else if ("80".equals(port) && "https".equals(scheme)) {
            scheme = "http";
        }
        if (("http".equals(scheme) && "80".equals(port)) || ("https".equals(scheme) && "443".equals(port))) {
            port = "";
        }

        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }

        StringBuilder normalized = new StringBuilder()
                .append(scheme)
                .append("://");
        if (userInfo != null) {
            normalized.append(userInfo).append('@');
        }
        normalized.append(host.toLowerCase(Locale.ROOT));
        if (!port.isEmpty()) {
            normalized.append(':').append(port);
        }
        return normalized.append(path).toString();
    }

    /**
     * Returns true when {@link #normalize(String)} would accept the URL.
     */
    public static boolean isValid(String rawUrl) {
        try {
            normalize(rawUrl);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
