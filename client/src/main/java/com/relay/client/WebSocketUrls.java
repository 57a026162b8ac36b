package com.relay.client;

import com.relay.common.exception.NetworkException;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Maps http/https endpoints to their ws/wss equivalents
 */
public final class WebSocketUrls {

    private WebSocketUrls() {
    }

    /**
     * Replace a leading "https" with "wss" or a leading "http" with "ws". Other URLs are returned as is.
     */
    public static String normalize(String url) {
        if (url.startsWith("https")) {
            return "wss" + url.substring("https".length());
        }
        if (url.startsWith("http")) {
            return "ws" + url.substring("http".length());
        }
        return url;
    }

    public static URI toWebSocketUri(String url) throws NetworkException {
        try {
            return new URI(normalize(url));
        } catch (URISyntaxException e) {
            throw NetworkException.invalidUrl(url, e);
        }
    }
}
