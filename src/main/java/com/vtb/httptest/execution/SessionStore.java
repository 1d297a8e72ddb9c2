package com.vtb.httptest.execution;

import okhttp3.Cookie;
import okhttp3.HttpUrl;

import java.util.List;
import java.util.Set;

/**
 * Per-host cookie jar shared by all requests of a run.
 * <p>
 * Implementations must be safe for concurrent use by parallel workers.
 * Only an in-memory store ships; a persistent one can implement this interface.
 */
public interface SessionStore {

    /**
     * Replaces a cookie with the same name for the host, or appends it.
     */
    void setCookie(String host, Cookie cookie);

    /**
     * Copy of the host's cookies; changing it does not affect the store.
     */
    List<Cookie> getCookies(String host);

    void clear(String host);

    void clearAll();

    Set<String> hosts();

    /**
     * Host key used for lookups: host name, plus {@code :port} when the port is not the scheme default.
     */
    static String hostKey(HttpUrl url) {
        if (url.port() == HttpUrl.defaultPort(url.scheme())) {
            return url.host();
        }
        return url.host() + ":" + url.port();
    }
}
