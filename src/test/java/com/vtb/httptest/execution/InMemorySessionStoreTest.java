package com.vtb.httptest.execution;

import okhttp3.Cookie;
import okhttp3.HttpUrl;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySessionStoreTest {

    private static Cookie cookie(String name, String value) {
        return new Cookie.Builder().name(name).value(value).domain("api.local").build();
    }

    @Test
    void replacesCookieWithSameName() {
        InMemorySessionStore store = new InMemorySessionStore();
        store.setCookie("api.local", cookie("session", "a"));
        store.setCookie("api.local", cookie("theme", "dark"));
        store.setCookie("api.local", cookie("session", "b"));

        List<Cookie> cookies = store.getCookies("api.local");
        assertEquals(2, cookies.size());
        assertEquals("session", cookies.get(0).name());
        assertEquals("b", cookies.get(0).value());
    }

    @Test
    void returnsCopiesAndClearsPerHost() {
        InMemorySessionStore store = new InMemorySessionStore();
        store.setCookie("api.local", cookie("session", "a"));
        store.setCookie("other.local", cookie("session", "x"));

        store.getCookies("api.local").clear();
        assertEquals(1, store.getCookies("api.local").size());
        assertEquals(Set.of("api.local", "other.local"), store.hosts());

        store.clear("api.local");
        assertTrue(store.getCookies("api.local").isEmpty());
        assertEquals(1, store.getCookies("other.local").size());

        store.clearAll();
        assertTrue(store.hosts().isEmpty());
    }

    @Test
    void hostKeyIncludesNonDefaultPort() {
        assertEquals("api.local", SessionStore.hostKey(HttpUrl.get("https://api.local/x")));
        assertEquals("api.local:8080", SessionStore.hostKey(HttpUrl.get("http://api.local:8080/x")));
    }

    @Test
    void concurrentWritersDoNotLoseCookies() throws Exception {
        InMemorySessionStore store = new InMemorySessionStore();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                int worker = t;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 50; i++) {
                        store.setCookie("api.local", cookie("c" + worker + "_" + i, "v"));
                        store.getCookies("api.local");
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(200, store.getCookies("api.local").size());
    }
}
