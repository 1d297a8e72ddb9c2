package com.vtb.httptest.execution;

import okhttp3.Cookie;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

public class InMemorySessionStore implements SessionStore {

    private final Map<String, List<Cookie>> cookies = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void setCookie(String host, Cookie cookie) {
        if (host == null || cookie == null) {
            return;
        }
        lock.writeLock().lock();
        try {
            List<Cookie> hostCookies = cookies.computeIfAbsent(host, h -> new ArrayList<>());
            for (int i = 0; i < hostCookies.size(); i++) {
                if (hostCookies.get(i).name().equals(cookie.name())) {
                    hostCookies.set(i, cookie);
                    return;
                }
            }
            hostCookies.add(cookie);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Cookie> getCookies(String host) {
        lock.readLock().lock();
        try {
            List<Cookie> hostCookies = cookies.get(host);
            return hostCookies == null ? Collections.emptyList() : new ArrayList<>(hostCookies);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void clear(String host) {
        lock.writeLock().lock();
        try {
            cookies.remove(host);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void clearAll() {
        lock.writeLock().lock();
        try {
            cookies.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Set<String> hosts() {
        lock.readLock().lock();
        try {
            return new LinkedHashSet<>(cookies.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }
}
