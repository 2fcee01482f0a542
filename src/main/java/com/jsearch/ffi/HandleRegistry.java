package com.jsearch.ffi;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Opaque handles for objects passed across the bridge. Handles start at 1
 * and are never reused, so 0 can signal failure and a stale handle never
 * reaches a newer object.
 */
final class HandleRegistry<T> {
    private final AtomicLong nextHandle = new AtomicLong(1);
    private final Map<Long, T> objects = new ConcurrentHashMap<>();

    long register(T object) {
        long handle = nextHandle.getAndIncrement();
        objects.put(handle, object);
        return handle;
    }

    /**
     * @return The object, or null for an unknown or released handle
     */
    T get(long handle) {
        return objects.get(handle);
    }

    /**
     * @return The released object, or null if the handle was not registered
     */
    T release(long handle) {
        return objects.remove(handle);
    }

    int size() {
        return objects.size();
    }
}
