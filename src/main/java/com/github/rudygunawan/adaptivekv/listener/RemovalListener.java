package com.github.rudygunawan.adaptivekv.listener;

import com.github.rudygunawan.adaptivekv.model.Value;
import com.github.rudygunawan.adaptivekv.policy.RemovalCause;

/**
 * A listener that receives notification when an entry is removed from a cache.
 *
 * <p>Implementations should be thread-safe and fast: they are called synchronously, while the
 * cache lock is held. An exception thrown by a listener is logged and otherwise ignored.
 *
 * <p>Usage example:
 * <pre>{@code
 * AdaptiveCache cache = CacheBuilder.newBuilder()
 *     .removalListener((key, value, cause) -> {
 *         if (cause.wasEvicted()) {
 *             evicted.increment();
 *         }
 *     })
 *     .build();
 * }</pre>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface RemovalListener {

    /**
     * Notifies the listener that an entry was removed.
     *
     * @param key the key of the removed entry
     * @param value the removed value, decoded if it was stored quantized, or {@code null} if
     *              decoding failed
     * @param cause the reason for the removal
     */
    void onRemoval(String key, Value value, RemovalCause cause);
}
