package io.intellixity.vigil.governance.internal;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Synchronized LRU cache with expire-after-write and optional expire-after-access.\n
 *
 * Entries leaving the cache (eviction, expiry, replacement, invalidation) are reported to the
 * removal listener, outside of any iteration but while holding the cache lock.\n
 */
public final class LruTtlCache<K, V> {
  private final int maxEntries;
  private final long ttlMillis;
  private final long idleMillis;
  private final LongSupplier nowMillis;
  private final BiConsumer<K, V> onRemoval;

  private final LinkedHashMap<K, Slot<V>> slots = new LinkedHashMap<>(16, 0.75f, true);

  private static final class Slot<V> {
    final V value;
    final long writtenAt;
    long readAt;

    Slot(V value, long now) {
      this.value = value;
      this.writtenAt = now;
      this.readAt = now;
    }
  }

  public LruTtlCache(int maxEntries, long ttlMillis, long idleMillis) {
    this(maxEntries, ttlMillis, idleMillis, System::currentTimeMillis, (k, v) -> {});
  }

  public LruTtlCache(int maxEntries, long ttlMillis, long idleMillis, LongSupplier nowMillis, BiConsumer<K, V> onRemoval) {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    if (ttlMillis < 0) throw new IllegalArgumentException("ttlMillis must be >= 0");
    if (idleMillis < 0) throw new IllegalArgumentException("idleMillis must be >= 0");
    this.maxEntries = maxEntries;
    this.ttlMillis = ttlMillis;
    this.idleMillis = idleMillis;
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
    this.onRemoval = Objects.requireNonNull(onRemoval, "onRemoval");
  }

  public synchronized V get(K key) {
    Objects.requireNonNull(key, "key");
    long now = nowMillis.getAsLong();
    expire(now);
    Slot<V> s = slots.get(key);
    if (s == null) return null;
    s.readAt = now;
    return s.value;
  }

  /** Cached value, or the supplier's value which is then cached. Null results are not cached. */
  public synchronized V getOrCompute(K key, Supplier<V> supplier) {
    Objects.requireNonNull(supplier, "supplier");
    V existing = get(key);
    if (existing != null) return existing;
    V created = supplier.get();
    if (created != null) put(key, created);
    return created;
  }

  public synchronized void put(K key, V value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    long now = nowMillis.getAsLong();
    expire(now);
    Slot<V> prev = slots.put(key, new Slot<>(value, now));
    if (prev != null && prev.value != value) onRemoval.accept(key, prev.value);
    while (slots.size() > maxEntries) {
      Iterator<Map.Entry<K, Slot<V>>> it = slots.entrySet().iterator();
      Map.Entry<K, Slot<V>> eldest = it.next();
      it.remove();
      onRemoval.accept(eldest.getKey(), eldest.getValue().value);
    }
  }

  public synchronized void invalidate(K key) {
    Slot<V> s = slots.remove(key);
    if (s != null) onRemoval.accept(key, s.value);
  }

  public synchronized int size() {
    expire(nowMillis.getAsLong());
    return slots.size();
  }

  private boolean expired(Slot<V> s, long now) {
    return (ttlMillis > 0 && now - s.writtenAt >= ttlMillis)
        || (idleMillis > 0 && now - s.readAt >= idleMillis);
  }

  private void expire(long now) {
    Iterator<Map.Entry<K, Slot<V>>> it = slots.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<K, Slot<V>> e = it.next();
      if (expired(e.getValue(), now)) {
        it.remove();
        onRemoval.accept(e.getKey(), e.getValue().value);
      }
    }
  }
}
