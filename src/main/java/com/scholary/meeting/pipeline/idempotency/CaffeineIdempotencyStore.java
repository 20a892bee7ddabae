package com.scholary.meeting.pipeline.idempotency;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process idempotency store backed by Caffeine.
 *
 * <p>Each entry carries its own TTL, so short-lived "processing" markers and long-lived
 * "completed" markers can share one cache. Set-if-absent goes through the cache's concurrent map
 * view, which is atomic and treats expired entries as absent.
 *
 * <p>Only safe when every worker runs in this JVM. Multi-process deployments use {@link
 * RedisIdempotencyStore}.
 */
public class CaffeineIdempotencyStore implements IdempotencyStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaffeineIdempotencyStore.class);

  private final Cache<String, Entry> cache;

  public CaffeineIdempotencyStore(long maxEntries) {
    this(maxEntries, Ticker.systemTicker());
  }

  public CaffeineIdempotencyStore(long maxEntries, Ticker ticker) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxEntries)
            .expireAfter(new EntryExpiry())
            .ticker(ticker)
            .build();

    LOGGER.info("Initialized in-memory idempotency store: maxEntries={}", maxEntries);
  }

  @Override
  public boolean setIfAbsent(String key, String value, Duration ttl) {
    return cache.asMap().putIfAbsent(key, new Entry(value, ttl)) == null;
  }

  @Override
  public Optional<String> get(String key) {
    Entry entry = cache.getIfPresent(key);
    return entry == null ? Optional.empty() : Optional.of(entry.value());
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    cache.put(key, new Entry(value, ttl));
  }

  @Override
  public void delete(String key) {
    cache.invalidate(key);
  }

  private record Entry(String value, Duration ttl) {}

  /** Expires each entry after its own TTL, restarting the clock on every write. */
  private static final class EntryExpiry implements Expiry<String, Entry> {

    @Override
    public long expireAfterCreate(String key, Entry entry, long currentTime) {
      return entry.ttl().toNanos();
    }

    @Override
    public long expireAfterUpdate(
        String key, Entry entry, long currentTime, long currentDuration) {
      return entry.ttl().toNanos();
    }

    @Override
    public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
