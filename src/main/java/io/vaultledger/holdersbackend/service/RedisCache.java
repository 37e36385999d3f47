package io.vaultledger.holdersbackend.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/** Best-effort response cache. A Redis failure degrades to a cache miss, never to an error. */
@Component
public class RedisCache {
  private static final Logger log = LoggerFactory.getLogger(RedisCache.class);

  private final StringRedisTemplate redis;
  private final ObjectMapper mapper;

  public RedisCache(StringRedisTemplate redis, ObjectMapper mapper) {
    this.redis = redis;
    this.mapper = mapper;
  }

  public Optional<String> get(String key) {
    try {
      String v = redis.opsForValue().get(key);
      return Optional.ofNullable(v);
    } catch (Exception e) {
      log.debug("cache read failed: key={}", key, e);
      return Optional.empty();
    }
  }

  public void set(String key, String value, long ttlSeconds) {
    if (key == null || value == null) return;
    try {
      redis.opsForValue().set(key, value, Duration.ofSeconds(Math.max(1, ttlSeconds)));
    } catch (Exception e) {
      log.debug("cache write failed: key={}", key, e);
    }
  }

  /**
   * Returns the cached value for {@code key} or subscribes to {@code loader} and stores its
   * result. Errors from the loader are never cached.
   */
  public <T> Mono<T> wrap(
      String key, long ttlSeconds, TypeReference<T> type, Supplier<Mono<T>> loader) {
    return Mono.fromCallable(() -> get(key))
        .subscribeOn(Schedulers.boundedElastic())
        .flatMap(
            cached -> {
              if (cached.isPresent()) {
                try {
                  return Mono.just(mapper.readValue(cached.get(), type));
                } catch (Exception e) {
                  log.debug("cache entry unreadable, reloading: key={}", key, e);
                }
              }
              return loader
                  .get()
                  .flatMap(
                      value ->
                          Mono.fromRunnable(() -> store(key, value, ttlSeconds))
                              .subscribeOn(Schedulers.boundedElastic())
                              .thenReturn(value));
            });
  }

  private void store(String key, Object value, long ttlSeconds) {
    try {
      set(key, mapper.writeValueAsString(value), ttlSeconds);
    } catch (Exception e) {
      log.debug("cache serialization failed: key={}", key, e);
    }
  }
}
