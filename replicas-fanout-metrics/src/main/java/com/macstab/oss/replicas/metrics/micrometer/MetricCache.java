/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.replicas.metrics.micrometer;

import static com.macstab.oss.replicas.metrics.micrometer.MetricsConfiguration.TAG_CONNECTION_NAME;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Thread-safe cache of Micrometer meters keyed by name and tags.
 *
 * <p><strong>Problem:</strong> a registry lookup with tag matching costs far more than a counter
 * increment, and the recording methods sit on the receive path (several calls per packet).
 *
 * <p><strong>Solution:</strong> {@link Counter} instances and gauge values ({@link AtomicInteger})
 * are cached in {@link ConcurrentHashMap}s. The first access registers the meter, later accesses
 * are a map lookup.
 *
 * <p><strong>Bounded:</strong> at most {@code maxCacheSize} entries. Tags such as {@code
 * server.address} grow with the cluster, so once the cache is full meters are resolved through the
 * registry directly (slower, still correct) and a warning is logged.
 *
 * <p><strong>Key Format:</strong> {@code metric.name:tag1=value1:tag2=value2} (tags in call
 * order).
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
final class MetricCache {

  private final MeterRegistry registry;
  private final int maxCacheSize;

  private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>(128);
  private final ConcurrentHashMap<String, AtomicInteger> gaugeValues = new ConcurrentHashMap<>();
  private final AtomicInteger cacheSize = new AtomicInteger();

  /**
   * Creates a meter cache.
   *
   * @param registry Micrometer meter registry
   * @param maxCacheSize maximum cached meters
   * @throws NullPointerException if registry is null
   * @throws IllegalArgumentException if maxCacheSize &lt;= 0
   */
  MetricCache(@NonNull final MeterRegistry registry, final int maxCacheSize) {
    if (maxCacheSize <= 0) {
      throw new IllegalArgumentException("maxCacheSize must be > 0, got: " + maxCacheSize);
    }
    this.registry = registry;
    this.maxCacheSize = maxCacheSize;
  }

  /**
   * Gets or creates a counter.
   *
   * @param name metric name (e.g. {@code replicas.fanout.packets.returned})
   * @param description metric description
   * @param tagPairs tag key-value pairs [key1, value1, key2, value2, ...]
   * @return cached counter, or a registry-resolved one when the cache is full
   * @throws IllegalArgumentException if tagPairs length is odd
   */
  Counter getOrCreateCounter(
      final String name, final String description, final String... tagPairs) {
    validateTagPairs(tagPairs);

    final var key = buildKey(name, tagPairs);
    final var cached = counters.get(key);
    if (cached != null) {
      return cached;
    }

    if (cacheSize.get() < maxCacheSize) {
      return counters.computeIfAbsent(
          key,
          k -> {
            cacheSize.incrementAndGet();
            return createCounter(name, description, tagPairs);
          });
    }

    log.warn(
        "Metric cache full at {} entries. Direct registry used for counter: {}", maxCacheSize, key);
    // the registry returns the already registered counter for identical name and tags
    return createCounter(name, description, tagPairs);
  }

  /**
   * Gets or creates the value holder of a gauge.
   *
   * <p>Gauges are always cached: the holder is the gauge's only strong reference, a fresh holder
   * per call would report stale values. Remove them with {@link #removeGaugesFor(String)}.
   *
   * @param name metric name (e.g. {@code replicas.fanout.sets.active})
   * @param description metric description
   * @param tagPairs tag key-value pairs [key1, value1, key2, value2, ...]
   * @return value holder backing the gauge
   * @throws IllegalArgumentException if tagPairs length is odd
   */
  AtomicInteger getOrCreateGaugeValue(
      final String name, final String description, final String... tagPairs) {
    validateTagPairs(tagPairs);

    return gaugeValues.computeIfAbsent(
        buildKey(name, tagPairs),
        k -> {
          cacheSize.incrementAndGet();
          final var gaugeValue = new AtomicInteger();
          Gauge.builder(name, gaugeValue, AtomicInteger::get)
              .description(description)
              .tags(tagPairs)
              .register(registry);
          return gaugeValue;
        });
  }

  /**
   * Removes every gauge tagged with {@code connection.name=<connectionName>} from the cache and
   * the registry.
   *
   * @param connectionName replica set name
   */
  void removeGaugesFor(final String connectionName) {
    final var pattern = ":" + TAG_CONNECTION_NAME + "=" + connectionName;

    gaugeValues
        .keySet()
        .removeIf(
            key -> {
              // exact tag segment: "a" must not match "ab"
              if (!key.endsWith(pattern) && !key.contains(pattern + ":")) {
                return false;
              }
              try {
                registry
                    .find(extractMetricName(key))
                    .tag(TAG_CONNECTION_NAME, connectionName)
                    .gauges()
                    .forEach(gauge -> registry.remove(gauge.getId()));
                cacheSize.decrementAndGet();
                log.debug("Removed gauge for replica set {}: {}", connectionName, key);
                return true;
              } catch (final RuntimeException e) {
                log.warn("Failed to remove gauge {}: {}", key, e.getMessage());
                return false;
              }
            });
  }

  /** Removes every cached gauge (metrics shutdown). */
  void removeAllGauges() {
    gaugeValues
        .keySet()
        .forEach(
            key ->
                registry
                    .find(extractMetricName(key))
                    .gauges()
                    .forEach(gauge -> registry.remove(gauge.getId())));
    cacheSize.addAndGet(-gaugeValues.size());
    gaugeValues.clear();
  }

  int getCacheSize() {
    return cacheSize.get();
  }

  int getMaxCacheSize() {
    return maxCacheSize;
  }

  private String buildKey(final String name, final String... tagPairs) {
    final var key = new StringBuilder(32 + tagPairs.length / 2 * 25);
    key.append(name);
    for (int i = 0; i < tagPairs.length; i += 2) {
      key.append(':').append(tagPairs[i]).append('=').append(tagPairs[i + 1]);
    }
    return key.toString();
  }

  private String extractMetricName(final String key) {
    final int colonIndex = key.indexOf(':');
    return colonIndex > 0 ? key.substring(0, colonIndex) : key;
  }

  private Counter createCounter(
      final String name, final String description, final String... tagPairs) {
    return Counter.builder(name).description(description).tags(tagPairs).register(registry);
  }

  private void validateTagPairs(final String... tagPairs) {
    if (tagPairs.length % 2 != 0) {
      throw new IllegalArgumentException(
          "Tag pairs must have even length (key-value pairs), got: " + tagPairs.length);
    }
  }
}
