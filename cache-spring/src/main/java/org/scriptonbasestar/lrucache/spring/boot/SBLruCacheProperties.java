package org.scriptonbasestar.lrucache.spring.boot;

import org.scriptonbasestar.lrucache.collection.map.SBLruCache;
import org.scriptonbasestar.lrucache.core.exception.SBLruCacheConfigException;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for SB LRU Cache.
 * <p>
 * Bind to {@code sb-lru-cache.*} properties in application.yml/properties.
 * </p>
 *
 * <h3>Example Configuration:</h3>
 * <pre>{@code
 * # application.yml
 * sb-lru-cache:
 *   default-capacity: 1000
 *   default-ttl: 5m
 *   allow-stale: false
 *   enable-metrics: true
 *   caches:
 *     users:
 *       capacity: 500
 *       ttl: 30s
 *     products:
 *       capacity: 5000
 * }</pre>
 *
 * @author archmagece
 * @since 2025-01
 */
@ConfigurationProperties(prefix = "sb-lru-cache")
public class SBLruCacheProperties {

	/**
	 * Default capacity for all caches.
	 */
	private int defaultCapacity = SBLruCache.DEFAULT_CAPACITY;

	/**
	 * Default TTL for entries stored without one. Unset means entries never become stale.
	 */
	private Duration defaultTtl;

	/**
	 * Return a stale value once before discarding it.
	 */
	private boolean allowStale = false;

	/**
	 * Enable metrics collection for all caches.
	 */
	private boolean enableMetrics = false;

	/**
	 * Per-cache configurations.
	 */
	private Map<String, CacheConfig> caches = new HashMap<>();

	// Getters and Setters

	public int getDefaultCapacity() {
		return defaultCapacity;
	}

	public void setDefaultCapacity(int defaultCapacity) {
		this.defaultCapacity = defaultCapacity;
	}

	public Duration getDefaultTtl() {
		return defaultTtl;
	}

	public void setDefaultTtl(Duration defaultTtl) {
		this.defaultTtl = defaultTtl;
	}

	public boolean isAllowStale() {
		return allowStale;
	}

	public void setAllowStale(boolean allowStale) {
		this.allowStale = allowStale;
	}

	public boolean isEnableMetrics() {
		return enableMetrics;
	}

	public void setEnableMetrics(boolean enableMetrics) {
		this.enableMetrics = enableMetrics;
	}

	public Map<String, CacheConfig> getCaches() {
		return caches;
	}

	public void setCaches(Map<String, CacheConfig> caches) {
		this.caches = caches;
	}

	/**
	 * Builder carrying the global defaults, used for caches created on demand.
	 *
	 * @return builder preset with the default settings
	 */
	public SBLruCache.Builder defaultBuilder() {
		return SBLruCache.builder()
			.capacity(defaultCapacity)
			.defaultTtl(defaultTtl)
			.allowStale(allowStale)
			.enableMetrics(enableMetrics);
	}

	/**
	 * Per-cache configuration.
	 */
	public static class CacheConfig {
		/**
		 * Cache-specific capacity (overrides default).
		 */
		private Integer capacity;

		/**
		 * Cache-specific TTL (overrides default).
		 */
		private Duration ttl;

		/**
		 * Cache-specific stale handling (overrides default).
		 */
		private Boolean allowStale;

		/**
		 * Enable metrics for this cache (overrides default).
		 */
		private Boolean enableMetrics;

		public Integer getCapacity() {
			return capacity;
		}

		public void setCapacity(Integer capacity) {
			this.capacity = capacity;
		}

		public Duration getTtl() {
			return ttl;
		}

		public void setTtl(Duration ttl) {
			this.ttl = ttl;
		}

		public Boolean getAllowStale() {
			return allowStale;
		}

		public void setAllowStale(Boolean allowStale) {
			this.allowStale = allowStale;
		}

		public Boolean getEnableMetrics() {
			return enableMetrics;
		}

		public void setEnableMetrics(Boolean enableMetrics) {
			this.enableMetrics = enableMetrics;
		}

		/**
		 * Apply defaults from global properties.
		 *
		 * @param defaults global properties
		 */
		public void applyDefaults(SBLruCacheProperties defaults) {
			if (capacity == null) {
				capacity = defaults.getDefaultCapacity();
			}
			if (ttl == null) {
				ttl = defaults.getDefaultTtl();
			}
			if (allowStale == null) {
				allowStale = defaults.isAllowStale();
			}
			if (enableMetrics == null) {
				enableMetrics = defaults.isEnableMetrics();
			}
		}

		/**
		 * Creates the cache described by this configuration. Call {@link #applyDefaults} first.
		 *
		 * @param cacheName cache name, used in error messages
		 * @return new cache
		 * @throws SBLruCacheConfigException if capacity or ttl is invalid
		 */
		public SBLruCache createCache(String cacheName) {
			try {
				return SBLruCache.builder()
					.capacity(capacity != null ? capacity : SBLruCache.DEFAULT_CAPACITY)
					.defaultTtl(ttl)
					.allowStale(Boolean.TRUE.equals(allowStale))
					.enableMetrics(Boolean.TRUE.equals(enableMetrics))
					.build();
			} catch (IllegalArgumentException e) {
				throw new SBLruCacheConfigException("Invalid configuration for cache '" + cacheName + "': " + e.getMessage(), e);
			}
		}
	}
}
