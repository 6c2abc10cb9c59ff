package org.scriptonbasestar.lrucache.collection.list;

import org.scriptonbasestar.lrucache.core.util.TimeCheckerUtil;

import java.time.Duration;
import java.util.Objects;

/**
 * A single cache entry.
 * <p>
 * Key, value, creation time and TTL are fixed at construction. The entry's position in the
 * recency order is held by the {@link RecencyList} slot that owns it, not by the entry itself,
 * so an entry can be handed out to callers as a snapshot.
 * </p>
 *
 * @author archmagece
 * @since 2025-01
 */
public final class LruEntry {

	private final String key;
	private final String value;
	private final long createdAt;
	private final Duration ttl;

	/**
	 * @param key       entry key
	 * @param value     entry value
	 * @param createdAt creation time (epoch milliseconds)
	 * @param ttl       time-to-live, null이면 만료되지 않음
	 */
	public LruEntry(String key, String value, long createdAt, Duration ttl) {
		this.key = Objects.requireNonNull(key, "key");
		this.value = Objects.requireNonNull(value, "value");
		this.createdAt = createdAt;
		this.ttl = ttl;
	}

	public String key() {
		return key;
	}

	public String value() {
		return value;
	}

	public long createdAt() {
		return createdAt;
	}

	/**
	 * @return TTL, or null when the entry never becomes stale
	 */
	public Duration ttl() {
		return ttl;
	}

	public boolean isStale(long now) {
		return TimeCheckerUtil.isStale(createdAt, ttl, now);
	}

	/**
	 * @param now current time (epoch milliseconds)
	 * @return time left before the entry becomes stale, null when it never does
	 */
	public Duration remaining(long now) {
		return TimeCheckerUtil.remaining(createdAt, ttl, now);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof LruEntry)) {
			return false;
		}
		LruEntry other = (LruEntry) o;
		return createdAt == other.createdAt
			&& key.equals(other.key)
			&& value.equals(other.value)
			&& Objects.equals(ttl, other.ttl);
	}

	@Override
	public int hashCode() {
		return Objects.hash(key, value, createdAt, ttl);
	}

	@Override
	public String toString() {
		return "LruEntry{key=" + key + ", value=" + value + ", createdAt=" + createdAt
			+ (ttl != null ? ", ttl=" + ttl : "") + "}";
	}
}
