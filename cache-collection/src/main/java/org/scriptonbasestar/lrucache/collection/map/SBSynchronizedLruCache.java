package org.scriptonbasestar.lrucache.collection.map;

import org.scriptonbasestar.lrucache.collection.list.LruEntry;
import org.scriptonbasestar.lrucache.collection.metrics.CacheMetrics;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Guards every operation of an {@link SBLruCache} with a single lock.
 * <p>
 * Enumeration returns copies taken under the lock, so iterating never observes a concurrent
 * change. Compound operations that must be atomic go through {@link #withLock(Function)}.
 * </p>
 *
 * <pre>{@code
 * SBSynchronizedLruCache shared = new SBSynchronizedLruCache(new SBLruCache(500));
 * String value = shared.withLock(cache -> {
 *     String current = cache.get("counter");
 *     String updated = current == null ? "1" : String.valueOf(Integer.parseInt(current) + 1);
 *     cache.set("counter", updated);
 *     return updated;
 * });
 * }</pre>
 *
 * @author archmagece
 * @since 2025-01
 */
public class SBSynchronizedLruCache implements Iterable<LruEntry> {

	private final SBLruCache delegate;
	private final Object lock = new Object();

	public SBSynchronizedLruCache(SBLruCache delegate) {
		this.delegate = Objects.requireNonNull(delegate, "delegate");
	}

	public void set(String key, String value) {
		synchronized (lock) {
			delegate.set(key, value);
		}
	}

	public void set(String key, String value, Duration ttl) {
		synchronized (lock) {
			delegate.set(key, value, ttl);
		}
	}

	public String get(String key) {
		synchronized (lock) {
			return delegate.get(key);
		}
	}

	public String peek(String key) {
		synchronized (lock) {
			return delegate.peek(key);
		}
	}

	public boolean has(String key) {
		synchronized (lock) {
			return delegate.has(key);
		}
	}

	public void remove(String key) {
		synchronized (lock) {
			delegate.remove(key);
		}
	}

	public String pop() {
		synchronized (lock) {
			return delegate.pop();
		}
	}

	public void reset() {
		synchronized (lock) {
			delegate.reset();
		}
	}

	public int size() {
		synchronized (lock) {
			return delegate.size();
		}
	}

	public int capacity() {
		return delegate.capacity();
	}

	public List<String> keys() {
		synchronized (lock) {
			return delegate.keys();
		}
	}

	public List<String> values() {
		synchronized (lock) {
			return delegate.values();
		}
	}

	public List<LruEntry> toArray() {
		synchronized (lock) {
			return delegate.toArray();
		}
	}

	public List<LruEntry> toArrayReverse() {
		synchronized (lock) {
			return delegate.toArrayReverse();
		}
	}

	/**
	 * @return iterator over a snapshot taken under the lock
	 */
	@Override
	public Iterator<LruEntry> iterator() {
		return toArray().iterator();
	}

	public void checkIntegrity() {
		synchronized (lock) {
			delegate.checkIntegrity();
		}
	}

	/**
	 * {@link CacheMetrics} is thread-safe on its own, no lock needed.
	 */
	public CacheMetrics metrics() {
		return delegate.metrics();
	}

	/**
	 * Runs the action with exclusive access to the underlying cache.
	 * The cache reference must not escape the action.
	 */
	public <T> T withLock(Function<SBLruCache, T> action) {
		synchronized (lock) {
			return action.apply(delegate);
		}
	}

	@Override
	public String toString() {
		synchronized (lock) {
			return delegate.toString();
		}
	}
}
