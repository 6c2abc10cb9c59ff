package org.scriptonbasestar.lrucache.collection.map;

import org.scriptonbasestar.lrucache.collection.list.LruEntry;
import org.scriptonbasestar.lrucache.collection.list.RecencyList;
import org.scriptonbasestar.lrucache.collection.metrics.CacheMetrics;
import org.scriptonbasestar.lrucache.core.exception.SBLruCacheCorruptedException;
import org.scriptonbasestar.lrucache.core.util.TimeCheckerUtil;
import org.scriptonbasestar.lrucache.core.util.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Fixed-capacity least-recently-used cache of {@code String} keys and values.
 *
 * <pre>{@code
 * SBLruCache cache = SBLruCache.builder()
 *     .capacity(100)
 *     .defaultTtl(Duration.ofMinutes(5))
 *     .enableMetrics(true)
 *     .build();
 *
 * cache.set("user:1", "alice");
 * String name = cache.get("user:1");   // "user:1" is now the most recently used key
 * String oldest = cache.pop();         // evicts the least recently used entry
 * }</pre>
 *
 * 	Features:
 * 	- O(1) set / get / remove / pop: 해시 인덱스 + arena 기반 이중 연결 리스트
 * 	- Capacity eviction: 가득 찬 상태에서 새 키를 넣으면 tail(LRU) 항목 제거
 * 	- Lazy TTL: stale 항목은 get/pop 시점에만 검사 (백그라운드 정리 없음)
 * 	- Per-item TTL: set(key, value, ttl)
 * 	- Metrics: 히트율, stale, 축출 통계 (Builder.enableMetrics()로 설정)
 *
 * <p>
 * Not thread-safe. Wrap in {@link SBSynchronizedLruCache} for shared use.
 * Enumeration ({@link #iterator()}, {@link #forEach(EntryVisitor)}, {@link #keys()}, ...) is
 * read-only: it never promotes, evicts or filters stale entries.
 * </p>
 *
 * @author archmagece
 * @since 2025-01
 */
public class SBLruCache implements Iterable<LruEntry> {

	private static final Logger log = LoggerFactory.getLogger(SBLruCache.class);

	public static final int DEFAULT_CAPACITY = 1000;

	private final int capacity;
	private final boolean allowStale;  // stale 항목을 한 번 반환한 뒤 폐기
	private final Duration defaultTtl;  // null이면 만료 없음
	private final TimeSource timeSource;
	private final CacheMetrics metrics;  // null이면 비활성화

	private Map<String, Integer> index;  // key -> arena handle
	private final RecencyList list;
	private int modCount;

	public SBLruCache() {
		this(DEFAULT_CAPACITY);
	}

	public SBLruCache(int capacity) {
		this(capacity, false, null, TimeSource.SYSTEM, false);
	}

	public SBLruCache(int capacity, Duration defaultTtl) {
		this(capacity, false, defaultTtl, TimeSource.SYSTEM, false);
	}

	/**
	 * 모든 옵션을 설정할 수 있는 생성자 (내부용)
	 *
	 * @param capacity 최대 항목 수 (양수)
	 * @param allowStale stale 항목을 폐기하면서 마지막으로 한 번 반환할지 여부
	 * @param defaultTtl TTL 없이 저장된 항목에 적용할 TTL, null이면 만료 없음
	 * @param timeSource 시간 공급자
	 * @param enableMetrics 통계 수집 활성화 여부
	 */
	protected SBLruCache(int capacity, boolean allowStale, Duration defaultTtl,
						 TimeSource timeSource, boolean enableMetrics) {
		if (capacity <= 0) {
			throw new IllegalArgumentException("capacity must be positive: " + capacity);
		}
		this.capacity = capacity;
		this.allowStale = allowStale;
		this.defaultTtl = TimeCheckerUtil.requireValidTtl(defaultTtl);
		this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
		this.metrics = enableMetrics ? new CacheMetrics() : null;
		this.index = new HashMap<>();
		this.list = new RecencyList(capacity);

		log.debug("SBLruCache created: capacity={}, defaultTtl={}, allowStale={}, metrics={}",
			capacity, defaultTtl, allowStale, enableMetrics);
	}

	/**
	 * Builder 패턴을 사용하여 SBLruCache를 생성합니다.
	 *
	 * @return Builder 인스턴스
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * SBLruCache Builder 클래스
	 */
	public static class Builder {
		private int capacity = DEFAULT_CAPACITY;
		private boolean allowStale = false;
		private Duration defaultTtl = null; // 기본값: 만료 없음
		private TimeSource timeSource = TimeSource.SYSTEM;
		private boolean enableMetrics = false;

		public Builder capacity(int capacity) {
			this.capacity = capacity;
			return this;
		}

		/**
		 * stale 항목 조회 시 폐기하면서 값을 한 번 반환하도록 설정합니다.
		 *
		 * @param allowStale true면 stale 값 반환
		 * @return Builder 인스턴스
		 */
		public Builder allowStale(boolean allowStale) {
			this.allowStale = allowStale;
			return this;
		}

		/**
		 * TTL 없이 저장되는 항목에 적용할 기본 TTL
		 *
		 * @param ttl 기본 TTL, null이면 만료 없음
		 * @return Builder 인스턴스
		 */
		public Builder defaultTtl(Duration ttl) {
			this.defaultTtl = ttl;
			return this;
		}

		public Builder timeSource(TimeSource timeSource) {
			this.timeSource = timeSource;
			return this;
		}

		public Builder enableMetrics(boolean enable) {
			this.enableMetrics = enable;
			return this;
		}

		public SBLruCache build() {
			return new SBLruCache(capacity, allowStale, defaultTtl, timeSource, enableMetrics);
		}
	}

	/**
	 * Stores the value under the key with the cache's default TTL and makes it the most
	 * recently used entry.
	 *
	 * @param key non-empty key
	 * @param value value, not null
	 */
	public void set(String key, String value) {
		set(key, value, null);
	}

	/**
	 * Stores the value under the key and makes it the most recently used entry.
	 * <p>
	 * An existing node for the key is unlinked and dropped from the index before the new node
	 * is created, so the list never holds two nodes for one key. When the cache is still full
	 * after that, the least recently used entry is evicted.
	 * </p>
	 *
	 * @param key non-empty key
	 * @param value value, not null
	 * @param ttl time-to-live for this entry, null to use the default TTL
	 */
	public void set(String key, String value, Duration ttl) {
		requireKey(key);
		Objects.requireNonNull(value, "value");
		TimeCheckerUtil.requireValidTtl(ttl);
		Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
		log.trace("set data - key : {} , value : {}, ttl : {}", key, value, effectiveTtl);

		Integer existing = index.remove(key);
		if (existing != null) {
			list.unlink(existing);
		}
		if (index.size() >= capacity) {
			evictTail();
		}

		LruEntry entry = new LruEntry(key, value, timeSource.now(), effectiveTtl);
		index.put(key, list.linkFirst(entry));
		modCount++;

		if (metrics != null) {
			metrics.recordPut();
		}
	}

	/**
	 * Returns the value and promotes the entry to most recently used.
	 * <p>
	 * A stale entry is removed and reported as a miss ({@code null}); with {@code allowStale}
	 * its value is returned one last time. Promotion keeps the original creation time, so it
	 * does not extend the entry's lifetime.
	 * </p>
	 *
	 * @param key key to look up
	 * @return the value, or null when absent or stale
	 */
	public String get(String key) {
		log.trace("get data - key : {}", key);
		Integer handle = index.get(key);
		if (handle == null) {
			if (metrics != null) {
				metrics.recordMiss();
			}
			return null;
		}

		index.remove(key);
		LruEntry entry = list.unlink(handle);
		modCount++;

		if (entry.isStale(timeSource.now())) {
			log.trace("stale entry discarded - key : {}", key);
			if (metrics != null) {
				metrics.recordStale();
			}
			return allowStale ? entry.value() : null;
		}

		index.put(key, list.linkFirst(entry));
		if (metrics != null) {
			metrics.recordHit();
		}
		return entry.value();
	}

	/**
	 * 순서를 바꾸지 않고 값을 조회합니다. stale 항목은 null을 반환하지만 제거하지 않습니다.
	 *
	 * @param key 조회할 키
	 * @return 값, 없거나 stale이면 null
	 */
	public String peek(String key) {
		Integer handle = index.get(key);
		if (handle == null) {
			return null;
		}
		LruEntry entry = list.entry(handle);
		return entry.isStale(timeSource.now()) ? null : entry.value();
	}

	/**
	 * Index membership only: ignores staleness and does not change the order.
	 */
	public boolean has(String key) {
		return index.containsKey(key);
	}

	/**
	 * Deletes the key if present.
	 */
	public void remove(String key) {
		Integer handle = index.remove(key);
		if (handle == null) {
			return;
		}
		list.unlink(handle);
		modCount++;
		log.trace("removed - key : {}", key);
		if (metrics != null) {
			metrics.recordRemoval();
		}
	}

	/**
	 * Removes the least recently used entry.
	 *
	 * @return its value, or null when the cache is empty or the entry was stale
	 */
	public String pop() {
		int tail = list.tail();
		if (tail == RecencyList.NIL) {
			return null;
		}
		LruEntry entry = list.unlink(tail);
		index.remove(entry.key());
		modCount++;
		log.trace("popped - key : {}", entry.key());

		if (metrics != null) {
			metrics.recordRemoval();
		}
		if (entry.isStale(timeSource.now())) {
			if (metrics != null) {
				metrics.recordStale();
			}
			return allowStale ? entry.value() : null;
		}
		return entry.value();
	}

	/**
	 * Drops every entry. Entries handed out earlier stay readable but no longer belong to the cache.
	 */
	public void reset() {
		index = new HashMap<>();
		list.clear();
		modCount++;
		log.debug("SBLruCache reset");
	}

	public int size() {
		return index.size();
	}

	public int capacity() {
		return capacity;
	}

	public boolean isEmpty() {
		return index.isEmpty();
	}

	public boolean isAllowStale() {
		return allowStale;
	}

	public Duration defaultTtl() {
		return defaultTtl;
	}

	/**
	 * @return 통계, 비활성화된 경우 null
	 */
	public CacheMetrics metrics() {
		return metrics;
	}

	/**
	 * @return entries from most to least recently used
	 */
	@Override
	public Iterator<LruEntry> iterator() {
		return new EntryIterator(true);
	}

	/**
	 * @return entries from least to most recently used
	 */
	public Iterator<LruEntry> descendingIterator() {
		return new EntryIterator(false);
	}

	@Override
	public Spliterator<LruEntry> spliterator() {
		return Spliterators.spliterator(iterator(), size(),
			Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.DISTINCT);
	}

	public Stream<LruEntry> stream() {
		return StreamSupport.stream(spliterator(), false);
	}

	/**
	 * Visits entries from most to least recently used with their position (0 = head).
	 */
	public void forEach(EntryVisitor visitor) {
		Objects.requireNonNull(visitor, "visitor");
		int expected = modCount;
		int position = 0;
		for (int h = list.head(); h != RecencyList.NIL; h = list.next(h)) {
			visitor.visit(list.entry(h), position++);
			checkModCount(expected);
		}
	}

	/**
	 * Visits entries from least to most recently used. Positions count down from
	 * {@code size() - 1}, so each entry receives the same position as in {@link #forEach(EntryVisitor)}.
	 */
	public void forEachReverse(EntryVisitor visitor) {
		Objects.requireNonNull(visitor, "visitor");
		int expected = modCount;
		int position = list.size() - 1;
		for (int h = list.tail(); h != RecencyList.NIL; h = list.prev(h)) {
			visitor.visit(list.entry(h), position--);
			checkModCount(expected);
		}
	}

	/**
	 * @return keys, most recently used first
	 */
	public List<String> keys() {
		List<String> keys = new ArrayList<>(size());
		for (LruEntry entry : this) {
			keys.add(entry.key());
		}
		return keys;
	}

	/**
	 * @return values, most recently used first
	 */
	public List<String> values() {
		List<String> values = new ArrayList<>(size());
		for (LruEntry entry : this) {
			values.add(entry.value());
		}
		return values;
	}

	/**
	 * @return entry snapshots, most recently used first
	 */
	public List<LruEntry> toArray() {
		List<LruEntry> entries = new ArrayList<>(size());
		for (LruEntry entry : this) {
			entries.add(entry);
		}
		return entries;
	}

	/**
	 * @return entry snapshots, least recently used first
	 */
	public List<LruEntry> toArrayReverse() {
		List<LruEntry> entries = new ArrayList<>(size());
		Iterator<LruEntry> it = descendingIterator();
		while (it.hasNext()) {
			entries.add(it.next());
		}
		return entries;
	}

	/**
	 * Walks the recency list and compares it with the key index.
	 *
	 * @throws SBLruCacheCorruptedException if they disagree or the list is malformed
	 */
	public void checkIntegrity() {
		int head = list.head();
		int tail = list.tail();
		if ((head == RecencyList.NIL) != (tail == RecencyList.NIL)) {
			throw new SBLruCacheCorruptedException("head/tail mismatch: head=" + head + ", tail=" + tail);
		}
		if (head != RecencyList.NIL && list.prev(head) != RecencyList.NIL) {
			throw new SBLruCacheCorruptedException("head has a previous node");
		}
		if (tail != RecencyList.NIL && list.next(tail) != RecencyList.NIL) {
			throw new SBLruCacheCorruptedException("tail has a next node");
		}

		Set<String> seen = new HashSet<>();
		int count = 0;
		int last = RecencyList.NIL;
		for (int h = head; h != RecencyList.NIL; h = list.next(h)) {
			if (++count > index.size()) {
				throw new SBLruCacheCorruptedException(
					"list longer than index (" + index.size() + "), cycle or orphaned node");
			}
			if (list.prev(h) != last) {
				throw new SBLruCacheCorruptedException("broken back link at handle " + h);
			}
			String key = list.entry(h).key();
			if (!seen.add(key)) {
				throw new SBLruCacheCorruptedException("duplicate node for key " + key);
			}
			Integer indexed = index.get(key);
			if (indexed == null || indexed != h) {
				throw new SBLruCacheCorruptedException("index does not point at node of key " + key);
			}
			last = h;
		}
		if (last != tail) {
			throw new SBLruCacheCorruptedException("walk ended at " + last + " but tail is " + tail);
		}
		if (count != index.size() || count != list.size()) {
			throw new SBLruCacheCorruptedException(
				"size mismatch: walked=" + count + ", index=" + index.size() + ", list=" + list.size());
		}
		if (count > capacity) {
			throw new SBLruCacheCorruptedException("size " + count + " exceeds capacity " + capacity);
		}
	}

	@Override
	public String toString() {
		return "SBLruCache{size=" + size() + ", capacity=" + capacity + ", keys=" + keys() + "}";
	}

	private void evictTail() {
		LruEntry victim = list.unlink(list.tail());
		index.remove(victim.key());
		log.trace("Evicting key due to capacity: {}", victim.key());
		if (metrics != null) {
			metrics.recordEviction(1);
		}
	}

	private void checkModCount(int expected) {
		if (modCount != expected) {
			throw new ConcurrentModificationException();
		}
	}

	private static void requireKey(String key) {
		if (key == null || key.isEmpty()) {
			throw new IllegalArgumentException("key must not be null or empty");
		}
	}

	/**
	 * Fail-fast walk over the recency list. Each call to {@link #iterator()} starts fresh.
	 */
	private final class EntryIterator implements Iterator<LruEntry> {
		private final boolean forward;
		private final int expectedModCount;
		private int cursor;

		EntryIterator(boolean forward) {
			this.forward = forward;
			this.expectedModCount = modCount;
			this.cursor = forward ? list.head() : list.tail();
		}

		@Override
		public boolean hasNext() {
			return cursor != RecencyList.NIL;
		}

		@Override
		public LruEntry next() {
			checkModCount(expectedModCount);
			if (cursor == RecencyList.NIL) {
				throw new NoSuchElementException();
			}
			LruEntry entry = list.entry(cursor);
			cursor = forward ? list.next(cursor) : list.prev(cursor);
			return entry;
		}
	}
}
