package org.scriptonbasestar.lrucache.spring;

import org.scriptonbasestar.lrucache.collection.map.SBLruCache;
import org.scriptonbasestar.lrucache.collection.map.SBSynchronizedLruCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 이름으로 조회하는 LRU 캐시 모음
 *
 * <p>Spring 빈으로 공유되므로 모든 캐시는 {@link SBSynchronizedLruCache}로 감싸서 보관합니다.</p>
 *
 * <pre>{@code
 * SBLruCacheRegistry registry = new SBLruCacheRegistry(() -> SBLruCache.builder().capacity(500));
 * registry.addCache("users", SBLruCache.builder().capacity(1000).enableMetrics(true).build());
 *
 * SBSynchronizedLruCache users = registry.getCache("users");
 * SBSynchronizedLruCache sessions = registry.getOrCreate("sessions");  // 기본 설정으로 생성
 * }</pre>
 *
 * @author archmagece
 * @since 2025-01
 */
public class SBLruCacheRegistry {

	private static final Logger log = LoggerFactory.getLogger(SBLruCacheRegistry.class);

	private final Map<String, SBSynchronizedLruCache> caches = new ConcurrentHashMap<>();
	private final Supplier<SBLruCache.Builder> defaultBuilder;

	public SBLruCacheRegistry() {
		this(SBLruCache::builder);
	}

	/**
	 * @param defaultBuilder {@link #getOrCreate(String)}로 생성되는 캐시의 설정
	 */
	public SBLruCacheRegistry(Supplier<SBLruCache.Builder> defaultBuilder) {
		if (defaultBuilder == null) {
			throw new IllegalArgumentException("defaultBuilder must not be null");
		}
		this.defaultBuilder = defaultBuilder;
	}

	/**
	 * 캐시를 등록합니다. 같은 이름의 캐시는 교체됩니다.
	 *
	 * @param name 캐시 이름
	 * @param cache 등록할 캐시
	 * @return 등록된 동기화 캐시
	 */
	public SBSynchronizedLruCache addCache(String name, SBLruCache cache) {
		requireName(name);
		if (cache == null) {
			throw new IllegalArgumentException("Cache must not be null");
		}
		SBSynchronizedLruCache wrapped = new SBSynchronizedLruCache(cache);
		caches.put(name, wrapped);
		log.debug("Registered LRU cache '{}' (capacity={})", name, cache.capacity());
		return wrapped;
	}

	/**
	 * @param name 캐시 이름
	 * @return 등록된 캐시, 없으면 null
	 */
	public SBSynchronizedLruCache getCache(String name) {
		return caches.get(name);
	}

	/**
	 * 캐시를 조회하고, 없으면 기본 설정으로 생성합니다.
	 *
	 * @param name 캐시 이름
	 * @return 캐시
	 */
	public SBSynchronizedLruCache getOrCreate(String name) {
		requireName(name);
		return caches.computeIfAbsent(name, key -> {
			log.debug("Creating LRU cache '{}' with default settings", key);
			return new SBSynchronizedLruCache(defaultBuilder.get().build());
		});
	}

	public Collection<String> getCacheNames() {
		return Collections.unmodifiableSet(caches.keySet());
	}

	public Map<String, SBSynchronizedLruCache> getAllCaches() {
		return Collections.unmodifiableMap(caches);
	}

	/**
	 * 캐시를 등록 해제하고 내용을 비웁니다.
	 *
	 * @param name 캐시 이름
	 * @return 제거된 캐시, 없으면 null
	 */
	public SBSynchronizedLruCache removeCache(String name) {
		SBSynchronizedLruCache removed = caches.remove(name);
		if (removed != null) {
			removed.reset();
		}
		return removed;
	}

	private static void requireName(String name) {
		if (name == null || name.trim().isEmpty()) {
			throw new IllegalArgumentException("Cache name must not be null or empty");
		}
	}
}
