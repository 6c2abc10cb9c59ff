package org.scriptonbasestar.lrucache.collection.map;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.scriptonbasestar.lrucache.collection.list.LruEntry;
import org.scriptonbasestar.lrucache.core.util.ManualTimeSource;

import java.time.Duration;
import java.util.Arrays;

/**
 * TTL(staleness) 동작 테스트
 *
 * 시간은 ManualTimeSource로 진행시킵니다.
 *
 * @author archmagece
 * @since 2025-01
 */
public class SBLruCacheTtlTest {

	private ManualTimeSource clock;

	@Before
	public void setUp() {
		clock = new ManualTimeSource(10_000L);
	}

	private SBLruCache cacheWithDefaultTtl(Duration ttl) {
		return SBLruCache.builder()
			.capacity(10)
			.defaultTtl(ttl)
			.timeSource(clock)
			.build();
	}

	@Test
	public void testStaleEntryIsMissAndRemoved() {
		SBLruCache cache = cacheWithDefaultTtl(Duration.ofMillis(1));
		cache.set("a", "1");

		clock.advanceMillis(2);

		Assert.assertNull(cache.get("a"));
		Assert.assertFalse(cache.has("a"));
		Assert.assertEquals(0, cache.size());
		cache.checkIntegrity();
	}

	@Test
	public void testRepeatedStaleGetStaysAbsent() {
		SBLruCache cache = cacheWithDefaultTtl(Duration.ofSeconds(1));
		cache.set("a", "1");
		clock.advance(Duration.ofSeconds(5));

		Assert.assertNull(cache.get("a"));
		Assert.assertNull(cache.get("a"));
		Assert.assertNull(cache.get("a"));
		Assert.assertFalse(cache.has("a"));
	}

	@Test
	public void testHasIgnoresStaleness() {
		SBLruCache cache = cacheWithDefaultTtl(Duration.ofMillis(1));
		cache.set("a", "1");
		clock.advanceMillis(100);

		// 인덱스에는 아직 남아있음
		Assert.assertTrue(cache.has("a"));
		Assert.assertEquals(1, cache.size());
		Assert.assertNull(cache.peek("a"));
		Assert.assertTrue(cache.has("a"));
	}

	@Test
	public void testEntryAtExactTtlIsStillFresh() {
		SBLruCache cache = cacheWithDefaultTtl(Duration.ofMillis(100));
		cache.set("a", "1");
		clock.advanceMillis(100);

		Assert.assertEquals("1", cache.get("a"));
	}

	@Test
	public void testPromotionDoesNotResetStalenessClock() {
		SBLruCache cache = cacheWithDefaultTtl(Duration.ofMillis(100));
		cache.set("a", "1");
		long createdAt = clock.now();

		clock.advanceMillis(60);
		Assert.assertEquals("1", cache.get("a"));
		Assert.assertEquals(createdAt, cache.toArray().get(0).createdAt());

		clock.advanceMillis(60);
		Assert.assertNull(cache.get("a"));
	}

	@Test
	public void testPerEntryTtlOverridesDefault() {
		SBLruCache cache = cacheWithDefaultTtl(Duration.ofMillis(10));
		cache.set("short", "s");
		cache.set("long", "l", Duration.ofMinutes(1));

		clock.advanceMillis(1_000);

		Assert.assertNull(cache.get("short"));
		Assert.assertEquals("l", cache.get("long"));
	}

	@Test
	public void testNoDefaultTtlNeverStale() {
		SBLruCache cache = SBLruCache.builder().capacity(5).timeSource(clock).build();
		cache.set("a", "1");
		clock.advance(Duration.ofDays(365));

		Assert.assertEquals("1", cache.get("a"));
	}

	@Test
	public void testOverwriteRestartsTtl() {
		SBLruCache cache = cacheWithDefaultTtl(Duration.ofMillis(100));
		cache.set("a", "1");
		clock.advanceMillis(80);
		cache.set("a", "2");
		clock.advanceMillis(80);

		Assert.assertEquals("2", cache.get("a"));
	}

	@Test
	public void testPopOfStaleTailReturnsAbsentButEvicts() {
		SBLruCache cache = SBLruCache.builder().capacity(5).timeSource(clock).build();
		cache.set("old", "1", Duration.ofMillis(5));
		cache.set("new", "2");
		clock.advanceMillis(10);

		Assert.assertNull(cache.pop());
		Assert.assertFalse(cache.has("old"));
		Assert.assertEquals(Arrays.asList("new"), cache.keys());
	}

	@Test
	public void testAllowStaleReturnsValueOnceThenDiscards() {
		SBLruCache cache = SBLruCache.builder()
			.capacity(5)
			.allowStale(true)
			.defaultTtl(Duration.ofMillis(5))
			.timeSource(clock)
			.build();
		cache.set("a", "1");
		cache.set("b", "2");
		clock.advanceMillis(10);

		Assert.assertEquals("1", cache.get("a"));
		Assert.assertFalse(cache.has("a"));
		Assert.assertNull(cache.get("a"));

		Assert.assertEquals("2", cache.pop());
		Assert.assertTrue(cache.isEmpty());
	}

	@Test
	public void testStaleEntriesAreEvictedByCapacityPressure() {
		SBLruCache cache = SBLruCache.builder().capacity(2).timeSource(clock).build();
		cache.set("a", "1", Duration.ofMillis(1));
		cache.set("b", "2");
		clock.advanceMillis(5);

		cache.set("c", "3");

		Assert.assertFalse(cache.has("a"));
		Assert.assertEquals(Arrays.asList("c", "b"), cache.keys());
	}

	@Test
	public void testEnumerationDoesNotFilterStale() {
		SBLruCache cache = cacheWithDefaultTtl(Duration.ofMillis(1));
		cache.set("a", "1");
		cache.set("b", "2");
		clock.advanceMillis(10);

		Assert.assertEquals(Arrays.asList("b", "a"), cache.keys());
		for (LruEntry entry : cache) {
			Assert.assertTrue(entry.isStale(clock.now()));
		}
		Assert.assertEquals(2, cache.size());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNegativeTtlRejected() {
		cacheWithDefaultTtl(null).set("a", "1", Duration.ofMillis(-1));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNegativeDefaultTtlRejected() {
		cacheWithDefaultTtl(Duration.ofSeconds(-1));
	}
}
