package org.scriptonbasestar.lrucache.metrics.micrometer;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.Before;
import org.junit.Test;
import org.scriptonbasestar.lrucache.collection.map.SBLruCache;
import org.scriptonbasestar.lrucache.collection.map.SBSynchronizedLruCache;

import static org.junit.Assert.*;

/**
 * MicrometerMetricsAdapter 테스트
 *
 * @author archmagece
 * @since 2025-01
 */
public class MicrometerMetricsAdapterTest {

	private SBLruCache cache;
	private MeterRegistry meterRegistry;
	private MicrometerMetricsAdapter adapter;

	@Before
	public void setUp() {
		cache = SBLruCache.builder().capacity(2).enableMetrics(true).build();
		meterRegistry = new SimpleMeterRegistry();
		adapter = new MicrometerMetricsAdapter(cache, meterRegistry, "test-cache");
	}

	private double counter(String name) {
		return meterRegistry.get(name).tag("cache", "test-cache").functionCounter().count();
	}

	private double gauge(String name) {
		return meterRegistry.get(name).tag("cache", "test-cache").gauge().value();
	}

	@Test
	public void testHitsAndMisses() {
		// When
		cache.set("a", "1");
		cache.get("a");
		cache.get("a");
		cache.get("missing");

		// Then
		assertEquals(2.0, counter("cache.hits"), 0.001);
		assertEquals(1.0, counter("cache.misses"), 0.001);
		assertEquals(1.0, counter("cache.puts"), 0.001);
	}

	@Test
	public void testEvictionsAndRemovals() {
		// When
		cache.set("a", "1");
		cache.set("b", "2");
		cache.set("c", "3");
		cache.remove("b");

		// Then
		assertEquals(1.0, counter("cache.evictions"), 0.001);
		assertEquals(1.0, counter("cache.removals"), 0.001);
	}

	@Test
	public void testSizeAndCapacityGauges() {
		cache.set("a", "1");

		assertEquals(1.0, gauge("cache.size"), 0.001);
		assertEquals(2.0, gauge("cache.capacity"), 0.001);

		cache.set("b", "2");
		assertEquals(2.0, gauge("cache.size"), 0.001);
	}

	@Test
	public void testGaugesSurviveGarbageCollection() {
		// Given
		SBSynchronizedLruCache shared = new SBSynchronizedLruCache(
			SBLruCache.builder().capacity(10).enableMetrics(true).build());
		new MicrometerMetricsAdapter(shared, meterRegistry, "gc");
		cache.set("a", "1");
		shared.set("k", "v");

		// When - 어댑터 밖에서 만든 상태 객체가 회수될 기회를 줌
		for (int i = 0; i < 10; i++) {
			byte[][] garbage = new byte[64][];
			for (int j = 0; j < garbage.length; j++) {
				garbage[j] = new byte[16 * 1024];
			}
			System.gc();
		}

		// Then
		assertEquals(1.0, gauge("cache.size"), 0.001);
		assertEquals(2.0, gauge("cache.capacity"), 0.001);
		assertEquals(1.0, meterRegistry.get("cache.size").tag("cache", "gc").gauge().value(), 0.001);
	}

	@Test
	public void testHitRateGauge() {
		cache.set("a", "1");
		cache.get("a");
		cache.get("b");

		assertEquals(0.5, gauge("cache.hit.rate"), 0.001);
	}

	@Test
	public void testSynchronizedCacheBinding() {
		SBSynchronizedLruCache shared = new SBSynchronizedLruCache(
			SBLruCache.builder().capacity(10).enableMetrics(true).build());
		new MicrometerMetricsAdapter(shared, meterRegistry, "shared");

		shared.set("k", "v");
		shared.get("k");

		assertEquals(1.0, meterRegistry.get("cache.hits").tag("cache", "shared").functionCounter().count(), 0.001);
		assertEquals(1.0, meterRegistry.get("cache.size").tag("cache", "shared").gauge().value(), 0.001);
	}

	@Test
	public void testGetters() {
		assertEquals("test-cache", adapter.getCacheName());
		assertSame(cache.metrics(), adapter.getCacheMetrics());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMetricsMustBeEnabled() {
		new MicrometerMetricsAdapter(new SBLruCache(5), meterRegistry, "no-metrics");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNullRegistry() {
		new MicrometerMetricsAdapter(cache, null, "test");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testEmptyCacheName() {
		new MicrometerMetricsAdapter(cache, meterRegistry, "  ");
	}
}
