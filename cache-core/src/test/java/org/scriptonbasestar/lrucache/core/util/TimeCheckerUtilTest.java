package org.scriptonbasestar.lrucache.core.util;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * @athor archmagece
 * @since 2017-01-17 16
 */
public class TimeCheckerUtilTest {

	@Before
	public void before(){
		Logger root = (Logger)LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
		root.setLevel(Level.ALL);
	}

	@Test
	public void isStaleWithoutTtl(){
		Assert.assertFalse(TimeCheckerUtil.isStale(0L, null, Long.MAX_VALUE));
	}

	@Test
	public void isStaleBoundary(){
		Duration ttl = Duration.ofSeconds(10);
		//생성 직후
		Assert.assertFalse(TimeCheckerUtil.isStale(1_000L, ttl, 1_000L));
		//9초 경과
		Assert.assertFalse(TimeCheckerUtil.isStale(1_000L, ttl, 10_000L));
		//정확히 10초 경과 - 아직 유효
		Assert.assertFalse(TimeCheckerUtil.isStale(1_000L, ttl, 11_000L));
		//10초 + 1밀리초
		Assert.assertTrue(TimeCheckerUtil.isStale(1_000L, ttl, 11_001L));
	}

	@Test
	public void zeroTtlIsStaleAfterAnyElapsedTime(){
		Assert.assertFalse(TimeCheckerUtil.isStale(500L, Duration.ZERO, 500L));
		Assert.assertTrue(TimeCheckerUtil.isStale(500L, Duration.ZERO, 501L));
	}

	@Test
	public void remaining(){
		Duration ttl = Duration.ofMillis(100);
		Assert.assertNull(TimeCheckerUtil.remaining(0L, null, 50L));
		Assert.assertEquals(Duration.ofMillis(60), TimeCheckerUtil.remaining(0L, ttl, 40L));
		Assert.assertEquals(Duration.ZERO, TimeCheckerUtil.remaining(0L, ttl, 100L));
		Assert.assertEquals(Duration.ZERO, TimeCheckerUtil.remaining(0L, ttl, 250L));
	}

	@Test(expected = IllegalArgumentException.class)
	public void negativeTtlRejected(){
		TimeCheckerUtil.requireValidTtl(Duration.ofMillis(-1));
	}

	@Test
	public void manualTimeSourceAdvances(){
		ManualTimeSource clock = new ManualTimeSource(1_000L);
		Duration ttl = Duration.ofMillis(5);
		long createdAt = clock.now();

		clock.advanceMillis(5);
		Assert.assertFalse(TimeCheckerUtil.isStale(createdAt, ttl, clock.now()));

		clock.advance(Duration.ofMillis(1));
		Assert.assertTrue(TimeCheckerUtil.isStale(createdAt, ttl, clock.now()));
	}
}
