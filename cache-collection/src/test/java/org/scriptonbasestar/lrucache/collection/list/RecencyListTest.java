package org.scriptonbasestar.lrucache.collection.list;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * RecencyList 테스트
 *
 * @author archmagece
 * @since 2025-01
 */
public class RecencyListTest {

	private RecencyList list;

	@Before
	public void setUp() {
		list = new RecencyList(100);
	}

	private static LruEntry entry(String key) {
		return new LruEntry(key, "v-" + key, 0L, null);
	}

	@Test
	public void testEmpty() {
		assertTrue(list.isEmpty());
		assertEquals(RecencyList.NIL, list.head());
		assertEquals(RecencyList.NIL, list.tail());
	}

	@Test
	public void testSingleNodeIsHeadAndTail() {
		int h = list.linkFirst(entry("a"));

		assertEquals(h, list.head());
		assertEquals(h, list.tail());
		assertEquals(RecencyList.NIL, list.prev(h));
		assertEquals(RecencyList.NIL, list.next(h));
		assertEquals(1, list.size());
	}

	@Test
	public void testLinkFirstOrdersMostRecentFirst() {
		int a = list.linkFirst(entry("a"));
		int b = list.linkFirst(entry("b"));
		int c = list.linkFirst(entry("c"));

		// c -> b -> a
		assertEquals(c, list.head());
		assertEquals(b, list.next(c));
		assertEquals(a, list.next(b));
		assertEquals(RecencyList.NIL, list.next(a));
		assertEquals(a, list.tail());
		assertEquals(b, list.prev(a));
		assertEquals(c, list.prev(b));
	}

	@Test
	public void testUnlinkMiddleJoinsNeighbours() {
		int a = list.linkFirst(entry("a"));
		int b = list.linkFirst(entry("b"));
		int c = list.linkFirst(entry("c"));

		LruEntry removed = list.unlink(b);

		assertEquals("b", removed.key());
		assertEquals(a, list.next(c));
		assertEquals(c, list.prev(a));
		assertEquals(2, list.size());
	}

	@Test
	public void testUnlinkEndpointsMovesHeadAndTail() {
		int a = list.linkFirst(entry("a"));
		int b = list.linkFirst(entry("b"));
		int c = list.linkFirst(entry("c"));

		list.unlink(c);
		assertEquals(b, list.head());
		assertEquals(RecencyList.NIL, list.prev(b));

		list.unlink(a);
		assertEquals(b, list.tail());
		assertEquals(RecencyList.NIL, list.next(b));

		list.unlink(b);
		assertTrue(list.isEmpty());
		assertEquals(RecencyList.NIL, list.head());
		assertEquals(RecencyList.NIL, list.tail());
	}

	@Test
	public void testReleasedSlotIsReused() {
		list.linkFirst(entry("a"));
		int b = list.linkFirst(entry("b"));
		list.unlink(b);

		int c = list.linkFirst(entry("c"));

		assertEquals(b, c);
		assertEquals("c", list.entry(c).key());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnlinkedHandleIsRejected() {
		int a = list.linkFirst(entry("a"));
		list.unlink(a);
		list.entry(a);
	}

	@Test
	public void testArenaGrowsUpToMaxSlots() {
		RecencyList small = new RecencyList(40);
		for (int i = 0; i < 40; i++) {
			small.linkFirst(entry(String.valueOf(i)));
		}
		assertEquals(40, small.size());
		assertEquals(40, small.slotCapacity());
	}

	@Test(expected = IllegalStateException.class)
	public void testLinkBeyondMaxSlotsFails() {
		RecencyList small = new RecencyList(2);
		small.linkFirst(entry("a"));
		small.linkFirst(entry("b"));
		small.linkFirst(entry("c"));
	}

	@Test
	public void testClearDropsEverything() {
		for (int i = 0; i < 50; i++) {
			list.linkFirst(entry(String.valueOf(i)));
		}
		list.clear();

		assertTrue(list.isEmpty());
		assertEquals(RecencyList.NIL, list.head());
		int h = list.linkFirst(entry("fresh"));
		assertEquals(h, list.head());
		assertEquals(h, list.tail());
	}
}
