package org.scriptonbasestar.lrucache.collection.list;

import java.util.Arrays;

/**
 * Doubly linked recency order stored in an arena of slots.
 * <p>
 * Every entry lives in a slot addressed by a stable {@code int} handle. The neighbour links are
 * parallel {@code next}/{@code prev} arrays, so the list is the only owner of its entries and
 * other structures (the cache index) refer to a node by handle only. Released slots are reused
 * through a free stack; the arena grows by doubling up to {@code maxSlots}.
 * </p>
 *
 * <pre>
 * head (MRU) → ... → tail (LRU)
 * </pre>
 *
 * Not thread-safe.
 *
 * @author archmagece
 * @since 2025-01
 */
public final class RecencyList {

	/**
	 * Handle value meaning "no node".
	 */
	public static final int NIL = -1;

	private static final int INITIAL_SLOTS = 16;

	private final int maxSlots;

	private LruEntry[] entries;
	private int[] next;
	private int[] prev;
	private int[] free;  // 반환된 슬롯 스택
	private int freeTop;
	private int allocated;  // 한 번이라도 사용된 슬롯 수 (high-water mark)

	private int head;
	private int tail;
	private int size;

	/**
	 * @param maxSlots upper bound of simultaneously linked entries
	 */
	public RecencyList(int maxSlots) {
		if (maxSlots <= 0) {
			throw new IllegalArgumentException("maxSlots must be positive: " + maxSlots);
		}
		this.maxSlots = maxSlots;
		init();
	}

	private void init() {
		int slots = Math.min(INITIAL_SLOTS, maxSlots);
		this.entries = new LruEntry[slots];
		this.next = new int[slots];
		this.prev = new int[slots];
		this.free = new int[slots];
		this.freeTop = 0;
		this.allocated = 0;
		this.head = NIL;
		this.tail = NIL;
		this.size = 0;
	}

	/**
	 * Links the entry in front of the current head.
	 *
	 * @param entry entry to link
	 * @return handle of the new node
	 * @throws IllegalStateException if {@code maxSlots} nodes are already linked
	 */
	public int linkFirst(LruEntry entry) {
		int handle = allocate();
		entries[handle] = entry;
		prev[handle] = NIL;
		next[handle] = head;
		if (head != NIL) {
			prev[head] = handle;
		} else {
			tail = handle;
		}
		head = handle;
		size++;
		return handle;
	}

	/**
	 * Detaches the node, joining its neighbours (or moving head/tail), and releases its slot.
	 * The handle must not be used afterwards.
	 *
	 * @param handle live node handle
	 * @return the entry that was stored in the node
	 */
	public LruEntry unlink(int handle) {
		LruEntry entry = entry(handle);
		int p = prev[handle];
		int n = next[handle];

		if (p != NIL) {
			next[p] = n;
		} else {
			head = n;
		}
		if (n != NIL) {
			prev[n] = p;
		} else {
			tail = p;
		}

		entries[handle] = null;
		next[handle] = NIL;
		prev[handle] = NIL;
		free[freeTop++] = handle;
		size--;
		return entry;
	}

	/**
	 * @param handle live node handle
	 * @return stored entry
	 * @throws IllegalArgumentException if the handle does not address a linked node
	 */
	public LruEntry entry(int handle) {
		if (handle < 0 || handle >= allocated || entries[handle] == null) {
			throw new IllegalArgumentException("Not a live handle: " + handle);
		}
		return entries[handle];
	}

	public int head() {
		return head;
	}

	public int tail() {
		return tail;
	}

	/**
	 * @return handle of the next (less recently used) node, or {@link #NIL}
	 */
	public int next(int handle) {
		entry(handle);
		return next[handle];
	}

	/**
	 * @return handle of the previous (more recently used) node, or {@link #NIL}
	 */
	public int prev(int handle) {
		entry(handle);
		return prev[handle];
	}

	public int size() {
		return size;
	}

	public boolean isEmpty() {
		return size == 0;
	}

	/**
	 * Drops every node by replacing the arena. Handles issued before the call become invalid.
	 */
	public void clear() {
		init();
	}

	/**
	 * @return number of slots currently backing the arena
	 */
	int slotCapacity() {
		return entries.length;
	}

	private int allocate() {
		if (freeTop > 0) {
			return free[--freeTop];
		}
		if (allocated == entries.length) {
			grow();
		}
		return allocated++;
	}

	private void grow() {
		int current = entries.length;
		if (current >= maxSlots) {
			throw new IllegalStateException("Recency list is full: " + maxSlots + " slots");
		}
		int newLength = (int) Math.min((long) maxSlots, (long) current * 2);
		entries = Arrays.copyOf(entries, newLength);
		next = Arrays.copyOf(next, newLength);
		prev = Arrays.copyOf(prev, newLength);
		free = Arrays.copyOf(free, newLength);
	}
}
