package org.scriptonbasestar.lrucache.collection.map;

import org.scriptonbasestar.lrucache.collection.list.LruEntry;

/**
 * Callback for indexed traversal of a cache.
 *
 * @author archmagece
 * @since 2025-01
 */
@FunctionalInterface
public interface EntryVisitor {

	/**
	 * @param entry visited entry
	 * @param index position in recency order, 0 = most recently used
	 */
	void visit(LruEntry entry, int index);
}
