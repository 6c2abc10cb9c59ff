package org.scriptonbasestar.lrucache.core.exception;

/**
 * Raised when the key index and the recency list of a cache no longer describe the same entries.
 * This is a programming error, never a runtime condition to recover from.
 *
 * @author archmagece
 * @since 2025-01
 */
public class SBLruCacheCorruptedException extends RuntimeException {

	public SBLruCacheCorruptedException(String message) {
		super(message);
	}

	public SBLruCacheCorruptedException(String message, Throwable cause) {
		super(message, cause);
	}
}
