package org.scriptonbasestar.lrucache.core.exception;

/**
 * @author archmagece
 * @since 2025-01
 */
public class SBLruCacheConfigException extends RuntimeException {

	public SBLruCacheConfigException() {
		super();
	}

	public SBLruCacheConfigException(String message) {
		super(message);
	}

	public SBLruCacheConfigException(String message, Throwable cause) {
		super(message, cause);
	}

	public SBLruCacheConfigException(Throwable cause) {
		super(cause);
	}
}
