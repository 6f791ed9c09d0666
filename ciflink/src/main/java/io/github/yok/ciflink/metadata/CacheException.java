package io.github.yok.ciflink.metadata;

/**
 * Raised when a persisted cache entry cannot be read or written. Always recovered inside
 * {@link CacheManager}.
 *
 * @author Yasuharu.Okawauchi
 */
class CacheException extends Exception {

    private static final long serialVersionUID = 1L;

    CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
