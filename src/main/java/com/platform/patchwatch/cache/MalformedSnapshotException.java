package com.platform.patchwatch.cache;

/**
 * Cache content that does not match any known schema. {@link CacheStore}
 * reports it as a corruption of the cache file.
 */
class MalformedSnapshotException extends RuntimeException {

    MalformedSnapshotException(String message) {
        super(message);
    }

    MalformedSnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
