package com.platform.patchwatch.error;

import java.nio.file.Path;

/**
 * Cache snapshot is unreadable or was written by an incompatible schema.
 * Never auto-repaired: the caller decides between aborting and resetting.
 */
public class CacheCorruptionException extends PatchWatchException {

    public static final String REMEDIAL_ACTION =
        "clear the cache file and rediscover the inventory";

    private final Path cacheFile;

    public CacheCorruptionException(Path cacheFile, String reason) {
        super(ErrorCode.CACHE_CORRUPTED, format(cacheFile, reason));
        this.cacheFile = cacheFile;
    }

    public CacheCorruptionException(Path cacheFile, String reason, Throwable cause) {
        super(ErrorCode.CACHE_CORRUPTED, format(cacheFile, reason), cause);
        this.cacheFile = cacheFile;
    }

    public Path getCacheFile() {
        return cacheFile;
    }

    public String getRemedialAction() {
        return REMEDIAL_ACTION;
    }

    private static String format(Path cacheFile, String reason) {
        return String.format("Cache %s cannot be loaded: %s. To recover, %s.", cacheFile, reason, REMEDIAL_ACTION);
    }
}
