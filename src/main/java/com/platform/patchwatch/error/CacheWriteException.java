package com.platform.patchwatch.error;

import java.nio.file.Path;

/**
 * Snapshot could not be persisted. The previous snapshot is left intact.
 */
public class CacheWriteException extends PatchWatchException {

    public CacheWriteException(Path cacheFile, Throwable cause) {
        super(ErrorCode.CACHE_WRITE_FAILED,
            String.format("Failed to write cache %s: %s", cacheFile, cause.getMessage()), cause);
    }
}
