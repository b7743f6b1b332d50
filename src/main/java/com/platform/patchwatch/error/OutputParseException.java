package com.platform.patchwatch.error;

/**
 * Provider output did not match the expected grammar, usually because the
 * remote tool changed its output format.
 */
public class OutputParseException extends PatchWatchException {

    private final String provider;

    public OutputParseException(String provider, String message) {
        super(ErrorCode.OUTPUT_PARSE_FAILED, message);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
