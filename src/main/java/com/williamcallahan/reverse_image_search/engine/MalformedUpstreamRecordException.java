package com.williamcallahan.reverse_image_search.engine;

/**
 * Raised for a single upstream record that cannot be turned into a search hit; the record is skipped
 */
public class MalformedUpstreamRecordException extends RuntimeException {

    public MalformedUpstreamRecordException(String message) {
        super(message);
    }

    public MalformedUpstreamRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
