/**
 * Exception thrown when a search engine or provider site cannot be reached or answers with an error status
 *
 * @author William Callahan
 *
 * Features:
 * - Carries the upstream name for log correlation
 * - Never cached, so a later search retries the same upstream
 */

package com.williamcallahan.reverse_image_search.engine;

public class SearchTransportException extends RuntimeException {

    private final String upstream;

    public SearchTransportException(String upstream, String message, Throwable cause) {
        super(upstream + ": " + message, cause);
        this.upstream = upstream;
    }

    public String getUpstream() {
        return upstream;
    }
}
