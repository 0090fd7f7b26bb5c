package com.emergencyalerts.exception;

import java.util.Map;

/**
 * An external collaborator (delivery transport, dedup cache) could not be reached.
 */
public class UpstreamUnavailableException extends BaseException {

    public UpstreamUnavailableException(String upstream, String message) {
        super(ErrorCode.UPSTREAM_UNAVAILABLE, message, Map.of("upstream", upstream));
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(ErrorCode.UPSTREAM_UNAVAILABLE, message, cause);
    }
}
