package com.warden.security.session;

/**
 * Where a request came from. Either field may be null when unknown.
 */
public record RequestContext(String ipAddress, String userAgent) {

    public static RequestContext unknown() {
        return new RequestContext(null, null);
    }
}
