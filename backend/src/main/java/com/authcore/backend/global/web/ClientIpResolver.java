package com.authcore.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.util.StringUtils;

/**
 * Resolves the caller address used for rate limiting and login metadata. Only the socket address is read; forwarded
 * headers are applied upstream by the container's remote-IP valve, and only for proxies listed in
 * {@code server.tomcat.remoteip.internal-proxies}.
 */
public final class ClientIpResolver {

    static final String UNKNOWN = "unknown";

    private ClientIpResolver() {
    }

    public static String resolve(HttpServletRequest request) {
        String remote = request.getRemoteAddr();
        return StringUtils.hasText(remote) ? remote : UNKNOWN;
    }
}
