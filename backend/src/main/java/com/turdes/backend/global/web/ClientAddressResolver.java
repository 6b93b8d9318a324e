package com.turdes.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Resolves the caller address used for throttling and log context.
 *
 * <p>Only the connection peer is read. {@code X-Forwarded-For} is honoured through
 * {@code server.forward-headers-strategy=native}, where the container rewrites the remote address
 * only when the peer matches {@code server.tomcat.remoteip.internal-proxies}. A client-supplied header
 * on a direct connection is ignored.
 */
public final class ClientAddressResolver {

    private ClientAddressResolver() {
    }

    public static String resolve(HttpServletRequest request) {
        return request.getRemoteAddr();
    }
}
