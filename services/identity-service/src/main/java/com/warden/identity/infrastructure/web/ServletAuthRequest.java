package com.warden.identity.infrastructure.web;

import com.warden.security.AuthRequest;
import jakarta.servlet.http.HttpServletRequest;

/**
 * {@link AuthRequest} view of a servlet request.
 *
 * <p>The path is taken relative to the context path, so an application deployed under {@code
 * /git} still sees {@code /api/...} for its API.
 */
public final class ServletAuthRequest implements AuthRequest {

    private final HttpServletRequest request;

    public ServletAuthRequest(HttpServletRequest request) {
        this.request = request;
    }

    @Override
    public String path() {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }

    @Override
    public String header(String name) {
        return request.getHeader(name);
    }
}
