package com.warden.identity.infrastructure.web;

import com.warden.security.SessionStore;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;

/**
 * {@link SessionStore} over the servlet container's {@link HttpSession}.
 *
 * <p>Reads and deletes never create a session; only {@link #set} does.
 */
public final class HttpSessionStore implements SessionStore {

    private final HttpServletRequest request;

    public HttpSessionStore(HttpServletRequest request) {
        this.request = request;
    }

    @Override
    public Object get(String key) {
        HttpSession session = request.getSession(false);
        return session == null ? null : session.getAttribute(key);
    }

    @Override
    public void set(String key, Object value) {
        request.getSession(true).setAttribute(key, value);
    }

    @Override
    public void delete(String key) {
        HttpSession session = request.getSession(false);
        if (session != null) {
            session.removeAttribute(key);
        }
    }

    /**
     * Issues a new session id for the current session, if there is one. Called when the
     * signed-in user changes.
     */
    public void renew() {
        if (request.getSession(false) != null) {
            request.changeSessionId();
        }
    }
}
