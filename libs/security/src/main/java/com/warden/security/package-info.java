/**
 * Request identity resolution.
 *
 * <p>{@link com.warden.security.IdentityResolver} decides who is behind a request, trying in
 * order:
 *
 * <ul>
 *   <li>an API access token ({@code Authorization: token <sha>})
 *   <li>the user id stored in the session
 *   <li>the reverse proxy header, with optional auto-registration
 *   <li>HTTP Basic credentials
 * </ul>
 *
 * <p>The resolver depends only on the {@link com.warden.security.UserDirectory}, {@link
 * com.warden.security.SessionStore} and {@link com.warden.security.AuthRequest} contracts, so it
 * carries no servlet or storage dependency.
 *
 * @see com.warden.security.directory.InMemoryUserDirectory
 */
package com.warden.security;
