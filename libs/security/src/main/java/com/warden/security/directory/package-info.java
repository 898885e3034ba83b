/**
 * {@link com.warden.security.UserDirectory} implementations.
 */
package com.warden.security.directory;
