package com.warden.identity.infrastructure.web;

import com.warden.observability.CorrelationContextHolder;
import com.warden.security.IdentityResolver;
import com.warden.security.ResolutionResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the identity behind every request once, before any handler runs.
 *
 * <p>The {@link ResolutionResult} is stored as request attribute {@value #RESULT_ATTRIBUTE}, where
 * controllers pick it up with {@code @RequestAttribute}. Anonymous requests are not rejected here;
 * each endpoint decides whether it needs a user.
 *
 * <p>The resolved user id and mechanism are added to the logging MDC, and every outcome is counted
 * in {@value #RESOLUTIONS_METRIC}, tagged by mechanism.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class IdentityResolutionFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolutionFilter.class);

    public static final String RESULT_ATTRIBUTE = "warden.identity";

    public static final String RESOLUTIONS_METRIC = "warden.identity.resolutions";

    private final IdentityResolver resolver;
    private final MeterRegistry meterRegistry;

    public IdentityResolutionFilter(IdentityResolver resolver, MeterRegistry meterRegistry) {
        this.resolver = resolver;
        this.meterRegistry = meterRegistry;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        ResolutionResult result =
                resolver.resolveUser(new ServletAuthRequest(request), new HttpSessionStore(request));
        request.setAttribute(RESULT_ATTRIBUTE, result);

        String userId = result.userIfPresent().map(u -> Long.toString(u.id())).orElse(null);
        CorrelationContextHolder.update(ctx -> ctx.withIdentity(userId, result.method().name()));
        Counter.builder(RESOLUTIONS_METRIC)
                .description("Identity resolutions by mechanism")
                .tag("method", result.method().name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
        log.debug("Resolved identity: method={}", result.method());

        filterChain.doFilter(request, response);
    }
}
