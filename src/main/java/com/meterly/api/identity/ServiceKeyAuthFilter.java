package com.meterly.api.identity;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.NonNull;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * <p>
 * A {@link OncePerRequestFilter OncePerRequest} security filter to authenticate internal services
 * using the shared key in the {@code X-Service-API-Key} request header.</p>
 * <p>
 * If the header is missing, the filter leaves the existing {@link
 * org.springframework.security.core.context.SecurityContext SecurityContext} untouched. Otherwise,
 * it sets a new {@link org.springframework.security.core.context.SecurityContext SecurityContext}
 * whose {@link org.springframework.security.core.Authentication Authentication} is {@code null}
 * if the key doesn't match.</p>
 */
@Component
public class ServiceKeyAuthFilter extends OncePerRequestFilter {

    private final IdentityService identityService;

    @Autowired
    public ServiceKeyAuthFilter(@NonNull IdentityService identityService) {
        this.identityService = identityService;
    }

    @Override
    protected void doFilterInternal(
        @NonNull HttpServletRequest request,
        @NonNull HttpServletResponse response,
        @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        verifyServiceApiKeyHeader(request);
        filterChain.doFilter(request, response);
    }

    private void verifyServiceApiKeyHeader(@NonNull HttpServletRequest request) {
        if (SecurityContextHolder.getContext().getAuthentication() != null) {
            return; // a previous filter may have performed authentication.
        }

        val header = request.getHeader(IdentityService.SERVICE_API_KEY_HEADER);
        if (header == null || header.isBlank()) {
            return;
        }

        val context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(identityService.verifyServiceApiKey(header));
        SecurityContextHolder.setContext(context);
    }
}
