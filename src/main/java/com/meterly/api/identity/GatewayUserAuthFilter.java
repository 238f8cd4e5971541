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
 * A {@link OncePerRequestFilter OncePerRequest} security filter that trusts the user id the API
 * gateway forwards in the {@code X-User-Id} header, after it has verified the user's session.
 */
@Component
public class GatewayUserAuthFilter extends OncePerRequestFilter {

    private final IdentityService identityService;

    @Autowired
    public GatewayUserAuthFilter(@NonNull IdentityService identityService) {
        this.identityService = identityService;
    }

    @Override
    protected void doFilterInternal(
        @NonNull HttpServletRequest request,
        @NonNull HttpServletResponse response,
        @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        if (SecurityContextHolder.getContext().getAuthentication() == null) {
            val header = request.getHeader(IdentityService.USER_ID_HEADER);
            if (header != null) {
                val context = SecurityContextHolder.createEmptyContext();
                context.setAuthentication(identityService.verifyGatewayUser(header));
                SecurityContextHolder.setContext(context);
            }
        }

        filterChain.doFilter(request, response);
    }
}
