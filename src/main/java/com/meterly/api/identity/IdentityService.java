package com.meterly.api.identity;

import com.meterly.api.config.GlobalConfiguration;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Authenticates callers from the headers set by the API gateway and by internal services. Users
 * sign in with an external identity service, so this service only ever sees their opaque ids.
 */
@Service
@Slf4j
public class IdentityService {

    public static final String SERVICE_API_KEY_HEADER = "X-Service-API-Key";
    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String INTERNAL_SERVICE_ROLE = "INTERNAL_SERVICE";

    private static final int MAX_USER_ID_LENGTH = 128;

    private final byte[] internalServiceApiKey;

    @Autowired
    public IdentityService(@NonNull GlobalConfiguration globalConfig) {
        this.internalServiceApiKey = globalConfig.getInternalServiceApiKey().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @param apiKey value of the {@code X-Service-API-Key} header.
     * @return a non-null {@link Authentication} with the {@code INTERNAL_SERVICE} role if the key
     * matches the configured one. {@code null} otherwise.
     */
    public Authentication verifyServiceApiKey(@NonNull String apiKey) {
        if (!MessageDigest.isEqual(internalServiceApiKey, apiKey.getBytes(StandardCharsets.UTF_8))) {
            log.debug("internal service api key verification failed");
            return null;
        }

        return new InternalService();
    }

    /**
     * @param userId value of the {@code X-User-Id} header.
     * @return a non-null {@link Authentication} whose principal is the user id if it is
     * well-formed. {@code null} otherwise.
     */
    public Authentication verifyGatewayUser(@NonNull String userId) {
        val trimmed = userId.trim();
        if (trimmed.isEmpty() || trimmed.length() > MAX_USER_ID_LENGTH) {
            log.debug("rejecting malformed user id header");
            return null;
        }

        return new GatewayUser(trimmed);
    }

    private static class InternalService extends AbstractAuthenticationToken {

        private InternalService() {
            super(List.of(new SimpleGrantedAuthority("ROLE_" + INTERNAL_SERVICE_ROLE)));
            setAuthenticated(true);
        }

        @Override
        public Object getCredentials() {
            return null;
        }

        @Override
        public Object getPrincipal() {
            return INTERNAL_SERVICE_ROLE;
        }
    }

    private static class GatewayUser extends AbstractAuthenticationToken {

        private final String userId;

        private GatewayUser(@NonNull String userId) {
            super(List.of());
            this.userId = userId;
            setAuthenticated(true);
        }

        @Override
        public Object getCredentials() {
            return null;
        }

        @Override
        public Object getPrincipal() {
            return userId;
        }
    }
}
