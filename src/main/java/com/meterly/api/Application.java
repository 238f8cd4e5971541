package com.meterly.api;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.meterly.api.identity.GatewayUserAuthFilter;
import com.meterly.api.identity.IdentityService;
import com.meterly.api.identity.ServiceKeyAuthFilter;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import jakarta.servlet.http.HttpServletResponse;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.Banner;
import org.springframework.boot.actuate.web.exchanges.HttpExchangeRepository;
import org.springframework.boot.actuate.web.exchanges.InMemoryHttpExchangeRepository;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.info.BuildProperties;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.http.HttpMethod;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import org.springframework.security.web.firewall.HttpStatusRequestRejectedHandler;
import org.springframework.security.web.firewall.RequestRejectedHandler;
import org.springframework.stereotype.Component;

import java.time.Clock;

// exclude user details service from Spring security. We're not using it.
@SpringBootApplication(exclude = {UserDetailsServiceAutoConfiguration.class})
@EnableCaching
@EnableScheduling
@ConfigurationPropertiesScan(basePackageClasses = Application.class)
public class Application {

    public static void main(String[] args) {
        new SpringApplicationBuilder(Application.class)
            .bannerMode(Banner.Mode.OFF)
            .run(args);
    }

    @NonNull
    @Bean
    Jackson2ObjectMapperBuilderCustomizer objectMapperBuilderCustomizer() {
        return builder -> {
            builder.featuresToEnable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            builder.featuresToDisable(SerializationFeature.WRITE_DATE_TIMESTAMPS_AS_NANOSECONDS);
        };
    }

    @NonNull
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @NonNull
    @Bean
    OpenAPI openAPI(@NonNull BuildProperties buildProperties) {
        return new OpenAPI()
            .info(
                new Info()
                    .title("Meterly API")
                    .version(String.format("v%s", buildProperties.getVersion())))
            .components(
                new Components()
                    .addSecuritySchemes("gateway-user-id", new SecurityScheme()
                        .type(SecurityScheme.Type.APIKEY)
                        .in(SecurityScheme.In.HEADER)
                        .name(IdentityService.USER_ID_HEADER))
                    .addSecuritySchemes("service-api-key", new SecurityScheme()
                        .type(SecurityScheme.Type.APIKEY)
                        .in(SecurityScheme.In.HEADER)
                        .name(IdentityService.SERVICE_API_KEY_HEADER)))
            .addSecurityItem(new SecurityRequirement().addList("gateway-user-id"))
            .addSecurityItem(new SecurityRequirement().addList("service-api-key"));
    }

    @NonNull
    @Bean
    HttpExchangeRepository httpExchangeRepository() {
        return new InMemoryHttpExchangeRepository();
    }

    @Bean
    SecurityFilterChain securityFilterChain(
        @NonNull HttpSecurity http,
        @NonNull ServiceKeyAuthFilter serviceKeyAuthFilter,
        @NonNull GatewayUserAuthFilter gatewayUserAuthFilter
    ) throws Exception {
        // disable default filters.
        http.cors().disable()
            .csrf().disable()
            .formLogin().disable()
            .headers().disable()
            .httpBasic().disable()
            .jee().disable()
            .logout().disable()
            .rememberMe().disable()
            .requestCache().disable()
            .securityContext().disable()
            .sessionManagement().disable();

        // Callers authenticate with the gateway or hold the internal service key, so there is no
        // entrypoint to redirect them to.
        http.exceptionHandling().authenticationEntryPoint(
            (request, response, authException) -> response.setStatus(HttpServletResponse.SC_UNAUTHORIZED));

        http.authorizeHttpRequests()
            .requestMatchers(HttpMethod.POST, "/v1/webhooks/stripe").permitAll()
            .requestMatchers("/v1/internal/**").hasRole(IdentityService.INTERNAL_SERVICE_ROLE)
            .requestMatchers("/v?*/**").fullyAuthenticated()
            .anyRequest().permitAll();

        // the service key takes precedence over the user id header.
        http.addFilterBefore(serviceKeyAuthFilter, AnonymousAuthenticationFilter.class);
        http.addFilterAfter(gatewayUserAuthFilter, ServiceKeyAuthFilter.class);
        return http.build();
    }

    @Bean
    RequestRejectedHandler requestRejectedHandler() {
        return new HttpStatusRequestRejectedHandler();
    }

    @Component
    @Slf4j
    static class ApplicationVersionLogger implements ApplicationRunner {

        @Autowired
        private BuildProperties buildProperties;

        @Override
        public void run(ApplicationArguments args) {
            log.info("Running {} version: v{}", buildProperties.getName(), buildProperties.getVersion());
        }
    }
}
