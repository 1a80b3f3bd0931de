package com.tasktracker.api.security;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.autoconfigure.security.servlet.EndpointRequest;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.List;

/**
 * Request pipeline for the API, in order:
 * 1. actuator chain (health/info public, rest denied)
 * 2. public chain: API root, health, register, token issue/refresh
 *    (each also with the trailing slash the browser client uses)
 * 3. secured chain: every other /api/** route needs a valid access token
 *
 * All chains are stateless. The secured chain only authenticates the token;
 * turning the token subject into a stored identity happens in {@link CallerResolver}.
 */
@Configuration
public class SecurityConfig {

    @Bean
    @Order(1)
    SecurityFilterChain actuatorChain(HttpSecurity http) throws Exception {
        return http
            .securityMatcher(EndpointRequest.toAnyEndpoint())
            .csrf(csrf -> csrf.disable())
            .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(EndpointRequest.to("health", "info")).permitAll()
                .anyRequest().denyAll()
            )
            .build();
    }

    @Bean
    @Order(2)
    SecurityFilterChain publicApiChain(HttpSecurity http, JsonSecurityErrorHandler errors) throws Exception {
        return http
            .securityMatcher(
                "/api", "/api/",
                "/api/health", "/api/health/",
                "/error",
                "/api/auth/register", "/api/auth/register/",
                "/api/token", "/api/token/",
                "/api/token/refresh", "/api/token/refresh/"
            )
            .cors(Customizer.withDefaults())
            .csrf(csrf -> csrf.disable())
            .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                .requestMatchers(HttpMethod.GET, "/api", "/api/", "/api/health", "/api/health/").permitAll()
                .requestMatchers("/error").permitAll()
                .requestMatchers(HttpMethod.POST,
                    "/api/auth/register", "/api/auth/register/",
                    "/api/token", "/api/token/",
                    "/api/token/refresh", "/api/token/refresh/"
                ).permitAll()
                .anyRequest().denyAll()
            )
            .exceptionHandling(ex -> ex.authenticationEntryPoint(errors).accessDeniedHandler(errors))
            .build();
    }

    @Bean
    @Order(3)
    SecurityFilterChain securedApiChain(
        HttpSecurity http,
        @Qualifier("accessTokenDecoder") JwtDecoder accessTokenDecoder,
        JsonSecurityErrorHandler errors
    ) throws Exception {
        return http
            .securityMatcher("/api/**")
            .cors(Customizer.withDefaults())
            .csrf(csrf -> csrf.disable())
            .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                .anyRequest().authenticated()
            )
            .oauth2ResourceServer(oauth -> oauth
                .jwt(jwt -> jwt.decoder(accessTokenDecoder))
                .authenticationEntryPoint(errors)
                .accessDeniedHandler(errors)
            )
            .exceptionHandling(ex -> ex.authenticationEntryPoint(errors).accessDeniedHandler(errors))
            .build();
    }

    @Bean
    CorsConfigurationSource corsConfigurationSource(CorsProperties props) {
        CorsConfiguration cors = new CorsConfiguration();
        cors.setAllowedOriginPatterns(props.allowedOriginList());
        cors.setAllowedMethods(List.of("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS"));
        cors.setAllowedHeaders(List.of("*"));
        cors.setExposedHeaders(List.of("X-Request-Id"));
        cors.setAllowCredentials(true);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/api/**", cors);
        return source;
    }
}
