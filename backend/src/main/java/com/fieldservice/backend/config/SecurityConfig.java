package com.fieldservice.backend.config;

import com.fieldservice.backend.exception.ErrorResponseWriter;
import com.fieldservice.backend.exception.SecurityError;
import com.fieldservice.backend.security.ClientIpResolver;
import com.fieldservice.backend.security.CsrfGuard;
import com.fieldservice.backend.security.CsrfValidationFilter;
import com.fieldservice.backend.security.JwtAuthFilter;
import com.fieldservice.backend.security.RateLimitFilter;
import com.fieldservice.backend.security.RateLimiter;
import com.fieldservice.backend.security.RequestSizeLimitFilter;
import com.fieldservice.backend.security.SecurityHeadersFilter;
import com.fieldservice.backend.security.SessionIdResolver;
import com.fieldservice.backend.security.TokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import java.time.Clock;

/**
 * Spring Security wiring for the stateless API.
 *
 * Filter order (addFilterBefore calls at the same anchor run in call order):
 *   SecurityHeaders → RequestSizeLimit → RateLimit → CsrfValidation → JwtAuth
 *   → authorization → controllers
 *
 * The filters are created here rather than declared as beans, so the servlet
 * container never registers them a second time outside the security chain.
 * Spring Security's own CSRF, header and logout handling is switched off; the
 * filters above replace it.
 */
@Slf4j
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private final SecurityProperties  properties;
    private final ErrorResponseWriter errorResponseWriter;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http,
                                                   TokenService tokenService,
                                                   RateLimiter rateLimiter,
                                                   ClientIpResolver clientIpResolver,
                                                   CsrfGuard csrfGuard,
                                                   SessionIdResolver sessionIdResolver,
                                                   Clock clock) throws Exception {
        http
                .csrf(AbstractHttpConfigurer::disable)
                .headers(AbstractHttpConfigurer::disable)
                .logout(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .requestCache(AbstractHttpConfigurer::disable)
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))

                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(HttpMethod.POST, "/api/v1/auth/login", "/api/v1/auth/logout").permitAll()
                        .requestMatchers(HttpMethod.GET, "/api/v1/auth/csrf-token").permitAll()
                        .requestMatchers("/api/v1/health", "/error").permitAll()
                        .requestMatchers("/api/v1/security/**").hasRole("admin")
                        .anyRequest().authenticated())

                .exceptionHandling(ex -> ex
                        .authenticationEntryPoint((request, response, authException) -> {
                            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
                            errorResponseWriter.write(response, SecurityError.TOKEN_INVALID);
                        })
                        .accessDeniedHandler((request, response, accessDeniedException) -> {
                            log.warn("Access denied for {} {}", request.getMethod(), request.getRequestURI());
                            errorResponseWriter.write(response, SecurityError.ACCESS_DENIED);
                        }));

        http.addFilterBefore(new SecurityHeadersFilter(), UsernamePasswordAuthenticationFilter.class);
        http.addFilterBefore(
                new RequestSizeLimitFilter(properties.getRequest().getMaxSize(), errorResponseWriter),
                UsernamePasswordAuthenticationFilter.class);

        if (properties.getRateLimit().isEnabled()) {
            http.addFilterBefore(
                    new RateLimitFilter(rateLimiter, clientIpResolver, errorResponseWriter,
                            properties.getRateLimit().getFailureMode(), clock),
                    UsernamePasswordAuthenticationFilter.class);
        } else {
            log.warn("Rate limiting is disabled (security.rate-limit.enabled=false)");
        }

        http.addFilterBefore(
                new CsrfValidationFilter(csrfGuard, sessionIdResolver, errorResponseWriter,
                        properties.getCsrf().getExcludedPaths()),
                UsernamePasswordAuthenticationFilter.class);
        http.addFilterBefore(new JwtAuthFilter(tokenService), UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }
}
