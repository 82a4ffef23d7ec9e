package com.aiinpocket.loyalty.config;

import com.aiinpocket.loyalty.security.InternalApiKeyFilter;
import com.aiinpocket.loyalty.security.SecurityErrorWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.server.resource.web.authentication.BearerTokenAuthenticationFilter;
import org.springframework.security.web.SecurityFilterChain;
import tools.jackson.databind.json.JsonMapper;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;

/**
 * Spring Security 安全配置。
 * 使用者以 HS256 簽章的 Bearer JWT 呼叫，內部服務以 X-Api-Key 呼叫；
 * 兩者都不是的請求在進入 Controller 之前就回應 401。
 */
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    /** HS256 金鑰長度下限（bytes） */
    static final int MIN_SECRET_BYTES = 32;

    private final LoyaltyProperties properties;

    @Bean
    public SecurityErrorWriter securityErrorWriter(JsonMapper jsonMapper) {
        return new SecurityErrorWriter(jsonMapper);
    }

    @Bean
    public JwtDecoder jwtDecoder() {
        String secret = properties.jwtSecret();
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("loyalty.jwt-secret 未設定或長度不足 " + MIN_SECRET_BYTES + " bytes");
        }
        SecretKeySpec key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        return NimbusJwtDecoder.withSecretKey(key)
                .macAlgorithm(MacAlgorithm.HS256)
                .build();
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http, SecurityErrorWriter errorWriter) throws Exception {
        http
                .authorizeHttpRequests(auth -> auth
                        // Actuator 只放行健康檢查端點
                        .requestMatchers("/actuator/health", "/actuator/health/**").permitAll()
                        .requestMatchers("/error").permitAll()
                        // 本人或內部服務的細部檢查由 CallerIdentity 負責
                        .requestMatchers("/api/**").authenticated()
                        .anyRequest().denyAll()
                )
                .oauth2ResourceServer(oauth -> oauth
                        .jwt(jwt -> jwt.decoder(jwtDecoder()))
                        .authenticationEntryPoint(errorWriter)
                        .accessDeniedHandler(errorWriter)
                )
                .addFilterBefore(new InternalApiKeyFilter(properties.internalApiKey(), errorWriter),
                        BearerTokenAuthenticationFilter.class)
                .exceptionHandling(ex -> ex
                        .authenticationEntryPoint(errorWriter)
                        .accessDeniedHandler(errorWriter)
                )
                // 無狀態 REST API，不使用 Session 與 CSRF
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .csrf(csrf -> csrf.disable());

        return http.build();
    }
}
