package com.aiinpocket.loyalty.security;

import com.aiinpocket.loyalty.exception.ErrorKind;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * 內部服務（訂單、管理後台）以 {@code X-Api-Key} 標頭呼叫。
 * 金鑰相符時建立具有 {@link #INTERNAL_AUTHORITY} 的認證；不符時直接回應 401，不再往下嘗試 JWT。
 * 沒有帶此標頭的請求原樣交給後續的 Bearer Token 驗證。
 */
@RequiredArgsConstructor
@Slf4j
public class InternalApiKeyFilter extends OncePerRequestFilter {

    public static final String API_KEY_HEADER = "X-Api-Key";
    public static final String INTERNAL_AUTHORITY = "ROLE_INTERNAL";
    static final String INTERNAL_PRINCIPAL = "internal-service";

    private final String expectedKey;
    private final SecurityErrorWriter errorWriter;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String apiKey = request.getHeader(API_KEY_HEADER);
        if (apiKey == null || apiKey.isBlank()) {
            filterChain.doFilter(request, response);
            return;
        }
        if (!matches(apiKey)) {
            log.warn("[身分] 收到無效的 API Key: {} {}", request.getMethod(), request.getRequestURI());
            errorWriter.write(response, ErrorKind.UNAUTHENTICATED, "API Key 無效");
            return;
        }

        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(UsernamePasswordAuthenticationToken.authenticated(
                INTERNAL_PRINCIPAL, null, List.of(new SimpleGrantedAuthority(INTERNAL_AUTHORITY))));
        SecurityContextHolder.setContext(context);
        filterChain.doFilter(request, response);
    }

    private boolean matches(String candidate) {
        if (expectedKey == null || expectedKey.isBlank()) {
            return false;
        }
        return MessageDigest.isEqual(
                expectedKey.getBytes(StandardCharsets.UTF_8),
                candidate.trim().getBytes(StandardCharsets.UTF_8));
    }
}
