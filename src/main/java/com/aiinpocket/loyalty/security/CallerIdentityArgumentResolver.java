package com.aiinpocket.loyalty.security;

import com.aiinpocket.loyalty.exception.AuthorizationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.MethodParameter;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * 從已通過 Spring Security 驗證的 {@link Authentication} 建立 {@link CallerIdentity}。
 * - 具有 {@link InternalApiKeyFilter#INTERNAL_AUTHORITY}：內部呼叫者
 * - Bearer JWT：使用者 id 取自 {@code userId} claim，其次 {@code id}，最後 {@code sub}
 * - 其他：401
 */
@Component
@Slf4j
public class CallerIdentityArgumentResolver implements HandlerMethodArgumentResolver {

    static final String USER_ID_CLAIM = "userId";
    static final String ID_CLAIM = "id";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return CallerIdentity.class.equals(parameter.getParameterType());
    }

    @Override
    public CallerIdentity resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                          NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        return fromAuthentication(SecurityContextHolder.getContext().getAuthentication());
    }

    static CallerIdentity fromAuthentication(Authentication auth) {
        if (auth == null || !auth.isAuthenticated() || auth instanceof AnonymousAuthenticationToken) {
            throw AuthorizationException.unauthenticated("缺少身分資訊");
        }
        boolean internal = auth.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .anyMatch(InternalApiKeyFilter.INTERNAL_AUTHORITY::equals);
        if (internal) {
            return CallerIdentity.internalService();
        }
        if (auth instanceof JwtAuthenticationToken token) {
            return CallerIdentity.user(userIdOf(token.getToken()));
        }
        log.warn("[身分] 不支援的認證型別: {}", auth.getClass().getSimpleName());
        throw AuthorizationException.unauthenticated("缺少身分資訊");
    }

    private static Long userIdOf(Jwt jwt) {
        Object claim = jwt.getClaim(USER_ID_CLAIM);
        if (claim == null) {
            claim = jwt.getClaim(ID_CLAIM);
        }
        if (claim == null) {
            claim = jwt.getSubject();
        }
        if (claim instanceof Number n) {
            return n.longValue();
        }
        if (claim instanceof String s && !s.isBlank()) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                throw AuthorizationException.unauthenticated("使用者身分格式不正確");
            }
        }
        throw AuthorizationException.unauthenticated("Token 中缺少使用者身分");
    }
}
