package com.aiinpocket.loyalty.security;

import com.aiinpocket.loyalty.exception.ErrorKind;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;
import tools.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * 過濾器鏈中的認證失敗與權限不足，回應格式與 GlobalExceptionHandler 相同。
 */
@RequiredArgsConstructor
@Slf4j
public class SecurityErrorWriter implements AuthenticationEntryPoint, AccessDeniedHandler {

    private final JsonMapper jsonMapper;

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        log.debug("[身分] 未通過認證: {} {}", request.getMethod(), request.getRequestURI());
        write(response, ErrorKind.UNAUTHENTICATED, "缺少或無效的身分憑證");
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response,
                       AccessDeniedException accessDeniedException) throws IOException {
        write(response, ErrorKind.FORBIDDEN, "無權執行此操作");
    }

    void write(HttpServletResponse response, ErrorKind kind, String message) throws IOException {
        response.setStatus(kind.getStatus().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(jsonMapper.writeValueAsString(
                Map.of("error", kind.name().toLowerCase(), "message", message)));
    }
}
