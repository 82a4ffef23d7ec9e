package com.aiinpocket.loyalty.controller;

import com.aiinpocket.loyalty.exception.ErrorKind;
import com.aiinpocket.loyalty.exception.GamificationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * 全域 REST API 異常處理器。
 * 所有錯誤回應統一為 {@code {"error": 種類, "message": 說明}}，不回傳堆疊追蹤。
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(GamificationException.class)
    public ResponseEntity<Map<String, String>> handleGamification(GamificationException e) {
        if (e.getKind() == ErrorKind.INTERNAL) {
            log.error("[GlobalExceptionHandler] 內部錯誤", e);
        } else {
            log.debug("[GlobalExceptionHandler] {}: {}", e.getKind(), e.getMessage());
        }
        return body(e.getKind(), sanitizeMessage(e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleInvalid(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .distinct()
                .sorted()
                .collect(Collectors.joining(", "));
        return body(ErrorKind.VALIDATION, msg.isEmpty() ? "請求欄位不正確" : "欄位缺漏或格式不正確: " + msg);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(HttpMessageNotReadableException e) {
        return body(ErrorKind.VALIDATION, "請求格式不正確，請檢查欄位型別");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, String>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return body(ErrorKind.VALIDATION, "參數格式不正確: " + e.getName());
    }

    @ExceptionHandler({DataAccessException.class, TransactionException.class})
    public ResponseEntity<Map<String, String>> handleStorage(RuntimeException e) {
        log.error("[GlobalExceptionHandler] 資料存取失敗，交易已回滾", e);
        return body(ErrorKind.STORAGE, "資料暫時無法存取，請稍後重試");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, String>> handleNoResource(NoResourceFoundException e) {
        log.debug("資源不存在: {}", e.getResourcePath());
        return body(ErrorKind.NOT_FOUND, "資源不存在");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneral(Exception e) {
        log.error("[GlobalExceptionHandler] 未預期的錯誤", e);
        return body(ErrorKind.INTERNAL, "系統發生錯誤，請稍後重試");
    }

    private static ResponseEntity<Map<String, String>> body(ErrorKind kind, String message) {
        return ResponseEntity.status(kind.getStatus())
                .body(Map.of("error", kind.name().toLowerCase(), "message", message));
    }

    /** 過濾可能含有敏感資訊的錯誤訊息 */
    static String sanitizeMessage(String msg) {
        if (msg == null || msg.length() > 200) return "操作失敗，請稍後重試";
        String lower = msg.toLowerCase();
        if (lower.contains("sql") || lower.contains("exception") || lower.contains("constraint")
                || lower.contains("connection") || lower.contains("timeout")
                || lower.contains("password") || lower.contains("token")) {
            return "操作失敗，請稍後重試";
        }
        return msg;
    }
}
