package com.aiinpocket.loyalty.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 失敗種類，對應回應中的 {@code error} 欄位與 HTTP 狀態碼。
 */
@Getter
public enum ErrorKind {

    VALIDATION(HttpStatus.BAD_REQUEST),
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    CONFLICT(HttpStatus.CONFLICT),
    STORAGE(HttpStatus.SERVICE_UNAVAILABLE),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }
}
