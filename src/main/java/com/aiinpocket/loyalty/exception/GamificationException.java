package com.aiinpocket.loyalty.exception;

import lombok.Getter;

/**
 * 遊戲化核心的業務例外基底類別。
 * 所有子類別都是 unchecked，拋出後由 Spring 交易回滾並由 GlobalExceptionHandler 轉換回應。
 */
@Getter
public abstract class GamificationException extends RuntimeException {

    private final ErrorKind kind;

    protected GamificationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
