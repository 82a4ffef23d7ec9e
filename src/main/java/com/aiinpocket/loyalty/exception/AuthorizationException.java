package com.aiinpocket.loyalty.exception;

/** 未提供身分，或非內部呼叫者嘗試操作其他使用者的資料。 */
public class AuthorizationException extends GamificationException {

    private AuthorizationException(ErrorKind kind, String message) {
        super(kind, message);
    }

    public static AuthorizationException unauthenticated(String message) {
        return new AuthorizationException(ErrorKind.UNAUTHENTICATED, message);
    }

    public static AuthorizationException forbidden(String message) {
        return new AuthorizationException(ErrorKind.FORBIDDEN, message);
    }
}
