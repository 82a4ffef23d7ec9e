package com.aiinpocket.loyalty.exception;

/** 使用者、徽章、挑戰或挑戰進度不存在。 */
public class NotFoundException extends GamificationException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public static NotFoundException user(Long userId) {
        return new NotFoundException("使用者不存在: " + userId);
    }
}
