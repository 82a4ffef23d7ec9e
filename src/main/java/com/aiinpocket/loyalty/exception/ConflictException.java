package com.aiinpocket.loyalty.exception;

/** 狀態衝突：重複完成挑戰、挑戰不在有效期間、進度未達標等。 */
public class ConflictException extends GamificationException {

    public ConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }
}
