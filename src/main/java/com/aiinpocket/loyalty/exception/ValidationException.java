package com.aiinpocket.loyalty.exception;

/** 欄位缺漏或格式錯誤，在任何寫入之前拒絕。 */
public class ValidationException extends GamificationException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
