package com.aiinpocket.loyalty.security;

import com.aiinpocket.loyalty.exception.AuthorizationException;

/**
 * 呼叫者身分。
 * 內部服務（訂單、管理後台）以 API Key 呼叫，可操作任何使用者；
 * 一般使用者只能存取自己的資料。
 *
 * @param internal 是否為內部呼叫者
 * @param userId   一般使用者的 id（內部呼叫者為 null）
 */
public record CallerIdentity(boolean internal, Long userId) {

    public static CallerIdentity internalService() {
        return new CallerIdentity(true, null);
    }

    public static CallerIdentity user(Long userId) {
        return new CallerIdentity(false, userId);
    }

    /** 只允許內部呼叫者或本人 */
    public void requireAccessTo(Long targetUserId) {
        if (internal) {
            return;
        }
        if (userId == null || !userId.equals(targetUserId)) {
            throw AuthorizationException.forbidden("無權存取其他使用者的資料");
        }
    }

    /** 只允許內部呼叫者（入帳、授予徽章、強制完成挑戰） */
    public void requireInternal() {
        if (!internal) {
            throw AuthorizationException.forbidden("此操作僅限內部服務呼叫");
        }
    }
}
