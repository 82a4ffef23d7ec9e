package com.aiinpocket.loyalty.repository;

/** 每位使用者的計數投影（徽章數、完成挑戰數） */
public interface UserCount {

    Long getUserId();

    Long getTotal();
}
