package com.aiinpocket.loyalty.model.criteria;

import com.aiinpocket.loyalty.model.enums.BadgeCategory;
import com.aiinpocket.loyalty.model.enums.Difficulty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.math.BigDecimal;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 徽章與挑戰的達成條件。
 * 以 JSON 欄位 {@code kind} 區分種類，每種條件自行推導分類、難度與進度目標值。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RewardCriteria.Orders.class, name = "orders"),
        @JsonSubTypes.Type(value = RewardCriteria.Reviews.class, name = "reviews"),
        @JsonSubTypes.Type(value = RewardCriteria.Referrals.class, name = "referrals"),
        @JsonSubTypes.Type(value = RewardCriteria.TimeOfDay.class, name = "time_of_day"),
        @JsonSubTypes.Type(value = RewardCriteria.RestaurantVariety.class, name = "restaurant_variety"),
        @JsonSubTypes.Type(value = RewardCriteria.Spending.class, name = "spending"),
        @JsonSubTypes.Type(value = RewardCriteria.Special.class, name = "special")
})
public sealed interface RewardCriteria {

    BadgeCategory category();

    /** 挑戰進度的目標值 */
    int target();

    default Difficulty difficulty() {
        return Difficulty.EASY;
    }

    /** 取得此條件附帶的特殊獎勵（授予徽章時一併回傳） */
    default List<SpecialReward> specialRewards() {
        return List.of();
    }

    /** 累計訂單數 */
    record Orders(int orders) implements RewardCriteria {
        @Override
        public BadgeCategory category() {
            return BadgeCategory.ORDERS;
        }

        @Override
        public int target() {
            return orders;
        }

        @Override
        public Difficulty difficulty() {
            if (orders >= 50) return Difficulty.HARD;
            if (orders >= 20) return Difficulty.MEDIUM;
            return Difficulty.EASY;
        }

        @Override
        public List<SpecialReward> specialRewards() {
            if (orders >= 10) {
                return List.of(new SpecialReward("discount", "下一筆訂單享 5% 特別折扣", 5));
            }
            return List.of();
        }
    }

    /** 累計評價數 */
    record Reviews(int reviews) implements RewardCriteria {
        @Override
        public BadgeCategory category() {
            return BadgeCategory.REVIEWS;
        }

        @Override
        public int target() {
            return reviews;
        }
    }

    /** 累計推薦好友數 */
    record Referrals(int referrals) implements RewardCriteria {
        @Override
        public BadgeCategory category() {
            return BadgeCategory.REFERRALS;
        }

        @Override
        public int target() {
            return referrals;
        }

        @Override
        public Difficulty difficulty() {
            if (referrals >= 10) return Difficulty.HARD;
            if (referrals >= 5) return Difficulty.MEDIUM;
            return Difficulty.EASY;
        }

        @Override
        public List<SpecialReward> specialRewards() {
            List<SpecialReward> rewards = new ArrayList<>();
            if (referrals >= 5) {
                rewards.add(new SpecialReward("free_delivery", "接下來 3 筆訂單免運", 3));
            }
            return rewards;
        }
    }

    /** 在指定時段內完成的訂單數（例如深夜 22:00 ~ 02:00） */
    record TimeOfDay(LocalTime from, LocalTime to, int orders) implements RewardCriteria {
        @Override
        public BadgeCategory category() {
            return BadgeCategory.SCHEDULE;
        }

        @Override
        public int target() {
            return orders;
        }
    }

    /** 在不同餐廳下單的家數 */
    record RestaurantVariety(int restaurants) implements RewardCriteria {
        @Override
        public BadgeCategory category() {
            return BadgeCategory.EXPLORATION;
        }

        @Override
        public int target() {
            return restaurants;
        }
    }

    /** 累計消費金額 */
    record Spending(BigDecimal totalSpent) implements RewardCriteria {
        @Override
        public BadgeCategory category() {
            return BadgeCategory.SPENDING;
        }

        @Override
        public int target() {
            return totalSpent == null ? 0 : totalSpent.intValue();
        }

        @Override
        public Difficulty difficulty() {
            if (totalSpent == null) return Difficulty.EASY;
            if (totalSpent.compareTo(BigDecimal.valueOf(1000)) >= 0) return Difficulty.HARD;
            if (totalSpent.compareTo(BigDecimal.valueOf(300)) >= 0) return Difficulty.MEDIUM;
            return Difficulty.EASY;
        }
    }

    /** 活動型特殊條件，由營運描述並指定目標值 */
    record Special(String description, int target) implements RewardCriteria {
        @Override
        public BadgeCategory category() {
            return BadgeCategory.OTHER;
        }
    }

    record SpecialReward(String type, String description, int value) {}
}
