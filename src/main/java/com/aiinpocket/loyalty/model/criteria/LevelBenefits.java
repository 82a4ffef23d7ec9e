package com.aiinpocket.loyalty.model.criteria;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 等級福利。
 *
 * @param discountPercent    訂單折扣百分比
 * @param freeDelivery       是否免運
 * @param prioritySupport    是否享有優先客服
 * @param bonusPointsPercent 額外積分加成百分比
 */
public record LevelBenefits(
        int discountPercent,
        boolean freeDelivery,
        boolean prioritySupport,
        int bonusPointsPercent
) {

    public static final LevelBenefits NONE = new LevelBenefits(0, false, false, 0);

    /**
     * 與前一等級比較，列出有變動的福利欄位。
     * 數值欄位附上差額，布林欄位差額為 null。
     */
    public Map<String, BenefitChange> improvementsOver(LevelBenefits previous) {
        LevelBenefits base = previous == null ? NONE : previous;
        Map<String, BenefitChange> changes = new LinkedHashMap<>();
        if (discountPercent != base.discountPercent) {
            changes.put("discountPercent", new BenefitChange(base.discountPercent, discountPercent,
                    discountPercent - base.discountPercent));
        }
        if (freeDelivery != base.freeDelivery) {
            changes.put("freeDelivery", new BenefitChange(base.freeDelivery, freeDelivery, null));
        }
        if (prioritySupport != base.prioritySupport) {
            changes.put("prioritySupport", new BenefitChange(base.prioritySupport, prioritySupport, null));
        }
        if (bonusPointsPercent != base.bonusPointsPercent) {
            changes.put("bonusPointsPercent", new BenefitChange(base.bonusPointsPercent, bonusPointsPercent,
                    bonusPointsPercent - base.bonusPointsPercent));
        }
        return changes;
    }

    public record BenefitChange(Object current, Object next, Integer improvement) {}
}
