package com.aiinpocket.loyalty.model.entity;

import com.aiinpocket.loyalty.model.converter.LevelBenefitsConverter;
import com.aiinpocket.loyalty.model.criteria.LevelBenefits;
import com.aiinpocket.loyalty.service.LevelTable.LevelDefinition;
import jakarta.persistence.*;
import lombok.*;

/**
 * 等級設定（levels 表）。靜態資料，啟動時由 LevelTableInitializer 寫入。
 */
@Entity
@Table(name = "levels")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Level {

    @Id
    @Column(name = "level_number")
    private Integer levelNumber;

    @Column(name = "level_name", nullable = false, length = 50)
    private String name;

    @Column(name = "points_required", nullable = false)
    private Long pointsRequired;

    @Convert(converter = LevelBenefitsConverter.class)
    @Column(columnDefinition = "TEXT")
    private LevelBenefits benefits;

    public LevelDefinition toDefinition() {
        return new LevelDefinition(levelNumber, name, pointsRequired,
                benefits == null ? LevelBenefits.NONE : benefits);
    }
}
