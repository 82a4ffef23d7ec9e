package com.aiinpocket.loyalty.model.converter;

import com.aiinpocket.loyalty.model.criteria.LevelBenefits;
import jakarta.persistence.Converter;

@Converter
public class LevelBenefitsConverter extends JsonColumnConverter<LevelBenefits> {

    public LevelBenefitsConverter() {
        super(LevelBenefits.class);
    }
}
