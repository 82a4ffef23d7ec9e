package com.aiinpocket.loyalty.model.converter;

import com.aiinpocket.loyalty.model.criteria.RewardCriteria;
import jakarta.persistence.Converter;

@Converter
public class RewardCriteriaConverter extends JsonColumnConverter<RewardCriteria> {

    public RewardCriteriaConverter() {
        super(RewardCriteria.class);
    }
}
