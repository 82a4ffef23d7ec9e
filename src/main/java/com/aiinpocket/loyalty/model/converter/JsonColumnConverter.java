package com.aiinpocket.loyalty.model.converter;

import jakarta.persistence.AttributeConverter;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

/**
 * 將具型別的結構存成 JSON 文字欄位。
 * 解析失敗代表資料庫內容損毀，直接拋出 IllegalStateException，不以空值吞掉。
 */
abstract class JsonColumnConverter<T> implements AttributeConverter<T, String> {

    static final JsonMapper MAPPER = JsonMapper.builder().build();

    private final Class<T> type;

    protected JsonColumnConverter(Class<T> type) {
        this.type = type;
    }

    @Override
    public String convertToDatabaseColumn(T attribute) {
        if (attribute == null) {
            return null;
        }
        return MAPPER.writeValueAsString(attribute);
    }

    @Override
    public T convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(dbData, type);
        } catch (JacksonException e) {
            throw new IllegalStateException("無法解析 " + type.getSimpleName() + " 欄位: " + dbData, e);
        }
    }
}
