package com.example.excelsplit.service;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.example.excelsplit.service.excel.ExcelValidationException;

import java.util.Arrays;
import java.util.Optional;

public enum ProcessType {
    SEA_RAIL_WITH_IMAGE("sea-rail-with-image"),   // 海铁有图版
    SEA_RAIL_NO_IMAGE("sea-rail-no-image"),       // 海铁无图版
    AIR_FREIGHT("air-freight");                   // 空运版

    private final String key;

    ProcessType(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public static Optional<ProcessType> find(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim();
        return Arrays.stream(values())
                .filter(type -> type.key.equalsIgnoreCase(normalized) || type.name().equalsIgnoreCase(normalized))
                .findFirst();
    }

    @JsonCreator
    public static ProcessType fromKey(String key) {
        return find(key).orElseThrow(() -> new ExcelValidationException("未知的处理类型: " + key));
    }

    @Override
    public String toString() {
        return key;
    }
}
