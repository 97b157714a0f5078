package com.example.excelsplit.service.excel;

import java.util.Optional;

public record CellStyle(String numberFormat, String backgroundColor) {

    public static final String GENERAL = "General";

    public static final CellStyle NONE = new CellStyle(null, null);
    public static final CellStyle GENERAL_STYLE = new CellStyle(GENERAL, null);

    public Optional<String> numberFormatIfCustom() {
        if (numberFormat == null || GENERAL.equals(numberFormat)) {
            return Optional.empty();
        }
        return Optional.of(numberFormat);
    }

    public Optional<String> background() {
        return Optional.ofNullable(backgroundColor);
    }

    /**
     * 默认样式不写入元数据，避免大表为每个单元格都保存一份记录。
     */
    public boolean isDefault() {
        return numberFormatIfCustom().isEmpty() && backgroundColor == null;
    }
}
