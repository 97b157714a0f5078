package com.example.excelsplit.service.excel;

import java.util.regex.Pattern;

public record CellValue(Type type, String text, double number) {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final CellValue EMPTY = new CellValue(Type.EMPTY, null, 0);

    public enum Type {
        EMPTY,
        TEXT,
        NUMBER,
        INTEGER,
        FORMULA
    }

    public static CellValue empty() {
        return EMPTY;
    }

    public static CellValue text(String text) {
        return new CellValue(Type.TEXT, text, 0);
    }

    public static CellValue number(double number) {
        return new CellValue(Type.NUMBER, null, number);
    }

    public static CellValue integer(long number) {
        return new CellValue(Type.INTEGER, null, number);
    }

    public static CellValue formula(String formula) {
        return new CellValue(Type.FORMULA, formula, 0);
    }

    /**
     * 按原始文本推断类型：整数 -> INTEGER，小数 -> NUMBER，其他非空 -> TEXT，空 -> EMPTY。
     */
    public static CellValue sniff(String value) {
        if (value == null || value.isEmpty()) {
            return EMPTY;
        }
        try {
            return integer(Long.parseLong(value));
        } catch (NumberFormatException ignored) {
            // 不是整数，继续按小数解析
        }
        if (DECIMAL.matcher(value).matches()) {
            return number(Double.parseDouble(value));
        }
        return text(value);
    }

    public boolean isEmpty() {
        return type == Type.EMPTY;
    }
}
