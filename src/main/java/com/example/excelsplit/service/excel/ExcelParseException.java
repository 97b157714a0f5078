package com.example.excelsplit.service.excel;

public class ExcelParseException extends ExcelProcessException {

    public static final String CODE = "PARSE_ERROR";

    public ExcelParseException(String message) {
        super(message, CODE);
    }

    public ExcelParseException(String message, Throwable cause) {
        super(message, CODE, cause);
    }
}
