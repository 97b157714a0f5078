package com.example.excelsplit.service.excel;

public class ExcelValidationException extends ExcelProcessException {

    public static final String CODE = "VALIDATION_ERROR";

    public ExcelValidationException(String message) {
        super(message, CODE);
    }

    public ExcelValidationException(String message, Throwable cause) {
        super(message, CODE, cause);
    }
}
