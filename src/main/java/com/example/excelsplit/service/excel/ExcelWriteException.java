package com.example.excelsplit.service.excel;

public class ExcelWriteException extends ExcelProcessException {

    public static final String CODE = "WRITE_ERROR";

    public ExcelWriteException(String message) {
        super(message, CODE);
    }

    public ExcelWriteException(String message, Throwable cause) {
        super(message, CODE, cause);
    }
}
