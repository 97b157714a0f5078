package com.example.excelsplit.service.excel;

public class ExcelFileException extends ExcelProcessException {

    public static final String CODE = "FILE_ERROR";

    public ExcelFileException(String message) {
        super(message, CODE);
    }

    public ExcelFileException(String message, Throwable cause) {
        super(message, CODE, cause);
    }
}
