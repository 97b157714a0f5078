package com.example.excelsplit.service.excel;

public class ImageEmbedException extends ExcelProcessException {

    public static final String CODE = "IMAGE_ERROR";

    public ImageEmbedException(String message) {
        super(message, CODE);
    }

    public ImageEmbedException(String message, Throwable cause) {
        super(message, CODE, cause);
    }
}
