package com.example.excelsplit.service.excel;

public class ConfigException extends ExcelProcessException {

    public static final String CODE = "CONFIG_ERROR";

    public ConfigException(String message) {
        super(message, CODE);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, CODE, cause);
    }
}
