package com.example.excelsplit.service.excel;

/**
 * 处理流程中所有可上报给调用方的错误的基类，{@link #getCode()} 与前端约定的错误码一致。
 */
public class ExcelProcessException extends RuntimeException {

    private final String code;

    public ExcelProcessException(String message, String code) {
        super(message);
        this.code = code;
    }

    public ExcelProcessException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
