package com.example.excelsplit.web;

import com.example.excelsplit.service.excel.ExcelProcessException;
import com.example.excelsplit.service.excel.ExcelValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 把处理异常转换为 {message, code}。配置或请求不合法返回 400，其余返回 500。
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ExcelValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ExcelValidationException e) {
        log.warn("请求校验失败: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage(), e.getCode()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        Throwable cause = e.getMostSpecificCause();
        String message = cause instanceof ExcelValidationException ? cause.getMessage() : "请求内容无法解析";
        log.warn("请求内容无法解析: {}", cause.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(message, ExcelValidationException.CODE));
    }

    @ExceptionHandler(ExcelProcessException.class)
    public ResponseEntity<ErrorResponse> handleProcess(ExcelProcessException e) {
        log.error("处理失败 [{}]: {}", e.getCode(), e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(e.getMessage(), e.getCode()));
    }
}
