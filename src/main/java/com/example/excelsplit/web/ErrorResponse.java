package com.example.excelsplit.web;

public record ErrorResponse(
        String message,
        String code
) {
}
