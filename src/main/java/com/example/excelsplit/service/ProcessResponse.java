package com.example.excelsplit.service;

import java.util.List;

public record ProcessResponse(
        boolean success,
        String outputPath,
        String message,
        List<String> logs
) {
}
