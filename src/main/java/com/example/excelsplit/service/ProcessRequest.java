package com.example.excelsplit.service;

public record ProcessRequest(
        String filePath,
        ProcessConfig config
) {
}
