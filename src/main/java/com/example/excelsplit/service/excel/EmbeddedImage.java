package com.example.excelsplit.service.excel;

// 浮动图片的 id 为 floating_行_列_rId
public record EmbeddedImage(String id, byte[] data, ImageFormat format) {

    public static final int MIN_IMAGE_BYTES = 8;

    public boolean hasUsableData() {
        return data != null && data.length >= MIN_IMAGE_BYTES;
    }
}
