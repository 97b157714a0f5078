package com.example.excelsplit.service.excel;

import java.util.Optional;

public enum ImageFormat {
    PNG,
    JPEG,
    GIF,
    BMP;

    private static final byte[] PNG_MAGIC = {(byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A};
    private static final byte[] JPEG_MAGIC = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
    private static final byte[] GIF87_MAGIC = {'G', 'I', 'F', '8', '7', 'a'};
    private static final byte[] GIF89_MAGIC = {'G', 'I', 'F', '8', '9', 'a'};
    private static final byte[] BMP_MAGIC = {'B', 'M'};
    private static final byte[] RIFF_MAGIC = {'R', 'I', 'F', 'F'};
    private static final byte[] WEBP_MAGIC = {'W', 'E', 'B', 'P'};

    public static Optional<ImageFormat> sniff(byte[] data) {
        if (data == null || data.length < 8) {
            return Optional.empty();
        }
        if (startsWith(data, 0, PNG_MAGIC)) {
            return Optional.of(PNG);
        }
        if (startsWith(data, 0, JPEG_MAGIC)) {
            return Optional.of(JPEG);
        }
        if (startsWith(data, 0, GIF87_MAGIC) || startsWith(data, 0, GIF89_MAGIC)) {
            return Optional.of(GIF);
        }
        if (startsWith(data, 0, BMP_MAGIC)) {
            return Optional.of(BMP);
        }
        return Optional.empty();
    }

    /**
     * WebP：RIFF....WEBP。输出端不支持，需要先转成 PNG。
     */
    public static boolean isWebp(byte[] data) {
        return data != null && data.length >= 12
                && startsWith(data, 0, RIFF_MAGIC)
                && startsWith(data, 8, WEBP_MAGIC);
    }

    private static boolean startsWith(byte[] data, int offset, byte[] magic) {
        if (data.length < offset + magic.length) {
            return false;
        }
        for (int i = 0; i < magic.length; i++) {
            if (data[offset + i] != magic[i]) {
                return false;
            }
        }
        return true;
    }
}
