package com.example.excelsplit.service.excel;

import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 压缩包内的媒体文件，按文件名（不含目录）索引。
 * <p>
 * PNG/JPEG/GIF/BMP 原样保留；WebP 解码后转存为 PNG；其余格式或转换失败的文件记入不支持列表。
 */
@Slf4j
public final class MediaLibrary {

    private final Map<String, MediaFile> files;
    private final List<String> convertedImages;
    private final List<String> unsupportedImages;

    private MediaLibrary(Map<String, MediaFile> files, List<String> convertedImages, List<String> unsupportedImages) {
        this.files = Collections.unmodifiableMap(files);
        this.convertedImages = Collections.unmodifiableList(convertedImages);
        this.unsupportedImages = Collections.unmodifiableList(unsupportedImages);
    }

    public static MediaLibrary scan(PackageArchive archive) {
        Map<String, MediaFile> files = new HashMap<>();
        List<String> converted = new ArrayList<>();
        List<String> unsupported = new ArrayList<>();

        for (String name : archive.entryNames()) {
            if (!isMediaEntry(name)) {
                continue;
            }
            byte[] data = archive.find(name).orElse(null);
            if (data == null || data.length < EmbeddedImage.MIN_IMAGE_BYTES) {
                continue;
            }
            String filename = fileNameOf(name);

            Optional<ImageFormat> format = ImageFormat.sniff(data);
            if (format.isPresent()) {
                files.put(filename, new MediaFile(data, format.get()));
                continue;
            }
            if (ImageFormat.isWebp(data)) {
                Optional<byte[]> png = convertToPng(filename, data);
                if (png.isPresent()) {
                    files.put(filename, new MediaFile(png.get(), ImageFormat.PNG));
                    converted.add(filename + " (WebP->PNG)");
                    continue;
                }
            }
            unsupported.add(filename);
        }

        log.debug("读取到 {} 个有效图片", files.size());
        if (!converted.isEmpty()) {
            log.info("转换了 {} 个图片格式: {}", converted.size(), String.join(", ", converted));
        }
        if (!unsupported.isEmpty()) {
            log.warn("跳过 {} 个无法处理的图片: {}", unsupported.size(), String.join(", ", unsupported));
        }
        return new MediaLibrary(files, converted, unsupported);
    }

    public Optional<MediaFile> get(String filename) {
        return Optional.ofNullable(files.get(filename));
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    public int size() {
        return files.size();
    }

    public List<String> convertedImages() {
        return convertedImages;
    }

    public List<String> unsupportedImages() {
        return unsupportedImages;
    }

    static boolean isMediaEntry(String name) {
        return name.startsWith("xl/media/") || name.startsWith("xl/embeddings/") || name.contains("/media/");
    }

    static String fileNameOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    private static Optional<byte[]> convertToPng(String filename, byte[] data) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(data));
            if (image == null) {
                log.debug("没有可用的 WebP 解码器或数据损坏: {}", filename);
                return Optional.empty();
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            if (!ImageIO.write(image, "png", out)) {
                log.debug("PNG 编码器不可用: {}", filename);
                return Optional.empty();
            }
            return Optional.of(out.toByteArray());
        } catch (IOException | RuntimeException e) {
            log.debug("转换 WebP 格式失败 {}: {}", filename, e.getMessage());
            return Optional.empty();
        }
    }

    public record MediaFile(byte[] data, ImageFormat format) {
    }
}
