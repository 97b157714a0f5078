package com.example.excelsplit.service.excel;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * xlsx 压缩包的只读句柄。一次请求只打开一次，所有子解析器共享同一个实例，由调用方负责关闭。
 */
@Slf4j
public final class PackageArchive implements AutoCloseable {

    public static final String WORKSHEET_PART = "xl/worksheets/sheet1.xml";
    public static final String STYLES_PART = "xl/styles.xml";
    public static final String CELL_IMAGES_PART = "xl/cellimages.xml";
    public static final String CELL_IMAGES_RELS_PART = "xl/_rels/cellimages.xml.rels";
    public static final String DRAWING_PART = "xl/drawings/drawing1.xml";
    public static final String DRAWING_RELS_PART = "xl/drawings/_rels/drawing1.xml.rels";

    private final Path path;
    private final ZipFile zipFile;
    private final List<String> entryNames;

    private PackageArchive(Path path, ZipFile zipFile, List<String> entryNames) {
        this.path = path;
        this.zipFile = zipFile;
        this.entryNames = entryNames;
    }

    public static PackageArchive open(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ExcelFileException("打开文件失败: 文件不存在 " + path);
        }
        try {
            ZipFile zipFile = new ZipFile(path.toFile());
            List<String> names = new ArrayList<>();
            Enumeration<? extends ZipEntry> entries = zipFile.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                if (!entry.isDirectory()) {
                    names.add(entry.getName());
                }
            }
            log.debug("打开压缩包 {}，共 {} 个部件", path, names.size());
            return new PackageArchive(path, zipFile, Collections.unmodifiableList(names));
        } catch (ZipException e) {
            throw new ExcelFileException("解析 ZIP 文件失败: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ExcelFileException("打开文件失败: " + e.getMessage(), e);
        }
    }

    public Path path() {
        return path;
    }

    public List<String> entryNames() {
        return entryNames;
    }

    public boolean contains(String partName) {
        return zipFile.getEntry(partName) != null;
    }

    /**
     * 读取可选部件，不存在时返回空。
     */
    public Optional<byte[]> find(String partName) {
        ZipEntry entry = zipFile.getEntry(partName);
        if (entry == null || entry.isDirectory()) {
            return Optional.empty();
        }
        try (InputStream in = zipFile.getInputStream(entry)) {
            return Optional.of(in.readAllBytes());
        } catch (IOException e) {
            throw new ExcelFileException("读取部件失败 " + partName + ": " + e.getMessage(), e);
        }
    }

    /**
     * 读取必需部件，不存在时抛出 {@link ExcelFileException}。
     */
    public byte[] read(String partName) {
        return find(partName)
                .orElseThrow(() -> new ExcelFileException("找不到必需的部件: " + partName));
    }

    @Override
    public void close() {
        try {
            zipFile.close();
        } catch (IOException e) {
            log.warn("关闭压缩包失败 {}: {}", path, e.getMessage());
        }
    }
}
